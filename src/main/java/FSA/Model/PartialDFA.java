package FSA.Model;

import java.util.BitSet;
import java.util.Collection;
import java.util.Map;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.alphabet.Alphabet;

/**
 * Deterministic finite automaton with a partial transition function. There is at most one transition per
 * (state, symbol); a missing one rejects.
 *
 * @param <I> input symbol type
 */
public final class PartialDFA<I> extends FiniteAutomaton<I> {
    public static final int UNDEFINED = -1;

    private final TransitionRows rows;

    private PartialDFA(Alphabet<I> alphabet, int size, int initialState, BitSet accepting, TransitionRows rows) {
        super(alphabet, size, initialState, accepting);
        this.rows = rows;
    }

    public static <I> Builder<I> builder(Alphabet<I> alphabet) {
        return new Builder<>(alphabet);
    }

    public static <I> Builder<I> builder(Collection<? extends I> alphabet) {
        return new Builder<>(toAlphabet(alphabet));
    }

    /**
     * Table-style construction: delta.get(q).get(a) == r iff there is a transition from q to r on a. States are
     * 0..numStates-1; a state without an entry in delta has no outgoing transitions.
     */
    public static <I> PartialDFA<I> of(int numStates,
                                       Collection<? extends I> alphabet,
                                       int initialState,
                                       Collection<Integer> finals,
                                       Map<Integer, ? extends Map<? extends I, Integer>> delta) {
        final Builder<I> builder = builder(alphabet);
        builder.withStates(numStates).initial(initialState).accepting(finals);
        for (Map.Entry<Integer, ? extends Map<? extends I, Integer>> row : delta.entrySet()) {
            for (Map.Entry<? extends I, Integer> t : row.getValue().entrySet()) {
                builder.transition(row.getKey(), t.getKey(), t.getValue());
            }
        }
        return builder.build();
    }

    /**
     * The automaton with a single non-accepting state and no transitions; it accepts nothing.
     */
    public static <I> PartialDFA<I> emptyLanguage(Alphabet<I> alphabet) {
        return new PartialDFA<>(alphabet, 1, 0, new BitSet(), TransitionRows.empty(1));
    }

    @Override
    public AutomatonKind getKind() {
        return AutomatonKind.DETERMINISTIC;
    }

    /**
     * @return the successor of state on the symbol with the given index, or {@link #UNDEFINED}.
     */
    public int getSuccessor(int state, int symbolIndex) {
        final int idx = rows.find(state, symbolIndex);
        return idx < 0 ? UNDEFINED : rows.heads[idx];
    }

    /**
     * @return the successor of state on symbol, or null if undefined
     */
    public Integer getSuccessor(int state, I symbol) {
        final int idx = getSymbolIndex(symbol);
        if (idx < 0) {
            return null;
        }
        final int succ = getSuccessor(state, idx);
        return succ == UNDEFINED ? null : succ;
    }

    /**
     * @return true iff every state has a transition on every symbol
     */
    public boolean isComplete() {
        return numTransitions() == size() * numInputs();
    }

    @Override
    public int numTransitions() {
        return rows.size();
    }

    @Override
    public void forEachTransition(TransitionVisitor visitor) {
        for (int q = 0; q < size(); q++) {
            for (int i = rows.offsets[q]; i < rows.offsets[q + 1]; i++) {
                visitor.visit(q, rows.labels[i], rows.heads[i]);
            }
        }
    }

    @Override
    public void addSuccessors(int state, int symbolIndex, BitSet out, int offset) {
        final int succ = getSuccessor(state, symbolIndex);
        if (succ != UNDEFINED) {
            out.set(succ + offset);
        }
    }

    public static final class Builder<I> extends FiniteAutomaton.Builder<I, PartialDFA<I>, Builder<I>> {

        private Builder(Alphabet<I> alphabet) {
            super(alphabet);
        }

        @Override
        protected Builder<I> self() {
            return this;
        }

        /**
         * @throws MalformedAutomatonException if an invariant is violated or a (state, symbol) pair has two different
         *         targets
         */
        @Override
        public PartialDFA<I> build() {
            final IntArrayList labels = validate();
            final TransitionRows rows = TransitionRows.build(numStates, tails, labels, heads);

            for (int q = 0; q < numStates; q++) {
                for (int i = rows.offsets[q] + 1; i < rows.offsets[q + 1]; i++) {
                    if (rows.labels[i] == rows.labels[i - 1]) {
                        throw new MalformedAutomatonException("state " + q + " has transitions to both " +
                                rows.heads[i - 1] + " and " + rows.heads[i] + " on symbol " + alphabet.getSymbol(rows.labels[i]));
                    }
                }
            }

            return new PartialDFA<>(alphabet, numStates, initialState, acceptingSet(), rows);
        }
    }
}
