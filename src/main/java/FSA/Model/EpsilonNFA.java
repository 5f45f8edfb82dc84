package FSA.Model;

import java.util.BitSet;
import java.util.Collection;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.alphabet.Alphabet;

/**
 * Nondeterministic finite automaton with a single initial state and optional epsilon moves.
 *
 * @param <I> input symbol type
 */
public final class EpsilonNFA<I> extends FiniteAutomaton<I> {
    private final TransitionRows rows;
    private final TransitionRows epsilonRows;

    private EpsilonNFA(Alphabet<I> alphabet, int size, int initialState, BitSet accepting,
                       TransitionRows rows, TransitionRows epsilonRows) {
        super(alphabet, size, initialState, accepting);
        this.rows = rows;
        this.epsilonRows = epsilonRows;
    }

    public static <I> Builder<I> builder(Alphabet<I> alphabet) {
        return new Builder<>(alphabet);
    }

    public static <I> Builder<I> builder(Collection<? extends I> alphabet) {
        return new Builder<>(toAlphabet(alphabet));
    }

    /**
     * The automaton with a single non-accepting state and no transitions; it accepts nothing.
     */
    public static <I> EpsilonNFA<I> emptyLanguage(Alphabet<I> alphabet) {
        return new EpsilonNFA<>(alphabet, 1, 0, new BitSet(), TransitionRows.empty(1), TransitionRows.empty(1));
    }

    @Override
    public AutomatonKind getKind() {
        return AutomatonKind.NONDETERMINISTIC;
    }

    /**
     * @return the direct successors of state on the symbol with the given index (possibly empty)
     */
    public BitSet getTransitions(int state, int symbolIndex) {
        final BitSet result = new BitSet();
        addSuccessors(state, symbolIndex, result, 0);
        return result;
    }

    /**
     * @return the states reachable from state by a single epsilon move
     */
    public BitSet getEpsilonTransitions(int state) {
        final BitSet result = new BitSet();
        for (int i = epsilonRows.offsets[state]; i < epsilonRows.offsets[state + 1]; i++) {
            result.set(epsilonRows.heads[i]);
        }
        return result;
    }

    public boolean hasEpsilonTransitions() {
        return epsilonRows.size() > 0;
    }

    @Override
    public int numTransitions() {
        return rows.size() + epsilonRows.size();
    }

    @Override
    public void forEachTransition(TransitionVisitor visitor) {
        for (int q = 0; q < size(); q++) {
            for (int i = rows.offsets[q]; i < rows.offsets[q + 1]; i++) {
                visitor.visit(q, rows.labels[i], rows.heads[i]);
            }
            for (int i = epsilonRows.offsets[q]; i < epsilonRows.offsets[q + 1]; i++) {
                visitor.visit(q, EPSILON, epsilonRows.heads[i]);
            }
        }
    }

    @Override
    public void addSuccessors(int state, int symbolIndex, BitSet out, int offset) {
        final int first = rows.find(state, symbolIndex);
        if (first < 0) {
            return;
        }
        for (int i = first; i < rows.offsets[state + 1] && rows.labels[i] == symbolIndex; i++) {
            out.set(rows.heads[i] + offset);
        }
    }

    @Override
    public BitSet epsilonClosure(BitSet states) {
        final BitSet closure = (BitSet) states.clone();
        if (!hasEpsilonTransitions()) {
            return closure;
        }
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        for (int q = states.nextSetBit(0); q >= 0; q = states.nextSetBit(q + 1)) {
            queue.enqueue(q);
        }
        while (!queue.isEmpty()) {
            final int q = queue.dequeueInt();
            for (int i = epsilonRows.offsets[q]; i < epsilonRows.offsets[q + 1]; i++) {
                final int r = epsilonRows.heads[i];
                if (!closure.get(r)) {
                    closure.set(r);
                    queue.enqueue(r);
                }
            }
        }
        return closure;
    }

    public static final class Builder<I> extends FiniteAutomaton.Builder<I, EpsilonNFA<I>, Builder<I>> {
        private final IntArrayList epsilonTails = new IntArrayList();
        private final IntArrayList epsilonHeads = new IntArrayList();

        private Builder(Alphabet<I> alphabet) {
            super(alphabet);
        }

        @Override
        protected Builder<I> self() {
            return this;
        }

        public Builder<I> epsilon(int tail, int head) {
            epsilonTails.add(tail);
            epsilonHeads.add(head);
            return this;
        }

        @Override
        public EpsilonNFA<I> build() {
            final IntArrayList labels = validate();
            final IntArrayList epsilonLabels = new IntArrayList(epsilonTails.size());
            for (int i = 0; i < epsilonTails.size(); i++) {
                final String move = "epsilon move (" + epsilonTails.getInt(i) + ", " + epsilonHeads.getInt(i) + ")";
                checkState(epsilonTails.getInt(i), "source of " + move);
                checkState(epsilonHeads.getInt(i), "target of " + move);
                epsilonLabels.add(0);
            }
            return new EpsilonNFA<>(alphabet, numStates, initialState, acceptingSet(),
                                    TransitionRows.build(numStates, tails, labels, heads),
                                    TransitionRows.build(numStates, epsilonTails, epsilonLabels, epsilonHeads));
        }
    }
}
