package FSA.Model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Immutable finite automaton over the states 0..size()-1 with a single initial state.
 * <p>
 * Symbols are addressed by their index in the input alphabet. Transitions are partial: an absent transition means
 * implicit rejection, no sink state is ever materialized. Instances never change after construction, every operation
 * that "modifies" an automaton returns a new one.
 *
 * @param <I> input symbol type
 */
public abstract class FiniteAutomaton<I> {
    /** Label of epsilon moves in {@link #forEachTransition(TransitionVisitor)}. */
    public static final int EPSILON = -1;

    private final Alphabet<I> alphabet;
    private final Object2IntMap<I> symbolIndex;
    private final int size;
    private final int initialState;
    private final BitSet accepting;

    protected FiniteAutomaton(Alphabet<I> alphabet, int size, int initialState, BitSet accepting) {
        this.alphabet = alphabet;
        this.symbolIndex = indexSymbols(alphabet);
        this.size = size;
        this.initialState = initialState;
        this.accepting = (BitSet) accepting.clone();
    }

    public abstract AutomatonKind getKind();

    public abstract int numTransitions();

    /**
     * Enumerate every transition. Epsilon moves are reported with label {@link #EPSILON}.
     */
    public abstract void forEachTransition(TransitionVisitor visitor);

    /**
     * Add the direct successors of state on the given symbol index to out, shifted by offset. Epsilon moves are not
     * followed.
     */
    public abstract void addSuccessors(int state, int symbolIndex, BitSet out, int offset);

    public int size() {
        return size;
    }

    public Alphabet<I> getInputAlphabet() {
        return alphabet;
    }

    public int numInputs() {
        return alphabet.size();
    }

    /**
     * @return index of symbol in the input alphabet, or -1 if it is not a member.
     */
    public int getSymbolIndex(I symbol) {
        return symbolIndex.getInt(symbol);
    }

    public I getSymbol(int index) {
        return alphabet.getSymbol(index);
    }

    public int getInitialState() {
        return initialState;
    }

    public boolean isAccepting(int state) {
        return accepting.get(state);
    }

    /**
     * A set of states is accepting iff it contains an accepting state.
     */
    public boolean isAccepting(BitSet states) {
        return states.intersects(accepting);
    }

    /**
     * @return a copy of the accepting states
     */
    public BitSet getFinalStates() {
        return (BitSet) accepting.clone();
    }

    public int numFinalStates() {
        return accepting.cardinality();
    }

    /**
     * Direct successors of state on symbol. Empty if the transition is undefined or the symbol is not in the
     * alphabet.
     */
    public BitSet successors(int state, I symbol) {
        final BitSet result = new BitSet();
        final int idx = getSymbolIndex(symbol);
        if (idx >= 0) {
            addSuccessors(state, idx, result, 0);
        }
        return result;
    }

    /**
     * States reachable from the given ones by epsilon moves only (including themselves). Deterministic automata have
     * no epsilon moves, so this is a copy of the argument.
     */
    public BitSet epsilonClosure(BitSet states) {
        return (BitSet) states.clone();
    }

    public boolean accepts(Iterable<? extends I> word) {
        final BitSet start = new BitSet();
        start.set(initialState);
        BitSet current = epsilonClosure(start);
        for (I symbol : word) {
            final int idx = getSymbolIndex(symbol);
            if (idx < 0) {
                return false;
            }
            final BitSet next = new BitSet();
            for (int q = current.nextSetBit(0); q >= 0; q = current.nextSetBit(q + 1)) {
                addSuccessors(q, idx, next, 0);
            }
            if (next.isEmpty()) {
                return false;
            }
            current = epsilonClosure(next);
        }
        return isAccepting(current);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append(getKind() == AutomatonKind.DETERMINISTIC ? "DFA" : "NFA");
        sb.append("(states=").append(size).append(", initial=").append(initialState);
        sb.append(", finals=").append(accepting).append(", transitions=[");
        final boolean[] first = {true};
        forEachTransition((tail, label, head) -> {
            if (!first[0]) {
                sb.append(", ");
            }
            first[0] = false;
            sb.append(tail).append(" -").append(label == EPSILON ? "eps" : getSymbol(label)).append("-> ").append(head);
        });
        return sb.append("])").toString();
    }

    private static <I> Object2IntMap<I> indexSymbols(Alphabet<I> alphabet) {
        final Object2IntMap<I> index = new Object2IntOpenHashMap<>(alphabet.size());
        index.defaultReturnValue(-1);
        for (int i = 0; i < alphabet.size(); i++) {
            index.put(alphabet.getSymbol(i), i);
        }
        return index;
    }

    static <I> Alphabet<I> toAlphabet(Collection<? extends I> symbols) {
        return Alphabets.fromCollection(new ArrayList<>(new LinkedHashSet<I>(symbols)));
    }

    /**
     * Collects states, accepting states and transitions, and validates them on {@link #build()}. Nothing is checked
     * before that, so malformed input is always reported with the offending state or symbol.
     */
    public abstract static class Builder<I, A extends FiniteAutomaton<I>, B extends Builder<I, A, B>> {
        protected final Alphabet<I> alphabet;
        private final Object2IntMap<I> symbolIndex;

        protected int numStates;
        protected int initialState = -1;
        protected final IntArrayList finals = new IntArrayList();

        protected final IntArrayList tails = new IntArrayList();
        protected final List<I> symbols = new ArrayList<>();
        protected final IntArrayList heads = new IntArrayList();

        protected Builder(Alphabet<I> alphabet) {
            this.alphabet = alphabet;
            this.symbolIndex = indexSymbols(alphabet);
        }

        protected abstract B self();

        public abstract A build();

        /**
         * Declare count additional non-accepting states.
         */
        public B withStates(int count) {
            numStates += count;
            return self();
        }

        /**
         * Declare a single state.
         * @return its identifier
         */
        public int addState(boolean accepting) {
            final int state = numStates++;
            if (accepting) {
                finals.add(state);
            }
            return state;
        }

        public B initial(int state) {
            this.initialState = state;
            return self();
        }

        public B accepting(int... states) {
            finals.addElements(finals.size(), states);
            return self();
        }

        public B accepting(Collection<Integer> states) {
            for (int q : states) {
                finals.add(q);
            }
            return self();
        }

        public B transition(int tail, I symbol, int head) {
            tails.add(tail);
            symbols.add(symbol);
            heads.add(head);
            return self();
        }

        protected void checkState(int state, String role) {
            if (state < 0 || state >= numStates) {
                throw new MalformedAutomatonException(role + " " + state + " is not a declared state (0.." + (numStates - 1) + ")");
            }
        }

        /**
         * Validate the common invariants and resolve symbols to indices.
         * @return label of every collected transition
         */
        protected IntArrayList validate() {
            if (initialState < 0) {
                throw new MalformedAutomatonException("no initial state declared");
            }
            checkState(initialState, "initial state");
            for (int i = 0; i < finals.size(); i++) {
                checkState(finals.getInt(i), "accepting state");
            }

            final IntArrayList labels = new IntArrayList(symbols.size());
            for (int i = 0; i < tails.size(); i++) {
                final I symbol = symbols.get(i);
                final int label = symbolIndex.getInt(symbol);
                final String transition = "(" + tails.getInt(i) + ", " + symbol + ", " + heads.getInt(i) + ")";
                if (label < 0) {
                    throw new MalformedAutomatonException("transition " + transition + " uses undeclared symbol " + symbol);
                }
                checkState(tails.getInt(i), "source of transition " + transition);
                checkState(heads.getInt(i), "target of transition " + transition);
                labels.add(label);
            }
            return labels;
        }

        protected BitSet acceptingSet() {
            final BitSet accepting = new BitSet(numStates);
            for (int i = 0; i < finals.size(); i++) {
                accepting.set(finals.getInt(i));
            }
            return accepting;
        }
    }
}
