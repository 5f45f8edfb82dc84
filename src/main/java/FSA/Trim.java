package FSA;

import java.util.BitSet;

import FSA.Model.EpsilonNFA;
import FSA.Model.FiniteAutomaton;
import FSA.Model.PartialDFA;
import FSA.Partition.TransitionIndex;

/**
 * Removal of unreachable and dead states.
 * <p>
 * A state survives iff it is reachable from the initial state and some accepting state is reachable from it.
 * Survivors keep their relative order. If no state survives, the result is the one-state automaton accepting nothing,
 * since an automaton always has an initial state.
 */
public class Trim {

    private Trim() {}

    @SuppressWarnings("unchecked")
    public static <I, A extends FiniteAutomaton<I>> A trim(A automaton) {
        return switch (automaton.getKind()) {
            case DETERMINISTIC -> (A) trim((PartialDFA<I>) automaton);
            case NONDETERMINISTIC -> (A) trim((EpsilonNFA<I>) automaton);
        };
    }

    public static <I> PartialDFA<I> trim(PartialDFA<I> dfa) {
        final BitSet live = liveStates(dfa, TransitionIndex.of(dfa));
        if (live.isEmpty()) {
            return PartialDFA.emptyLanguage(dfa.getInputAlphabet());
        }
        final int[] renaming = renaming(dfa.size(), live);
        final PartialDFA.Builder<I> builder = PartialDFA.builder(dfa.getInputAlphabet());
        declareStates(dfa, live, renaming, builder);
        dfa.forEachTransition((tail, label, head) -> {
            if (live.get(tail) && live.get(head)) {
                builder.transition(renaming[tail], dfa.getSymbol(label), renaming[head]);
            }
        });
        return builder.build();
    }

    public static <I> EpsilonNFA<I> trim(EpsilonNFA<I> nfa) {
        final BitSet live = liveStates(nfa, TransitionIndex.of(nfa));
        if (live.isEmpty()) {
            return EpsilonNFA.emptyLanguage(nfa.getInputAlphabet());
        }
        final int[] renaming = renaming(nfa.size(), live);
        final EpsilonNFA.Builder<I> builder = EpsilonNFA.builder(nfa.getInputAlphabet());
        declareStates(nfa, live, renaming, builder);
        nfa.forEachTransition((tail, label, head) -> {
            if (live.get(tail) && live.get(head)) {
                if (label == FiniteAutomaton.EPSILON) {
                    builder.epsilon(renaming[tail], renaming[head]);
                } else {
                    builder.transition(renaming[tail], nfa.getSymbol(label), renaming[head]);
                }
            }
        });
        return builder.build();
    }

    /**
     * States that are reachable from the initial state and co-reachable to an accepting state.
     * @param index transition index of automaton; its adjacency order is changed
     */
    public static BitSet liveStates(FiniteAutomaton<?> automaton, TransitionIndex index) {
        final BitSet init = new BitSet();
        init.set(automaton.getInitialState());
        final BitSet live = index.reach(init, true);

        final BitSet finals = automaton.getFinalStates();
        finals.and(live);
        live.and(index.reach(finals, false));
        return live;
    }

    /**
     * @return true iff every state is live
     */
    public static boolean isTrim(FiniteAutomaton<?> automaton) {
        return liveStates(automaton, TransitionIndex.of(automaton)).cardinality() == automaton.size();
    }

    private static int[] renaming(int size, BitSet keep) {
        final int[] renaming = new int[size];
        int next = 0;
        for (int q = 0; q < size; q++) {
            renaming[q] = keep.get(q) ? next++ : -1;
        }
        return renaming;
    }

    private static void declareStates(FiniteAutomaton<?> automaton, BitSet live, int[] renaming,
                                      FiniteAutomaton.Builder<?, ?, ?> builder) {
        for (int q = live.nextSetBit(0); q >= 0; q = live.nextSetBit(q + 1)) {
            builder.addState(automaton.isAccepting(q));
        }
        builder.initial(renaming[automaton.getInitialState()]);
    }
}
