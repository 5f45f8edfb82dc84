package FSA;

import java.util.BitSet;
import java.util.Set;

import FSA.Model.AutomatonKind;
import FSA.Model.EpsilonNFA;
import FSA.Model.FiniteAutomaton;
import FSA.Model.PartialDFA;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Translation between our automata and AutomataLib's compact ones. Used by the BA reader/writer and to cross-check
 * results against AutomataLib's own algorithms.
 */
public class AutomataLibConversions {

    private AutomataLibConversions() {}

    /**
     * Copy a DFA into a CompactDFA over the same alphabet. Undefined transitions stay undefined.
     */
    public static <I> CompactDFA<I> toCompactDFA(PartialDFA<I> dfa) {
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        final CompactDFA<I> result = new CompactDFA<>(alphabet, dfa.size());
        for (int q = 0; q < dfa.size(); q++) {
            result.addState(dfa.isAccepting(q));
        }
        result.setInitialState(dfa.getInitialState());
        dfa.forEachTransition((tail, label, head) -> result.setTransition(tail, label, head));
        return result;
    }

    /**
     * Copy any automaton into a CompactNFA over the given alphabet, which must contain the automaton's symbols.
     * Epsilon moves are removed: a state gets the successors and acceptance of its epsilon closure.
     */
    public static <I> CompactNFA<I> toCompactNFA(FiniteAutomaton<I> automaton, Alphabet<I> alphabet) {
        final CompactNFA<I> result = new CompactNFA<>(alphabet, automaton.size());
        final BitSet[] closures = new BitSet[automaton.size()];
        for (int q = 0; q < automaton.size(); q++) {
            closures[q] = automaton.epsilonClosure(BitSetUtils.of(q));
            result.addState(automaton.isAccepting(closures[q]));
        }
        result.setInitial(automaton.getInitialState(), true);

        for (int a = 0; a < automaton.numInputs(); a++) {
            final int target = alphabet.getSymbolIndex(automaton.getSymbol(a));
            for (int q = 0; q < automaton.size(); q++) {
                final BitSet post = new BitSet();
                final BitSet closure = closures[q];
                for (int p = closure.nextSetBit(0); p >= 0; p = closure.nextSetBit(p + 1)) {
                    automaton.addSuccessors(p, a, post, 0);
                }
                final BitSet succ = automaton.epsilonClosure(post);
                for (int r = succ.nextSetBit(0); r >= 0; r = succ.nextSetBit(r + 1)) {
                    result.addTransition(q, target, r);
                }
            }
        }
        return result;
    }

    public static <I> PartialDFA<I> fromCompactDFA(CompactDFA<I> dfa) {
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        final Integer init = dfa.getInitialState();
        if (init == null) {
            return PartialDFA.emptyLanguage(alphabet);
        }
        final PartialDFA.Builder<I> builder = PartialDFA.builder(alphabet);
        for (int q = 0; q < dfa.size(); q++) {
            builder.addState(dfa.isAccepting(q));
        }
        builder.initial(init);
        for (int q = 0; q < dfa.size(); q++) {
            for (int a = 0; a < alphabet.size(); a++) {
                final int succ = dfa.getSuccessor(q, a);
                if (succ >= 0) {
                    builder.transition(q, alphabet.getSymbol(a), succ);
                }
            }
        }
        return builder.build();
    }

    /**
     * A CompactNFA with a single initial state and at most one successor per state and symbol becomes a
     * {@link PartialDFA}. Otherwise the result is an {@link EpsilonNFA}; several initial states are joined under a
     * fresh start state with epsilon moves to each of them.
     */
    public static <I> FiniteAutomaton<I> fromCompactNFA(CompactNFA<I> nfa) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        final Set<Integer> initialStates = nfa.getInitialStates();
        if (initialStates.isEmpty()) {
            return PartialDFA.emptyLanguage(alphabet);
        }
        final AutomatonKind kind = isDeterministic(nfa) ? AutomatonKind.DETERMINISTIC : AutomatonKind.NONDETERMINISTIC;
        return switch (kind) {
            case DETERMINISTIC -> {
                final PartialDFA.Builder<I> builder = PartialDFA.builder(alphabet);
                copyStatesAndTransitions(nfa, builder);
                builder.initial(initialStates.iterator().next());
                yield builder.build();
            }
            case NONDETERMINISTIC -> {
                final EpsilonNFA.Builder<I> builder = EpsilonNFA.builder(alphabet);
                copyStatesAndTransitions(nfa, builder);
                if (initialStates.size() == 1) {
                    builder.initial(initialStates.iterator().next());
                } else {
                    final int start = builder.addState(false);
                    builder.initial(start);
                    for (int q : initialStates) {
                        builder.epsilon(start, q);
                    }
                }
                yield builder.build();
            }
        };
    }

    private static <I> void copyStatesAndTransitions(CompactNFA<I> nfa, FiniteAutomaton.Builder<I, ?, ?> builder) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        for (int q = 0; q < nfa.size(); q++) {
            builder.addState(nfa.isAccepting(q));
        }
        for (int q = 0; q < nfa.size(); q++) {
            for (int a = 0; a < alphabet.size(); a++) {
                for (int r : nfa.getTransitions(q, a)) {
                    builder.transition(q, alphabet.getSymbol(a), r);
                }
            }
        }
    }

    private static boolean isDeterministic(CompactNFA<?> nfa) {
        if (nfa.getInitialStates().size() != 1) {
            return false;
        }
        final int numInputs = nfa.getInputAlphabet().size();
        for (int q = 0; q < nfa.size(); q++) {
            for (int a = 0; a < numInputs; a++) {
                if (nfa.getTransitions(q, a).size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }
}
