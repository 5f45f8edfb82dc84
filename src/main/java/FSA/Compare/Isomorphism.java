package FSA.Compare;

import java.util.Arrays;

import FSA.Model.AutomatonKind;
import FSA.Model.FiniteAutomaton;
import FSA.Model.PartialDFA;
import FSA.Model.UnsupportedAutomatonKindException;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;

/**
 * Structural identity of two DFAs up to renaming of states.
 * <p>
 * The check covers the full declared state set: a state that cannot be reached from the initial state is never
 * paired, so an automaton with unreachable states is not isomorphic to anything of the same size. Trim both automata
 * first to compare only their live parts.
 */
public final class Isomorphism {

    private Isomorphism() {}

    public static <I> boolean isomorphic(FiniteAutomaton<I> a, FiniteAutomaton<I> b) {
        return findIsomorphism(a, b) != null;
    }

    /**
     * @return mapping[q] = state of b paired with state q of a, or null if the automata are not isomorphic
     * @throws UnsupportedAutomatonKindException if either automaton is nondeterministic
     */
    public static <I> int[] findIsomorphism(FiniteAutomaton<I> a, FiniteAutomaton<I> b) {
        return findIsomorphism(asDFA(a), asDFA(b));
    }

    public static <I> int[] findIsomorphism(PartialDFA<I> a, PartialDFA<I> b) {
        if (a.size() != b.size() || a.numFinalStates() != b.numFinalStates()) {
            return null;
        }
        final SymbolAlignment<I> symbols = new SymbolAlignment<>(a, b);
        if (!symbols.isShared()) {
            return null;
        }

        final int[] forward = new int[a.size()];
        final int[] backward = new int[b.size()];
        Arrays.fill(forward, -1);
        Arrays.fill(backward, -1);

        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        forward[a.getInitialState()] = b.getInitialState();
        backward[b.getInitialState()] = a.getInitialState();
        queue.enqueue(a.getInitialState());
        int mapped = 1;

        while (!queue.isEmpty()) {
            final int p = queue.dequeueInt();
            final int q = forward[p];
            if (a.isAccepting(p) != b.isAccepting(q)) {
                return null;
            }
            for (int k = 0; k < symbols.size(); k++) {
                final int pSucc = a.getSuccessor(p, symbols.left(k));
                final int qSucc = b.getSuccessor(q, symbols.right(k));
                if (pSucc == PartialDFA.UNDEFINED || qSucc == PartialDFA.UNDEFINED) {
                    if (pSucc != qSucc) {
                        return null;
                    }
                    continue;
                }
                if (forward[pSucc] >= 0) {
                    if (forward[pSucc] != qSucc) {
                        return null;
                    }
                    continue;
                }
                if (backward[qSucc] >= 0) {
                    // qSucc already paired with a different state of a
                    return null;
                }
                forward[pSucc] = qSucc;
                backward[qSucc] = pSucc;
                mapped++;
                queue.enqueue(pSucc);
            }
        }

        // unreachable states were never paired
        return mapped == a.size() ? forward : null;
    }

    private static <I> PartialDFA<I> asDFA(FiniteAutomaton<I> automaton) {
        if (automaton.getKind() != AutomatonKind.DETERMINISTIC) {
            throw new UnsupportedAutomatonKindException("Isomorphism checking", automaton.getKind());
        }
        return (PartialDFA<I>) automaton;
    }
}
