package FSA.Compare;

import FSA.Model.AutomatonKind;
import FSA.Model.FiniteAutomaton;
import FSA.Model.PartialDFA;
import net.automatalib.word.Word;

/**
 * Language equivalence independent of structure and size. Two DFAs are compared with {@link HopcroftKarp}; as soon as
 * one argument is nondeterministic, {@link BisimulationUpToCongruence} is used instead. Symbols that only one of the
 * automata knows behave like undefined transitions in the other.
 */
public final class Equivalence {

    private Equivalence() {}

    public static <I> boolean equivalent(FiniteAutomaton<I> a, FiniteAutomaton<I> b) {
        return findSeparatingWord(a, b) == null;
    }

    /**
     * @return a word accepted by exactly one of the automata, or null if they accept the same language
     */
    public static <I> Word<I> findSeparatingWord(FiniteAutomaton<I> a, FiniteAutomaton<I> b) {
        if (a.getKind() == AutomatonKind.DETERMINISTIC && b.getKind() == AutomatonKind.DETERMINISTIC) {
            return HopcroftKarp.findSeparatingWord((PartialDFA<I>) a, (PartialDFA<I>) b);
        }
        return BisimulationUpToCongruence.findSeparatingWord(a, b);
    }
}
