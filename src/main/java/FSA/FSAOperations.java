package FSA;

import FSA.Compare.Equivalence;
import FSA.Compare.Isomorphism;
import FSA.Model.FiniteAutomaton;
import FSA.Model.PartialDFA;
import FSA.Model.UnsupportedAutomatonKindException;
import net.automatalib.word.Word;

/**
 * Entry point for the queries on finite automata. Every operation is pure: arguments are never modified and results
 * share no mutable state with them.
 */
public final class FSAOperations {

    private FSAOperations() {}

    /**
     * Keep only states that are reachable and co-reachable. The result has the kind of the argument.
     */
    public static <I, A extends FiniteAutomaton<I>> A trim(A automaton) {
        return Trim.trim(automaton);
    }

    /**
     * @throws UnsupportedAutomatonKindException if automaton is nondeterministic
     */
    public static <I> PartialDFA<I> minimize(FiniteAutomaton<I> automaton) {
        return ValmariMinimizer.minimize(automaton);
    }

    /**
     * @throws UnsupportedAutomatonKindException if either argument is nondeterministic
     */
    public static <I> boolean isomorphic(FiniteAutomaton<I> a, FiniteAutomaton<I> b) {
        return Isomorphism.isomorphic(a, b);
    }

    /**
     * @return the state bijection from a to b, or null if there is none
     */
    public static <I> int[] findIsomorphism(FiniteAutomaton<I> a, FiniteAutomaton<I> b) {
        return Isomorphism.findIsomorphism(a, b);
    }

    public static <I> boolean equivalent(FiniteAutomaton<I> a, FiniteAutomaton<I> b) {
        return Equivalence.equivalent(a, b);
    }

    /**
     * @return a word accepted by exactly one of the automata, or null if they are equivalent
     */
    public static <I> Word<I> findSeparatingWord(FiniteAutomaton<I> a, FiniteAutomaton<I> b) {
        return Equivalence.findSeparatingWord(a, b);
    }

    public static <I> PartialDFA<I> determinize(FiniteAutomaton<I> automaton) {
        return PowersetDeterminizer.determinize(automaton);
    }

    public static <I> PartialDFA<I> complete(PartialDFA<I> dfa) {
        return Products.complete(dfa);
    }

    public static <I> PartialDFA<I> product(PartialDFA<I> a, PartialDFA<I> b, AcceptanceCombiner combiner) {
        return Products.product(a, b, combiner);
    }
}
