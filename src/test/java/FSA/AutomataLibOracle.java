package FSA;

import FSA.Compare.SymbolAlignment;
import FSA.Model.FiniteAutomaton;
import FSA.Model.PartialDFA;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference answers computed with AutomataLib's own algorithms.
 */
public class AutomataLibOracle {

    private AutomataLibOracle() {}

    /**
     * Language equivalence, by determinizing both automata to complete DFAs over the union alphabet.
     */
    public static <I> boolean sameLanguage(FiniteAutomaton<I> a, FiniteAutomaton<I> b) {
        final SymbolAlignment<I> symbols = new SymbolAlignment<>(a, b);
        final List<I> union = new ArrayList<>(symbols.size());
        for (int k = 0; k < symbols.size(); k++) {
            union.add(symbols.symbol(k));
        }
        final Alphabet<I> alphabet = Alphabets.fromCollection(union);
        final CompactDFA<I> dfaA = determinize(a, alphabet);
        final CompactDFA<I> dfaB = determinize(b, alphabet);
        return Automata.testEquivalence(dfaA, dfaB, alphabet);
    }

    public static <I> CompactDFA<I> determinize(FiniteAutomaton<I> automaton, Alphabet<I> alphabet) {
        final CompactNFA<I> nfa = AutomataLibConversions.toCompactNFA(automaton, alphabet);
        return NFAs.determinize(nfa, alphabet, false, false);
    }

    /**
     * Number of states of the minimal partial DFA: Hopcroft's minimal complete DFA without its dead state, but at
     * least one state.
     */
    public static <I> int minimalStateCount(PartialDFA<I> dfa) {
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        final CompactDFA<I> complete = AutomataLibConversions.toCompactDFA(Products.complete(Trim.trim(dfa)));
        final CompactDFA<I> minimal = HopcroftMinimizer.minimizeDFA(complete, alphabet);
        int count = minimal.size();
        for (int q = 0; q < minimal.size(); q++) {
            if (isDead(minimal, q)) {
                count--;
            }
        }
        return Math.max(count, 1);
    }

    private static boolean isDead(CompactDFA<?> dfa, int state) {
        if (dfa.isAccepting(state)) {
            return false;
        }
        for (int a = 0; a < dfa.getInputAlphabet().size(); a++) {
            if (dfa.getSuccessor(state, a) != state) {
                return false;
            }
        }
        return true;
    }
}
