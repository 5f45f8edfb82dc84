package FSA.Compare;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import FSA.Model.FiniteAutomaton;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.word.Word;

/**
 * Language equivalence of two automata of any kind with the HKC algorithm of Bonchi and Pous,
 * <a href="https://doi.org/10.1145/2429069.2429124">Checking NFA equivalence with bisimulations up to congruence</a>.
 * <p>
 * The automata are never determinized up front. Pairs of state sets are explored on the fly from the epsilon closures
 * of the two initial states; a pair that already follows from the explored pairs by union and equivalence is not
 * expanded. Sound and complete, but exponential in the worst case.
 */
public final class BisimulationUpToCongruence {
    public static boolean DEBUG = false;

    private BisimulationUpToCongruence() {}

    public static <I> boolean equivalent(FiniteAutomaton<I> a, FiniteAutomaton<I> b) {
        return findSeparatingWord(a, b) == null;
    }

    /**
     * @return a word accepted by exactly one of the automata, or null if they are equivalent
     */
    public static <I> Word<I> findSeparatingWord(FiniteAutomaton<I> a, FiniteAutomaton<I> b) {
        final SymbolAlignment<I> symbols = new SymbolAlignment<>(a, b);
        final int offset = a.size();

        final List<SetPair> pairs = new ArrayList<>();
        final Deque<Integer> todo = new ArrayDeque<>();
        final Congruence relation = new Congruence();

        pairs.add(new SetPair(initialSet(a), initialSet(b), -1, -1));
        todo.add(0);

        int skipped = 0;
        while (!todo.isEmpty()) {
            final int current = todo.poll();
            final SetPair pair = pairs.get(current);

            if (relation.contains(shift(pair.left(), 0), shift(pair.right(), offset))) {
                skipped++;
                continue;
            }
            if (a.isAccepting(pair.left()) != b.isAccepting(pair.right())) {
                return witness(pairs, current, symbols);
            }
            relation.add(shift(pair.left(), 0), shift(pair.right(), offset));

            for (int k = 0; k < symbols.size(); k++) {
                final BitSet leftSucc = post(a, pair.left(), symbols.left(k));
                final BitSet rightSucc = post(b, pair.right(), symbols.right(k));
                pairs.add(new SetPair(leftSucc, rightSucc, current, k));
                todo.add(pairs.size() - 1);
            }
        }

        if (DEBUG) {
            System.out.println("DEBUG: HKC: " + relation.size() + " pairs expanded, " + skipped + " skipped by congruence");
        }
        return null;
    }

    private static BitSet initialSet(FiniteAutomaton<?> automaton) {
        final BitSet init = new BitSet();
        init.set(automaton.getInitialState());
        return automaton.epsilonClosure(init);
    }

    /**
     * Epsilon-closed successors of a set of states; empty if the symbol is not in the alphabet.
     */
    private static BitSet post(FiniteAutomaton<?> automaton, BitSet states, int symbolIndex) {
        final BitSet result = new BitSet();
        if (symbolIndex < 0) {
            return result;
        }
        for (int q = states.nextSetBit(0); q >= 0; q = states.nextSetBit(q + 1)) {
            automaton.addSuccessors(q, symbolIndex, result, 0);
        }
        return automaton.epsilonClosure(result);
    }

    // both automata share one state space: right states are shifted by the size of the left automaton
    private static BitSet shift(BitSet states, int offset) {
        if (offset == 0) {
            return (BitSet) states.clone();
        }
        final BitSet result = new BitSet();
        for (int q = states.nextSetBit(0); q >= 0; q = states.nextSetBit(q + 1)) {
            result.set(q + offset);
        }
        return result;
    }

    private static <I> Word<I> witness(List<SetPair> pairs, int index, SymbolAlignment<I> symbols) {
        final IntArrayList reversed = new IntArrayList();
        for (int i = index; pairs.get(i).parent() >= 0; i = pairs.get(i).parent()) {
            reversed.add(pairs.get(i).symbol());
        }
        return symbols.toWord(reversed);
    }

    private record SetPair(BitSet left, BitSet right, int parent, int symbol) { }
}
