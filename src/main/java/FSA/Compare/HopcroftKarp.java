package FSA.Compare;

import java.util.ArrayList;
import java.util.List;

import FSA.Model.PartialDFA;
import FSA.Partition.UnionFind;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.word.Word;

/**
 * Language equivalence of two partial DFAs with Hopcroft and Karp's near-linear algorithm, as presented in
 * <a href="https://doi.org/10.1145/2429069.2429124">Checking NFA equivalence with bisimulations up to congruence</a>
 * by Bonchi and Pous.
 * <p>
 * States of both automata live in one union-find: states of the left automaton keep their number, states of the
 * right one are shifted by its size, and a single non-accepting absorbing sink stands in for every undefined
 * transition on either side.
 */
public final class HopcroftKarp {

    private HopcroftKarp() {}

    public static <I> boolean equivalent(PartialDFA<I> a, PartialDFA<I> b) {
        return findSeparatingWord(a, b) == null;
    }

    /**
     * @return a word accepted by exactly one of the automata, or null if they are equivalent
     */
    public static <I> Word<I> findSeparatingWord(PartialDFA<I> a, PartialDFA<I> b) {
        final SymbolAlignment<I> symbols = new SymbolAlignment<>(a, b);
        final int offset = a.size();
        final int sink = a.size() + b.size();
        final UnionFind equiv = new UnionFind(sink + 1);

        // visited pairs, with the pair and symbol they were reached from
        final List<PairRecord> pairs = new ArrayList<>();
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

        equiv.union(a.getInitialState(), b.getInitialState() + offset);
        pairs.add(new PairRecord(a.getInitialState(), b.getInitialState() + offset, -1, -1));
        queue.enqueue(0);

        while (!queue.isEmpty()) {
            final int current = queue.dequeueInt();
            final PairRecord pair = pairs.get(current);

            final boolean leftAcc = pair.left() != sink && a.isAccepting(pair.left());
            final boolean rightAcc = pair.right() != sink && b.isAccepting(pair.right() - offset);
            if (leftAcc != rightAcc) {
                return witness(pairs, current, symbols);
            }

            for (int k = 0; k < symbols.size(); k++) {
                final int leftSucc = successor(a, pair.left(), symbols.left(k), 0, sink);
                final int rightSucc = successor(b, pair.right(), symbols.right(k), offset, sink);
                if (equiv.find(leftSucc) != equiv.find(rightSucc)) {
                    equiv.union(leftSucc, rightSucc);
                    pairs.add(new PairRecord(leftSucc, rightSucc, current, k));
                    queue.enqueue(pairs.size() - 1);
                }
            }
        }
        return null;
    }

    private static int successor(PartialDFA<?> dfa, int state, int symbolIndex, int offset, int sink) {
        if (state == sink || symbolIndex < 0) {
            return sink;
        }
        final int succ = dfa.getSuccessor(state - offset, symbolIndex);
        return succ == PartialDFA.UNDEFINED ? sink : succ + offset;
    }

    private static <I> Word<I> witness(List<PairRecord> pairs, int index, SymbolAlignment<I> symbols) {
        final IntArrayList reversed = new IntArrayList();
        for (int i = index; pairs.get(i).parent() >= 0; i = pairs.get(i).parent()) {
            reversed.add(pairs.get(i).symbol());
        }
        return symbols.toWord(reversed);
    }

    private record PairRecord(int left, int right, int parent, int symbol) { }
}
