package FSA;

import java.util.ArrayList;
import java.util.List;

import FSA.Compare.SymbolAlignment;
import FSA.Model.PartialDFA;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;

/**
 * Completion and synchronous products of partial DFAs.
 */
public class Products {
    private static final int ABSENT = -1;

    private Products() {}

    /**
     * Totalize dfa: every undefined transition is redirected to a new non-accepting sink state that loops on every
     * symbol. Returns dfa itself if it is already complete.
     */
    public static <I> PartialDFA<I> complete(PartialDFA<I> dfa) {
        if (dfa.isComplete()) {
            return dfa;
        }
        final int sink = dfa.size();
        final PartialDFA.Builder<I> builder = PartialDFA.builder(dfa.getInputAlphabet());
        builder.withStates(dfa.size() + 1).initial(dfa.getInitialState());
        for (int q = 0; q <= sink; q++) {
            if (q < sink && dfa.isAccepting(q)) {
                builder.accepting(q);
            }
            for (int a = 0; a < dfa.numInputs(); a++) {
                final int succ = q == sink ? PartialDFA.UNDEFINED : dfa.getSuccessor(q, a);
                builder.transition(q, dfa.getSymbol(a), succ == PartialDFA.UNDEFINED ? sink : succ);
            }
        }
        return builder.build();
    }

    /**
     * Reachable part of the synchronous product of a and b over the union of their alphabets. A component without a
     * transition drops out of the product state; product states in which both components dropped out are only
     * kept if the combiner accepts there.
     */
    public static <I> PartialDFA<I> product(PartialDFA<I> a, PartialDFA<I> b, AcceptanceCombiner combiner) {
        final SymbolAlignment<I> symbols = new SymbolAlignment<>(a, b);
        final List<I> alphabet = new ArrayList<>(symbols.size());
        for (int k = 0; k < symbols.size(); k++) {
            alphabet.add(symbols.symbol(k));
        }
        final PartialDFA.Builder<I> builder = PartialDFA.builder(alphabet);
        final boolean keepBothAbsent = combiner.combine(false, false);

        final Long2IntMap states = new Long2IntOpenHashMap();
        states.defaultReturnValue(-1);
        final List<long[]> pending = new ArrayList<>();
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

        final int init = addPair(a, b, a.getInitialState(), b.getInitialState(), combiner, builder, states, pending);
        builder.initial(init);
        queue.enqueue(init);

        while (!queue.isEmpty()) {
            final int current = queue.dequeueInt();
            final int p = (int) pending.get(current)[0];
            final int q = (int) pending.get(current)[1];
            for (int k = 0; k < symbols.size(); k++) {
                final int pSucc = successor(a, p, symbols.left(k));
                final int qSucc = successor(b, q, symbols.right(k));
                if (pSucc == ABSENT && qSucc == ABSENT && !keepBothAbsent) {
                    continue;
                }
                int target = states.get(key(pSucc, qSucc));
                if (target < 0) {
                    target = addPair(a, b, pSucc, qSucc, combiner, builder, states, pending);
                    queue.enqueue(target);
                }
                builder.transition(current, symbols.symbol(k), target);
            }
        }
        return builder.build();
    }

    private static <I> int addPair(PartialDFA<I> a, PartialDFA<I> b, int p, int q, AcceptanceCombiner combiner,
                                   PartialDFA.Builder<I> builder, Long2IntMap states, List<long[]> pending) {
        final boolean acc = combiner.combine(p != ABSENT && a.isAccepting(p), q != ABSENT && b.isAccepting(q));
        final int state = builder.addState(acc);
        states.put(key(p, q), state);
        pending.add(new long[]{p, q});
        return state;
    }

    private static int successor(PartialDFA<?> dfa, int state, int symbolIndex) {
        if (state == ABSENT || symbolIndex < 0) {
            return ABSENT;
        }
        return dfa.getSuccessor(state, symbolIndex);
    }

    private static long key(int p, int q) {
        return ((long) p << 32) | (q & 0xffffffffL);
    }
}
