package FSA;

import java.util.Arrays;
import java.util.BitSet;

import FSA.Model.AutomatonKind;
import FSA.Model.FiniteAutomaton;
import FSA.Model.PartialDFA;
import FSA.Model.UnsupportedAutomatonKindException;
import FSA.Partition.RefinablePartition;
import FSA.Partition.TransitionIndex;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;

/**
 * Minimization of partial DFAs with Valmari and Lehtinen's algorithm, described in
 * <a href="https://doi.org/10.1016/j.ipl.2011.12.004">Fast brief practical DFA minimization</a>
 * by Antti Valmari.
 * <p>
 * Runs in O(n + m log n) for n states and m defined transitions. Missing transitions are never completed with a
 * sink state.
 */
public class ValmariMinimizer {
    public static boolean DEBUG = false;

    private ValmariMinimizer() {}

    /**
     * @throws UnsupportedAutomatonKindException if automaton is nondeterministic
     */
    public static <I> PartialDFA<I> minimize(FiniteAutomaton<I> automaton) {
        if (automaton.getKind() != AutomatonKind.DETERMINISTIC) {
            throw new UnsupportedAutomatonKindException("Valmari minimization", automaton.getKind());
        }
        return minimize((PartialDFA<I>) automaton);
    }

    /**
     * Compute the minimal partial DFA accepting the same language. The result keeps the input alphabet and its states
     * are numbered in breadth-first order from the initial state (which is therefore 0).
     * @param dfa - input DFA, not modified
     * @return minimal trim DFA, or the one-state automaton accepting nothing
     * @param <I> - Input symbol type
     */
    public static <I> PartialDFA<I> minimize(PartialDFA<I> dfa) {
        final TransitionIndex index = TransitionIndex.of(dfa);

        // only live states can distinguish anything
        final BitSet live = Trim.liveStates(dfa, index);
        if (live.isEmpty()) {
            return PartialDFA.emptyLanguage(dfa.getInputAlphabet());
        }
        index.retainWithin(live);

        final RefinablePartition blocks = RefinablePartition.singleBlock(dfa.size(), live.stream().toArray());

        // accepting vs. rejecting
        for (int q = live.nextSetBit(0); q >= 0; q = live.nextSetBit(q + 1)) {
            if (dfa.isAccepting(q)) {
                blocks.mark(q);
            }
        }
        blocks.split();

        // cords: transitions grouped by label
        final int numTrans = index.numTransitions();
        final int[] labels = new int[numTrans];
        for (int i = 0; i < numTrans; i++) {
            labels[i] = index.label(i);
        }
        final RefinablePartition cords = RefinablePartition.byKey(numTrans, labels, dfa.numInputs());

        index.makeAdjacent(false);
        refine(index, blocks, cords);

        if (DEBUG) {
            System.out.println("DEBUG: Valmari: " + live.cardinality() + " live states -> " + blocks.size() + " blocks, "
                               + cords.size() + " cords");
        }

        return extract(dfa, blocks);
    }

    /**
     * Main loop: each cord splits blocks by the tails of its transitions, each new block splits cords by the
     * transitions entering it. Block 0 is never used as a splitter; every other block is.
     */
    private static void refine(TransitionIndex index, RefinablePartition blocks, RefinablePartition cords) {
        int block = 1;
        int cord = 0;
        while (cord < cords.size()) {
            for (int i = cords.first(cord); i < cords.past(cord); i++) {
                blocks.mark(index.tail(cords.element(i)));
            }
            blocks.split();
            cord++;

            while (block < blocks.size()) {
                for (int i = blocks.first(block); i < blocks.past(block); i++) {
                    final int state = blocks.element(i);
                    for (int j = index.adjacentFirst(state); j < index.adjacentPast(state); j++) {
                        cords.mark(index.adjacent(j));
                    }
                }
                cords.split();
                block++;
            }
        }
    }

    /**
     * Build the quotient automaton. All members of a block agree on acceptance and on the target block of every
     * symbol, so the first member of each block represents it.
     */
    private static <I> PartialDFA<I> extract(PartialDFA<I> dfa, RefinablePartition blocks) {
        final int numBlocks = blocks.size();
        final int numInputs = dfa.numInputs();

        final int[] representative = new int[numBlocks];
        for (int b = 0; b < numBlocks; b++) {
            representative[b] = blocks.element(blocks.first(b));
        }

        // canonical numbering: breadth-first from the initial block, symbols in alphabet order
        final int[] order = new int[numBlocks];
        Arrays.fill(order, -1);
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        final int initBlock = blocks.blockOf(dfa.getInitialState());
        order[initBlock] = 0;
        queue.enqueue(initBlock);
        int next = 1;

        final PartialDFA.Builder<I> builder = PartialDFA.builder(dfa.getInputAlphabet());
        builder.withStates(numBlocks).initial(0);
        while (!queue.isEmpty()) {
            final int b = queue.dequeueInt();
            final int rep = representative[b];
            if (dfa.isAccepting(rep)) {
                builder.accepting(order[b]);
            }
            for (int a = 0; a < numInputs; a++) {
                final int succ = dfa.getSuccessor(rep, a);
                if (succ == PartialDFA.UNDEFINED || !blocks.contains(succ)) {
                    continue;
                }
                final int target = blocks.blockOf(succ);
                if (order[target] < 0) {
                    order[target] = next++;
                    queue.enqueue(target);
                }
                builder.transition(order[b], dfa.getSymbol(a), order[target]);
            }
        }
        assert next == numBlocks : "every block of a trim automaton is reachable";

        return builder.build();
    }
}
