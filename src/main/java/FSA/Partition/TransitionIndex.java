package FSA.Partition;

import java.util.BitSet;

import FSA.Model.FiniteAutomaton;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Flat transition arrays of an automaton plus an adjacency index that can be sorted either by tail (outgoing
 * transitions) or by head (incoming transitions).
 * <p>
 * Transition i goes from tail(i) to head(i) on label(i). After {@link #makeAdjacent(boolean)}, the transitions
 * adjacent to state q are adjacent(j) for j in [adjacentFirst(q), adjacentPast(q)). Built once per call and shared by
 * trimming and minimization; never stored in an automaton.
 */
public final class TransitionIndex {
    private final int numStates;
    private int numTransitions;
    private final int[] tails;
    private final int[] labels;
    private final int[] heads;
    private final int[] adjacent;
    private final int[] offset;

    private TransitionIndex(int numStates, int[] tails, int[] labels, int[] heads) {
        this.numStates = numStates;
        this.numTransitions = tails.length;
        this.tails = tails;
        this.labels = labels;
        this.heads = heads;
        this.adjacent = new int[tails.length];
        this.offset = new int[numStates + 1];
    }

    public static TransitionIndex of(FiniteAutomaton<?> automaton) {
        final int m = automaton.numTransitions();
        final IntArrayList tails = new IntArrayList(m);
        final IntArrayList labels = new IntArrayList(m);
        final IntArrayList heads = new IntArrayList(m);
        automaton.forEachTransition((tail, label, head) -> {
            tails.add(tail);
            labels.add(label);
            heads.add(head);
        });
        return new TransitionIndex(automaton.size(), tails.toIntArray(), labels.toIntArray(), heads.toIntArray());
    }

    public int numStates() {
        return numStates;
    }

    public int numTransitions() {
        return numTransitions;
    }

    public int tail(int transition) {
        return tails[transition];
    }

    public int label(int transition) {
        return labels[transition];
    }

    public int head(int transition) {
        return heads[transition];
    }

    public int adjacentFirst(int state) {
        return offset[state];
    }

    public int adjacentPast(int state) {
        return offset[state + 1];
    }

    public int adjacent(int j) {
        return adjacent[j];
    }

    /**
     * Sort the adjacency index by tails (forwards) or heads (backwards) using counting sort.
     */
    public void makeAdjacent(boolean forwards) {
        final int[] key = forwards ? tails : heads;
        for (int q = 0; q <= numStates; q++) {
            offset[q] = 0;
        }
        for (int i = 0; i < numTransitions; i++) {
            offset[key[i]]++;
        }
        for (int q = 0; q < numStates; q++) {
            offset[q + 1] += offset[q];
        }
        for (int i = numTransitions - 1; i >= 0; i--) {
            adjacent[--offset[key[i]]] = i;
        }
    }

    /**
     * Breadth-first search along transitions (forwards) or against them (backwards). Epsilon moves are followed like
     * any other transition. Re-sorts the adjacency index.
     * @param from start states
     * @return every state reachable from (forwards) or co-reachable to (backwards) a start state
     */
    public BitSet reach(BitSet from, boolean forwards) {
        makeAdjacent(forwards);
        final int[] next = forwards ? heads : tails;
        final BitSet reached = (BitSet) from.clone();
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        for (int q = from.nextSetBit(0); q >= 0; q = from.nextSetBit(q + 1)) {
            queue.enqueue(q);
        }
        while (!queue.isEmpty()) {
            final int q = queue.dequeueInt();
            for (int j = offset[q]; j < offset[q + 1]; j++) {
                final int r = next[adjacent[j]];
                if (!reached.get(r)) {
                    reached.set(r);
                    queue.enqueue(r);
                }
            }
        }
        return reached;
    }

    /**
     * Drop every transition with an endpoint outside states, compacting the arrays in place. The adjacency index must
     * be rebuilt afterwards.
     */
    public void retainWithin(BitSet states) {
        int kept = 0;
        for (int i = 0; i < numTransitions; i++) {
            if (states.get(tails[i]) && states.get(heads[i])) {
                tails[kept] = tails[i];
                labels[kept] = labels[i];
                heads[kept] = heads[i];
                kept++;
            }
        }
        numTransitions = kept;
    }
}
