package FSA.Model;

import java.util.Arrays;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Compressed transition rows: the transitions leaving state q are stored at indices [offsets[q], offsets[q+1]),
 * sorted by label and then by head. Duplicate triples are dropped. Only defined transitions take up space, so a partial
 * automaton is never blown up to a states x symbols table.
 */
final class TransitionRows {
    final int[] offsets;
    final int[] labels;
    final int[] heads;

    private TransitionRows(int[] offsets, int[] labels, int[] heads) {
        this.offsets = offsets;
        this.labels = labels;
        this.heads = heads;
    }

    static TransitionRows empty(int numStates) {
        return new TransitionRows(new int[numStates + 1], new int[0], new int[0]);
    }

    /**
     * Counting sort by tail, then sort each row by (label, head) and drop duplicates.
     */
    static TransitionRows build(int numStates, IntArrayList tails, IntArrayList labels, IntArrayList heads) {
        final int count = tails.size();
        final int[] offsets = new int[numStates + 1];
        for (int i = 0; i < count; i++) {
            offsets[tails.getInt(i) + 1]++;
        }
        for (int q = 0; q < numStates; q++) {
            offsets[q + 1] += offsets[q];
        }

        final long[] packed = new long[count];
        final int[] fill = Arrays.copyOf(offsets, numStates);
        for (int i = 0; i < count; i++) {
            packed[fill[tails.getInt(i)]++] = ((long) labels.getInt(i) << 32) | (heads.getInt(i) & 0xffffffffL);
        }

        final int[] newOffsets = new int[numStates + 1];
        final int[] outLabels = new int[count];
        final int[] outHeads = new int[count];
        int size = 0;
        for (int q = 0; q < numStates; q++) {
            Arrays.sort(packed, offsets[q], offsets[q + 1]);
            newOffsets[q] = size;
            for (int i = offsets[q]; i < offsets[q + 1]; i++) {
                if (i > offsets[q] && packed[i] == packed[i - 1]) {
                    continue;
                }
                outLabels[size] = (int) (packed[i] >>> 32);
                outHeads[size] = (int) packed[i];
                size++;
            }
        }
        newOffsets[numStates] = size;

        return new TransitionRows(newOffsets, Arrays.copyOf(outLabels, size), Arrays.copyOf(outHeads, size));
    }

    int size() {
        return heads.length;
    }

    /**
     * @return index of the first transition of state on label, or -1 if there is none.
     */
    int find(int state, int label) {
        int low = offsets[state];
        int high = offsets[state + 1];
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (labels[mid] < label) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return (low < offsets[state + 1] && labels[low] == label) ? low : -1;
    }
}
