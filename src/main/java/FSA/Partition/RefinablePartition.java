package FSA.Partition;

import java.util.Arrays;

/**
 * Refinable partition of a subset of the integers 0..universe-1, as used by Valmari and Lehtinen's DFA minimization.
 * <p>
 * Members of the same block are contiguous in {@code elements}: block b is elements[first[b] .. past[b]). Marked
 * members of a block are moved to its front; {@link #split()} then separates every touched block into its marked and
 * unmarked part. The smaller part always receives the new block index, so repeatedly processing new blocks only costs
 * O(m log n) in total.
 */
public final class RefinablePartition {
    private final int[] elements;
    private final int[] location;
    private final int[] blockOf;
    private final int[] first;
    private final int[] past;
    private final int[] marked;
    private final int[] touched;
    private int numTouched;
    private int size;

    private RefinablePartition(int universe, int capacity) {
        this.elements = new int[capacity];
        this.location = new int[universe];
        this.blockOf = new int[universe];
        this.first = new int[capacity + 1];
        this.past = new int[capacity + 1];
        this.marked = new int[capacity + 1];
        this.touched = new int[capacity + 1];
        Arrays.fill(location, -1);
        Arrays.fill(blockOf, -1);
    }

    /**
     * A partition with a single block holding the given members (no block at all if there are none).
     * @param universe elements are in 0..universe-1
     * @param members distinct members
     */
    public static RefinablePartition singleBlock(int universe, int[] members) {
        final RefinablePartition p = new RefinablePartition(universe, members.length);
        for (int i = 0; i < members.length; i++) {
            p.elements[i] = members[i];
            p.location[members[i]] = i;
            p.blockOf[members[i]] = 0;
        }
        if (members.length > 0) {
            p.past[0] = members.length;
            p.size = 1;
        }
        return p;
    }

    /**
     * A partition of 0..count-1 where elements share a block iff they have the same key. Blocks are ordered by key,
     * members keep their relative order (counting sort).
     * @param keys key of every element, in 0..numKeys-1
     */
    public static RefinablePartition byKey(int count, int[] keys, int numKeys) {
        final RefinablePartition p = new RefinablePartition(count, count);
        final int[] start = new int[numKeys + 1];
        for (int e = 0; e < count; e++) {
            start[keys[e] + 1]++;
        }
        for (int k = 0; k < numKeys; k++) {
            start[k + 1] += start[k];
        }
        final int[] blockOfKey = new int[numKeys];
        for (int k = 0; k < numKeys; k++) {
            if (start[k] < start[k + 1]) {
                blockOfKey[k] = p.size;
                p.first[p.size] = start[k];
                p.past[p.size] = start[k + 1];
                p.size++;
            }
        }
        final int[] fill = Arrays.copyOf(start, numKeys);
        for (int e = 0; e < count; e++) {
            final int pos = fill[keys[e]]++;
            p.elements[pos] = e;
            p.location[e] = pos;
            p.blockOf[e] = blockOfKey[keys[e]];
        }
        return p;
    }

    public int size() {
        return size;
    }

    public int first(int block) {
        return first[block];
    }

    public int past(int block) {
        return past[block];
    }

    public int element(int position) {
        return elements[position];
    }

    /**
     * @return block of element, or -1 if element is not a member of the partition
     */
    public int blockOf(int element) {
        return blockOf[element];
    }

    public boolean contains(int element) {
        return blockOf[element] >= 0;
    }

    public int[] members(int block) {
        return Arrays.copyOfRange(elements, first[block], past[block]);
    }

    /**
     * Mark element for the next {@link #split()}. Marking twice has no effect.
     */
    public void mark(int element) {
        final int block = blockOf[element];
        final int index = location[element];
        final int unmarked = first[block] + marked[block];
        if (index < unmarked) {
            return;
        }

        // move element to the end of the marked prefix
        elements[index] = elements[unmarked];
        location[elements[index]] = index;
        elements[unmarked] = element;
        location[element] = unmarked;

        if (marked[block] == 0) {
            touched[numTouched++] = block;
        }
        marked[block]++;
    }

    /**
     * Split every touched block into its marked and unmarked members and clear all marks.
     * @return number of blocks created
     */
    public int split() {
        final int before = size;
        while (numTouched > 0) {
            final int block = touched[--numTouched];
            final int unmarked = first[block] + marked[block];

            if (unmarked == past[block]) {
                // every member marked, nothing to separate
                marked[block] = 0;
                continue;
            }

            // the smaller half gets the new index
            if (marked[block] <= past[block] - unmarked) {
                first[size] = first[block];
                past[size] = unmarked;
                first[block] = unmarked;
            } else {
                past[size] = past[block];
                first[size] = unmarked;
                past[block] = unmarked;
            }
            for (int i = first[size]; i < past[size]; i++) {
                blockOf[elements[i]] = size;
            }
            marked[block] = 0;
            marked[size] = 0;
            size++;
        }
        return size - before;
    }
}
