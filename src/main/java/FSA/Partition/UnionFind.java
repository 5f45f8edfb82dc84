package FSA.Partition;

/**
 * Disjoint sets over 0..size-1 with union by rank and path compression.
 */
public final class UnionFind {
    private final int[] parent;
    private final int[] rank;
    private int numClasses;

    public UnionFind(int size) {
        this.parent = new int[size];
        this.rank = new int[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
        this.numClasses = size;
    }

    /**
     * @return representative of the class of element
     */
    public int find(int element) {
        int root = element;
        while (parent[root] != root) {
            root = parent[root];
        }
        // path compression
        while (parent[element] != root) {
            final int next = parent[element];
            parent[element] = root;
            element = next;
        }
        return root;
    }

    /**
     * Merge the classes of a and b.
     * @return representative of the merged class
     */
    public int union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return rootA;
        }
        if (rank[rootA] < rank[rootB]) {
            final int tmp = rootA;
            rootA = rootB;
            rootB = tmp;
        }
        parent[rootB] = rootA;
        if (rank[rootA] == rank[rootB]) {
            rank[rootA]++;
        }
        numClasses--;
        return rootA;
    }

    public boolean areEquivalent(int a, int b) {
        return find(a) == find(b);
    }

    public int size() {
        return parent.length;
    }

    public int numClasses() {
        return numClasses;
    }
}
