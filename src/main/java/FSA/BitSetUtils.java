package FSA;

import java.util.BitSet;

public class BitSetUtils {

    private BitSetUtils() {}

    /**
     * Determine is sub is a subset of sup.
     */
    public static boolean isSubset(BitSet sub, BitSet sup) {
        for (int i = sub.nextSetBit(0); i >= 0; i = sub.nextSetBit(i + 1)) {
            if (!sup.get(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Set of the given elements.
     */
    public static BitSet of(int... elements) {
        final BitSet result = new BitSet();
        for (int e : elements) {
            result.set(e);
        }
        return result;
    }
}
