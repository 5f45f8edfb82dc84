package FSA.Compare;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import FSA.BitSetUtils;

/**
 * Congruence closure of a relation R on sets of states: the smallest equivalence containing R that is closed under
 * union. Membership is decided by rewriting both sets to their normal forms, where a rule (X, Y) of R adds Y to any
 * set containing X and vice versa; two sets are congruent iff the normal forms coincide.
 * <p>
 * Rules are applied in insertion order until nothing changes. The order only affects how fast the fixed point is
 * reached, never the normal form.
 */
final class Congruence {
    private final List<BitSet> lefts = new ArrayList<>();
    private final List<BitSet> rights = new ArrayList<>();

    void add(BitSet x, BitSet y) {
        lefts.add(x);
        rights.add(y);
    }

    int size() {
        return lefts.size();
    }

    boolean contains(BitSet x, BitSet y) {
        if (x.equals(y)) {
            return true;
        }
        return normalForm(x).equals(normalForm(y));
    }

    BitSet normalForm(BitSet set) {
        final BitSet result = (BitSet) set.clone();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i < lefts.size(); i++) {
                final BitSet x = lefts.get(i);
                final BitSet y = rights.get(i);
                if (BitSetUtils.isSubset(x, result) && !BitSetUtils.isSubset(y, result)) {
                    result.or(y);
                    changed = true;
                }
                if (BitSetUtils.isSubset(y, result) && !BitSetUtils.isSubset(x, result)) {
                    result.or(x);
                    changed = true;
                }
            }
        }
        return result;
    }
}
