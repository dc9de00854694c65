// file: core/src/main/java/io/courselite/core/AvlInvariants.java
package io.courselite.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checker for {@link AvlTree}.
 * <p>
 * Walks the whole tree and reports every violation of:
 *  - BST order (strict, against the bounds inherited from ancestors),
 *  - stored height vs. height recomputed from children,
 *  - AVL balance (|balance factor| <= 1),
 *  - node count vs. {@link AvlTree#size()}.
 * <p>
 * O(n); meant for tests and diagnostics, not for hot paths.
 */
public final class AvlInvariants {

    private AvlInvariants() {
        // utility
    }

    /** @return violation messages, empty when the tree is valid */
    public static List<String> check(AvlTree<?> tree) {
        List<String> violations = new ArrayList<>();
        int[] count = new int[1];
        walk(tree.root(), null, null, violations, count);
        if (count[0] != tree.size()) {
            violations.add("size() reports " + tree.size() + " but tree holds " + count[0] + " nodes");
        }
        return violations;
    }

    public static boolean isValid(AvlTree<?> tree) {
        return check(tree).isEmpty();
    }

    /**
     * Upper bound on the height of an AVL tree holding n keys:
     * 1.4405 * log2(n + 2) - 0.3277.
     * <p>
     * The commonly quoted 1.44 / 0.328 rounding is slightly too tight once floored
     * for some minimal (Fibonacci) trees.
     */
    public static double heightBound(int n) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0");
        return 1.4405 * (Math.log(n + 2) / Math.log(2)) - 0.3277;
    }

    /** Largest integer height allowed by {@link #heightBound(int)}. */
    public static int maxHeightFor(int n) {
        return (int) Math.floor(heightBound(n));
    }

    // Returns the recomputed height of the subtree.
    private static int walk(AvlTree.Node<?> n,
                            String lower,
                            String upper,
                            List<String> violations,
                            int[] count) {
        if (n == null) return 0;
        count[0]++;

        if (lower != null && n.key.compareTo(lower) <= 0) {
            violations.add("order: key '" + n.key + "' not greater than ancestor bound '" + lower + "'");
        }
        if (upper != null && n.key.compareTo(upper) >= 0) {
            violations.add("order: key '" + n.key + "' not less than ancestor bound '" + upper + "'");
        }

        int hl = walk(n.left, lower, n.key, violations, count);
        int hr = walk(n.right, n.key, upper, violations, count);
        int actual = 1 + Math.max(hl, hr);

        if (n.height != actual) {
            violations.add("height: node '" + n.key + "' stores " + n.height + ", expected " + actual);
        }
        if (Math.abs(hl - hr) > 1) {
            violations.add("balance: node '" + n.key + "' has balance factor " + (hl - hr));
        }
        return actual;
    }
}
