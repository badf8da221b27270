package splay;

import java.util.Comparator;

import static splay.Types.*;

/**
 * Structural integrity checks.  Linear time, no splaying.  A check can
 * detect certain errors, but it cannot prove their absence.
 */
final class Health {
    private Health() {}

    static <K, V> HealthReport check(Node<K, V> root, int size, Comparator<? super K> cmp) {
        if (root == null && size == 0) return HealthReport.OK;

        String sizeFailure = sizeFailure(root, size);
        if (sizeFailure != null) return HealthReport.failure(sizeFailure);

        String orderFailure = orderFailure(root, null, null, cmp);
        if (orderFailure != null) return HealthReport.failure(orderFailure);

        return HealthReport.OK;
    }

    /** Size counter against the root's presence, then against a full count. */
    static String sizeFailure(Node<?, ?> root, int size) {
        if (root != null && size == 0)
            return "Size counter is zero but tree has non-nil root.";
        if (root == null && size != 0)
            return String.format("Size counter is %d but tree has nil root.", size);
        int reachable = Node.count(root);
        if (size != reachable)
            return String.format("Size counter is %d but tree has %d reachable nodes.",
                size, reachable);
        return null;
    }

    /**
     * First node whose key falls outside [lo, hi], the range inherited from
     * its ancestors (null bounds are open).  The range is closed because
     * equal keys may sit on either side of one another.
     */
    static <K, V> String orderFailure(Node<K, V> t, K lo, K hi, Comparator<? super K> cmp) {
        if (t == null) return null;
        if ((lo != null && cmp.compare(t.key, lo) < 0) || (hi != null && cmp.compare(hi, t.key) < 0)) {
            return String.format("Node with key %s violates the BST property; "
                + "should be in range [%s, %s].",
                t.key, lo != null ? lo : NEG_INF, hi != null ? hi : POS_INF);
        }
        String l = orderFailure(t.left, lo, t.key, cmp);
        return l != null ? l : orderFailure(t.right, t.key, hi, cmp);
    }
}
