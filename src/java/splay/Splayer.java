package splay;

import java.util.Comparator;

/**
 * Top-down splaying drivers: keyed search, insertion partition, and the
 * comparison-free min/max splays.  Every routine takes the current root and
 * returns the updated root; none allocates tree nodes.
 *
 * Keys are compared only through {@link #lessKey} and {@link #keyLess}.
 * Equality is whatever is left over, so equal keys are handled the same way
 * everywhere: the existing node goes first, the query second, and a true
 * {@code lessKey} means the right link.
 */
final class Splayer<K, V> {
    private final Comparator<? super K> cmp;
    private final Topdown<K, V> td = new Topdown<>();
    private boolean found;

    Splayer(Comparator<? super K> cmp) {
        this.cmp = cmp;
    }

    /** Did the last {@link #search} find its key? */
    boolean found() { return found; }

    boolean lessKey(Node<K, V> p, K k) {
        return cmp.compare(p.key, k) < 0;
    }

    boolean keyLess(K k, Node<K, V> p) {
        return cmp.compare(k, p.key) < 0;
    }

    /**
     * Search for k and splay.  If k is present the returned root holds it;
     * otherwise the root is the last node probed (an in-order neighbor of k).
     * An empty tree stays empty.  Sets {@link #found()}.
     *
     * Each round steps down at most two links and exits on one of:
     * (1) the working root holds k; (2) the first step runs off the tree;
     * (3) the child holds k; (4) the second step runs off the tree.
     * Exits 3 and 4 leave one level of history for a final zig.
     */
    Node<K, V> search(Node<K, V> root, K k) {
        found = false;
        if (root == null) return null;

        for (td.begin(); ; td.setAside()) {
            assert root != null;

            if (lessKey(root, k)) {
                root = td.stepRightFirst(root);
            } else if (keyLess(k, root)) {
                root = td.stepLeftFirst(root);
            } else {
                found = true;
                break;
            }

            if (root == null) {
                root = td.undoFirstStep();
                break;
            }

            if (lessKey(root, k)) {
                root = td.stepRight2nd(root);
            } else if (keyLess(k, root)) {
                root = td.stepLeft2nd(root);
            } else {
                found = true;
                break;
            }

            if (root == null) {
                root = td.undoSecondStep();
                break;
            }
        }

        assert found != (lessKey(root, k) || keyLess(k, root));

        // final zig
        if (!td.isHistoryBlank()) td.setAside();

        return td.finish(root);
    }

    /**
     * Partition the whole tree against n's key and make n the root.
     * Unlike {@link #search} there is no early exit: every old node lands in
     * one of the two remainder trees.  Old keys equal to n's go right.
     */
    Node<K, V> insert(Node<K, V> root, Node<K, V> n) {
        assert n.isLeaf();
        if (root == null) return n;

        for (td.begin(); root != null; td.setAside()) {
            root = lessKey(root, n.key) ? td.stepRightFirst(root) : td.stepLeftFirst(root);
            if (root != null)
                root = lessKey(root, n.key) ? td.stepRight2nd(root) : td.stepLeft2nd(root);
        }

        return td.adopt(n);
    }

    /**
     * Splay the minimum to the root.  Every node on the leftmost path goes
     * into the right remainder tree; the left remainder stays empty.
     */
    Node<K, V> min(Node<K, V> root) {
        if (root == null) return null;

        for (td.begin(); root.left != null; td.setAside()) {
            root = td.stepLeftFirst(root);
            if (root.left != null)
                root = td.stepLeft2nd(root);
        }

        assert root.left == null && td.left.root == null;
        return td.finish(root);
    }

    /** Mirror image of {@link #min}. */
    Node<K, V> max(Node<K, V> root) {
        if (root == null) return null;

        for (td.begin(); root.right != null; td.setAside()) {
            root = td.stepRightFirst(root);
            if (root.right != null)
                root = td.stepRight2nd(root);
        }

        assert root.right == null && td.right.root == null;
        return td.finish(root);
    }
}
