package splay;

/**
 * State for one top-down splay (Sleator &amp; Tarjan 1985, Fig. 12).
 *
 * As the search descends, the working root advances one or two links per
 * round and the nodes it leaves behind are held in a two-level history.
 * When a round completes, or the search ends, {@link #setAside()} moves the
 * history into two remainder trees: L collects nodes left of the target,
 * R nodes right of it.  {@link #finish} grafts both onto the new root.
 *
 * History slots, by level and by the link taken from the ancestor:
 * <pre>
 *   level 1 (grandparent):  rightFirst  leftFirst
 *   level 2 (parent):       right2nd    left2nd
 * </pre>
 * At most one slot of each level is occupied.  Example: after stepping
 * right from C to E and right again, rightFirst = C, right2nd = E.
 */
final class Topdown<K, V> {
    /**
     * A remainder tree under construction.  The tip is the node whose frontier
     * child is the next empty slot; a null tip means the root slot itself.
     * L grows along its rightmost frontier, R along its leftmost, so keys
     * arrive in nondecreasing order on L and nonincreasing order on R.
     */
    static final class Remainder<K, V> {
        private final boolean growsRight;
        Node<K, V> root, tip;

        Remainder(boolean growsRight) {
            this.growsRight = growsRight;
        }

        /** Attach n at the tip.  n's frontier link is cut and becomes the new tip slot. */
        void append(Node<K, V> n) {
            assert n != null && slot() == null;
            if (tip == null) root = n;
            else if (growsRight) tip.right = n;
            else tip.left = n;
            if (growsRight) n.right = null;
            else n.left = null;
            tip = n;
        }

        /** Fill the empty tip slot with a subtree (possibly null). */
        void graft(Node<K, V> subtree) {
            if (tip == null) root = subtree;
            else if (growsRight) tip.right = subtree;
            else tip.left = subtree;
        }

        Node<K, V> slot() {
            if (tip == null) return root;
            return growsRight ? tip.right : tip.left;
        }

        void reset() {
            root = tip = null;
        }
    }

    final Remainder<K, V> left = new Remainder<>(true);
    final Remainder<K, V> right = new Remainder<>(false);

    private Node<K, V> rightFirst, leftFirst, right2nd, left2nd;

    /** Empty both remainder trees and the history. */
    void begin() {
        left.reset();
        right.reset();
        clearHistory();
    }

    private void clearHistory() {
        rightFirst = leftFirst = right2nd = left2nd = null;
    }

    boolean isHistoryBlank() {
        return rightFirst == null && leftFirst == null;
    }

    // Each step records the working root and returns its child as the new working root.

    Node<K, V> stepRightFirst(Node<K, V> root) {
        assert leftFirst == null;
        return (rightFirst = root).right;
    }

    Node<K, V> stepLeftFirst(Node<K, V> root) {
        assert rightFirst == null;
        return (leftFirst = root).left;
    }

    Node<K, V> stepRight2nd(Node<K, V> root) {
        assert left2nd == null && !isHistoryBlank();
        return (right2nd = root).right;
    }

    Node<K, V> stepLeft2nd(Node<K, V> root) {
        assert right2nd == null && !isHistoryBlank();
        return (left2nd = root).left;
    }

    /** Remove and return the level-1 ancestor. */
    Node<K, V> undoFirstStep() {
        assert rightFirst == null || leftFirst == null;
        Node<K, V> n;
        if (rightFirst != null) {
            n = rightFirst;
            rightFirst = null;
        } else {
            n = leftFirst;
            leftFirst = null;
        }
        assert n != null;
        return n;
    }

    /** Remove and return the level-2 ancestor; level 1 is kept. */
    Node<K, V> undoSecondStep() {
        assert right2nd == null || left2nd == null;
        Node<K, V> n;
        if (right2nd != null) {
            n = right2nd;
            right2nd = null;
        } else {
            n = left2nd;
            left2nd = null;
        }
        assert n != null;
        return n;
    }

    /**
     * Move the history into the remainder trees and blank it.  The history
     * must hold a level-1 ancestor.  Not idempotent.
     */
    void setAside() {
        assert !isHistoryBlank() : "set aside with blank history";

        // right2nd's right link reaches the working root; left2nd's left link does.
        if (right2nd == null && left2nd == null) {
            if (rightFirst != null)
                left.append(rightFirst);                      // zig \
            else
                right.append(leftFirst);                      // zig /
        } else if (left2nd == null) {
            if (rightFirst != null) {
                left.append(Node.rotateLeft(rightFirst));     // zig-zig \\
            } else {
                right.append(leftFirst);                      // zig-zag <
                left.append(right2nd);
            }
        } else {
            if (leftFirst != null) {
                right.append(Node.rotateRight(leftFirst));    // zig-zig //
            } else {
                left.append(rightFirst);                      // zig-zag >
                right.append(left2nd);
            }
        }

        clearHistory();
    }

    /**
     * Closing move of every top-down splay: root's subtrees go to the tips,
     * and the remainder trees become root's subtrees.
     */
    Node<K, V> finish(Node<K, V> root) {
        assert isHistoryBlank();
        left.graft(root.left);
        root.left = left.root;
        right.graft(root.right);
        root.right = right.root;
        left.reset();
        right.reset();
        return root;
    }

    /**
     * Closing move of an insertion, where the whole old tree has been
     * partitioned: the remainder trees become the subtrees of leaf n.
     */
    Node<K, V> adopt(Node<K, V> n) {
        assert isHistoryBlank() && n.isLeaf();
        n.left = left.root;
        n.right = right.root;
        left.reset();
        right.reset();
        return n;
    }
}
