package splay;

import static splay.Types.*;

/**
 * Binary search tree node: key, satellite value and two child links.
 * No parent link and no balance bits.  The left subtree holds keys not
 * exceeding {@code key}, the right subtree keys at least as large.
 */
final class Node<K, V> implements NodeView<K, V> {
    K key;
    V value;
    Node<K, V> left, right;

    Node(K key, V value) {
        this.key = key;
        this.value = value;
    }

    @Override public K key() { return key; }
    @Override public V value() { return value; }
    @Override public NodeView<K, V> left() { return left; }
    @Override public NodeView<K, V> right() { return right; }

    boolean isLeaf() { return left == null && right == null; }

    /** Left rotation at t, the top of the rotated link.  Returns the new top. */
    static <K, V> Node<K, V> rotateLeft(Node<K, V> t) {
        assert t != null && t.right != null;
        Node<K, V> u = t.right;
        t.right = u.left;
        u.left = t;
        return u;
    }

    /** Right rotation at t, the top of the rotated link.  Returns the new top. */
    static <K, V> Node<K, V> rotateRight(Node<K, V> t) {
        assert t != null && t.left != null;
        Node<K, V> s = t.left;
        t.left = s.right;
        s.right = t;
        return s;
    }

    /** Number of nodes reachable from n.  Recursion depth is the subtree height. */
    static int count(Node<?, ?> n) {
        return n == null ? 0 : 1 + count(n.left) + count(n.right);
    }

    /**
     * Postorder deep copy of the subtree at n.  Links of the copy are only
     * published once both children are complete, so an allocation failure
     * leaves nothing reachable from the caller.
     */
    static <K, V> Node<K, V> copy(Node<K, V> n) {
        if (n == null) return null;
        Node<K, V> l = copy(n.left);
        Node<K, V> r = copy(n.right);
        Node<K, V> out = new Node<>(n.key, n.value);
        out.left = l;
        out.right = r;
        return out;
    }
}
