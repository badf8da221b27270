package splay;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;

import static splay.Types.*;

/**
 * Tarjan-Sleator splay tree: an ordered dictionary, set, multimap or
 * multiset.
 *
 * A self-adjusting binary search tree with no balance information and no
 * parent links.  Every keyed access splays the node it reaches to the root
 * by top-down splaying, so find, insert, update, erase, min and max take
 * amortized O(log n) time.  A single call may take O(n).
 *
 * Keys need not be unique.  Among equal keys, which record a find, update
 * or erase reaches is unspecified.  Null keys are not supported.
 *
 * Not thread-safe.  Even find, min and max restructure the tree, so callers
 * sharing a tree must hold one lock around every call.
 *
 * Reference: Sleator &amp; Tarjan, "Self-Adjusting Binary Search Trees",
 * JACM 32(3), 1985.
 *
 * @param <K> key type, totally ordered by the tree's comparator
 * @param <V> value type, opaque to the tree
 */
public final class SplayTree<K, V> {
    private final Comparator<? super K> cmp;
    private final Splayer<K, V> splayer;
    private final boolean verbose;

    private Node<K, V> root;
    private int size;

    public SplayTree(Comparator<? super K> cmp) {
        this(cmp, new TreeOptions());
    }

    public SplayTree(Comparator<? super K> cmp, TreeOptions opts) {
        this.cmp = cmp;
        this.splayer = new Splayer<>(cmp);
        this.verbose = opts.verbose;
    }

    /** Empty tree ordered by the keys' natural ordering. */
    public static <K extends Comparable<? super K>, V> SplayTree<K, V> natural() {
        return new SplayTree<>(Comparator.<K>naturalOrder());
    }

    public int size() { return size; }
    public boolean isEmpty() { return size == 0; }
    public Comparator<? super K> comparator() { return cmp; }

    /** Key at the root, or null if empty.  Does not splay. */
    public K rootKey() { return root == null ? null : root.key; }

    // ── Dictionary operations ──

    /**
     * Search for k.  If absent, the last node probed is splayed instead and
     * the result is not found.
     */
    public Result<K, V> find(K k) {
        root = splayer.search(root, k);
        boolean found = splayer.found();
        trace("find", k, found ? "found" : "not found");
        return found ? new Result<>(true, root.key, root.value) : Result.notFound();
    }

    /** Insert a record; an existing record with an equal key is kept. */
    public void insert(K k, V v) {
        Node<K, V> n = new Node<>(k, v);
        root = splayer.insert(root, n);
        assert root == n;
        size++;
        trace("insert", k, "inserted");
    }

    /**
     * Overwrite the value of a record with key k.  With duplicate keys there
     * is no control over which record changes.
     *
     * @return false if k is absent (the tree is still splayed)
     */
    public boolean update(K k, V v) {
        root = splayer.search(root, k);
        boolean found = splayer.found();
        if (found) root.value = v;
        trace("update", k, found ? "updated" : "not found");
        return found;
    }

    /**
     * Remove one record with key k.  The successor of the removed record, if
     * any, becomes the root; otherwise its left child does.
     *
     * @return the removed record, or not found (no change) if k is absent
     */
    public Result<K, V> erase(K k) {
        root = splayer.search(root, k);
        if (!splayer.found()) {
            trace("erase", k, "not found");
            return Result.notFound();
        }

        Node<K, V> radix = root;
        if (radix.right != null) {
            // Splay the successor within the right subtree; it has no left child.
            root = splayer.min(radix.right);
            assert root.left == null;
            root.left = radix.left;
        } else {
            root = radix.left;
        }
        radix.left = radix.right = null;

        size--;
        trace("erase", k, "erased");
        return new Result<>(true, radix.key, radix.value);
    }

    /**
     * Splay the minimum record to the root.  To extract it, erase the key
     * returned.
     */
    public Result<K, V> min() {
        if (root == null) return Result.notFound();
        root = splayer.min(root);
        trace("min", root.key, "found");
        return new Result<>(true, root.key, root.value);
    }

    /** Splay the maximum record to the root. */
    public Result<K, V> max() {
        if (root == null) return Result.notFound();
        root = splayer.max(root);
        trace("max", root.key, "found");
        return new Result<>(true, root.key, root.value);
    }

    // ── Whole-tree operations ──

    /** Drop every record.  Safe to call repeatedly. */
    public void clear() {
        root = null;
        size = 0;
    }

    /**
     * Deep copy into {@code dst}, which must be empty and ordered by an equal
     * comparator.  This tree is
     * unaffected.  The copy is built before it is attached, so if
     * allocation fails {@code dst} stays empty.  Recursion depth is the
     * tree height.
     */
    public void copyTo(SplayTree<K, V> dst) {
        checkDestination(dst);
        Node<K, V> copy = Node.copy(root);
        dst.root = copy;
        dst.size = size;
    }

    /**
     * Transfer every record to {@code dst} in constant time.  {@code dst}
     * must be empty and ordered by an equal comparator.
     */
    public void moveTo(SplayTree<K, V> dst) {
        checkDestination(dst);
        dst.root = root;
        dst.size = size;
        root = null;
        size = 0;
    }

    private void checkDestination(SplayTree<K, V> dst) {
        if (dst == this)
            throw new IllegalArgumentException("source and destination are the same tree");
        if (!cmp.equals(dst.cmp))
            throw new IllegalArgumentException(
                "destination tree orders keys with a different comparator");
        if (dst.root != null || dst.size != 0)
            throw new IllegalStateException(
                "destination tree is not empty (size " + dst.size + ")");
    }

    // ── Support operations: linear time, no splaying ──

    /**
     * Test the tree for broken invariants: the size counter against the
     * reachable node count, then BST ordering.  Reports the first problem
     * found.  Advisory only; nothing calls it internally.
     */
    public HealthReport healthCheck() {
        return Health.check(root, size, cmp);
    }

    /** Visit every node depth-first, parent before children (preorder). */
    public void traverse(NodeVisitor<K, V> visitor) {
        traverse(root, 0, visitor);
    }

    private static <K, V> void traverse(Node<K, V> n, int depth, NodeVisitor<K, V> visitor) {
        if (n == null) return;
        visitor.visit(n, depth);
        traverse(n.left, depth + 1, visitor);
        traverse(n.right, depth + 1, visitor);
    }

    /**
     * Print the size and one line per node in preorder, indented by depth.
     * Nodes are identified by identity hash.
     */
    public void debugPrint(PrintStream out) {
        out.printf("Tree size: %d%n", size);
        traverse((n, depth) -> {
            StringBuilder sb = new StringBuilder();
            for (int j = 0; j < depth; j++) sb.append(' ');
            out.printf("%sNode at %s has key %s, left %s, right %s%n",
                sb, id(n), n.key(), id(n.left()), id(n.right()));
        });
    }

    /** The text of {@link #debugPrint} as a string. */
    public String dump() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8)) {
            debugPrint(out);
        }
        return buf.toString(StandardCharsets.UTF_8);
    }

    private static String id(NodeView<?, ?> n) {
        return n == null ? "null" : "@" + Integer.toHexString(System.identityHashCode(n));
    }

    private void trace(String op, K k, String outcome) {
        if (verbose) {
            System.err.printf("splay: %s %s: %s, root %s -> %s, size %d%n",
                op, k, outcome, rootKey(), root == null ? null : root.value, size);
        }
    }

    // package-private access for tests

    Node<K, V> root() { return root; }
    void setRoot(Node<K, V> root, int size) { this.root = root; this.size = size; }
}
