package splay;

/** Shared types for the splay tree dictionary. */
public final class Types {
    private Types() {}

    /** Stand-ins printed for the open ends of a key range. */
    public static final String NEG_INF = "-inf";
    public static final String POS_INF = "+inf";

    // ── Configuration ──

    public static final class TreeOptions {
        /** Trace every splay to standard error. */
        public boolean verbose = false;
    }

    // ── Search outcomes ──

    /**
     * Outcome of a find, min, max or erase.  When {@code found} is false the
     * key and value are null.
     */
    public static final class Result<K, V> {
        public final boolean found;
        public final K key;
        public final V value;

        public Result(boolean found, K key, V value) {
            this.found = found;
            this.key = key;
            this.value = value;
        }

        public static <K, V> Result<K, V> notFound() {
            return new Result<>(false, null, null);
        }

        @Override
        public String toString() {
            return found ? "found " + key + " -> " + value : "not found";
        }
    }

    // ── Integrity ──

    /** Health check verdict.  The message is empty for a healthy tree. */
    public static final class HealthReport {
        public final boolean healthy;
        public final String message;

        public HealthReport(boolean healthy, String message) {
            this.healthy = healthy;
            this.message = message;
        }

        static final HealthReport OK = new HealthReport(true, "");

        static HealthReport failure(String message) {
            return new HealthReport(false, message);
        }

        @Override
        public String toString() {
            return healthy ? "healthy" : "unhealthy: " + message;
        }
    }

    // ── Traversal hooks ──

    /**
     * Read-only view of one node.  Child views are null for empty slots;
     * view identity is node identity.
     */
    public interface NodeView<K, V> {
        K key();
        V value();
        NodeView<K, V> left();
        NodeView<K, V> right();
    }

    /** Callback for the preorder traversal hook. */
    @FunctionalInterface
    public interface NodeVisitor<K, V> {
        void visit(NodeView<K, V> node, int depth);
    }
}
