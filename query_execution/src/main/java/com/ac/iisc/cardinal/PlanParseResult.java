package com.ac.iisc.cardinal;

/**
 * Outcome of {@link PlanParser#parse(Object)}: either a canonical plan tree or the
 * reason the payload could not be read. Exactly one of the two is set.
 *
 * A failed parse is not an error for callers that only want hints; they proceed
 * without a directive.
 */
public final class PlanParseResult {
    private final PlanNode root;
    private final String failureReason;

    private PlanParseResult(PlanNode root, String failureReason) {
        this.root = root;
        this.failureReason = failureReason;
    }

    public static PlanParseResult success(PlanNode root) {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        return new PlanParseResult(root, null);
    }

    public static PlanParseResult failure(String reason) {
        return new PlanParseResult(null, reason == null || reason.isBlank() ? "unparseable plan" : reason);
    }

    public boolean isParsed() { return root != null; }

    /** Plan root; null when {@link #isParsed()} is false. */
    public PlanNode getRoot() { return root; }

    /** Why parsing failed; null on success. */
    public String getFailureReason() { return failureReason; }

    @Override
    public String toString() {
        return isParsed() ? "PlanParseResult[parsed " + root.getKind() + "]"
                          : "PlanParseResult[unparseable: " + failureReason + "]";
    }
}
