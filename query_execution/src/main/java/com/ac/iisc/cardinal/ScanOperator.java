package com.ac.iisc.cardinal;

import java.util.HashMap;
import java.util.Map;

/**
 * Scan operators that pg_hint_plan can force, keyed by the EXPLAIN {@code Node Type}
 * that produces them. Both bitmap node types map to the single {@code BitmapScan} hint.
 */
public enum ScanOperator {
    SEQ_SCAN("Seq Scan", "SeqScan"),
    INDEX_SCAN("Index Scan", "IndexScan"),
    INDEX_ONLY_SCAN("Index Only Scan", "IndexOnlyScan"),
    BITMAP_HEAP_SCAN("Bitmap Heap Scan", "BitmapScan"),
    BITMAP_INDEX_SCAN("Bitmap Index Scan", "BitmapScan"),
    TID_SCAN("Tid Scan", "TidScan"),
    TID_RANGE_SCAN("Tid Range Scan", "TidRangeScan");

    private static final Map<String, ScanOperator> BY_NODE_TYPE = new HashMap<>();

    static {
        for (ScanOperator op : values()) {
            BY_NODE_TYPE.put(op.nodeType, op);
        }
    }

    private final String nodeType;
    private final String hintName;

    ScanOperator(String nodeType, String hintName) {
        this.nodeType = nodeType;
        this.hintName = hintName;
    }

    /** EXPLAIN node type, e.g. {@code "Seq Scan"}. */
    public String getNodeType() { return nodeType; }

    /** pg_hint_plan hint name, e.g. {@code "SeqScan"}. */
    public String getHintName() { return hintName; }

    /** Scan operator for a node type, or null when the node is not a scan. */
    public static ScanOperator fromNodeType(String nodeType) {
        return nodeType == null ? null : BY_NODE_TYPE.get(nodeType);
    }
}
