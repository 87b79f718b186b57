package com.ac.iisc.cardinal;

import java.util.HashMap;
import java.util.Map;

/** Join methods that pg_hint_plan can force, keyed by EXPLAIN {@code Node Type}. */
public enum JoinOperator {
    NESTED_LOOP("Nested Loop", "NestLoop"),
    HASH_JOIN("Hash Join", "HashJoin"),
    MERGE_JOIN("Merge Join", "MergeJoin");

    private static final Map<String, JoinOperator> BY_NODE_TYPE = new HashMap<>();

    static {
        for (JoinOperator op : values()) {
            BY_NODE_TYPE.put(op.nodeType, op);
        }
    }

    private final String nodeType;
    private final String hintName;

    JoinOperator(String nodeType, String hintName) {
        this.nodeType = nodeType;
        this.hintName = hintName;
    }

    public String getNodeType() { return nodeType; }

    public String getHintName() { return hintName; }

    /** Join operator for a node type, or null when the node is not a join. */
    public static JoinOperator fromNodeType(String nodeType) {
        return nodeType == null ? null : BY_NODE_TYPE.get(nodeType);
    }
}
