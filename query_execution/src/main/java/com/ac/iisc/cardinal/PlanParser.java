package com.ac.iisc.cardinal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Normalizes a PostgreSQL EXPLAIN (FORMAT JSON) payload into one {@link PlanNode} tree.
 *
 * Accepted shapes:
 *  - {@code {"Plan": {...}, "Planning Time": ...}}: the root object EXPLAIN returns per statement.
 *  - {@code [{"Plan": {...}}]}: the array EXPLAIN (FORMAT JSON) actually prints. The first
 *    element is used.
 *  - the bare node object ({@code {"Node Type": ..., "Plans": [...]}}).
 *  - the serialized text of any of the above.
 *
 * Anything else yields a failed {@link PlanParseResult} rather than an exception.
 */
public final class PlanParser {

    private static final Logger LOGGER = LogManager.getLogger(PlanParser.class);

    // Keys read from each plan node
    static final String PLAN = "Plan";
    static final String PLANS = "Plans";
    static final String NODE_TYPE = "Node Type";
    static final String RELATION_NAME = "Relation Name";
    static final String ALIAS = "Alias";
    static final String INDEX_NAME = "Index Name";
    static final String ACTUAL_TOTAL_TIME = "Actual Total Time";
    static final String ACTUAL_ROWS = "Actual Rows";
    static final String TOTAL_COST = "Total Cost";
    static final String PLAN_ROWS = "Plan Rows";
    static final String HASH_COND = "Hash Cond";
    static final String MERGE_COND = "Merge Cond";

    private PlanParser() {}

    /**
     * Parse a plan payload given as {@link JSONObject}, {@link JSONArray} or JSON text.
     *
     * @param payload plan payload; may be null
     * @return parsed tree, or a failure describing why the payload was rejected
     */
    public static PlanParseResult parse(Object payload) {
        if (payload == null || payload == JSONObject.NULL) {
            return PlanParseResult.failure("no plan payload");
        }

        Object json = payload;
        if (payload instanceof String text) {
            if (text.isBlank()) return PlanParseResult.failure("empty plan text");
            try {
                json = new JSONTokener(text.trim()).nextValue();
            } catch (JSONException e) {
                LOGGER.debug("Plan text is not valid JSON: {}", e.getMessage());
                return PlanParseResult.failure("invalid plan JSON: " + e.getMessage());
            }
        }

        // EXPLAIN (FORMAT JSON) wraps the statement's plan in a one-element array
        if (json instanceof JSONArray arr) {
            if (arr.isEmpty()) return PlanParseResult.failure("plan array is empty");
            json = arr.get(0);
        }

        if (!(json instanceof JSONObject root)) {
            return PlanParseResult.failure("plan payload is not a JSON object");
        }

        // Lift the 'Plan' node when present
        JSONObject planObject = root;
        if (root.has(PLAN)) {
            planObject = root.optJSONObject(PLAN);
            if (planObject == null) {
                return PlanParseResult.failure("'Plan' field is not a JSON object");
            }
        }

        try {
            return PlanParseResult.success(toNode(planObject));
        } catch (IllegalArgumentException e) {
            LOGGER.debug("Rejected plan tree: {}", e.getMessage());
            return PlanParseResult.failure(e.getMessage());
        }
    }

    /** Recursively convert a plan node object; children keep their array order. */
    private static PlanNode toNode(JSONObject obj) {
        PlanNode node = new PlanNode(optString(obj, NODE_TYPE));
        node.setRelationName(optString(obj, RELATION_NAME));
        node.setAlias(optString(obj, ALIAS));
        node.setIndexName(optString(obj, INDEX_NAME));
        node.setActualTotalTime(optDouble(obj, ACTUAL_TOTAL_TIME));
        node.setActualRows(optDouble(obj, ACTUAL_ROWS));
        node.setTotalCost(optDouble(obj, TOTAL_COST));
        Double planRows = optDouble(obj, PLAN_ROWS);
        node.setPlanRows(planRows == null ? null : planRows.longValue());
        node.setHashCond(optString(obj, HASH_COND));
        node.setMergeCond(optString(obj, MERGE_COND));

        if (obj.has(PLANS) && !obj.isNull(PLANS)) {
            JSONArray plans = obj.optJSONArray(PLANS);
            if (plans == null) {
                throw new IllegalArgumentException("'Plans' field is not a JSON array");
            }
            for (int i = 0; i < plans.length(); i++) {
                Object child = plans.get(i);
                if (!(child instanceof JSONObject childObj)) {
                    throw new IllegalArgumentException("'Plans' entry " + i + " is not a JSON object");
                }
                node.addChild(toNode(childObj));
            }
        }
        return node;
    }

    /** String value of a key, or null when absent or JSON null. */
    static String optString(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) return null;
        return String.valueOf(obj.get(key));
    }

    /** Numeric value of a key, or null when absent, JSON null or non-numeric. */
    static Double optDouble(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) return null;
        double d = obj.optDouble(key, Double.NaN);
        return Double.isNaN(d) ? null : d;
    }
}
