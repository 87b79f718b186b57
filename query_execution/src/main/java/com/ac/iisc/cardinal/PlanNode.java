package com.ac.iisc.cardinal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One operator of a PostgreSQL EXPLAIN (FORMAT JSON) plan, in canonical form.
 *
 * Characteristics:
 * - Stores the fields the hint compiler reads ({@code Node Type}, {@code Relation Name},
 *   {@code Alias}, {@code Index Name}) plus a handful of analyze-time fields used only
 *   by {@link #render()}.
 * - Children are kept in plan order. Order matters: the left/right operands of a join
 *   are identified by position, never by the {@code Parent Relationship} label.
 * - Instances are built by {@link PlanParser} and are not shared between compilations.
 */
public class PlanNode {
    private final String kind;
    private String relationName;
    private String alias;
    private String indexName;

    // Display-only fields (EXPLAIN ANALYZE / estimates)
    private Double actualTotalTime;
    private Double actualRows;
    private Double totalCost;
    private Long planRows;
    private String hashCond;
    private String mergeCond;

    private final List<PlanNode> children = new ArrayList<>();

    public PlanNode(String kind) {
        this.kind = kind == null ? "" : kind;
    }

    /** Append a child operator (no effect for null). */
    public void addChild(PlanNode child) {
        if (child != null) this.children.add(child);
    }

    /**
     * Table identifier used in hints: the alias when the planner reported one,
     * otherwise the relation name. Blank names count as absent; null when the node
     * touches no table.
     */
    public String getTableIdentifier() {
        if (alias != null && !alias.isBlank()) return alias;
        if (relationName != null && !relationName.isBlank()) return relationName;
        return null;
    }

    // --- Getters/Setters ---
    public String getKind() { return kind; }
    public String getRelationName() { return relationName; }
    public void setRelationName(String relationName) { this.relationName = relationName; }
    public String getAlias() { return alias; }
    public void setAlias(String alias) { this.alias = alias; }
    public String getIndexName() { return indexName; }
    public void setIndexName(String indexName) { this.indexName = indexName; }
    public Double getActualTotalTime() { return actualTotalTime; }
    public void setActualTotalTime(Double actualTotalTime) { this.actualTotalTime = actualTotalTime; }
    public Double getActualRows() { return actualRows; }
    public void setActualRows(Double actualRows) { this.actualRows = actualRows; }
    public Double getTotalCost() { return totalCost; }
    public void setTotalCost(Double totalCost) { this.totalCost = totalCost; }
    public Long getPlanRows() { return planRows; }
    public void setPlanRows(Long planRows) { this.planRows = planRows; }
    public String getHashCond() { return hashCond; }
    public void setHashCond(String hashCond) { this.hashCond = hashCond; }
    public String getMergeCond() { return mergeCond; }
    public void setMergeCond(String mergeCond) { this.mergeCond = mergeCond; }
    public List<PlanNode> getChildren() { return Collections.unmodifiableList(children); }

    // --- Equality/Hash ---
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlanNode other)) return false;
        return kind.equals(other.kind)
            && Objects.equals(relationName, other.relationName)
            && Objects.equals(alias, other.alias)
            && Objects.equals(indexName, other.indexName)
            && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, relationName, alias, indexName, children);
    }

    // --- Rendering ---

    /**
     * Readable indented tree, two spaces per level. Each operator line shows actual
     * time and rows when the plan was analyzed, otherwise the planner estimates;
     * followed by the scanned table and the join condition when present.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        render(sb, 0);
        return sb.toString();
    }

    private void render(StringBuilder sb, int depth) {
        String spacing = "  ".repeat(depth);
        String label = kind.isEmpty() ? "Unknown" : kind;

        sb.append(spacing).append(label);
        if (actualTotalTime != null) {
            sb.append(String.format(Locale.ROOT, " (Time: %.2fms, Rows: %s)",
                actualTotalTime, formatRows(actualRows)));
        } else {
            sb.append(String.format(Locale.ROOT, " (Est Cost: %.2f, Est Rows: %d)",
                totalCost == null ? 0.0 : totalCost, planRows == null ? 0L : planRows));
        }
        sb.append('\n');

        if (relationName != null) {
            sb.append(spacing).append("  Table: ").append(relationName).append('\n');
        }
        if (hashCond != null) {
            sb.append(spacing).append("  Join Condition: ").append(hashCond).append('\n');
        } else if (mergeCond != null) {
            sb.append(spacing).append("  Join Condition: ").append(mergeCond).append('\n');
        }

        for (PlanNode child : children) {
            child.render(sb, depth + 1);
        }
    }

    // PostgreSQL 18 reports fractional "Actual Rows"; print whole counts without decimals
    static String formatRows(Double rows) {
        if (rows == null) return "0";
        if (rows == Math.rint(rows) && !Double.isInfinite(rows)) return Long.toString(rows.longValue());
        return String.format(Locale.ROOT, "%.2f", rows);
    }

    @Override
    public String toString() {
        return render();
    }
}
