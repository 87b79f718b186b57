package com.ac.iisc.cardinal;

import java.util.List;

/**
 * Forces the join method over a set of tables: {@code HashJoin(a b ...)}.
 * Operand order is the order in which the tables were found under the join,
 * left subtree first.
 */
public final class JoinHint extends HintToken {
    private final JoinOperator operator;
    private final List<String> tables;

    public JoinHint(JoinOperator operator, List<String> tables) {
        if (operator == null) throw new IllegalArgumentException("operator must not be null");
        if (tables == null || tables.size() < 2) {
            throw new IllegalArgumentException("a join hint needs at least two tables");
        }
        this.operator = operator;
        this.tables = List.copyOf(tables);
    }

    public JoinOperator getOperator() { return operator; }
    public List<String> getTables() { return tables; }

    @Override
    public String render() {
        return operator.getHintName() + "(" + String.join(" ", tables) + ")";
    }
}
