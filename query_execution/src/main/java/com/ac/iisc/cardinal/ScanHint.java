package com.ac.iisc.cardinal;

/** Forces the scan method for one table: {@code SeqScan(t)}, {@code IndexScan(t)}, ... */
public final class ScanHint extends HintToken {
    private final ScanOperator operator;
    private final String table;

    public ScanHint(ScanOperator operator, String table) {
        if (operator == null) throw new IllegalArgumentException("operator must not be null");
        if (table == null || table.isBlank()) throw new IllegalArgumentException("table must not be null or blank");
        this.operator = operator;
        this.table = table;
    }

    public ScanOperator getOperator() { return operator; }
    public String getTable() { return table; }

    @Override
    public String render() {
        return operator.getHintName() + "(" + table + ")";
    }
}
