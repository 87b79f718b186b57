package com.ac.iisc.cardinal;

/** Pins the index used to scan a table: {@code IndexScan(t idx)}. */
public final class IndexHint extends HintToken {
    private final String table;
    private final String indexName;

    public IndexHint(String table, String indexName) {
        if (table == null || table.isBlank()) throw new IllegalArgumentException("table must not be null or blank");
        if (indexName == null) throw new IllegalArgumentException("indexName must not be null");
        this.table = table;
        this.indexName = indexName;
    }

    public String getTable() { return table; }
    public String getIndexName() { return indexName; }

    @Override
    public String render() {
        return "IndexScan(" + table + " " + indexName + ")";
    }
}
