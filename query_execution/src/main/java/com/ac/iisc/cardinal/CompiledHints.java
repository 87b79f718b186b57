package com.ac.iisc.cardinal;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything one compilation produced: the tokens by category, in emission order,
 * the tables the plan scans, and the rendered directive.
 */
public final class CompiledHints {

    /** Returned when there is nothing to hint (no plan, or a plan without hintable operators). */
    public static final CompiledHints EMPTY = new CompiledHints(List.of(), List.of(), List.of(), List.of());

    private final List<ScanHint> scanHints;
    private final List<JoinHint> joinHints;
    private final List<IndexHint> indexHints;
    private final List<String> tables;
    private final String directive;

    CompiledHints(List<ScanHint> scanHints, List<JoinHint> joinHints, List<IndexHint> indexHints, List<String> tables) {
        this.scanHints = List.copyOf(scanHints);
        this.joinHints = List.copyOf(joinHints);
        this.indexHints = List.copyOf(indexHints);
        this.tables = List.copyOf(tables);
        this.directive = render(this.getTokens());
    }

    public List<ScanHint> getScanHints() { return scanHints; }

    /** Join hints after deduplication, in order of first discovery. */
    public List<JoinHint> getJoinHints() { return joinHints; }

    public List<IndexHint> getIndexHints() { return indexHints; }

    /** Distinct scanned table identifiers in discovery order. */
    public List<String> getTables() { return tables; }

    /** All tokens in directive order: scans, then joins, then index hints. */
    public List<HintToken> getTokens() {
        List<HintToken> tokens = new ArrayList<>(scanHints.size() + joinHints.size() + indexHints.size());
        tokens.addAll(scanHints);
        tokens.addAll(joinHints);
        tokens.addAll(indexHints);
        return tokens;
    }

    /** {@code /*+ tok tok ... *}{@code /}, or the empty string when there are no tokens. */
    public String getDirective() { return directive; }

    public boolean isEmpty() { return directive.isEmpty(); }

    private static String render(List<HintToken> tokens) {
        if (tokens.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("/*+ ");
        for (int i = 0; i < tokens.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(tokens.get(i).render());
        }
        return sb.append(" */").toString();
    }

    @Override
    public String toString() {
        return directive;
    }
}
