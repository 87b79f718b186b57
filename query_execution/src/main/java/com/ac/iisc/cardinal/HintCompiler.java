package com.ac.iisc.cardinal;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles a PostgreSQL plan tree into a pg_hint_plan directive that makes the planner
 * choose the same scan methods, join methods and indexes again.
 *
 * Algorithm:
 * - Post-order walk; each subtree reports the table identifiers found beneath it,
 *   so a join's operands are known before the join itself is visited.
 * - Scan nodes ({@link ScanOperator}) with a table emit {@code Scan(t)}; when they also
 *   name an index they emit {@code IndexScan(t idx)} too.
 * - Join nodes ({@link JoinOperator}) with at least two children emit
 *   {@code Join(t1 t2 ...)} over the tables of all children concatenated in child
 *   order, provided that list holds at least two tables.
 * - Every other node (Hash, Sort, Aggregate, Gather, ...) emits nothing and passes its
 *   children's tables up unchanged.
 *
 * The operand list of a join is every table under it, not just the adjacent inputs, so
 * nested joins produce hints such as {@code HashJoin(v p u)}.
 *
 * The compiler is stateless; instances may be shared between threads.
 */
public class HintCompiler {

    private static final Logger LOGGER = LogManager.getLogger(HintCompiler.class);

    /**
     * Compile a parsed plan into its directive.
     *
     * @param root plan root
     * @return directive text, or "" when the plan has nothing hintable
     */
    public String compile(PlanNode root) {
        return compileVerbose(root).getDirective();
    }

    /**
     * Parse and compile a raw payload. An unparseable payload compiles to "".
     */
    public String compile(Object planPayload) {
        PlanParseResult parsed = PlanParser.parse(planPayload);
        if (!parsed.isParsed()) {
            LOGGER.debug("No hints: {}", parsed.getFailureReason());
            return "";
        }
        return compile(parsed.getRoot());
    }

    /** Compile a parse result; a failed parse yields {@link CompiledHints#EMPTY}. */
    public CompiledHints compileVerbose(PlanParseResult parsed) {
        return parsed.isParsed() ? compileVerbose(parsed.getRoot()) : CompiledHints.EMPTY;
    }

    /** Compile a plan and keep the token breakdown. */
    public CompiledHints compileVerbose(PlanNode root) {
        if (root == null) throw new IllegalArgumentException("root must not be null");

        Collector collector = new Collector();
        collector.visit(root);

        // Join hints are deduplicated on their rendered text, first occurrence wins
        Set<String> seen = new LinkedHashSet<>();
        List<JoinHint> joins = new ArrayList<>();
        for (JoinHint join : collector.joinHints) {
            if (seen.add(join.render())) joins.add(join);
        }

        return new CompiledHints(collector.scanHints, joins, collector.indexHints,
            new ArrayList<>(collector.tables));
    }

    /** Per-compilation accumulator. */
    private static final class Collector {
        final List<ScanHint> scanHints = new ArrayList<>();
        final List<JoinHint> joinHints = new ArrayList<>();
        final List<IndexHint> indexHints = new ArrayList<>();
        final Set<String> tables = new LinkedHashSet<>();

        /** Visit a subtree and return the table identifiers found in it, in discovery order. */
        List<String> visit(PlanNode node) {
            List<String> subtreeTables = new ArrayList<>();
            List<List<String>> childTables = new ArrayList<>();

            for (PlanNode child : node.getChildren()) {
                List<String> found = visit(child);
                childTables.add(found);
                subtreeTables.addAll(found);
            }

            ScanOperator scan = ScanOperator.fromNodeType(node.getKind());
            if (scan != null) {
                String table = node.getTableIdentifier();
                if (table != null) {
                    scanHints.add(new ScanHint(scan, table));
                    tables.add(table);
                    subtreeTables.add(table);
                    if (node.getIndexName() != null && !node.getIndexName().isBlank()) {
                        indexHints.add(new IndexHint(table, node.getIndexName()));
                    }
                }
                return subtreeTables;
            }

            JoinOperator join = JoinOperator.fromNodeType(node.getKind());
            if (join != null && childTables.size() >= 2) {
                List<String> operands = new ArrayList<>();
                for (List<String> found : childTables) {
                    operands.addAll(found);
                }
                if (operands.size() >= 2) {
                    joinHints.add(new JoinHint(join, operands));
                }
            }
            return subtreeTables;
        }
    }
}
