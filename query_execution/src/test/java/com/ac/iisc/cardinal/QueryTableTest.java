package com.ac.iisc.cardinal;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class QueryTableTest
{
    @TempDir
    Path dir;

    @Test
    void testReadQuotedJsonPlans() throws Exception
    {
        Path csv = dir.resolve("queries.csv");
        Files.writeString(csv, String.join("\n",
            "query,plan_json",
            "\"select a, b from t\",\"[{\"\"Plan\"\": {\"\"Node Type\"\": \"\"Seq Scan\"\", \"\"Relation Name\"\": \"\"t\"\"}}]\"",
            "\"select 1\n  from dual\",",
            ""), StandardCharsets.UTF_8);

        QueryTable table = QueryTable.read(csv);

        assertEquals(List.of("query", "plan_json"), table.getColumns());
        assertEquals(2, table.size());
        assertEquals("select a, b from t", table.get(0, "query"));
        assertEquals("[{\"Plan\": {\"Node Type\": \"Seq Scan\", \"Relation Name\": \"t\"}}]", table.get(0, "plan_json"));
        assertEquals("select 1\n  from dual", table.get(1, "query"));
        assertEquals("", table.get(1, "plan_json"));
        assertTrue(PlanParser.parse(table.get(0, "plan_json")).isParsed());
    }

    @Test
    void testWriteThenReadKeepsOrderAndContent() throws Exception
    {
        String plan = "{\"Plan\": {\"Node Type\": \"Hash Join\", \"Hash Cond\": \"(a.id = b.id)\"}}";
        QueryTable table = new QueryTable(List.of("query", "plan_json", "execution_time"), List.of(
            List.of("select \"x\", y from a", plan, "1.5"),
            List.of("select 2", "", ""),
            List.of("select 3", "", "7.25")));
        Path csv = dir.resolve("out.csv");

        table.write(csv);
        QueryTable back = QueryTable.read(csv);

        assertEquals(table.getColumns(), back.getColumns());
        assertEquals(3, back.size());
        for (int r = 0; r < 3; r++)
            assertEquals(table.getRow(r), back.getRow(r));
    }

    @Test
    void testWriteEmptyTableKeepsHeader() throws Exception
    {
        Path csv = dir.resolve("empty.csv");
        new QueryTable(List.of("query", "execution_time"), List.of()).write(csv);

        QueryTable back = QueryTable.read(csv);
        assertEquals(List.of("query", "execution_time"), back.getColumns());
        assertEquals(0, back.size());
    }

    @Test
    void testReadEmptyFile() throws Exception
    {
        Path csv = dir.resolve("blank.csv");
        Files.writeString(csv, "");

        QueryTable table = QueryTable.read(csv);
        assertTrue(table.getColumns().isEmpty());
        assertFalse(table.hasColumn("query"));
    }

    @Test
    void testShortRowsArePadded()
    {
        QueryTable table = new QueryTable(List.of("a", "b", "c"), List.of(Arrays.asList("1", null)));

        assertEquals(List.of("1", "", ""), table.getRow(0));
        assertNull(table.get(0, "missing"));
    }

    @Test
    void testUnquotedCommaInQueryIsRejected() throws Exception
    {
        Path csv = dir.resolve("unquoted.csv");
        Files.writeString(csv, "id,query\n1,select 1\n2,select a, b from t\n", StandardCharsets.UTF_8);

        IOException e = assertThrows(IOException.class, () -> QueryTable.read(csv));
        assertTrue(e.getMessage().contains("expected 2 fields in record 3, saw 3"), e.getMessage());
    }

    @Test
    void testLongRowsAreRejected()
    {
        assertThrows(IllegalArgumentException.class,
            () -> new QueryTable(List.of("query"), List.of(List.of("select a", " b from t"))));
    }

    @Test
    void testWithColumnAppendsOrReplaces()
    {
        QueryTable table = new QueryTable(List.of("query"), List.of(List.of("q0"), List.of("q1")));

        QueryTable added = table.withColumn("execution_time", Arrays.asList("3.0", null));
        assertEquals(List.of("query", "execution_time"), added.getColumns());
        assertEquals("", added.get(1, "execution_time"));

        QueryTable replaced = added.withColumn("query", List.of("x", "y"));
        assertEquals(List.of("x", "3.0"), replaced.getRow(0));
        assertEquals("q0", table.get(0, "query"));

        assertThrows(IllegalArgumentException.class, () -> table.withColumn("t", List.of("only one")));
    }
}
