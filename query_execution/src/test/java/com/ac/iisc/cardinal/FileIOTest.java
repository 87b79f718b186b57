package com.ac.iisc.cardinal;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class FileIOTest
{
    @TempDir
    Path dir;

    @Test
    void testDefaultOutputPath()
    {
        assertEquals("queries_with_times.csv", FileIO.defaultOutputPath("queries.csv"));
        assertEquals("data/run.1_with_times.tsv", FileIO.defaultOutputPath("data/run.1.tsv"));
        assertEquals("queries_with_times.csv", FileIO.defaultOutputPath("queries"));
        assertEquals("some.dir/queries_with_times.csv", FileIO.defaultOutputPath("some.dir/queries"));
        assertEquals(".hidden_with_times.csv", FileIO.defaultOutputPath(".hidden"));
        assertThrows(IllegalArgumentException.class, () -> FileIO.defaultOutputPath(" "));
    }

    @Test
    void testReadTextFile() throws Exception
    {
        Path f = dir.resolve("plan.json");
        Files.writeString(f, "{\"Plan\": {}}");

        assertEquals("{\"Plan\": {}}", FileIO.readTextFile(f.toString()));
        assertThrows(IOException.class, () -> FileIO.readTextFile(dir.resolve("nope.json").toString()));
        assertThrows(IllegalArgumentException.class, () -> FileIO.readTextFile(""));
    }

    @Test
    void testEnvironmentOverridesProperties()
    {
        Properties props = new Properties();
        props.setProperty(FileIO.PG_HOST, "db.internal");

        assertEquals("db.internal", FileIO.resolve(props, Map.of(), FileIO.PG_HOST, "localhost"));
        assertEquals("override", FileIO.resolve(props, Map.of("POSTGRES_HOST", "override"), FileIO.PG_HOST, "localhost"));
        assertEquals("localhost", FileIO.resolve(new Properties(), Map.of("POSTGRES_HOST", " "), FileIO.PG_HOST, "localhost"));
    }

    @Test
    void testParseIntFallsBack()
    {
        assertEquals(6543, FileIO.parseInt(FileIO.PG_PORT, " 6543 ", 5432));
        assertEquals(5432, FileIO.parseInt(FileIO.PG_PORT, "abc", 5432));
        assertEquals(5432, FileIO.parseInt(FileIO.PG_PORT, null, 5432));
    }
}
