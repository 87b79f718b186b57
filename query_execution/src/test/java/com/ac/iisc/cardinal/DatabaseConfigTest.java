package com.ac.iisc.cardinal;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;

public class DatabaseConfigTest
{
    @Test
    void testDefaults()
    {
        DatabaseConfig config = DatabaseConfig.from(new Properties(), Map.of());

        assertEquals("localhost", config.getHost());
        assertEquals(5432, config.getPort());
        assertEquals("cardinal_test", config.getDatabase());
        assertEquals("postgres", config.getUser());
        assertEquals(30, config.getStatementTimeoutSeconds());
        assertEquals(10, config.getConnectTimeoutSeconds());
        assertEquals(5, config.getSampleResultLimit());
        assertEquals("jdbc:postgresql://localhost:5432/cardinal_test", config.getJdbcUrl());
    }

    @Test
    void testPropertiesThenEnvironment()
    {
        Properties props = new Properties();
        props.setProperty(FileIO.PG_HOST, "pg.example");
        props.setProperty(FileIO.PG_PORT, "6000");
        props.setProperty(FileIO.STATEMENT_TIMEOUT_SECONDS, "0");

        DatabaseConfig config = DatabaseConfig.from(props, Map.of("POSTGRES_PORT", "7000", "POSTGRES_DB", "stack"));

        assertEquals("pg.example", config.getHost());
        assertEquals(7000, config.getPort());
        assertEquals("stack", config.getDatabase());
        assertEquals(0, config.getStatementTimeoutSeconds());
    }

    @Test
    void testBuilderValidation()
    {
        assertThrows(IllegalArgumentException.class, () -> DatabaseConfig.builder().host(" ").build());
        assertThrows(IllegalArgumentException.class, () -> DatabaseConfig.builder().port(70000).build());
        assertThrows(IllegalArgumentException.class, () -> DatabaseConfig.builder().statementTimeoutSeconds(-1).build());
    }

    @Test
    void testToStringHidesPassword()
    {
        DatabaseConfig config = DatabaseConfig.builder().password("s3cret-pw").build();
        assertFalse(config.toString().contains("s3cret-pw"));
    }
}
