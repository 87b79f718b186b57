/*
 * =====================================================================================
 *  FileIO.java
 *
 *  Purpose
 *  -------
 *  Centralizes configuration lookup and small file helpers used by the CLI and the
 *  benchmark harness, so java.nio usage and property parsing live in one place.
 *
 *  What it provides
 *  ----------------
 *  - getConfig / resolve / parseInt: config.properties lookup with environment
 *    overrides, used by DatabaseConfig.
 *  - readTextFile: UTF-8 text input with argument validation.
 *  - defaultOutputPath: "<base>_with_times<ext>" naming for batch results.
 *
 *  Configuration sources (first hit wins)
 *  --------------------------------------
 *  1. Environment variable mapped to the key (see ENV_OVERRIDES), e.g. POSTGRES_HOST.
 *  2. config.properties on the classpath, or the file named by -Dcardinal.config.
 *  3. The caller's default.
 *
 *  Error handling
 *  --------------
 *  - Null/blank paths throw IllegalArgumentException (programming errors).
 *  - Missing or unreadable files produce IOException with the offending path.
 *  - A missing config.properties is not an error; defaults apply.
 *
 *  Thread-safety
 *  -------------
 *  - The configuration is loaded once (double-checked) and is read-only afterwards.
 * =====================================================================================
 */
package com.ac.iisc.cardinal;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Small, focused configuration and I/O utility. All methods are static.
 */
public class FileIO
{
	private static final Logger LOGGER = LogManager.getLogger(FileIO.class);

	// Config handling
	private static volatile Properties CONFIG;
	static final String CONFIG_RESOURCE = "config.properties";
	static final String CONFIG_PATH_PROPERTY = "cardinal.config";

	// Property keys
	public static final String PG_HOST = "pg_host";
	public static final String PG_PORT = "pg_port";
	public static final String PG_DATABASE = "pg_database";
	public static final String PG_USER = "pg_user";
	public static final String PG_PASSWORD = "pg_password";
	public static final String STATEMENT_TIMEOUT_SECONDS = "statement_timeout_seconds";
	public static final String CONNECT_TIMEOUT_SECONDS = "connect_timeout_seconds";
	public static final String SAMPLE_RESULT_LIMIT = "sample_result_limit";

	/** Environment variables that override individual keys. */
	static final Map<String, String> ENV_OVERRIDES = Map.of(
		PG_HOST, "POSTGRES_HOST",
		PG_PORT, "POSTGRES_PORT",
		PG_DATABASE, "POSTGRES_DB",
		PG_USER, "POSTGRES_USER",
		PG_PASSWORD, "POSTGRES_PASSWORD"
	);

	private FileIO() {}

	/**
	 * Read a text file as UTF-8 and return its content.
	 *
	 * @param path Path to the file to read
	 * @return File content as UTF-8 String
	 * @throws IllegalArgumentException if path is null/blank
	 * @throws IOException if file does not exist or cannot be read
	 */
	public static String readTextFile(String path) throws IOException {
		if (path == null || path.isBlank()) {
			throw new IllegalArgumentException("path must not be null or blank");
		}
		Path p = Paths.get(path);
		if (!Files.exists(p)) {
			throw new IOException("File not found: " + p);
		}
		return Files.readString(p, StandardCharsets.UTF_8);
	}

	/**
	 * Output path used by the batch runner when none is given:
	 * {@code queries.csv -> queries_with_times.csv}, {@code queries -> queries_with_times.csv}.
	 */
	public static String defaultOutputPath(String inputPath) {
		if (inputPath == null || inputPath.isBlank()) {
			throw new IllegalArgumentException("inputPath must not be null or blank");
		}
		int slash = Math.max(inputPath.lastIndexOf('/'), inputPath.lastIndexOf('\\'));
		int dot = inputPath.lastIndexOf('.');
		// A dot in a directory name or a leading dot (hidden file) is not an extension
		if (dot <= slash + 1) {
			return inputPath + "_with_times.csv";
		}
		return inputPath.substring(0, dot) + "_with_times" + inputPath.substring(dot);
	}

	// --- Config helpers ---

	/** Load config from classpath resource `config.properties`, or from -Dcardinal.config. */
	static Properties getConfig() {
		if (CONFIG == null) {
			synchronized (FileIO.class) {
				if (CONFIG == null) {
					CONFIG = loadConfig();
				}
			}
		}
		return CONFIG;
	}

	private static Properties loadConfig() {
		Properties props = new Properties();
		String explicitPath = System.getProperty(CONFIG_PATH_PROPERTY);
		try {
			if (explicitPath != null && !explicitPath.isBlank()) {
				Path cfgPath = Paths.get(explicitPath);
				try (InputStream fis = Files.newInputStream(cfgPath)) {
					props.load(fis);
				}
				LOGGER.debug("Loaded configuration from {}", cfgPath);
			} else {
				try (InputStream is = FileIO.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
					if (is != null) {
						props.load(is);
						LOGGER.debug("Loaded configuration from classpath {}", CONFIG_RESOURCE);
					}
				}
			}
		} catch (IOException e) {
			LOGGER.warn("Unable to read configuration ({}); using defaults", e.getMessage());
		}
		return props;
	}

	/** Environment override first, then the properties, then {@code defaultValue}. */
	static String resolve(Properties props, Map<String, String> env, String key, String defaultValue) {
		String envName = ENV_OVERRIDES.get(key);
		if (envName != null && env != null) {
			String fromEnv = env.get(envName);
			if (fromEnv != null && !fromEnv.isBlank()) return fromEnv.trim();
		}
		String v = props == null ? null : props.getProperty(key);
		return (v == null || v.isBlank()) ? defaultValue : v.trim();
	}

	static int parseInt(String key, String raw, int defaultValue) {
		if (raw == null) return defaultValue;
		try {
			return Integer.parseInt(raw.trim());
		} catch (NumberFormatException e) {
			LOGGER.warn("Ignoring non-numeric value '{}' for {}; using {}", raw, key, defaultValue);
			return defaultValue;
		}
	}
}
