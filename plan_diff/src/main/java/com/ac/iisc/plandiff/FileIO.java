/*
 * =====================================================================================
 *  FileIO.java
 *
 *  Purpose
 *  -------
 *  Centralizes file input/output and configuration used by the regression driver.
 *  The parser and comparator never touch the file system; everything that reads
 *  report files or writes JSON baselines goes through here.
 *
 *  What it provides
 *  ----------------
 *  - readTextFile(Path): Read a UTF-8 text file with validation.
 *  - writeTextFile(Path, String): Write UTF-8 text, creating parent directories.
 *  - listFileStems(Path, String...): Names of the files in a directory that end
 *    with one of the given suffixes, suffix removed, sorted.
 *  - getProperty(String, String): Value from `config.properties` with a fallback.
 *
 *  Conventions
 *  -----------
 *  - A regression case <id> is stored as <id>.sql plus <id>.explain (raw report
 *    text copied from a MySQL client), or as <id>.json (a saved Plan).
 *  - Suffixes and default directories come from `config.properties` on the
 *    classpath (keys: baseline_dir, target_dir, sql_suffix, explain_suffix,
 *    json_suffix).
 *
 *  Error handling
 *  --------------
 *  - Null/blank arguments throw IllegalArgumentException (programming errors).
 *  - Missing files and read/write failures throw IOException with a clear message.
 *  - A missing or unreadable config file is reported on stderr and the defaults apply.
 *
 *  Thread-safety
 *  -------------
 *  - Stateless apart from the lazily loaded configuration, which is published
 *    through a volatile field under double-checked locking.
 *
 * =====================================================================================
 */
package com.ac.iisc.plandiff;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Small, focused I/O utility. All methods are static for easy reuse from the
 * CLI, the regression driver and tests.
 */
public final class FileIO
{
    // Config handling
    private static volatile Properties CONFIG;
    private static final String CONFIG_RESOURCE = "config.properties";

    private FileIO() {}

    /**
     * Read a text file as UTF-8 and return its content.
     *
     * @throws IllegalArgumentException if path is null
     * @throws IOException if the file does not exist or cannot be read
     */
    public static String readTextFile(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("File not found: " + path);
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /** Write UTF-8 text content to a file, creating parent directories if needed. */
    public static void writeTextFile(Path path, String content) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, content == null ? "" : content, StandardCharsets.UTF_8);
    }

    /**
     * File names in {@code dir} ending with any of {@code suffixes}, with the
     * suffix removed. Sorted and de-duplicated, so {@code q1.sql} and
     * {@code q1.explain} yield a single {@code q1}.
     */
    public static List<String> listFileStems(Path dir, String... suffixes) throws IOException {
        if (dir == null || !Files.isDirectory(dir)) {
            throw new IOException("Not a directory: " + dir);
        }
        TreeSet<String> stems = new TreeSet<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
            for (Path p : ds) {
                if (!Files.isRegularFile(p)) continue;
                String name = p.getFileName().toString();
                for (String suffix : suffixes) {
                    if (name.endsWith(suffix) && name.length() > suffix.length()) {
                        stems.add(name.substring(0, name.length() - suffix.length()));
                    }
                }
            }
        }
        return new ArrayList<>(stems);
    }

    // --- Config helpers ---

    /** Load config from the classpath resource `config.properties`; empty if absent. */
    private static Properties getConfig() {
        if (CONFIG == null) {
            synchronized (FileIO.class) {
                if (CONFIG == null) {
                    Properties props = new Properties();
                    try (InputStream is = FileIO.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
                        if (is != null) {
                            props.load(is);
                        }
                    } catch (IOException ex) {
                        System.err.println("[FileIO] Warning: could not read " + CONFIG_RESOURCE
                                + ", using defaults: " + ex.getMessage());
                    }
                    CONFIG = props;
                }
            }
        }
        return CONFIG;
    }

    /** Get property by key with a default fallback. */
    public static String getProperty(String key, String defaultValue) {
        String v = getConfig().getProperty(key);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    // Typed accessors
    public static String getBaselineDir() { return getProperty("baseline_dir", "plans/baseline"); }
    public static String getTargetDir() { return getProperty("target_dir", "plans/target"); }
    public static String getSqlSuffix() { return getProperty("sql_suffix", ".sql"); }
    public static String getExplainSuffix() { return getProperty("explain_suffix", ".explain"); }
    public static String getJsonSuffix() { return getProperty("json_suffix", ".json"); }
}
