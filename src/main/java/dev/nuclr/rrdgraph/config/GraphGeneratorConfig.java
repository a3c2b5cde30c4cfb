package dev.nuclr.rrdgraph.config;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Properties;
import java.util.function.Function;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Generator configuration loaded from {@code graph-generator.properties} on the classpath.
 * All fields are read-only after construction; fall back to safe defaults if the file is absent.
 */
@Slf4j
@Getter
public final class GraphGeneratorConfig {

    private static final String PROPS_RESOURCE = "graph-generator.properties";

    /** Full path to the {@code rrdtool} executable, or {@code null} for auto-detection. */
    private final String executablePath;

    /** Arguments passed to the renderer; {@code -} puts rrdtool into pipe mode. */
    private final String rendererArguments;

    /** Seconds a rendered image is kept in the cache. */
    private final double cacheTimeoutSeconds;

    /** Parent directory of the per-run report directories. */
    private final Path reportDirectory;

    /** Delay between two report steps. */
    private final long reportStepMillis;

    /** Number of trailing renderer output lines reported when the renderer dies. */
    private final int crashOutputLines;

    /** Directory holding cached images, or {@code null} for a fresh temporary directory. */
    private final Path scratchDirectory;

    public GraphGeneratorConfig() {
        this(loadProps());
    }

    /** Package-private so tests can feed properties without touching the classpath. */
    GraphGeneratorConfig(Properties p) {
        executablePath      = blankToNull(p.getProperty("executablePath", ""));
        rendererArguments   = p.getProperty("rendererArguments", "-").trim();
        cacheTimeoutSeconds = parse(p, "cacheTimeoutSeconds", 120.0, Double::parseDouble);
        reportStepMillis    = parse(p, "reportStepMillis", 250L, Long::parseLong);
        crashOutputLines    = parse(p, "crashOutputLines", 50, Integer::parseInt);

        String report = blankToNull(p.getProperty("reportDirectory", ""));
        reportDirectory = report != null
                ? Path.of(report)
                : Path.of(System.getProperty("user.home"), "Documents", "SystemDataScope");

        String scratch = blankToNull(p.getProperty("scratchDirectory", ""));
        scratchDirectory = scratch != null ? Path.of(scratch) : null;
    }

    /** Convenience for embedding code and tests. */
    public static GraphGeneratorConfig fromProperties(Properties p) {
        return new GraphGeneratorConfig(p);
    }

    private static Properties loadProps() {
        Properties p = new Properties();
        try (InputStream in = GraphGeneratorConfig.class
                .getClassLoader()
                .getResourceAsStream(PROPS_RESOURCE)) {
            if (in != null) {
                p.load(in);
            } else {
                log.debug("{} not found on classpath, using built-in defaults", PROPS_RESOURCE);
            }
        } catch (Exception e) {
            log.warn("Could not load {}: {}", PROPS_RESOURCE, e.getMessage());
        }
        return p;
    }

    private static String blankToNull(String value) {
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static <T> T parse(Properties p, String key, T def, Function<String, T> parser) {
        String raw = p.getProperty(key);
        if (raw == null) {
            return def;
        }
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value '{}' for {}, using default {}", raw, key, def);
            return def;
        }
    }
}
