package dev.nuclr.rrdgraph.service;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import dev.nuclr.rrdgraph.config.GraphGeneratorConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Locates the {@code rrdtool} executable.
 * Search order:
 * <ol>
 *   <li>Configured {@code executablePath} (if set)</li>
 *   <li>Entries in the {@code PATH} environment variable</li>
 *   <li>Common Unix installation directories</li>
 * </ol>
 * When nothing is found the bare executable name is returned and left to the OS
 * to resolve; a missing binary then surfaces as a launch failure.
 */
@Slf4j
public final class RendererLocator {

    static final String EXECUTABLE =
            System.getProperty("os.name", "").regionMatches(true, 0, "win", 0, 3) ? "rrdtool.exe" : "rrdtool";

    // Homebrew on macOS, distro packages on Linux
    private static final List<Path> INSTALL_DIRS = List.of(
            Path.of("/opt/homebrew/bin"),
            Path.of("/usr/local/bin"),
            Path.of("/usr/bin"));

    private final GraphGeneratorConfig config;
    private final String pathEnv;

    public RendererLocator(GraphGeneratorConfig config) {
        this(config, System.getenv("PATH"));
    }

    /** Package-private: injects the {@code PATH} value for tests. */
    RendererLocator(GraphGeneratorConfig config, String pathEnv) {
        this.config = config;
        this.pathEnv = pathEnv;
    }

    /** Returns the executable to launch; never {@code null}. */
    public String locate() {
        if (config.getExecutablePath() != null) {
            Path configured = Path.of(config.getExecutablePath());
            if (Files.isRegularFile(configured)) {
                return configured.toString();
            }
            log.warn("Configured executablePath '{}' does not exist, searching PATH", configured);
        }

        Optional<Path> found = searchDirectories().stream()
                .map(dir -> dir.resolve(EXECUTABLE))
                .filter(Files::isRegularFile)
                .findFirst();
        if (found.isPresent()) {
            log.debug("Found rrdtool at {}", found.get());
            return found.get().toString();
        }
        log.debug("rrdtool not found, relying on the OS to resolve '{}'", EXECUTABLE);
        return EXECUTABLE;
    }

    /** {@code PATH} entries in order, then the usual install prefixes. */
    List<Path> searchDirectories() {
        List<Path> dirs = new ArrayList<>();
        if (pathEnv != null) {
            for (String entry : pathEnv.split(File.pathSeparator)) {
                if (!entry.isBlank()) {
                    dirs.add(Path.of(entry.trim()));
                }
            }
        }
        dirs.addAll(INSTALL_DIRS);
        return dirs;
    }
}
