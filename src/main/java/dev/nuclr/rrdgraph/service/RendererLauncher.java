package dev.nuclr.rrdgraph.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over starting the long-lived renderer child process.
 * Swap out the default implementation in tests via {@link dev.nuclr.rrdgraph.MockRendererLauncher}.
 */
public interface RendererLauncher {

    /**
     * Starts the renderer and wires its output to {@code output}.
     *
     * @param command          full argument list (no shell expansion)
     * @param workingDirectory process directory of the renderer
     * @param output           receives every output line, then the exit code exactly once
     * @return a handle used to write commands to the renderer
     * @throws IOException if the process cannot be started
     */
    RendererConnection launch(List<String> command, Path workingDirectory, RendererOutput output)
            throws IOException;
}
