package dev.nuclr.rrdgraph.service;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

/**
 * Real {@link RendererLauncher} implementation that starts a child process via
 * {@link ProcessBuilder}. No shell is involved; the command is passed directly
 * to the OS. Stderr is merged into stdout so error text arrives in order with
 * the answers, and a daemon thread drains the merged stream line by line.
 */
@Slf4j
public final class DefaultRendererLauncher implements RendererLauncher {

    @Override
    public RendererConnection launch(List<String> command, Path workingDirectory, RendererOutput output)
            throws IOException {
        log.debug("Launching: {} in {}", command, workingDirectory);

        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        Process proc = builder.start();

        Thread reader = new Thread(() -> drain(proc, output), "renderer-output");
        reader.setDaemon(true);
        reader.start();

        return new ProcessConnection(proc);
    }

    private void drain(Process proc, RendererOutput output) {
        try (var in = new BufferedReader(new InputStreamReader(proc.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                output.line(line);
            }
        } catch (IOException e) {
            log.debug("Renderer output stream closed: {}", e.getMessage());
        }

        int exitCode;
        try {
            exitCode = proc.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            proc.destroyForcibly();
            exitCode = -1;
        }
        output.exited(exitCode);
    }

    private static final class ProcessConnection implements RendererConnection {

        private final Process proc;
        private final BufferedWriter writer;

        ProcessConnection(Process proc) {
            this.proc = proc;
            this.writer = new BufferedWriter(new OutputStreamWriter(proc.getOutputStream(), StandardCharsets.UTF_8));
        }

        @Override
        public void send(String command) throws IOException {
            writer.write(command);
            writer.newLine();
            writer.flush();
        }

        @Override
        public boolean isAlive() {
            return proc.isAlive();
        }

        @Override
        public void destroy() {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("Closing renderer input failed: {}", e.getMessage());
            }
            proc.destroy();
        }
    }
}
