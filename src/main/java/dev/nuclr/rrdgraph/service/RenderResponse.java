package dev.nuclr.rrdgraph.service;

import java.util.Optional;

/**
 * Immutable result of one renderer command.
 *
 * @param success   {@code true} if the renderer answered {@code OK}
 * @param output    lines printed before the terminating {@code OK} / {@code ERROR:} line
 * @param error     error text, empty on success
 * @param pixelSize size reported by a graph command, or {@code null}
 */
public record RenderResponse(boolean success, String output, String error, PixelSize pixelSize) {

    public static RenderResponse ok(String output, PixelSize pixelSize) {
        return new RenderResponse(true, output, "", pixelSize);
    }

    public static RenderResponse failure(String error) {
        return new RenderResponse(false, "", error, null);
    }

    public Optional<PixelSize> reportedSize() {
        return Optional.ofNullable(pixelSize);
    }
}
