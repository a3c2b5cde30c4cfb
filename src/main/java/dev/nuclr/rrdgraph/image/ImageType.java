package dev.nuclr.rrdgraph.image;

import java.util.Map;

import lombok.Getter;

/**
 * A registered kind of plot: the renderer template plus per-type rendering hints.
 */
@Getter
public final class ImageType {

    private final String name;

    /** Opaque to the generator apart from the color placeholders. */
    private final String commandTemplate;

    /** Requests of this type always render in full-size mode and share the full-size cache entries. */
    private final boolean fullSizeOnly;

    /** Font tag to point size; wins over the generator-wide font sizes. */
    private final Map<String, Integer> fontSizeOverrides;

    public ImageType(String name, String commandTemplate, boolean fullSizeOnly, Map<String, Integer> fontSizeOverrides) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Image type name must not be blank");
        }
        if (commandTemplate == null) {
            throw new IllegalArgumentException("Command template of '" + name + "' must not be null");
        }
        this.name = name;
        this.commandTemplate = commandTemplate;
        this.fullSizeOnly = fullSizeOnly;
        this.fontSizeOverrides = Map.copyOf(fontSizeOverrides);
    }
}
