package dev.nuclr.rrdgraph.image;

import java.awt.Color;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

import dev.nuclr.rrdgraph.service.PixelSize;

/**
 * Builds {@code rrdtool graph} command lines.
 *
 * <p>The generator owns the time range, the size, the fonts and the output file;
 * the type's template supplies the data sources and graph elements. The only
 * placeholders substituted in a template are {@code ${color_main}} and
 * {@code ${color_secondary}}, which become {@code RRGGBB} hex values.
 *
 * <p>Not thread-safe: every method must be called on the event loop.
 */
public final class RrdGraphCommandBuilder implements CommandBuilder {

    public static final Color DEFAULT_MAIN_COLOR = new Color(0x00, 0x00, 0xFF);
    public static final Color DEFAULT_SECONDARY_COLOR = new Color(0x00, 0xC0, 0x00);

    static final String MAIN_PLACEHOLDER = "${color_main}";
    static final String SECONDARY_PLACEHOLDER = "${color_secondary}";

    // sorted so the command text is stable for equal settings
    private final Map<String, Integer> fontSizes = new TreeMap<>();

    private Color mainColor;
    private Color secondaryColor;

    /** Sets the point size of a rrdtool font tag (DEFAULT, TITLE, AXIS, UNIT, LEGEND, WATERMARK). */
    public void setFontSize(String tag, int size) {
        checkFontSize(tag, size);
        fontSizes.put(tag.trim().toUpperCase(), size);
    }

    /** @throws IllegalArgumentException for a blank tag or a size below one point */
    public static void checkFontSize(String tag, int size) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Font tag must not be blank");
        }
        if (size <= 0) {
            throw new IllegalArgumentException("Font size must be positive: " + size);
        }
    }

    public void setColors(Color main, Color secondary) {
        this.mainColor = main;
        this.secondaryColor = secondary;
    }

    /** Applies the default colors unless colors were set before. */
    public void setDefaultColorsIfUnset() {
        if (mainColor == null) {
            mainColor = DEFAULT_MAIN_COLOR;
        }
        if (secondaryColor == null) {
            secondaryColor = DEFAULT_SECONDARY_COLOR;
        }
    }

    public Color mainColor() {
        return mainColor;
    }

    public Color secondaryColor() {
        return secondaryColor;
    }

    @Override
    public String build(ImageType type, ImageRequest request, PixelSize renderSize, Path output) {
        StringBuilder cmd = new StringBuilder("graph ");
        cmd.append(quote(output.toString()))
                .append(" --imgformat PNG")
                .append(" --start ").append(request.from())
                .append(" --end ").append(request.to())
                .append(" --width ").append(renderSize.width())
                .append(" --height ").append(renderSize.height());
        if (request.fullSize()) {
            cmd.append(" --full-size-mode");
        }

        Map<String, Integer> fonts = new TreeMap<>(fontSizes);
        type.getFontSizeOverrides().forEach((tag, size) -> fonts.put(tag.toUpperCase(), size));
        fonts.forEach((tag, size) -> cmd.append(" --font ").append(tag).append(':').append(size).append(':'));

        String body = substituteColors(type.getCommandTemplate()).trim();
        if (!body.isEmpty()) {
            cmd.append(' ').append(body);
        }
        return cmd.toString();
    }

    String substituteColors(String template) {
        Color main = mainColor != null ? mainColor : DEFAULT_MAIN_COLOR;
        Color secondary = secondaryColor != null ? secondaryColor : DEFAULT_SECONDARY_COLOR;
        return template
                .replace(MAIN_PLACEHOLDER, hex(main))
                .replace(SECONDARY_PLACEHOLDER, hex(secondary))
                .replace('\n', ' ');
    }

    static String hex(Color color) {
        return String.format("%02X%02X%02X", color.getRed(), color.getGreen(), color.getBlue());
    }

    /** rrdtool's pipe mode splits arguments on blanks unless they are quoted. */
    private static String quote(String arg) {
        return "'" + arg.replace("'", "\\'") + "'";
    }
}
