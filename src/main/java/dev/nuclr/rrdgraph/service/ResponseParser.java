package dev.nuclr.rrdgraph.service;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the answers rrdtool prints in pipe mode.
 *
 * <p>Typical answer to a {@code graph} command:
 * <pre>
 * 497x148
 * OK u:0,01 s:0,00 r:0,02
 * </pre>
 * and to a failing command:
 * <pre>
 * ERROR: opening 'cpu.rrd': No such file or directory
 * </pre>
 * Everything up to and including the first {@code OK} or {@code ERROR:} line
 * belongs to the command currently in flight.
 */
public final class ResponseParser {

    private static final Pattern SIZE_LINE = Pattern.compile("^\\s*(\\d+)x(\\d+)\\s*$");

    private static final String OK = "OK";
    private static final String ERROR = "ERROR:";

    private ResponseParser() {}

    /** Returns {@code true} if {@code line} ends a renderer answer. */
    public static boolean isTerminator(String line) {
        String trimmed = line.trim();
        return trimmed.equals(OK) || trimmed.startsWith(OK + " ") || trimmed.startsWith(ERROR);
    }

    /**
     * Pure parser: {@code lines} is one complete answer, the last line being its terminator.
     */
    public static RenderResponse parse(List<String> lines) {
        if (lines.isEmpty()) {
            return RenderResponse.failure("Empty response from renderer");
        }

        String last = lines.get(lines.size() - 1).trim();
        List<String> body = lines.subList(0, lines.size() - 1);

        if (last.startsWith(ERROR)) {
            String message = last.substring(ERROR.length()).trim();
            return RenderResponse.failure(message.isEmpty() ? "Unknown renderer error" : message);
        }
        if (!isTerminator(last)) {
            return RenderResponse.failure("Unterminated response from renderer: " + last);
        }

        PixelSize size = null;
        for (String line : body) {
            Matcher m = SIZE_LINE.matcher(line);
            if (m.matches()) {
                int w = Integer.parseInt(m.group(1));
                int h = Integer.parseInt(m.group(2));
                // rrdtool prints 0x0 for graphs it did not lay out
                if (w > 0 && h > 0) {
                    size = new PixelSize(w, h);
                }
            }
        }
        return RenderResponse.ok(String.join("\n", body), size);
    }
}
