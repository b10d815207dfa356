package droidreplay.device;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Screen rectangle of a UI node, in device pixels.
 *
 * <p>Accepts both the accessibility form {@code "[x1,y1][x2,y2]"} and the
 * flat form {@code "x1,y1,x2,y2"}.
 */
public record Bounds(int left, int top, int right, int bottom) {

    private static final Pattern BRACKETED =
            Pattern.compile("\\[\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*]\\s*\\[\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*]");
    private static final Pattern FLAT =
            Pattern.compile("\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*");

    /** Returns the parsed bounds, or {@code null} if {@code raw} is in neither form. */
    public static Bounds parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Matcher m = BRACKETED.matcher(raw.trim());
        if (!m.matches()) {
            m = FLAT.matcher(raw);
            if (!m.matches()) {
                return null;
            }
        }
        try {
            return new Bounds(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public int centerX() { return (left + right) / 2; }
    public int centerY() { return (top + bottom) / 2; }
    public int width()   { return right - left; }
}
