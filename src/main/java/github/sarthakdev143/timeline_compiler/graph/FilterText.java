package github.sarthakdev143.timeline_compiler.graph;

import java.io.File;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Number formatting and escaping for text embedded in filter expressions. None of this applies to plain
 * {@code -i} or output arguments, which are passed to the engine verbatim.
 */
public final class FilterText {

    private static final Pattern RGB_PATTERN = Pattern.compile("rgba?\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,\\s*(\\d+)");
    private static final String DEFAULT_COLOR = "0xFFFFFF";
    private static final BigInteger MAX_CHANNEL = BigInteger.valueOf(255);

    private FilterText() {
    }

    /**
     * Seconds with up to six decimals and no trailing zeros, e.g. {@code 5}, {@code 2.5}, {@code 0.033333}.
     */
    public static String time(double seconds) {
        BigDecimal value = BigDecimal.valueOf(seconds).setScale(6, RoundingMode.HALF_UP).stripTrailingZeros();
        if (value.signum() == 0) {
            return "0";
        }
        return value.toPlainString();
    }

    public static String millis(double seconds) {
        return String.valueOf(Math.round(seconds * 1000.0));
    }

    /**
     * Three decimals, used for enable windows.
     */
    public static String window(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    public static String twoDecimals(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    public static String enableBetween(double start, double end) {
        return "enable='between(t," + window(start) + "," + window(end) + ")'";
    }

    /**
     * Overlay offset that centers the item and moves it by {@code normalized} half-canvases.
     */
    public static String centeredOffset(String canvas, String item, double normalized) {
        String base = "(" + canvas + "-" + item + ")/2";
        if (normalized == 0.0) {
            return base;
        }
        String sign = normalized > 0 ? "+" : "-";
        return base + sign + time(Math.abs(normalized)) + "*" + canvas + "/2";
    }

    /**
     * Escapes a file path for use inside a quoted filter argument.
     */
    public static String escapePath(Path path) {
        return path.toString()
                .replace("\\", "\\\\")
                .replace(":", "\\:")
                .replace("'", "\\'");
    }

    /**
     * Joins font directories with the platform path separator. Backslashes become forward slashes first.
     */
    public static String escapeFontDirectories(List<Path> directories) {
        return directories.stream()
                .map(directory -> directory.toString().replace("\\", "/").replace(":", "\\:").replace("'", "\\'"))
                .collect(Collectors.joining(File.pathSeparator));
    }

    public static String escapeDrawText(String text) {
        return text
                .replace("\\", "\\\\")
                .replace(":", "\\:")
                .replace("'", "\\'")
                .replace("%", "\\%")
                .replace("\n", "\\n");
    }

    /**
     * Converts {@code #rgb}, {@code #rrggbb[aa]} and {@code rgb[a](r, g, b[, a])} to {@code 0xRRGGBB}. Anything else
     * falls back to white.
     */
    public static String color(String cssColor) {
        if (cssColor == null || cssColor.isBlank()) {
            return DEFAULT_COLOR;
        }
        String value = cssColor.trim();
        if (value.startsWith("#")) {
            String hex = value.substring(1);
            if (hex.length() == 3) {
                StringBuilder expanded = new StringBuilder();
                for (char c : hex.toCharArray()) {
                    expanded.append(c).append(c);
                }
                hex = expanded.toString();
            }
            if (hex.length() >= 6 && hex.substring(0, 6).matches("[0-9a-fA-F]{6}")) {
                return "0x" + hex.substring(0, 6).toUpperCase(Locale.ROOT);
            }
            return DEFAULT_COLOR;
        }
        Matcher matcher = RGB_PATTERN.matcher(value);
        if (matcher.find()) {
            return String.format(
                    Locale.ROOT,
                    "0x%02X%02X%02X",
                    clampChannel(matcher.group(1)),
                    clampChannel(matcher.group(2)),
                    clampChannel(matcher.group(3)));
        }
        return DEFAULT_COLOR;
    }

    private static int clampChannel(String value) {
        return new BigInteger(value).min(MAX_CHANNEL).intValue();
    }
}
