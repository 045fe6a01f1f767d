package org.faultline.runtime;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The part of a placeholder after the colon: <code>[[fill]align][0][width][.precision][?]</code>.
 *
 * @param fill The padding character.
 * @param align {@code '<'}, {@code '>'}, {@code '^'}, or {@code 0} for the default alignment of the value.
 * @param width The minimum width, or -1.
 * @param precision Decimal places for floating point values, maximum length for others, or -1.
 * @param debug Whether the value is rendered in its debug form.
 */
public record FormatSpec(char fill, char align, int width, int precision, boolean debug) {

    /** The spec of a bare placeholder. */
    public static final FormatSpec DISPLAY = new FormatSpec(' ', (char) 0, -1, -1, false);

    private static final Pattern SPEC = Pattern.compile(
            "(?:(?<fill>[^{}])?(?<align>[<>^]))?(?<zero>0)?(?<width>[0-9]{1,4})?(?:\\.(?<precision>[0-9]{1,4}))?(?<debug>\\?)?");

    /**
     * Parses a format spec.
     * @param spec The text after the colon; empty for a bare placeholder.
     * @return The parsed spec, or null if the text is not a supported spec.
     */
    public static FormatSpec parse(String spec) {
        if (spec.isEmpty()) {
            return DISPLAY;
        }
        Matcher m = SPEC.matcher(spec);
        if (!m.matches()) {
            return null;
        }
        boolean zero = m.group("zero") != null;
        char align = m.group("align") != null ? m.group("align").charAt(0) : (zero ? '>' : 0);
        char fill = m.group("fill") != null ? m.group("fill").charAt(0) : (zero && m.group("align") == null ? '0' : ' ');
        int width = m.group("width") != null ? Integer.parseInt(m.group("width")) : -1;
        int precision = m.group("precision") != null ? Integer.parseInt(m.group("precision")) : -1;
        return new FormatSpec(fill, align, width, precision, m.group("debug") != null);
    }

    /**
     * Pads a rendered value to the minimum width.
     * @param text The rendered value.
     * @param numeric Whether the value is a number, which aligns right by default.
     * @return The padded text.
     */
    String pad(String text, boolean numeric) {
        int missing = width - text.codePointCount(0, text.length());
        if (missing <= 0) {
            return text;
        }
        char effective = align != 0 ? align : (numeric ? '>' : '<');
        String fillText = String.valueOf(fill);
        return switch (effective) {
            case '>' -> fillText.repeat(missing) + text;
            case '^' -> fillText.repeat(missing / 2) + text + fillText.repeat(missing - missing / 2);
            default -> text + fillText.repeat(missing);
        };
    }
}
