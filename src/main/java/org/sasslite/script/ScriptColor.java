package org.sasslite.script;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntBinaryOperator;

/**
 * An RGB color. Channels are kept within 0..255.
 */
public record ScriptColor(int red, int green, int blue) implements ScriptValue {

    private static final Map<String, Integer> HTML4_COLORS = new LinkedHashMap<>();

    static {
        HTML4_COLORS.put("black", 0x000000);
        HTML4_COLORS.put("silver", 0xc0c0c0);
        HTML4_COLORS.put("gray", 0x808080);
        HTML4_COLORS.put("white", 0xffffff);
        HTML4_COLORS.put("maroon", 0x800000);
        HTML4_COLORS.put("red", 0xff0000);
        HTML4_COLORS.put("purple", 0x800080);
        HTML4_COLORS.put("fuchsia", 0xff00ff);
        HTML4_COLORS.put("green", 0x008000);
        HTML4_COLORS.put("lime", 0x00ff00);
        HTML4_COLORS.put("olive", 0x808000);
        HTML4_COLORS.put("yellow", 0xffff00);
        HTML4_COLORS.put("navy", 0x000080);
        HTML4_COLORS.put("blue", 0x0000ff);
        HTML4_COLORS.put("teal", 0x008080);
        HTML4_COLORS.put("aqua", 0x00ffff);
    }

    public ScriptColor {
        red = clamp(red);
        green = clamp(green);
        blue = clamp(blue);
    }

    /**
     * Parses {@code #rgb} or {@code #rrggbb}.
     */
    public static ScriptColor parse(String token) {
        String hex = token.substring(1);
        if (hex.length() == 3) {
            StringBuilder expanded = new StringBuilder();
            for (char c : hex.toCharArray()) {
                expanded.append(c).append(c);
            }
            hex = expanded.toString();
        }
        return fromRgb(Integer.parseInt(hex, 16));
    }

    /**
     * @return the color for one of the 16 HTML4 color names
     */
    public static Optional<ScriptColor> named(String name) {
        Integer rgb = HTML4_COLORS.get(name.toLowerCase(Locale.ROOT));
        return rgb == null ? Optional.empty() : Optional.of(fromRgb(rgb));
    }

    private static ScriptColor fromRgb(int rgb) {
        return new ScriptColor((rgb >> 16) & 0xff, (rgb >> 8) & 0xff, rgb & 0xff);
    }

    /**
     * Applies an operation channel by channel against another color.
     */
    public ScriptColor combine(ScriptColor other, IntBinaryOperator op) {
        return new ScriptColor(
                op.applyAsInt(red, other.red),
                op.applyAsInt(green, other.green),
                op.applyAsInt(blue, other.blue));
    }

    /**
     * Applies an operation to every channel with the same operand.
     */
    public ScriptColor combine(double operand, DoubleChannelOperator op) {
        return new ScriptColor(
                clamp(Math.round(op.apply(red, operand))),
                clamp(Math.round(op.apply(green, operand))),
                clamp(Math.round(op.apply(blue, operand))));
    }

    @FunctionalInterface
    public interface DoubleChannelOperator {
        double apply(int channel, double operand);
    }

    private int rgb() {
        return (red << 16) | (green << 8) | blue;
    }

    private static int clamp(int channel) {
        return Math.max(0, Math.min(255, channel));
    }

    private static int clamp(long channel) {
        return (int) Math.max(0, Math.min(255, channel));
    }

    @Override
    public String toCss() {
        int rgb = rgb();
        for (Map.Entry<String, Integer> entry : HTML4_COLORS.entrySet()) {
            if (entry.getValue() == rgb) {
                return entry.getKey();
            }
        }
        return String.format("#%02x%02x%02x", red, green, blue);
    }
}
