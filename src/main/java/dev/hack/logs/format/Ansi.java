package dev.hack.logs.format;

import java.util.Locale;
import java.util.Map;

/**
 * Minimal ANSI styling for terminal output.
 */
public final class Ansi {
    static final String RESET = "\u001b[0m";
    static final String DIM = "\u001b[2m";
    static final String RED = "\u001b[31m";
    static final String YELLOW = "\u001b[33m";
    static final String CYAN = "\u001b[36m";

    private static final int[] PALETTE = {
        33, 39, 45, 69, 75, 81, 87, 93, 99, 105, 111, 141, 147, 153, 159, 165, 171, 177, 183, 189
    };

    private Ansi() {}

    /**
     * Color only when attached to a terminal and {@code HACK_NO_COLOR} is not set to a truthy value.
     */
    public static boolean enabled(boolean terminal, Map<String, String> env) {
        if (!terminal) {
            return false;
        }
        String noColor = env.getOrDefault("HACK_NO_COLOR", "").trim().toLowerCase(Locale.ROOT);
        return !(noColor.equals("1") || noColor.equals("true") || noColor.equals("yes") || noColor.equals("on"));
    }

    static String color(String text, String code) {
        return code + text + RESET;
    }

    /**
     * Bold 256-color rendering whose color is stable for a given text.
     */
    static String hashed(String text) {
        int code = PALETTE[Integer.remainderUnsigned(fnv1a32(text), PALETTE.length)];
        return "\u001b[1m\u001b[38;5;" + code + "m" + text + RESET;
    }

    static int fnv1a32(String text) {
        int hash = 0x811c9dc5;
        for (int i = 0; i < text.length(); i++) {
            hash ^= text.charAt(i);
            hash *= 0x01000193;
        }
        return hash;
    }
}
