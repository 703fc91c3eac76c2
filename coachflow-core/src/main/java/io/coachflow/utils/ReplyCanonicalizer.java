package io.coachflow.utils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes free-text replies so that flows can match them case-, whitespace- and
 * punctuation-insensitively.
 */
public final class ReplyCanonicalizer {

    private static final Pattern EDGE_NOISE = Pattern.compile("^[\\p{Punct}\\s]+|[\\p{Punct}\\s]+$");
    private static final Pattern INNER_SPACE = Pattern.compile("\\s+");
    private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}']+");

    private ReplyCanonicalizer() {
    }

    /**
     * Lowercase, trim, strip leading/trailing punctuation and collapse inner whitespace.
     * Returns an empty string for null input.
     */
    public static String canonicalize(String reply) {
        if (reply == null) {
            return "";
        }
        String s = reply.toLowerCase(Locale.ROOT).trim();
        s = EDGE_NOISE.matcher(s).replaceAll("");
        return INNER_SPACE.matcher(s).replaceAll(" ");
    }

    /**
     * True if the canonical reply equals any option, or contains a multi-character option as a whole
     * word or phrase. Single-character options (menu numbers) only match exactly so that "15 mins"
     * does not count as option "1".
     */
    public static boolean matches(String canonicalReply, String... options) {
        if (canonicalReply == null || canonicalReply.isEmpty()) {
            return false;
        }
        String padded = " " + String.join(" ", WORD_SPLIT.split(canonicalReply)) + " ";
        for (String option : options) {
            String o = canonicalize(option);
            if (o.isEmpty()) {
                continue;
            }
            if (canonicalReply.equals(o)) {
                return true;
            }
            if (o.length() > 1 && padded.contains(" " + String.join(" ", WORD_SPLIT.split(o)) + " ")) {
                return true;
            }
        }
        return false;
    }
}
