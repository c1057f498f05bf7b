package com.flowb.social.util;

/**
 * Splits a crew name like "🐺 Wolves" into its leading emoji and the plain name.
 *
 * Detection works on code points: one pictographic symbol, optionally followed by a
 * variation selector, a skin tone, or further symbols joined with zero-width joiners.
 * Regional indicator pairs (flags) count as one emoji.
 */
public final class CrewNameParser {

    private static final int VARIATION_SELECTOR = 0xFE0F;
    private static final int ZERO_WIDTH_JOINER = 0x200D;
    private static final int KEYCAP = 0x20E3;

    private CrewNameParser() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static final class ParsedName {
        private final String emoji;
        private final String name;

        ParsedName(String emoji, String name) {
            this.emoji = emoji;
            this.name = name;
        }

        /**
         * The leading emoji, or null when the name has none.
         */
        public String getEmoji() {
            return emoji;
        }

        public String getName() {
            return name;
        }
    }

    public static ParsedName parse(String rawName) {
        String trimmed = rawName == null ? "" : rawName.trim();
        int end = leadingEmojiEnd(trimmed);
        if (end == 0) {
            return new ParsedName(null, trimmed);
        }
        return new ParsedName(trimmed.substring(0, end), trimmed.substring(end).trim());
    }

    /**
     * Index just past the leading emoji cluster, or 0 when the text does not start with one.
     */
    static int leadingEmojiEnd(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        int first = text.codePointAt(0);
        if (!isPictographic(first) && !isRegionalIndicator(first)) {
            return 0;
        }
        int index = Character.charCount(first);
        if (isRegionalIndicator(first)) {
            if (index < text.length() && isRegionalIndicator(text.codePointAt(index))) {
                index += Character.charCount(text.codePointAt(index));
            }
            return index;
        }
        while (index < text.length()) {
            int cp = text.codePointAt(index);
            if (cp == VARIATION_SELECTOR || cp == KEYCAP || isSkinTone(cp)) {
                index += Character.charCount(cp);
            } else if (cp == ZERO_WIDTH_JOINER && index + 1 < text.length()
                    && isPictographic(text.codePointAt(index + 1))) {
                int next = text.codePointAt(index + 1);
                index += 1 + Character.charCount(next);
            } else {
                break;
            }
        }
        return index;
    }

    static boolean isPictographic(int cp) {
        if (cp >= 0x1F000 && cp <= 0x1FAFF) {
            return !isSkinTone(cp) && !isRegionalIndicator(cp);
        }
        if (cp >= 0x2300 && cp <= 0x2BFF) {
            return Character.getType(cp) == Character.OTHER_SYMBOL;
        }
        return false;
    }

    private static boolean isSkinTone(int cp) {
        return cp >= 0x1F3FB && cp <= 0x1F3FF;
    }

    private static boolean isRegionalIndicator(int cp) {
        return cp >= 0x1F1E6 && cp <= 0x1F1FF;
    }
}
