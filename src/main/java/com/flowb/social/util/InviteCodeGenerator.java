package com.flowb.social.util;

import java.security.SecureRandom;
import java.util.function.Predicate;

/**
 * Utility class for generating share codes for flow invites, crew join codes and
 * personal crew invites.
 */
public class InviteCodeGenerator {

    /**
     * Lowercase letters and digits without the easily confused i, l, o, 0 and 1.
     */
    static final String CHARACTERS = "abcdefghjkmnpqrstuvwxyz23456789";
    private static final SecureRandom random = new SecureRandom();

    private InviteCodeGenerator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Generate a random code of the given length (e.g. "k7mq2x" for 6).
     */
    public static String generate(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Code length must be positive: " + length);
        }
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            int index = random.nextInt(CHARACTERS.length());
            code.append(CHARACTERS.charAt(index));
        }
        return code.toString();
    }

    /**
     * Generate a code that the checker reports as unused.
     * Loops until a code is generated that doesn't exist.
     *
     * @param length Code length
     * @param existsChecker Function that returns true if a code already exists
     * @return A unique code
     */
    public static String generateUnique(int length, Predicate<String> existsChecker) {
        String code;
        do {
            code = generate(length);
        } while (existsChecker.test(code));
        return code;
    }
}
