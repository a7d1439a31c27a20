package com.tracelens.service.log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits log lines on whitespace and masks variable tokens with {@link #WILDCARD}.
 */
public final class LogTokenizer {

    public static final String WILDCARD = "<*>";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern UUID = Pattern.compile(
            "(?i).*[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}.*");
    // Long hex runs such as trace ids or hashes, with or without a 0x prefix
    private static final Pattern HEX_ID = Pattern.compile("(?i)^[\"'(\\[]?(0x)?[0-9a-f]{16,}[\"')\\],;:.]?$");
    private static final Pattern EMAIL = Pattern.compile("^[\"'<(]?[\\w.+-]+@[\\w-]+(\\.[\\w-]+)+[\"'>),;:.]?$");

    private LogTokenizer() {
    }

    public static List<String> tokenize(String message) {
        if (message == null) {
            return Collections.emptyList();
        }
        String trimmed = message.trim();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        String[] raw = WHITESPACE.split(trimmed);
        List<String> tokens = new ArrayList<>(raw.length);
        for (String token : raw) {
            tokens.add(isVariable(token) ? WILDCARD : token);
        }
        return tokens;
    }

    /**
     * Tokens carrying numbers, ids, addresses or timestamps vary between otherwise identical lines.
     */
    static boolean isVariable(String token) {
        return DIGIT.matcher(token).find()
                || UUID.matcher(token).matches()
                || HEX_ID.matcher(token).matches()
                || EMAIL.matcher(token).matches();
    }

    static String signature(List<String> tokens) {
        return String.join(" ", tokens);
    }
}
