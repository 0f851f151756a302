package com.docsearch.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns raw words into index keys: letters only, lower case, at least
 * {@link #MIN_TOKEN_LENGTH} characters.
 */
public final class Normalizer {

    public static final int MIN_TOKEN_LENGTH = 2;

    // Unicode White_Space, so no-break and em spaces separate words too
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern NON_WHITESPACE = Pattern.compile("\\S", Pattern.UNICODE_CHARACTER_CLASS);

    private Normalizer() {}

    /**
     * Normalizes a single word. Empty when fewer than two letters survive.
     */
    public static Optional<String> normalize(String raw) {
        String letters = lettersOnly(raw);
        if (letters.length() < MIN_TOKEN_LENGTH) return Optional.empty();
        return Optional.of(letters);
    }

    /**
     * Same filtering as {@link #normalize(String)} without the length check.
     */
    public static String normalizePrefix(String raw) {
        return lettersOnly(raw);
    }

    /**
     * True for null, empty, or whitespace-only text, using the same notion of
     * whitespace as {@link #words(String)}.
     */
    public static boolean isBlank(String text) {
        return text == null || !NON_WHITESPACE.matcher(text).find();
    }

    /**
     * Splits on whitespace, dropping empty pieces.
     */
    public static List<String> words(String text) {
        if (isBlank(text)) return List.of();

        String[] parts = WHITESPACE.split(text);
        List<String> out = new ArrayList<>(parts.length);
        for (String p : parts) {
            if (!p.isEmpty()) out.add(p);
        }
        return out;
    }

    /**
     * Normalized tokens of a text, in order, duplicates kept.
     */
    public static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        for (String w : words(text)) {
            normalize(w).ifPresent(out::add);
        }
        return out;
    }

    private static String lettersOnly(String raw) {
        if (raw == null || raw.isEmpty()) return "";

        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (Character.isLetter(c)) sb.append(c);
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
