package com.campaign.canon.core;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Name normalization used for every name and title lookup.
 *
 * <p>Two tiers are used:</p>
 * <ul>
 *   <li>{@link #key(String)}: lower-case, trimmed, whitespace collapsed. This is the
 *       case-insensitive exact match baseline.</li>
 *   <li>{@link #normalizedForm(String)}: the key with punctuation removed and a leading
 *       article dropped ("The Crone" and "crone" share a normalized form).</li>
 * </ul>
 */
public final class NameKeys {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{Punct}\\u2018\\u2019\\u201C\\u201D]");
    private static final Pattern LEADING_ARTICLE = Pattern.compile("^(the|a|an) ");

    private NameKeys() {
    }

    public static String key(String name) {
        if (name == null) {
            return "";
        }
        return WHITESPACE.matcher(name.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    public static String normalizedForm(String name) {
        String stripped = PUNCTUATION.matcher(key(name)).replaceAll("");
        stripped = WHITESPACE.matcher(stripped.trim()).replaceAll(" ");
        String withoutArticle = LEADING_ARTICLE.matcher(stripped).replaceFirst("");
        return withoutArticle.isEmpty() ? stripped : withoutArticle;
    }

    public static boolean isBlank(String name) {
        return key(name).isEmpty();
    }
}
