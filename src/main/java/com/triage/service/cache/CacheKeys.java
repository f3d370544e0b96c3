package com.triage.service.cache;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cache key fingerprints: SHA-256 of normalized query text and model name.
 * Normalization lowercases and collapses whitespace so trivially different spellings share a key.
 */
public final class CacheKeys {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private CacheKeys() {
    }

    public static String fingerprint(String queryText, String modelName) {
        return DigestUtils.sha256Hex(normalize(queryText) + "\u0000" + modelName);
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }
}
