package com.salesagent.leads.service;

import org.apache.commons.codec.digest.DigestUtils;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The one place identity is computed. Writer, deduplicator and tests all go through here,
 * so "Joe's Cafe" and "joe's  cafe" can never end up under different keys.
 */
public final class IdentityKeys {

    private static final Pattern APOSTROPHES = Pattern.compile("['‘’`´]");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");

    private IdentityKeys() {
    }

    /**
     * Unicode NFKC, lower case, '&' read as "and", apostrophes dropped,
     * any other run of non letter/digit characters collapsed to one space.
     */
    public static String normalize(String value) {
        if (value == null) return "";
        String s = Normalizer.normalize(value, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        s = s.replace("&", " and ");
        s = APOSTROPHES.matcher(s).replaceAll("");
        s = NON_ALNUM.matcher(s).replaceAll(" ");
        return s.trim();
    }

    /** SHA-256 hex of normalize(name) + "|" + normalize(address). */
    public static String identityKey(String name, String address) {
        return DigestUtils.sha256Hex(normalize(name) + "|" + normalize(address));
    }
}
