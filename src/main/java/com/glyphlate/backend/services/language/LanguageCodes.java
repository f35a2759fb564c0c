package com.glyphlate.backend.services.language;

import java.util.Locale;
import java.util.Map;

/**
 * Normalizes language codes received at the HTTP boundary.
 */
public final class LanguageCodes {

    public static final String AUTO = "auto";

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("zh-cn", "zh"),
            Map.entry("zh-sg", "zh"),
            Map.entry("zh-hans", "zh-Hans"),
            Map.entry("zh-tw", "zh-Hant"),
            Map.entry("zh-hk", "zh-Hant"),
            Map.entry("zh-hant", "zh-Hant"),
            Map.entry("pt-br", "pt"),
            Map.entry("pt-pt", "pt"),
            Map.entry("en-us", "en"),
            Map.entry("en-gb", "en"),
            Map.entry("jp", "ja"),
            Map.entry("kr", "ko"),
            Map.entry("cn", "zh")
    );

    private LanguageCodes() {
    }

    public static boolean isAuto(String code) {
        return code == null || code.isBlank() || AUTO.equalsIgnoreCase(code.trim());
    }

    /**
     * Blank input yields {@value #AUTO}. Region subtags other than the known aliases are dropped.
     */
    public static String normalize(String code) {
        if (isAuto(code)) return AUTO;

        String lower = code.trim().replace('_', '-').toLowerCase(Locale.ROOT);
        String alias = ALIASES.get(lower);
        if (alias != null) return alias;

        int dash = lower.indexOf('-');
        return dash > 0 ? lower.substring(0, dash) : lower;
    }
}
