package io.citestyle.core.style;

import java.util.Locale;
import java.util.Map;

/** Locale identifier helpers following CSL's {@code xml:lang} matching rules. */
public final class LocaleMatcher {

    /** Dialect used when only a primary language is known, from the CSL locales repository. */
    private static final Map<String, String> DEFAULT_DIALECTS = Map.ofEntries(
            Map.entry("af", "af-ZA"),
            Map.entry("ar", "ar"),
            Map.entry("bg", "bg-BG"),
            Map.entry("ca", "ca-AD"),
            Map.entry("cs", "cs-CZ"),
            Map.entry("cy", "cy-GB"),
            Map.entry("da", "da-DK"),
            Map.entry("de", "de-DE"),
            Map.entry("el", "el-GR"),
            Map.entry("en", "en-US"),
            Map.entry("es", "es-ES"),
            Map.entry("et", "et-EE"),
            Map.entry("eu", "eu"),
            Map.entry("fa", "fa-IR"),
            Map.entry("fi", "fi-FI"),
            Map.entry("fr", "fr-FR"),
            Map.entry("he", "he-IL"),
            Map.entry("hr", "hr-HR"),
            Map.entry("hu", "hu-HU"),
            Map.entry("id", "id-ID"),
            Map.entry("is", "is-IS"),
            Map.entry("it", "it-IT"),
            Map.entry("ja", "ja-JP"),
            Map.entry("km", "km-KH"),
            Map.entry("ko", "ko-KR"),
            Map.entry("lt", "lt-LT"),
            Map.entry("lv", "lv-LV"),
            Map.entry("mn", "mn-MN"),
            Map.entry("nb", "nb-NO"),
            Map.entry("nl", "nl-NL"),
            Map.entry("nn", "nn-NO"),
            Map.entry("pl", "pl-PL"),
            Map.entry("pt", "pt-PT"),
            Map.entry("ro", "ro-RO"),
            Map.entry("ru", "ru-RU"),
            Map.entry("sk", "sk-SK"),
            Map.entry("sl", "sl-SI"),
            Map.entry("sr", "sr-RS"),
            Map.entry("sv", "sv-SE"),
            Map.entry("th", "th-TH"),
            Map.entry("tr", "tr-TR"),
            Map.entry("uk", "uk-UA"),
            Map.entry("vi", "vi-VN"),
            Map.entry("zh", "zh-CN"));

    private LocaleMatcher() {
        // utility class
    }

    /**
     * Returns {@code true} if a locale block tagged {@code candidate} applies to {@code requested}.
     * An absent tag on either side matches everything. Otherwise the primary languages must be
     * equal, and so must the regions when both sides have one: {@code en} matches {@code en-GB},
     * {@code en-US} does not.
     */
    public static boolean isCompatible(String candidate, String requested) {
        if (isBlank(candidate) || isBlank(requested)) {
            return true;
        }
        String[] a = split(candidate);
        String[] b = split(requested);
        if (!a[0].equals(b[0])) {
            return false;
        }
        return a.length == 1 || b.length == 1 || a[1].equals(b[1]);
    }

    /** Returns the primary language subtag, lower-cased ({@code "de-AT"} gives {@code "de"}). */
    public static String primaryLanguage(String localeId) {
        return split(localeId)[0];
    }

    /**
     * Returns the dialect to use when only a language is known: {@code "de"} gives
     * {@code "de-DE"}. Identifiers that already carry a region, and unknown languages, are
     * returned unchanged.
     */
    public static String defaultDialect(String localeId) {
        String[] parts = split(localeId);
        if (parts.length > 1) {
            return localeId;
        }
        return DEFAULT_DIALECTS.getOrDefault(parts[0], localeId);
    }

    private static String[] split(String localeId) {
        String normalized = localeId.trim().replace('_', '-');
        int dash = normalized.indexOf('-');
        if (dash < 0) {
            return new String[] {normalized.toLowerCase(Locale.ROOT)};
        }
        return new String[] {
            normalized.substring(0, dash).toLowerCase(Locale.ROOT),
            normalized.substring(dash + 1).toUpperCase(Locale.ROOT)
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
