package io.citestyle.core.spi;

import io.citestyle.core.model.StyleNode;
import java.util.Optional;

/**
 * Source of standalone CSL locale documents, merged after a style's own locale blocks.
 * Implementations MUST be thread-safe.
 */
@FunctionalInterface
public interface LocaleProvider {

    /**
     * Loads the {@code locale} element for the given locale identifier.
     *
     * @param localeId a locale such as {@code "en-US"} or {@code "de"}
     * @return the parsed, comment-free locale root, or empty if no locale file is available
     * @throws io.citestyle.core.error.StyleParseException if a locale file exists but is malformed
     */
    Optional<StyleNode> load(String localeId);

    /** A provider that never supplies a locale. */
    static LocaleProvider none() {
        return localeId -> Optional.empty();
    }
}
