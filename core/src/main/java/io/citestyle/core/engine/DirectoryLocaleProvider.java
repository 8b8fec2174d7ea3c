package io.citestyle.core.engine;

import io.citestyle.core.compiler.ElementTag;
import io.citestyle.core.error.StyleStructureException;
import io.citestyle.core.model.StyleNode;
import io.citestyle.core.spi.LocaleProvider;
import io.citestyle.core.style.LocaleMatcher;
import io.citestyle.core.style.StyleReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads locales from a directory laid out like the CSL locales repository
 * ({@code locales-en-US.xml}, {@code locales-de-DE.xml}, ...).
 *
 * <p>
 * A bare language ({@code "de"}) resolves to its default dialect ({@code "de-DE"}); a dialect
 * without a file ({@code "de-CH"}) falls back to the default dialect of its language.
 *
 * <p>
 * Thread-safe; files are read on every call.
 */
public final class DirectoryLocaleProvider implements LocaleProvider {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryLocaleProvider.class);

    private final Path directory;
    private final StyleReader reader = new StyleReader();

    public DirectoryLocaleProvider(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    @Override
    public Optional<StyleNode> load(String localeId) {
        Objects.requireNonNull(localeId, "localeId must not be null");
        String dialect = LocaleMatcher.defaultDialect(localeId);
        Path file = localeFile(dialect);
        if (!Files.isRegularFile(file)) {
            String fallback = LocaleMatcher.defaultDialect(LocaleMatcher.primaryLanguage(localeId));
            Path fallbackFile = localeFile(fallback);
            if (fallback.equals(dialect) || !Files.isRegularFile(fallbackFile)) {
                LOG.debug("No locale file for '{}' in {}", localeId, directory);
                return Optional.empty();
            }
            LOG.debug("No locale file for '{}', falling back to '{}'", localeId, fallback);
            file = fallbackFile;
        }
        StyleNode root = reader.readDocument(file);
        if (!ElementTag.LOCALE.xmlName().equals(root.tag())) {
            throw new StyleStructureException(
                    "Locale file root must be <locale>, found <" + root.tag() + ">", file.toString());
        }
        return Optional.of(root);
    }

    /** Returns the path of the file holding {@code localeId}. */
    public Path localeFile(String localeId) {
        return directory.resolve("locales-" + localeId + ".xml");
    }
}
