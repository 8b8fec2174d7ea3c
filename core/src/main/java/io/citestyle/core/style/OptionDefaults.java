package io.citestyle.core.style;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.citestyle.core.model.CompiledLayout;
import io.citestyle.core.model.CompiledStyle;
import io.citestyle.core.model.OptionMap;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fills options a style leaves unset. Runs once, after all structural parsing, so explicit
 * settings always win.
 *
 * <p>
 * Independent defaults come from the classpath table {@value #RESOURCE}. A second pass resolves
 * the collapse delimiters, whose defaults depend on the {@code collapse} option and on the
 * citation layout's delimiter.
 *
 * <p>
 * Applying the defaults more than once changes nothing after the first run.
 */
public final class OptionDefaults {

    /** Classpath location of the default table. */
    public static final String RESOURCE = "/style-option-defaults.yaml";

    static final String COLLAPSE = "collapse";
    static final String CITE_GROUP_DELIMITER = "cite-group-delimiter";
    static final String AFTER_COLLAPSE_DELIMITER = "after-collapse-delimiter";
    static final String YEAR_SUFFIX_DELIMITER = "year-suffix-delimiter";

    private static final String CITATION_NUMBER = "citation-number";
    private static final Set<String> YEAR_SUFFIX_COLLAPSES = Set.of("year-suffix", "year-suffix-ranged");
    private static final String DEFAULT_CITE_GROUP_DELIMITER = ", ";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final List<Entry> TABLE = loadTable();

    /**
     * One row of the default table.
     *
     * @param scope  the option mapping the default belongs to
     * @param option the option name
     * @param value  the default value
     */
    public record Entry(OptionScope scope, String option, String value) {}

    private OptionDefaults() {
        // utility class
    }

    /** The independent defaults, in table order. */
    public static List<Entry> table() {
        return TABLE;
    }

    /** Applies the independent defaults and then the dependent collapse delimiters. */
    public static void apply(CompiledStyle.Builder style) {
        for (Entry entry : TABLE) {
            entry.scope().of(style).setIfAbsent(entry.option(), entry.value());
        }
        applyCollapseDefaults(style.citeOptions(), style.citeLayout());
    }

    /**
     * Resolves the delimiters that depend on {@code collapse}. Nothing is set for
     * {@code collapse="citation-number"} or when {@code collapse} is absent.
     *
     * @param citeOptions the citation options, already holding explicit settings
     * @param citeLayout  the citation layout, whose delimiter is the fallback for the collapse
     *                    delimiters; may be {@code null}
     */
    static void applyCollapseDefaults(OptionMap citeOptions, CompiledLayout citeLayout) {
        String collapse = citeOptions.get(COLLAPSE);
        if (collapse == null || CITATION_NUMBER.equals(collapse)) {
            return;
        }
        citeOptions.setIfAbsent(CITE_GROUP_DELIMITER, DEFAULT_CITE_GROUP_DELIMITER);
        String layoutDelimiter = citeLayout != null ? citeLayout.delimiter() : null;
        if (layoutDelimiter == null) {
            return;
        }
        citeOptions.setIfAbsent(AFTER_COLLAPSE_DELIMITER, layoutDelimiter);
        if (YEAR_SUFFIX_COLLAPSES.contains(collapse)) {
            citeOptions.setIfAbsent(YEAR_SUFFIX_DELIMITER, layoutDelimiter);
        }
    }

    private static List<Entry> loadTable() {
        try (InputStream in = OptionDefaults.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Option default table not found on classpath: " + RESOURCE);
            }
            JsonNode root = YAML_MAPPER.readTree(in);
            List<Entry> entries = new ArrayList<>();
            for (OptionScope scope : OptionScope.values()) {
                JsonNode options = root.get(scope.key());
                if (options == null || options.isNull()) {
                    continue;
                }
                if (!options.isObject()) {
                    throw new IllegalStateException("Option defaults for '" + scope.key() + "' must be a mapping");
                }
                for (Map.Entry<String, JsonNode> field : options.properties()) {
                    entries.add(new Entry(scope, field.getKey(), field.getValue().asText()));
                }
            }
            return List.copyOf(entries);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read option default table " + RESOURCE, e);
        }
    }
}
