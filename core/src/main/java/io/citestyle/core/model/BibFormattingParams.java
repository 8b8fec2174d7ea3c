package io.citestyle.core.model;

import io.citestyle.core.error.OptionValueException;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Typed bibliography formatting parameters derived from a style's resolved bibliography options.
 *
 * @param hangingIndent    whether entries use a hanging indent
 * @param lineSpacing      line spacing within entries
 * @param entrySpacing     spacing between entries
 * @param secondFieldAlign first-field alignment; {@link SecondFieldAlign#DISABLED} when unset
 */
public record BibFormattingParams(
        boolean hangingIndent, double lineSpacing, double entrySpacing, SecondFieldAlign secondFieldAlign) {

    public static final String HANGING_INDENT = "hanging-indent";
    public static final String LINE_SPACING = "line-spacing";
    public static final String ENTRY_SPACING = "entry-spacing";
    public static final String SECOND_FIELD_ALIGN = "second-field-align";

    /** The only bibliography options that are formatting parameters. */
    public static final Set<String> KEYS = Set.of(HANGING_INDENT, LINE_SPACING, ENTRY_SPACING, SECOND_FIELD_ALIGN);

    /**
     * Converts resolved bibliography options. Other keys are ignored; absent keys take the CSL
     * defaults ({@code false}, {@code 1}, {@code 1}, disabled).
     *
     * @throws OptionValueException if a value is outside the domain of its option
     */
    public static BibFormattingParams fromOptions(OptionMap bibOptions) {
        Map<String, Object> typed = convert(bibOptions);
        Object hanging = typed.getOrDefault(HANGING_INDENT, Boolean.FALSE);
        Object line = typed.getOrDefault(LINE_SPACING, 1.0d);
        Object entry = typed.getOrDefault(ENTRY_SPACING, 1.0d);
        Object align = typed.get(SECOND_FIELD_ALIGN);
        if (!(hanging instanceof Boolean hangingValue)) {
            throw invalid(HANGING_INDENT, bibOptions.get(HANGING_INDENT));
        }
        if (!(line instanceof Double lineValue)) {
            throw invalid(LINE_SPACING, bibOptions.get(LINE_SPACING));
        }
        if (!(entry instanceof Double entryValue)) {
            throw invalid(ENTRY_SPACING, bibOptions.get(ENTRY_SPACING));
        }
        if (!(align instanceof SecondFieldAlign alignValue)) {
            throw invalid(SECOND_FIELD_ALIGN, bibOptions.get(SECOND_FIELD_ALIGN));
        }
        return new BibFormattingParams(hangingValue, lineValue, entryValue, alignValue);
    }

    /**
     * Converts the formatting keys of {@code bibOptions} value by value: {@code "true"} and
     * {@code "false"} become booleans, {@code "flush"} and {@code "margin"} become
     * {@link SecondFieldAlign} constants, anything else is parsed as a number. The result always
     * contains {@code second-field-align}, as {@link SecondFieldAlign#DISABLED} when the option
     * was absent or false.
     *
     * @throws OptionValueException if a value is not a boolean, alignment or number, or if an
     *                              alignment is used for another option
     */
    public static Map<String, Object> convert(OptionMap bibOptions) {
        Map<String, Object> result = new LinkedHashMap<>();
        bibOptions.asMap().forEach((key, value) -> {
            if (KEYS.contains(key)) {
                result.put(key, convertValue(key, value));
            }
        });
        Object align = result.get(SECOND_FIELD_ALIGN);
        if (align == null || Boolean.FALSE.equals(align)) {
            result.put(SECOND_FIELD_ALIGN, SecondFieldAlign.DISABLED);
        }
        return result;
    }

    /** Returns the parameters as an option-name keyed map. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(HANGING_INDENT, hangingIndent);
        map.put(LINE_SPACING, lineSpacing);
        map.put(ENTRY_SPACING, entrySpacing);
        map.put(SECOND_FIELD_ALIGN, secondFieldAlign);
        return map;
    }

    private static Object convertValue(String key, String value) {
        return switch (value) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            case "flush", "margin" -> {
                if (!SECOND_FIELD_ALIGN.equals(key)) {
                    throw invalid(key, value);
                }
                yield "flush".equals(value) ? SecondFieldAlign.FLUSH : SecondFieldAlign.MARGIN;
            }
            default -> parseNumber(key, value);
        };
    }

    // BigDecimal accepts plain decimal notation only: no NaN, Infinity, type suffixes or hex.
    private static Double parseNumber(String key, String value) {
        double number;
        try {
            number = new BigDecimal(value.trim()).doubleValue();
        } catch (NumberFormatException e) {
            throw new OptionValueException(
                    "Invalid value '" + value + "' for bibliography option '" + key + "'", e, null);
        }
        if (!Double.isFinite(number)) {
            throw invalid(key, value);
        }
        return number;
    }

    private static OptionValueException invalid(String key, String value) {
        return new OptionValueException("Invalid value '" + value + "' for bibliography option '" + key + "'", null);
    }
}
