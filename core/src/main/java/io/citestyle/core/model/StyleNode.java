package io.citestyle.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Generic parsed XML element of a style or locale document: a tag, its attributes in document
 * order, and its children in document order.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param tag        local element name, e.g. {@code "citation"}
 * @param attributes attribute name to value, document order
 * @param children   nested elements, text leaves and (before stripping) comments
 */
public record StyleNode(String tag, Map<String, String> attributes, List<NodeContent> children)
        implements NodeContent {

    /** Canonical constructor with defensive copies. */
    public StyleNode {
        Objects.requireNonNull(tag, "tag must not be null");
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
        children = children != null ? List.copyOf(children) : List.of();
    }

    /** Returns the attribute value, or {@code null} if the attribute is absent. */
    public String attr(String name) {
        return attributes.get(name);
    }

    /** Returns the child elements, skipping text and comments. */
    public List<StyleNode> elements() {
        List<StyleNode> result = new ArrayList<>();
        for (NodeContent child : children) {
            if (child instanceof StyleNode node) {
                result.add(node);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /** Returns the first child element with the given tag. */
    public Optional<StyleNode> firstElement(String childTag) {
        for (NodeContent child : children) {
            if (child instanceof StyleNode node && node.tag().equals(childTag)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /** Concatenates the direct text children, or returns {@code ""} if there are none. */
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (NodeContent child : children) {
            if (child instanceof NodeContent.Text text) {
                sb.append(text.value());
            }
        }
        return sb.toString();
    }

    /** Returns a copy of this element with the same children and no attributes. */
    public StyleNode withoutAttributes() {
        return new StyleNode(tag, Map.of(), children);
    }

    /** Returns a copy of this tree with every comment removed, recursively. */
    public StyleNode withoutComments() {
        List<NodeContent> kept = new ArrayList<>(children.size());
        for (NodeContent child : children) {
            if (child instanceof StyleNode node) {
                kept.add(node.withoutComments());
            } else if (child instanceof NodeContent.Text) {
                kept.add(child);
            }
        }
        return new StyleNode(tag, attributes, kept);
    }

    /** Convenience factory for elements without children. */
    public static StyleNode leaf(String tag, Map<String, String> attributes) {
        return new StyleNode(tag, attributes, List.of());
    }
}
