package io.citestyle.core.model;

import java.util.Objects;

/**
 * One child of a parsed style element: a nested element, a run of text, or a comment. Comments
 * only exist between parsing and {@link StyleNode#withoutComments()}; the compiler never sees
 * them.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface NodeContent permits StyleNode, NodeContent.Text, NodeContent.Comment {

    /** A text leaf. Whitespace-only runs are dropped by the reader. */
    record Text(String value) implements NodeContent {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** An XML comment. */
    record Comment(String value) implements NodeContent {}
}
