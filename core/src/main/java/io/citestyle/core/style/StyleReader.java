package io.citestyle.core.style;

import io.citestyle.core.error.StyleInputException;
import io.citestyle.core.error.StyleParseException;
import io.citestyle.core.model.NodeContent;
import io.citestyle.core.model.StyleNode;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Reads CSL style and locale documents into {@link StyleNode} trees. A style identifier is either
 * inline XML (it starts with {@code <} after optional whitespace) or a path to a file.
 *
 * <p>
 * Parsing uses the JDK DOM parser with DOCTYPE declarations disabled. Element names are taken
 * without namespace prefix; namespace declarations are not kept as attributes; whitespace-only
 * text is dropped.
 *
 * <p>
 * Thread-safe: a new {@link DocumentBuilder} is created per document.
 */
public final class StyleReader {

    /** Origin reported for inline XML input. */
    public static final String INLINE = "<inline>";

    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final Pattern INLINE_XML = Pattern.compile("^\\s*<");
    private static final Pattern YEAR_SUFFIX_VAR =
            Pattern.compile(Pattern.quote("variable=\"year-suffix\""), Pattern.CASE_INSENSITIVE);

    private static final ErrorHandler FAIL_FAST = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            // warnings do not make a document unusable
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    /**
     * Reads a style from inline XML or from a file.
     *
     * @param style inline XML text or a filesystem path
     * @return the parsed style with its year-suffix flag
     * @throws StyleInputException if the identifier is not inline XML and cannot be read as a file
     * @throws StyleParseException if the XML is malformed
     */
    public StyleSource read(String style) {
        Objects.requireNonNull(style, "style must not be null");
        boolean inline = isInlineXml(style);
        String origin = inline ? INLINE : style;
        String text = inline ? style : readFile(style);
        boolean usesYearSuffixVar = usesYearSuffixVar(text);
        StyleNode root = parse(text, origin).withoutComments();
        return new StyleSource(origin, usesYearSuffixVar, root);
    }

    /**
     * Reads a file and parses it without any style-specific processing. Used for locale files.
     *
     * @throws StyleInputException if the file cannot be read
     * @throws StyleParseException if the XML is malformed
     */
    public StyleNode readDocument(Path path) {
        String text;
        try {
            text = stripByteOrderMark(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StyleInputException("Cannot read " + path + ": " + e.getMessage(), e, path.toString());
        }
        return parse(text, path.toString()).withoutComments();
    }

    /** Returns {@code true} if {@code style} is inline XML rather than a path. */
    public static boolean isInlineXml(String style) {
        return INLINE_XML.matcher(style).find();
    }

    /** Case-insensitive scan for a reference to the {@code year-suffix} variable. */
    public static boolean usesYearSuffixVar(String text) {
        return YEAR_SUFFIX_VAR.matcher(text).find();
    }

    /**
     * Parses XML text into a tree that still contains comments.
     *
     * @param origin path or {@link #INLINE}, reported in errors
     * @throws StyleParseException if the text is not well-formed XML
     */
    public StyleNode parse(String text, String origin) {
        Document document;
        try {
            DocumentBuilder builder = newDocumentBuilder();
            document = builder.parse(new InputSource(new StringReader(text)));
        } catch (SAXException e) {
            throw new StyleParseException("Malformed XML: " + e.getMessage(), e, origin);
        } catch (IOException | ParserConfigurationException e) {
            throw new StyleParseException("Failed to parse XML: " + e.getMessage(), e, origin);
        }
        return toStyleNode(document.getDocumentElement());
    }

    private String readFile(String style) {
        Path path;
        try {
            path = Path.of(style);
        } catch (InvalidPathException e) {
            throw new StyleInputException(
                    "Style is neither inline XML nor a valid path: " + abbreviate(style), e, style);
        }
        if (!Files.isRegularFile(path)) {
            throw new StyleInputException(
                    "Style is neither inline XML nor a readable file: " + abbreviate(style), style);
        }
        try {
            return stripByteOrderMark(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StyleInputException("Cannot read style file " + path + ": " + e.getMessage(), e, style);
        }
    }

    private static String stripByteOrderMark(String text) {
        return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setIgnoringComments(false);
        factory.setExpandEntityReferences(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(FAIL_FAST);
        return builder;
    }

    private static StyleNode toStyleNode(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            attributes.put(localName(attr), attr.getValue());
        }

        List<NodeContent> children = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            switch (node.getNodeType()) {
                case Node.ELEMENT_NODE -> children.add(toStyleNode((Element) node));
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> {
                    String value = node.getNodeValue();
                    if (!value.isBlank()) {
                        children.add(new NodeContent.Text(value));
                    }
                }
                case Node.COMMENT_NODE -> children.add(new NodeContent.Comment(node.getNodeValue()));
                default -> {
                    // processing instructions and entity references carry nothing a style needs
                }
            }
        }
        return new StyleNode(localName(element), attributes, children);
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    private static String abbreviate(String value) {
        return value.length() <= 80 ? value : value.substring(0, 77) + "...";
    }
}
