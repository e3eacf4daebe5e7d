package com.al.ccda2omop.service.engine;

import com.al.ccda2omop.util.Hl7Time;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpression;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * XPath helpers over namespace-unaware DOM trees.
 *
 * <p>
 * Compiled expressions are cached per thread, since neither {@link XPath}
 * nor {@link XPathExpression} may be shared between threads. Invalid
 * expressions raise {@link IllegalArgumentException}.
 */
public final class XmlExtractor {

    private static final ThreadLocal<XPath> XPATH =
            ThreadLocal.withInitial(() -> XPathFactory.newInstance().newXPath());

    private static final ThreadLocal<Map<String, XPathExpression>> CACHE =
            ThreadLocal.withInitial(HashMap::new);

    private XmlExtractor() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * First node matched by the expression, or null.
     */
    public static Node first(Node context, String expression) {
        if (context == null || expression == null || expression.isBlank()) {
            return null;
        }
        NodeList nodes = evaluate(context, expression);
        return nodes.getLength() == 0 ? null : nodes.item(0);
    }

    /**
     * Elements matched by the expression, in document order.
     */
    public static List<Element> elements(Node context, String expression) {
        List<Element> result = new ArrayList<>();
        if (context == null || expression == null || expression.isBlank()) {
            return result;
        }
        NodeList nodes = evaluate(context, expression);
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element) {
                result.add((Element) nodes.item(i));
            }
        }
        return result;
    }

    /**
     * String value of the first match: an attribute's value, or an
     * element's leading text. "" when nothing matches.
     */
    public static String string(Node context, String expression) {
        return valueOf(first(context, expression));
    }

    /**
     * {@link #string(Node, String)} of the primary expression, or of the
     * fallback when the primary yields nothing.
     */
    public static String string(Node context, String expression, String fallback) {
        String value = string(context, expression);
        if (value.isEmpty() && fallback != null && !fallback.isBlank()) {
            return string(context, fallback);
        }
        return value;
    }

    /**
     * HL7 timestamp at the expression: an element's {@code @value}, or the
     * matched attribute's value.
     */
    public static LocalDateTime time(Node context, String expression) {
        Node node = first(context, expression);
        if (node == null) {
            return null;
        }
        String raw = node instanceof Element ? ((Element) node).getAttribute("value") : node.getNodeValue();
        return Hl7Time.parse(raw);
    }

    public static String attribute(Element element, String name) {
        return element == null ? "" : element.getAttribute(name);
    }

    /**
     * First direct child element with the given tag name, or null.
     */
    public static Element child(Element parent, String tagName) {
        if (parent == null) {
            return null;
        }
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element && tagName.equals(localName(n))) {
                return (Element) n;
            }
        }
        return null;
    }

    static String valueOf(Node node) {
        if (node == null) {
            return "";
        }
        if (node instanceof Element) {
            Node text = node.getFirstChild();
            if (text != null && (text.getNodeType() == Node.TEXT_NODE || text.getNodeType() == Node.CDATA_SECTION_NODE)) {
                return text.getNodeValue();
            }
            return "";
        }
        String value = node.getNodeValue();
        return value == null ? "" : value;
    }

    private static String localName(Node node) {
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon < 0 ? name : name.substring(colon + 1);
    }

    private static NodeList evaluate(Node context, String expression) {
        try {
            return (NodeList) compile(expression).evaluate(context, XPathConstants.NODESET);
        } catch (XPathExpressionException e) {
            throw new IllegalArgumentException("Invalid XPath expression '" + expression + "'", e);
        }
    }

    private static XPathExpression compile(String expression) throws XPathExpressionException {
        Map<String, XPathExpression> cache = CACHE.get();
        XPathExpression compiled = cache.get(expression);
        if (compiled == null) {
            compiled = XPATH.get().compile(expression);
            cache.put(expression, compiled);
        }
        return compiled;
    }
}
