package im.arun.xml2csv.xml;

import im.arun.xml2csv.model.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses XML into {@link TreeNode}s with the JDK DOM parser.
 * Only elements are kept; attributes, comments and processing instructions are dropped and
 * namespace prefixes stay part of the tag.
 */
public class XmlTreeParser {
    private static final Logger logger = LoggerFactory.getLogger(XmlTreeParser.class);

    private final DocumentBuilderFactory factory;

    public XmlTreeParser() {
        this.factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setIgnoringComments(true);
        factory.setCoalescing(true);
        factory.setExpandEntityReferences(false);
        factory.setXIncludeAware(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    public TreeNode parse(byte[] source) throws DocumentParseException {
        try {
            return parse(new InputSource(new ByteArrayInputStream(source)));
        } catch (DocumentParseException e) {
            throw e;
        } catch (IOException e) {
            throw new DocumentParseException("Failed to read document: " + e.getMessage(), e);
        }
    }

    public TreeNode parse(InputStream source) throws IOException {
        return parse(new InputSource(source));
    }

    /**
     * Parse a file, letting the XML declaration decide the encoding.
     */
    public TreeNode parse(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            InputSource inputSource = new InputSource(in);
            inputSource.setSystemId(path.toUri().toString());
            return parse(inputSource);
        }
    }

    /**
     * Parse a file, decoding it with the given charset regardless of its declaration.
     */
    public TreeNode parse(Path path, Charset charset) throws IOException {
        try (InputStreamReader reader = new InputStreamReader(Files.newInputStream(path), charset)) {
            InputSource inputSource = new InputSource(reader);
            inputSource.setSystemId(path.toUri().toString());
            return parse(inputSource);
        }
    }

    private TreeNode parse(InputSource inputSource) throws IOException {
        Document document;
        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new FailingErrorHandler());
            document = builder.parse(inputSource);
        } catch (SAXParseException e) {
            throw new DocumentParseException(String.format("Malformed XML at line %d, column %d: %s",
                e.getLineNumber(), e.getColumnNumber(), e.getMessage()), e);
        } catch (SAXException e) {
            throw new DocumentParseException("Malformed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser misconfigured", e);
        }

        Element root = document.getDocumentElement();
        if (root == null) {
            throw new DocumentParseException("Document has no root element");
        }
        TreeNode tree = toTreeNode(root);
        logger.debug("Parsed document with root <{}>", tree.getTag());
        return tree;
    }

    private TreeNode toTreeNode(Element element) {
        NodeList childNodes = element.getChildNodes();
        List<TreeNode> children = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < childNodes.getLength(); i++) {
            Node child = childNodes.item(i);
            switch (child.getNodeType()) {
                case Node.ELEMENT_NODE:
                    children.add(toTreeNode((Element) child));
                    break;
                case Node.TEXT_NODE:
                case Node.CDATA_SECTION_NODE:
                    text.append(child.getNodeValue());
                    break;
                default:
                    break;
            }
        }
        return new TreeNode(element.getTagName(), text.toString(), children);
    }

    private static final class FailingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException exception) {
            logger.debug("XML parser warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
