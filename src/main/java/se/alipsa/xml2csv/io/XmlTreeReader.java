package se.alipsa.xml2csv.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import se.alipsa.xml2csv.ConversionException;
import se.alipsa.xml2csv.model.Node;

/**
 * Parses XML into an immutable {@link Node} tree.
 *
 * <p>
 * Elements become nodes tagged with their qualified name; attributes, comments
 * and processing instructions are dropped. The text of an element is the
 * trimmed concatenation of its direct text and CDATA children. Documents
 * carrying a DOCTYPE declaration are refused.
 * </p>
 */
public final class XmlTreeReader {

  private static final Logger log = LoggerFactory.getLogger(XmlTreeReader.class);

  private final DocumentBuilderFactory factory;

  /**
   * Create a reader with a hardened parser configuration.
   */
  public XmlTreeReader() {
    factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(false);
    factory.setValidating(false);
    factory.setXIncludeAware(false);
    try {
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
      factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
      factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser does not support secure processing", e);
    }
  }

  /**
   * Read a document from a file.
   *
   * @param file
   *          the XML file
   * @return the root node
   * @throws ConversionException
   *           if the file cannot be read or is not well formed XML
   */
  public Node read(Path file) throws ConversionException {
    Objects.requireNonNull(file, "file");
    try (InputStream in = Files.newInputStream(file)) {
      return read(in, file.toString());
    } catch (IOException e) {
      throw new ConversionException("Failed to read " + file + ": " + e.getMessage(), e);
    }
  }

  /**
   * Read a document from a stream.
   *
   * @param in
   *          the XML content
   * @param name
   *          the name of the source, used in error messages
   * @return the root node
   * @throws ConversionException
   *           if the content cannot be read or is not well formed XML
   */
  public Node read(InputStream in, String name) throws ConversionException {
    Objects.requireNonNull(in, "in");
    InputSource source = new InputSource(in);
    source.setSystemId(name);
    return parse(source, name);
  }

  /**
   * Parse a document held in a string.
   *
   * @param xml
   *          the XML text
   * @return the root node
   * @throws ConversionException
   *           if the text is not well formed XML
   */
  public Node parse(String xml) throws ConversionException {
    Objects.requireNonNull(xml, "xml");
    return parse(new InputSource(new StringReader(xml)), "<string>");
  }

  private Node parse(InputSource source, String name) throws ConversionException {
    try {
      DocumentBuilder builder = factory.newDocumentBuilder();
      builder.setErrorHandler(new FailingErrorHandler());
      Document doc = builder.parse(source);
      return toNode(doc.getDocumentElement());
    } catch (SAXParseException e) {
      throw new ConversionException(
          "Malformed XML in " + name + " at line " + e.getLineNumber() + ", column " + e.getColumnNumber() + ": "
              + e.getMessage(),
          e);
    } catch (SAXException | ParserConfigurationException e) {
      throw new ConversionException("Failed to parse " + name + ": " + e.getMessage(), e);
    } catch (IOException e) {
      throw new ConversionException("Failed to read " + name + ": " + e.getMessage(), e);
    }
  }

  private static Node toNode(Element documentElement) {
    Deque<PendingElement> stack = new ArrayDeque<>();
    stack.push(new PendingElement(documentElement));
    Node root = null;
    while (!stack.isEmpty()) {
      PendingElement top = stack.peek();
      Element next = top.nextChildElement();
      if (next != null) {
        stack.push(new PendingElement(next));
        continue;
      }
      stack.pop();
      Node built = top.build();
      if (stack.isEmpty()) {
        root = built;
      } else {
        stack.peek().children.add(built);
      }
    }
    return root;
  }

  /**
   * An element whose children are still being converted.
   */
  private static final class PendingElement {

    private final Element element;
    private final List<Node> children = new ArrayList<>();
    private final StringBuilder text = new StringBuilder();
    private org.w3c.dom.Node cursor;

    PendingElement(Element element) {
      this.element = element;
      this.cursor = element.getFirstChild();
    }

    /** Advance to the next child element, collecting text passed on the way. */
    Element nextChildElement() {
      while (cursor != null) {
        org.w3c.dom.Node current = cursor;
        cursor = cursor.getNextSibling();
        switch (current.getNodeType()) {
          case org.w3c.dom.Node.ELEMENT_NODE:
            return (Element) current;
          case org.w3c.dom.Node.TEXT_NODE:
          case org.w3c.dom.Node.CDATA_SECTION_NODE:
            text.append(current.getNodeValue());
            break;
          case org.w3c.dom.Node.ENTITY_REFERENCE_NODE:
            text.append(current.getTextContent());
            break;
          default:
            break;
        }
      }
      return null;
    }

    Node build() {
      String value = text.toString().trim();
      if (children.isEmpty()) {
        return new Node(element.getTagName(), value, List.of());
      }
      return new Node(element.getTagName(), value.isEmpty() ? null : value, children);
    }
  }

  /**
   * Turns parser errors into exceptions instead of printing them.
   */
  private static final class FailingErrorHandler implements ErrorHandler {

    @Override
    public void warning(SAXParseException exception) {
      log.warn("XML warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
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
