package guraa.doccompare.extraction;

import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Extracts the text of OpenDocument text files by reading {@code content.xml} from the package.
 * Paragraphs and headings end with a line break; {@code text:s}, {@code text:tab} and
 * {@code text:line-break} become whitespace.
 */
@Component
public class OdtTextExtractor implements TextExtractor {

    static final String TEXT_NS = "urn:oasis:names:tc:opendocument:xmlns:text:1.0";
    private static final String CONTENT_ENTRY = "content.xml";

    @Override
    public Set<String> supportedExtensions() {
        return Set.of("odt");
    }

    @Override
    public String extractText(Path file) throws IOException {
        try (ZipFile zip = new ZipFile(file.toFile())) {
            ZipEntry entry = zip.getEntry(CONTENT_ENTRY);
            if (entry == null) {
                throw new IOException("No " + CONTENT_ENTRY + " in " + file.getFileName());
            }
            try (InputStream content = zip.getInputStream(entry)) {
                org.w3c.dom.Document xml = newDocumentBuilder().parse(content);
                StringBuilder text = new StringBuilder();
                collectText(xml.getDocumentElement(), text);
                return text.toString();
            }
        } catch (SAXException | ParserConfigurationException e) {
            throw new IOException("Malformed OpenDocument content in " + file.getFileName(), e);
        }
    }

    private static void collectText(Node node, StringBuilder text) {
        if (node.getNodeType() == Node.TEXT_NODE) {
            text.append(node.getNodeValue());
            return;
        }
        if (node.getNodeType() != Node.ELEMENT_NODE) {
            return;
        }

        Element element = (Element) node;
        boolean textElement = TEXT_NS.equals(element.getNamespaceURI());
        String name = element.getLocalName();
        if (textElement && ("s".equals(name) || "tab".equals(name) || "line-break".equals(name))) {
            text.append(' ');
            return;
        }

        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            collectText(children.item(i), text);
        }

        if (textElement && ("p".equals(name) || "h".equals(name))) {
            text.append('\n');
        }
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setExpandEntityReferences(false);
        return factory.newDocumentBuilder();
    }
}
