package org.epubmeta.service.content;

import lombok.RequiredArgsConstructor;
import org.apache.commons.text.StringEscapeUtils;
import org.epubmeta.dom.EpubElement;
import org.epubmeta.dom.EpubXPath;
import org.epubmeta.exception.EpubError;
import org.epubmeta.model.ManifestItem;
import org.epubmeta.service.loader.DocumentLoader;
import org.epubmeta.util.HtmlElements;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.Text;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * Extracts the text of XHTML content documents, either as plain text or with basic formatting markup kept.
 */
@RequiredArgsConstructor
public class ContentExtractor {

    private static final String ELEMENT_BY_ID = "//*[@id=$id]";
    private static final String BODY = "//*[local-name()='body']";

    private final DocumentLoader documentLoader;
    private final EpubXPath xpath = new EpubXPath();

    public String extract(ManifestItem item, String fragmentBegin, String fragmentEnd, boolean keepMarkup) {
        Document document = documentLoader.parseXhtml(item.getData(), item.getPath());
        return extract(document, fragmentBegin, fragmentEnd, keepMarkup);
    }

    /**
     * Collect the text of a document in reading order.
     * <p>
     * Extraction starts at the element with ID {@code fragmentBegin} (or the body) and runs on past the end of that
     * element until the element with ID {@code fragmentEnd} is reached. Without an end ID it runs to the end of the
     * document. Block level elements are followed by a line break in plain text mode.
     *
     * @throws org.epubmeta.exception.FragmentNotFoundException if one of the given IDs does not exist
     */
    public String extract(Document document, String fragmentBegin, String fragmentEnd, boolean keepMarkup) {
        Node node = findStart(document, fragmentBegin);

        StringBuilder contents = new StringBuilder();
        Deque<String> endMarkers = new ArrayDeque<>();
        while (node != null && !isFragmentEnd(node, fragmentEnd)) {
            if (node instanceof Text text) {
                contents.append(keepMarkup ? StringEscapeUtils.escapeXml10(text.getData()) : text.getData());
            } else if (node instanceof Element element) {
                String tag = element.getLocalName() != null ? element.getLocalName() : element.getTagName();
                if (keepMarkup && HtmlElements.isKeptMarkup(tag)) {
                    contents.append('<').append(tag).append('>');
                    endMarkers.push("</" + tag + ">");
                } else if (HtmlElements.isBlockLevel(tag)) {
                    endMarkers.push("\n");
                } else {
                    endMarkers.push("");
                }

                if (element.hasChildNodes()) {
                    node = element.getFirstChild();
                    continue;
                }
            }

            node = leave(node, contents, endMarkers, fragmentEnd);
        }
        while (!endMarkers.isEmpty()) {
            contents.append(endMarkers.pop());
        }
        return contents.toString();
    }

    private Node findStart(Document document, String fragmentBegin) {
        if (fragmentBegin != null) {
            EpubElement begin = xpath.queryFirst(ELEMENT_BY_ID, document, Map.of("id", fragmentBegin));
            if (begin == null) {
                throw EpubError.FRAGMENT_BEGIN_NOT_FOUND.createException(fragmentBegin);
            }
            return begin.unwrap();
        }
        EpubElement body = xpath.queryFirst(BODY, document);
        return body != null ? body.unwrap() : document.getDocumentElement();
    }

    private static boolean isFragmentEnd(Node node, String fragmentEnd) {
        return fragmentEnd != null && node instanceof Element element && fragmentEnd.equals(element.getAttribute("id"));
    }

    /**
     * Close the given node and all ancestors without a following sibling.
     *
     * @return the next node in document order, {@code null} at the end of the document
     */
    private static Node leave(Node node, StringBuilder contents, Deque<String> endMarkers, String fragmentEnd) {
        Node current = node;
        while (current != null) {
            // ancestors of a fragment start were never entered and have no marker
            if (current instanceof Element && !endMarkers.isEmpty()) {
                contents.append(endMarkers.pop());
            }
            if (current.getNextSibling() != null) {
                return current.getNextSibling();
            }
            current = current.getParentNode();
        }
        if (fragmentEnd != null) {
            throw EpubError.FRAGMENT_END_NOT_FOUND.createException(fragmentEnd);
        }
        return null;
    }
}
