package io.quarkus.qe.git.content.search.match.impl;

import io.quarkus.qe.git.content.search.history.RetrievedContent;
import io.quarkus.qe.git.content.search.match.ContentMatchException;
import io.quarkus.qe.git.content.search.match.ContentMatcher;
import jakarta.inject.Singleton;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Searches the cell values of Office Open XML workbooks (.xlsx, .xlsm).
 * <p>
 * A workbook is a zip archive; text cells reference {@code xl/sharedStrings.xml}, inline strings and
 * numbers are stored in the worksheet parts under {@code xl/worksheets/}. The query must occur within a
 * single cell value.
 */
@Singleton
final class SpreadsheetContentMatcher implements ContentMatcher {

    private static final Set<String> EXTENSIONS = Set.of(".xlsx", ".xlsm");
    private static final String SHARED_STRINGS = "xl/sharedStrings.xml";
    private static final String WORKSHEETS_PREFIX = "xl/worksheets/";

    @Override
    public boolean contains(RetrievedContent content, String query) {
        try (ZipFile workbook = new ZipFile(content.path().toFile())) {
            List<String> sharedStrings = readSharedStrings(workbook);

            List<? extends ZipEntry> worksheets = Collections.list(workbook.entries()).stream()
                    .filter(entry -> entry.getName().startsWith(WORKSHEETS_PREFIX))
                    .filter(entry -> entry.getName().endsWith(".xml"))
                    .toList();

            for (ZipEntry worksheet : worksheets) {
                if (worksheetContains(workbook, worksheet, sharedStrings, query)) {
                    return true;
                }
            }
            return false;
        } catch (IOException | SAXException | ParserConfigurationException e) {
            throw new ContentMatchException("Failed to read workbook " + content.path() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean supports(String filePath) {
        String lowerCasePath = filePath.toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(lowerCasePath::endsWith);
    }

    private static List<String> readSharedStrings(ZipFile workbook)
            throws IOException, SAXException, ParserConfigurationException {
        ZipEntry entry = workbook.getEntry(SHARED_STRINGS);
        if (entry == null) {
            return List.of();
        }

        Document doc = parse(workbook, entry);
        NodeList items = doc.getElementsByTagNameNS("*", "si");
        List<String> sharedStrings = new ArrayList<>(items.getLength());
        for (int i = 0; i < items.getLength(); i++) {
            sharedStrings.add(collectText((Element) items.item(i)));
        }
        return sharedStrings;
    }

    private static boolean worksheetContains(ZipFile workbook, ZipEntry worksheet, List<String> sharedStrings,
            String query) throws IOException, SAXException, ParserConfigurationException {
        Document doc = parse(workbook, worksheet);
        NodeList cells = doc.getElementsByTagNameNS("*", "c");

        for (int i = 0; i < cells.getLength(); i++) {
            String value = cellValue((Element) cells.item(i), sharedStrings);
            if (value != null && value.contains(query)) {
                return true;
            }
        }
        return false;
    }

    private static String cellValue(Element cell, List<String> sharedStrings) {
        String type = cell.getAttribute("t");

        if ("inlineStr".equals(type)) {
            NodeList inline = cell.getElementsByTagNameNS("*", "is");
            return inline.getLength() > 0 ? collectText((Element) inline.item(0)) : null;
        }

        String raw = firstChildText(cell, "v");
        if (raw == null) {
            return null;
        }
        if ("s".equals(type)) {
            try {
                int index = Integer.parseInt(raw.trim());
                return index >= 0 && index < sharedStrings.size() ? sharedStrings.get(index) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return raw;
    }

    /**
     * Concatenates the text runs of a string item, leaving out phonetic hints.
     */
    private static String collectText(Element stringItem) {
        StringBuilder text = new StringBuilder();
        NodeList runs = stringItem.getElementsByTagNameNS("*", "t");
        for (int i = 0; i < runs.getLength(); i++) {
            Node run = runs.item(i);
            if (!"rPh".equals(run.getParentNode().getLocalName())) {
                text.append(run.getTextContent());
            }
        }
        return text.toString();
    }

    private static String firstChildText(Element parent, String localName) {
        NodeList nodeList = parent.getElementsByTagNameNS("*", localName);
        if (nodeList.getLength() > 0) {
            return nodeList.item(0).getTextContent();
        }
        return null;
    }

    private static Document parse(ZipFile workbook, ZipEntry entry)
            throws IOException, SAXException, ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        DocumentBuilder builder = factory.newDocumentBuilder();
        try (InputStream input = workbook.getInputStream(entry)) {
            return builder.parse(input);
        }
    }
}
