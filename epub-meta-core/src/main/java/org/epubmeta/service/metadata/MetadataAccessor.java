package org.epubmeta.service.metadata;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.epubmeta.dom.EpubElement;
import org.epubmeta.dom.PackageDocument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads and writes the Dublin Core metadata of a package document.
 * <p>
 * Every write ends with a {@link PackageDocument#resync()}.
 */
@Slf4j
@RequiredArgsConstructor
public class MetadataAccessor {

    public static final String TITLE = "dc:title";
    public static final String LANGUAGE = "dc:language";
    public static final String PUBLISHER = "dc:publisher";
    public static final String RIGHTS = "dc:rights";
    public static final String DESCRIPTION = "dc:description";
    public static final String IDENTIFIER = "dc:identifier";
    public static final String CREATOR = "dc:creator";
    public static final String SUBJECT = "dc:subject";

    private static final String METADATA_PATH = "//opf:metadata/";
    private static final String SCHEME = "opf:scheme";
    private static final String ROLE = "opf:role";
    private static final String FILE_AS = "opf:file-as";
    private static final String AUTHOR_ROLE = "aut";
    private static final String UPPER_CASE = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String LOWER_CASE = "abcdefghijklmnopqrstuvwxyz";

    private final PackageDocument packageDocument;

    public String getSingleton(String element) {
        return getSingleton(element, null, Collections.emptyList(), false);
    }

    /**
     * Text of the first metadata element matching the name and, if given, one of the attribute values.
     *
     * @param attribute       attribute to filter on, {@code null} for no filter
     * @param values          accepted attribute values
     * @param caseInsensitive whether attribute values are compared ignoring ASCII case
     * @return the unescaped text, or an empty string if nothing matches
     */
    public String getSingleton(String element, String attribute, List<String> values, boolean caseInsensitive) {
        Map<String, String> bindings = new HashMap<>();
        String expression = buildQuery(element, attribute, values, caseInsensitive, bindings);
        EpubElement node = packageDocument.queryFirst(expression, bindings);
        return node != null ? node.getText() : "";
    }

    public void setSingleton(String element, String value) {
        setSingleton(element, value, null, Collections.emptyList(), false);
    }

    /**
     * Set the text of a metadata element that should exist at most once. If exactly one element matches its text is
     * replaced, otherwise all matches are dropped and a single new element is added. An empty value removes the
     * element.
     */
    public void setSingleton(String element, String value, String attribute, List<String> values, boolean caseInsensitive) {
        EpubElement metadata = packageDocument.requireMetadata();
        Map<String, String> bindings = new HashMap<>();
        String expression = buildQuery(element, attribute, values, caseInsensitive, bindings);
        List<EpubElement> nodes = packageDocument.query(expression, bindings);

        if (nodes.size() == 1) {
            EpubElement node = nodes.get(0);
            if (StringUtils.isEmpty(value)) {
                node.delete();
            } else {
                node.setText(value);
            }
        } else {
            nodes.forEach(EpubElement::delete);
            if (StringUtils.isNotEmpty(value)) {
                EpubElement node = metadata.newChild(element, value);
                if (attribute != null && !values.isEmpty()) {
                    node.setAttribute(attribute, values.get(0));
                }
            }
        }
        packageDocument.resync();
    }

    public String getUniqueIdentifier() {
        String id = uniqueIdentifierId();
        return StringUtils.isEmpty(id) ? "" : getSingleton(IDENTIFIER, "id", List.of(id), false);
    }

    /**
     * Set the identifier the package document declares as its unique identifier. Does nothing if the package
     * document does not declare one.
     */
    public void setUniqueIdentifier(String value) {
        String id = uniqueIdentifierId();
        if (StringUtils.isEmpty(id)) {
            log.warn("Package document {} declares no unique identifier", packageDocument.getPath());
            return;
        }
        setSingleton(IDENTIFIER, value, "id", List.of(id), false);
    }

    public String getIdentifier(IdentifierScheme scheme) {
        return getSingleton(IDENTIFIER, SCHEME, scheme.getSpellings(), true);
    }

    public void setIdentifier(IdentifierScheme scheme, String value) {
        setSingleton(IDENTIFIER, value, SCHEME, scheme.getSpellings(), true);
    }

    public String getIdentifier(String scheme) {
        return getSingleton(IDENTIFIER, SCHEME, List.of(scheme), true);
    }

    public void setIdentifier(String scheme, String value) {
        setSingleton(IDENTIFIER, value, SCHEME, List.of(scheme), true);
    }

    /**
     * Authors mapped from their sort key ("file as") to their display name.
     * <p>
     * If no creator has the author role, all creators are taken as authors and the document is updated to say so.
     * Missing sort keys are filled in with the display name.
     */
    public Map<String, String> getAuthors() {
        boolean roleFix = false;
        List<EpubElement> nodes = packageDocument.query(authorQuery());
        if (nodes.isEmpty()) {
            nodes = packageDocument.query(METADATA_PATH + CREATOR);
            roleFix = !nodes.isEmpty();
        }

        boolean modified = roleFix;
        Map<String, String> authors = new LinkedHashMap<>();
        for (EpubElement node : nodes) {
            String name = node.getText();
            String fileAs = node.getAttribute(FILE_AS);
            if (StringUtils.isEmpty(fileAs)) {
                fileAs = name;
                node.setAttribute(FILE_AS, fileAs);
                modified = true;
            }
            if (roleFix) {
                node.setAttribute(ROLE, AUTHOR_ROLE);
            }
            authors.put(fileAs, name);
        }
        if (modified) {
            packageDocument.resync();
        }
        return authors;
    }

    /**
     * Replace all authors. Sort keys are kept as given.
     */
    public void setAuthors(Map<String, String> authors) {
        EpubElement metadata = packageDocument.requireMetadata();
        packageDocument.query(authorQuery()).forEach(EpubElement::delete);
        authors.forEach((fileAs, name) -> {
            EpubElement node = metadata.newChild(CREATOR, name);
            node.setAttribute(ROLE, AUTHOR_ROLE);
            node.setAttribute(FILE_AS, fileAs);
        });
        packageDocument.resync();
    }

    /**
     * Replace all authors, using the names as their own sort keys.
     */
    public void setAuthors(List<String> names) {
        Map<String, String> authors = new LinkedHashMap<>();
        names.forEach(name -> authors.put(name, name));
        setAuthors(authors);
    }

    /**
     * Replace all authors by a comma separated list of names. An empty string removes all authors.
     */
    public void setAuthors(String names) {
        setAuthors(splitList(names));
    }

    public List<String> getSubjects() {
        return packageDocument.query(METADATA_PATH + SUBJECT).stream()
                .map(EpubElement::getText)
                .collect(Collectors.toList());
    }

    public void setSubjects(List<String> subjects) {
        EpubElement metadata = packageDocument.requireMetadata();
        packageDocument.query(METADATA_PATH + SUBJECT).forEach(EpubElement::delete);
        subjects.forEach(subject -> metadata.newChild(SUBJECT, subject));
        packageDocument.resync();
    }

    /**
     * Replace all subjects by a comma separated list. An empty string removes all subjects.
     */
    public void setSubjects(String subjects) {
        setSubjects(splitList(subjects));
    }

    private String uniqueIdentifierId() {
        return packageDocument.getRoot().getAttribute("unique-identifier");
    }

    private static String authorQuery() {
        return METADATA_PATH + CREATOR + "[@" + ROLE + "='" + AUTHOR_ROLE + "']";
    }

    private static List<String> splitList(String list) {
        if (StringUtils.isEmpty(list)) {
            return new ArrayList<>();
        }
        return Arrays.stream(list.split(","))
                .map(String::trim)
                .collect(Collectors.toList());
    }

    /**
     * Query for metadata elements with the given name. Attribute values are bound as variables. In case insensitive
     * mode the attribute is folded to lower case with {@code translate()} and compared to lower cased values.
     */
    static String buildQuery(String element, String attribute, List<String> values, boolean caseInsensitive,
                             Map<String, String> bindings) {
        StringBuilder query = new StringBuilder(METADATA_PATH).append(element);
        if (attribute == null || values.isEmpty()) {
            return query.toString();
        }
        String operand = "@" + attribute;
        if (caseInsensitive) {
            operand = "translate(" + operand + ", $upper, $lower)";
            bindings.put("upper", UPPER_CASE);
            bindings.put("lower", LOWER_CASE);
        }
        query.append('[');
        for (int i = 0; i < values.size(); i++) {
            String value = values.get(i);
            bindings.put("v" + i, caseInsensitive ? value.toLowerCase(Locale.ROOT) : value);
            if (i > 0) {
                query.append(" or ");
            }
            query.append(operand).append("=$v").append(i);
        }
        return query.append(']').toString();
    }
}
