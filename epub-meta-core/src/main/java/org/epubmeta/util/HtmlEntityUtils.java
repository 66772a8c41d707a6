package org.epubmeta.util;

import lombok.experimental.UtilityClass;
import org.jsoup.nodes.Entities;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@UtilityClass
public class HtmlEntityUtils {

    private static final Pattern NAMED_ENTITY_PATTERN = Pattern.compile("&([A-Za-z][A-Za-z0-9]*);");
    private static final Set<String> XML_ENTITIES = Set.of("amp", "lt", "gt", "quot", "apos");

    /**
     * Replace named HTML entities like {@code &nbsp;} by numeric character references, since a strict XML
     * parser only knows the five XML entities. Unknown names are left alone.
     */
    public static String convertNamedToNumeric(String html) {
        if (html == null || html.indexOf('&') < 0) {
            return html;
        }
        Matcher matcher = NAMED_ENTITY_PATTERN.matcher(html);
        StringBuilder sb = new StringBuilder(html.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = matcher.group();
            if (!XML_ENTITIES.contains(name) && Entities.isNamedEntity(name)) {
                replacement = toNumericReferences(Entities.getByName(name));
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String toNumericReferences(String characters) {
        StringBuilder sb = new StringBuilder();
        characters.codePoints().forEach(cp -> sb.append("&#").append(cp).append(';'));
        return sb.toString();
    }
}
