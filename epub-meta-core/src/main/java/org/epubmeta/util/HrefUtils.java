package org.epubmeta.util;

import lombok.experimental.UtilityClass;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@UtilityClass
public class HrefUtils {

    private static final Pattern PERCENT_ESCAPES = Pattern.compile("(?:%[0-9A-Fa-f]{2})+");

    /**
     * Decode the percent-escaped octets of an href as UTF-8. A {@code %} not followed by two hex digits and
     * {@code +} are taken literally, as hrefs in EPUBs are often written unescaped.
     */
    public static String decode(String href) {
        if (href == null || href.indexOf('%') < 0) {
            return href;
        }
        Matcher matcher = PERCENT_ESCAPES.matcher(href);
        StringBuilder sb = new StringBuilder(href.length());
        while (matcher.find()) {
            String decoded = URLDecoder.decode(matcher.group(), StandardCharsets.UTF_8);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(decoded));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
