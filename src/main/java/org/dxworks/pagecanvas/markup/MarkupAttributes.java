package org.dxworks.pagecanvas.markup;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads attribute values out of raw markup without building a DOM.
 */
public final class MarkupAttributes {

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    private MarkupAttributes() {}

    /**
     * Returns the value of the first {@code name="value"} attribute in {@code html}, or null when
     * the attribute does not occur. Values are returned as written, entities included.
     */
    public static String get(String html, String attributeName) {
        if (html == null || attributeName == null) return null;
        Matcher matcher = patternFor(attributeName).matcher(html);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static Pattern patternFor(String attributeName) {
        return PATTERNS.computeIfAbsent(attributeName, name -> Pattern.compile(
                "\\b" + Pattern.quote(name) + "=\"([^\"]*)\"", Pattern.CASE_INSENSITIVE));
    }
}
