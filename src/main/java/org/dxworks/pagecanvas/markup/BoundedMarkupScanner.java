package org.dxworks.pagecanvas.markup;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds blocks of markup that start at a boundary pattern (typically a tag carrying a marker
 * attribute) and end at the closing tag that balances it, even when tags of the same kind are
 * nested in between.
 *
 * The scanner knows nothing about pages. Each caller supplies a collector that turns the raw
 * text of a block into whatever it needs.
 */
public final class BoundedMarkupScanner {

    public static final String DEFAULT_TAG_NAME = "div";
    public static final int DEFAULT_MAX_DEPTH = 1000;

    private static final Pattern INSIGNIFICANT_WHITESPACE = Pattern.compile("[\\t\\r\\n]");

    private final String tagName;
    private final int maxDepth;
    // group(1) is "/" for a closing tag
    private final Pattern tagPattern;
    private final Pattern leadingTagPattern;
    private final Pattern trailingCloseTagPattern;

    public BoundedMarkupScanner() {
        this(DEFAULT_TAG_NAME, DEFAULT_MAX_DEPTH);
    }

    public BoundedMarkupScanner(int maxDepth) {
        this(DEFAULT_TAG_NAME, maxDepth);
    }

    public BoundedMarkupScanner(String tagName, int maxDepth) {
        Objects.requireNonNull(tagName, "tagName");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.tagName = tagName.toLowerCase(Locale.ROOT);
        this.maxDepth = maxDepth;

        String quoted = Pattern.quote(this.tagName);
        this.tagPattern = Pattern.compile("<(/?)" + quoted + "\\b[^>]*>", Pattern.CASE_INSENSITIVE);
        this.leadingTagPattern = Pattern.compile("^<" + quoted + "\\b[^>]*>", Pattern.CASE_INSENSITIVE);
        this.trailingCloseTagPattern = Pattern.compile("</" + quoted + "\\s*>$", Pattern.CASE_INSENSITIVE);
    }

    public String getTagName() {
        return tagName;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Returns every balanced block starting at {@code boundaryStart}, in document order.
     * Blocks never overlap: the search for the next one resumes after the closing tag of the
     * previous one.
     *
     * @throws MalformedMarkupException if a block is never closed or nests deeper than the limit
     */
    public <T> List<T> scan(String html, Pattern boundaryStart, Function<String, T> collector) {
        return collect(html, boundaryStart, collector, Integer.MAX_VALUE);
    }

    /**
     * Returns the first balanced block starting at {@code boundaryStart}, if any.
     */
    public <T> Optional<T> scanFirst(String html, Pattern boundaryStart, Function<String, T> collector) {
        List<T> blocks = collect(html, boundaryStart, collector, 1);
        return blocks.isEmpty() ? Optional.empty() : Optional.ofNullable(blocks.get(0));
    }

    /**
     * Strips the opening tag and the final closing tag from a block returned by {@link #scan}.
     */
    public String innerMarkup(String block) {
        if (block == null) return "";
        String withoutOpen = leadingTagPattern.matcher(block).replaceFirst("");
        return trailingCloseTagPattern.matcher(withoutOpen).replaceFirst("");
    }

    private <T> List<T> collect(String html, Pattern boundaryStart, Function<String, T> collector, int limit) {
        Objects.requireNonNull(boundaryStart, "boundaryStart");
        Objects.requireNonNull(collector, "collector");

        List<T> blocks = new ArrayList<>();
        if (html == null || html.isEmpty()) {
            return blocks;
        }

        String cleaned = INSIGNIFICANT_WHITESPACE.matcher(html).replaceAll("");
        Matcher boundary = boundaryStart.matcher(cleaned);
        Matcher tags = tagPattern.matcher(cleaned);

        int searchFrom = 0;
        while (blocks.size() < limit && searchFrom < cleaned.length() && boundary.find(searchFrom)) {
            int start = boundary.start();
            int end = findBlockEnd(cleaned, tags, start);
            blocks.add(collector.apply(cleaned.substring(start, end).trim()));
            searchFrom = end;
        }

        return blocks;
    }

    /**
     * Returns the offset just past the closing tag balancing the opening tag at {@code start}.
     */
    private int findBlockEnd(String markup, Matcher tags, int start) {
        // the opening tag at start is the one we are balancing
        int depth = 1;
        int searchFrom = start + 1;

        while (tags.find(searchFrom)) {
            boolean closing = !tags.group(1).isEmpty();
            if (closing) {
                depth--;
            } else if (!tags.group().endsWith("/>")) {
                depth++;
            }
            searchFrom = tags.end();

            if (depth == 0) {
                return tags.end();
            }
            if (depth > maxDepth) {
                throw new MalformedMarkupException("Nesting of <" + tagName + "> exceeded " + maxDepth
                        + " levels in block starting at offset " + start);
            }
        }

        throw new MalformedMarkupException("Unterminated <" + tagName + "> block starting at offset " + start
                + " (" + preview(markup, start) + ")");
    }

    private static String preview(String markup, int start) {
        int end = Math.min(markup.length(), start + 60);
        return markup.substring(start, end);
    }
}
