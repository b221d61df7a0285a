package org.dxworks.pagecanvas.markup;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class BoundedMarkupScannerTest {

    private static final Pattern MARKED = Pattern.compile("<div\\b[^>]*data-m[^>]*?>", Pattern.CASE_INSENSITIVE);

    private final BoundedMarkupScanner scanner = new BoundedMarkupScanner();

    @Test
    void returnsNothingForNullOrEmptyInput() {
        assertTrue(scanner.scan(null, MARKED, Function.identity()).isEmpty());
        assertTrue(scanner.scan("", MARKED, Function.identity()).isEmpty());
    }

    @Test
    void returnsNothingWhenBoundaryDoesNotOccur() {
        assertTrue(scanner.scan("<div><p>plain</p></div>", MARKED, Function.identity()).isEmpty());
    }

    @Test
    void balancesNestedDivsOfTheSameKind() {
        String html = "<div data-m=\"1\"><div><div>x</div></div><div>y</div></div><div>after</div>";

        List<String> blocks = scanner.scan(html, MARKED, Function.identity());

        assertEquals(List.of("<div data-m=\"1\"><div><div>x</div></div><div>y</div></div>"), blocks);
    }

    @Test
    void handlesHundredsOfNestingLevels() {
        int levels = 600;
        String html = "<div data-m=\"\">" + "<div>".repeat(levels) + "deep" + "</div>".repeat(levels) + "</div>";

        List<String> blocks = scanner.scan(html, MARKED, Function.identity());

        assertEquals(1, blocks.size());
        assertEquals(html, blocks.get(0));
    }

    @Test
    void returnsDisjointBlocksInDocumentOrder() {
        String html = "<div data-m=\"a\">A</div><p>between</p><div data-m=\"b\"><div>B</div></div>";

        List<String> blocks = scanner.scan(html, MARKED, Function.identity());

        assertEquals(List.of("<div data-m=\"a\">A</div>", "<div data-m=\"b\"><div>B</div></div>"), blocks);
    }

    @Test
    void resumesSearchAfterTheClosingTagOfTheOuterBlock() {
        String html = "<div data-m=\"outer\"><div data-m=\"inner\">x</div></div>";

        List<String> blocks = scanner.scan(html, MARKED, Function.identity());

        assertEquals(List.of(html), blocks);
    }

    @Test
    void stripsTabsAndLineBreaksBeforeScanning() {
        String html = "<div data-m=\"1\">\n\t<span>a</span>\r\n</div>";

        List<String> blocks = scanner.scan(html, MARKED, Function.identity());

        assertEquals(List.of("<div data-m=\"1\"><span>a</span></div>"), blocks);
    }

    @Test
    void treatsSelfClosingTagsAsNeutral() {
        String html = "<div data-m=\"1\"><div/>x</div><div>tail</div>";

        List<String> blocks = scanner.scan(html, MARKED, Function.identity());

        assertEquals(List.of("<div data-m=\"1\"><div/>x</div>"), blocks);
    }

    @Test
    void appliesTheCollectorToEveryBlock() {
        String html = "<div data-m=\"1\">one</div><div data-m=\"2\">two</div>";

        List<String> inner = scanner.scan(html, MARKED, scanner::innerMarkup);

        assertEquals(List.of("one", "two"), inner);
    }

    @Test
    void failsOnUnterminatedBlock() {
        String html = "<div data-m=\"1\"><div>never closed</div>";

        assertThrows(MalformedMarkupException.class, () -> scanner.scan(html, MARKED, Function.identity()));
    }

    @Test
    void failsWhenNestingExceedsTheLimit() {
        BoundedMarkupScanner shallow = new BoundedMarkupScanner(5);
        String html = "<div data-m=\"\">" + "<div>".repeat(10) + "</div>".repeat(10) + "</div>";

        MalformedMarkupException e = assertThrows(MalformedMarkupException.class,
                () -> shallow.scan(html, MARKED, Function.identity()));
        assertTrue(e.getMessage().contains("exceeded 5 levels"));
    }

    @Test
    void acceptsNestingUpToTheLimit() {
        BoundedMarkupScanner shallow = new BoundedMarkupScanner(5);
        String html = "<div data-m=\"\">" + "<div>".repeat(4) + "</div>".repeat(4) + "</div>";

        assertEquals(1, shallow.scan(html, MARKED, Function.identity()).size());
    }

    @Test
    void scanFirstStopsAtTheFirstBlock() {
        String html = "<div data-m=\"1\">one</div><div data-m=\"2\">two</div>";

        Optional<String> first = scanner.scanFirst(html, MARKED, scanner::innerMarkup);

        assertEquals(Optional.of("one"), first);
        assertEquals(Optional.empty(), scanner.scanFirst("<p>none</p>", MARKED, scanner::innerMarkup));
    }

    @Test
    void innerMarkupStripsOnlyTheOuterTags() {
        assertEquals("<div>x</div>", scanner.innerMarkup("<div data-m=\"1\"><div>x</div></div>"));
        assertEquals("", scanner.innerMarkup("<div data-m=\"1\"></div>"));
        assertEquals("", scanner.innerMarkup(null));
    }

    @Test
    void rejectsNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedMarkupScanner(0));
    }

    @Test
    void scansOtherTagNames() {
        BoundedMarkupScanner sections = new BoundedMarkupScanner("section", 10);
        Pattern boundary = Pattern.compile("<section\\b[^>]*data-m[^>]*?>");
        String html = "<section data-m=\"\"><section>x</section><div>y</div></section>";

        assertEquals(List.of(html), sections.scan(html, boundary, Function.identity()));
        assertEquals("section", sections.getTagName());
    }
}
