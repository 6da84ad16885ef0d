package me.golemcore.engine.domain.citation;

import me.golemcore.engine.domain.model.SourceCatalogEntry;
import me.golemcore.engine.domain.model.SourceReference;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CitationProcessorTest {

    private static final String BLOCK_OPEN = "\n\n<br/>\n<details><summary class=\"engine-sources__summary\">Sources</summary>\n"
            + "<ul class=\"engine-sources__list\">\n";
    private static final String BLOCK_CLOSE = "</ul>\n</details>";

    private final CitationProcessor processor = new CitationProcessor();

    private static String item(int index, String text) {
        return "<li class=\"engine-sources__item\"><span class=\"engine-sources__index\">[" + index
                + "]</span><span class=\"engine-sources__text\">" + text + "</span></li>\n";
    }

    @Test
    void shouldRenumberFootnotesByFirstMention() {
        String content = "Cats purr [^9] while dogs bark [^1]\n\n#### Sources:\n\n[^1]: [[A]]\n[^9]: [[B]]";

        String result = processor.processInlineCitations(content, true);

        assertEquals("Cats purr [1] while dogs bark [2]" + BLOCK_OPEN + item(1, "[[B]]") + item(2, "[[A]]")
                + BLOCK_CLOSE, result);
    }

    @Test
    void shouldNumberHighFootnotesFromOne() {
        String content = "First [^7] then [^8]\n\n## Sources\n[^7]: [[Seven]]\n[^8]: [[Eight]]";

        String result = processor.processInlineCitations(content, true);

        assertTrue(result.startsWith("First [1] then [2]"));
        assertTrue(result.contains(item(1, "[[Seven]]") + item(2, "[[Eight]]")));
    }

    @Test
    void shouldRenumberAdjacentFootnotesWithoutSeparator() {
        String content = "text [^7][^8]\n\n#### Sources:\n[^7]: [[Seven]]\n[^8]: [[Eight]]";

        String result = processor.processInlineCitations(content, true);

        assertEquals("text [1][2]" + BLOCK_OPEN + item(1, "[[Seven]]") + item(2, "[[Eight]]") + BLOCK_CLOSE,
                result);
    }

    @Test
    void shouldCollapseAdjacentMarkersMergedIntoOneSource() {
        String content = "a [^1][^2]\n\n#### Sources:\n[^1]: [[A]]\n[^2]: [[A]]";

        String result = processor.processInlineCitations(content, true);

        assertEquals("a [1]" + BLOCK_OPEN + item(1, "[[A]]") + BLOCK_CLOSE, result);
    }

    @Test
    void shouldNumberUndefinedFootnoteWithoutSourceRow() {
        String content = "a [^1] b [^5]\n\n#### Sources:\n[^1]: [[A]]";

        String result = processor.processInlineCitations(content, true);

        assertEquals("a [1] b [2]" + BLOCK_OPEN + item(1, "[[A]]") + BLOCK_CLOSE, result);
    }

    @Test
    void shouldSortAndDeduplicateGroupedMarkers() {
        String content = "Claim [^2, ^1, ^2]\n\nSources:\n[^1]: [[A]]\n[^2]: [[B]]";

        String result = processor.processInlineCitations(content, true);

        assertTrue(result.startsWith("Claim [1, 2]"));
        assertTrue(result.contains(item(1, "[[B]]") + item(2, "[[A]]")));
    }

    @Test
    void shouldDropPeriodDirectlyAfterMarker() {
        String content = "The study found X [^1].\n\nSources:\n[^1]: [[Study]]";

        String result = processor.processInlineCitations(content, true);

        assertTrue(result.startsWith("The study found X [1]" + BLOCK_OPEN));
    }

    @Test
    void shouldMergeDuplicateSourcesByTitle() {
        String content = "X [^1] and Y [^2]\n\n#### Sources:\n[^1]: [[Note]]\n[^2]: [[note]]";

        String result = processor.processInlineCitations(content, true);

        assertEquals("X [1] and Y [1]" + BLOCK_OPEN + item(1, "[[Note]]") + BLOCK_CLOSE, result);
    }

    @Test
    void shouldRenumberOnlyDefinedNumericMarkers() {
        String content = "Value is 42 [2] and [7]\n\nSources:\n[^2]: [Site](https://example.com)";

        String result = processor.processInlineCitations(content, true);

        assertEquals("Value is 42 [1] and [7]" + BLOCK_OPEN + item(1, "[Site](https://example.com)")
                + BLOCK_CLOSE, result);
    }

    @Test
    void shouldLeaveMarkdownLinksUntouched() {
        String content = "See [1](https://a.example) and [^1]\n\nSources:\n[^1]: [[A]]";

        String result = processor.processInlineCitations(content, true);

        assertTrue(result.startsWith("See [1](https://a.example) and [1]"));
    }

    @Test
    void shouldSplitSingleLineSourcesBlock() {
        String content = "A [^1] B [^2]\n\n#### Sources:\n[^1]: [[A]] [^2]: [[B]]";

        String result = processor.processInlineCitations(content, true);

        assertTrue(result.contains(item(1, "[[A]]") + item(2, "[[B]]")));
    }

    @Test
    void shouldMoveDefinitionsFromBodyIntoSourcesBlock() {
        String content = "A [^1]\n[^1]: [[Moved]]\n\nSources:";

        String result = processor.processInlineCitations(content, true);

        assertEquals("A [1]" + BLOCK_OPEN + item(1, "[[Moved]]") + BLOCK_CLOSE, result);
    }

    @Test
    void shouldTreatBareDefinitionsAsSourcesBlock() {
        String content = "Fact [^3]\n\n[^3]: [[Only]]";

        String result = processor.processInlineCitations(content, true);

        assertEquals("Fact [1]" + BLOCK_OPEN + item(1, "[[Only]]") + BLOCK_CLOSE, result);
    }

    @Test
    void shouldRenderPlainListWhenBlockHasNoDefinitions() {
        String content = "Answer\n\nSources:\n- [[A]]\n- [[B]]";

        String result = processor.processInlineCitations(content, true);

        assertEquals("Answer" + BLOCK_OPEN + item(1, "[[A]]") + item(2, "[[B]]") + BLOCK_CLOSE, result);
    }

    @Test
    void shouldBeIdempotent() {
        String content = "Cats [^2] dogs [^1]\n\n#### Sources:\n[^1]: [[A]]\n[^2]: [[B]]";

        String once = processor.processInlineCitations(content, true);
        String twice = processor.processInlineCitations(once, true);

        assertEquals(once, twice);
    }

    @Test
    void shouldReturnContentUnchangedWhenDisabledOrWithoutSources() {
        String withSources = "A [^1]\n\nSources:\n[^1]: [[A]]";
        String plain = "No citations here [1].";

        assertSame(withSources, processor.processInlineCitations(withSources, false));
        assertSame(plain, processor.processInlineCitations(plain, true));
        assertNull(processor.processInlineCitations(null, true));
    }

    @Test
    void shouldAppendFallbackSources() {
        List<SourceReference> sources = List.of(
                new SourceReference("A", "a.md", 0.9),
                new SourceReference("", "b.md", 0.5),
                new SourceReference(null, null, 0.1));

        String result = processor.addFallbackSources("Answer", sources, true);

        assertEquals("Answer\n\n#### Sources:\n\n[^1]: [[A]]\n[^2]: [[b.md]]\n[^3]: [[Untitled]]", result);
    }

    @Test
    void shouldCapFallbackSources() {
        CitationProcessor capped = new CitationProcessor(1);
        List<SourceReference> sources = List.of(
                new SourceReference("A", "a.md", 0.9),
                new SourceReference("B", "b.md", 0.5));

        assertEquals("Answer\n\n#### Sources:\n\n[^1]: [[A]]", capped.addFallbackSources("Answer", sources, true));
    }

    @Test
    void shouldSkipFallbackSourcesWhenAnswerAlreadyCites() {
        List<SourceReference> sources = List.of(new SourceReference("A", "a.md", 0.9));
        String cited = "Answer [^1]\n[^1]: [[A]]";
        String rendered = "Answer\n<details><summary class=\"x\">Sources</summary></details>";

        assertEquals(cited, processor.addFallbackSources(cited, sources, true));
        assertEquals(rendered, processor.addFallbackSources(rendered, sources, true));
        assertEquals("Answer", processor.addFallbackSources("Answer", sources, false));
        assertEquals("Answer", processor.addFallbackSources("Answer", List.of(), true));
        assertEquals("", processor.addFallbackSources(null, sources, true));
    }

    @Test
    void shouldDetectExistingCitations() {
        assertTrue(processor.hasExistingCitations("text\n\n## Sources\n- a"));
        assertTrue(processor.hasExistingCitations("text\n[^2]: [[B]]"));
        assertFalse(processor.hasExistingCitations("text with [1] only"));
        assertFalse(processor.hasExistingCitations(null));
    }

    @Test
    void shouldSanitizeRetrievedContent() {
        String text = "Fact [1] and [^2] see [link](http://x) [3](http://y)\n[^2]: definition\nend";

        String result = processor.sanitizeContentForCitations(text);

        assertEquals("Fact  and  see [link](http://x) [3](http://y)\n\nend", result);
        assertEquals("", processor.sanitizeContentForCitations(null));
    }

    @Test
    void shouldFormatSourceCatalogWithFallbacks() {
        List<String> lines = processor.formatSourceCatalog(List.of(
                new SourceCatalogEntry("A", "a.md"),
                new SourceCatalogEntry("", "b.md"),
                new SourceCatalogEntry(null, null)));

        assertEquals(List.of("- [[A]] (a.md)", "- [[b.md]] (b.md)", "- [[Untitled]] (Untitled)"), lines);
    }

    @Test
    void shouldBuildGuidanceOnlyWhenEnabled() {
        String guidance = processor.citationGuidance(true, List.of("- [[A]] (a.md)"));

        assertTrue(guidance.startsWith("\n\n<guidance>\nCITATION RULES:"));
        assertTrue(guidance.endsWith("Source Catalog (for reference only):\n- [[A]] (a.md)\n</guidance>"));
        assertEquals("", processor.citationGuidance(false, List.of("- [[A]] (a.md)")));
    }

    @Test
    void shouldExtractDisplayFromDefinitionText() {
        assertEquals("[Doc](https://d.example)",
                CitationProcessor.toSourceItem("see [Doc](https://d.example) here").display());
        assertEquals("[[Note]]", CitationProcessor.toSourceItem("[[Note]] (notes/Note.md)").display());
        assertEquals("Plain title", CitationProcessor.toSourceItem("Plain title (p. 4)").display());
    }
}
