package com.williamcallahan.codelab.service.markdown;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FlexmarkMarkupRendererTest {

    private final FlexmarkMarkupRenderer renderer = new FlexmarkMarkupRenderer();

    @Test
    @DisplayName("Should tag fenced code with its language class")
    void testFencedCodeLanguage() {
        String html = renderer.render("```java\nint x = 1;\n```");

        assertTrue(html.contains("<code class=\"language-java\">"), "Should carry language class");
    }

    @Test
    @DisplayName("Should pass raw HTML through unescaped")
    void testRawHtmlPassThrough() {
        String html = renderer.render("<button><a href=\"https://example.com\">Go</a></button>");

        assertTrue(html.contains("<button><a href=\"https://example.com\">Go</a></button>"), "Should keep raw HTML");
    }

    @Test
    @DisplayName("Should render definition lists used for infoboxes")
    void testDefinitionList() {
        String html = renderer.render("Positive\n: Keep going.");

        assertTrue(html.contains("<dt>Positive</dt>"), "Should contain definition term");
        assertTrue(html.contains("<dd>"), "Should contain definition");
    }

    @Test
    @DisplayName("Should render pipe tables")
    void testTables() {
        String html = renderer.render("| a | b |\n|---|---|\n| 1 | 2 |");

        assertTrue(html.contains("<table>"), "Should contain table");
        assertTrue(html.contains("<td>1</td>"), "Should contain body cell");
    }

    @Test
    @DisplayName("Should render nothing for null input")
    void testNullInput() {
        assertEquals("", renderer.render(null));
    }
}
