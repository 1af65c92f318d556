package com.williamcallahan.codelab.domain.codelab;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.codelab.domain.codelab.node.TextNode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Verifies document and step invariants.
 */
class CodelabTest {

    @Test
    @DisplayName("Should keep tags case-folded, sorted and unique")
    void testTagsNormalized() {
        Codelab codelab = new Codelab();
        Step step = codelab.newStep("Set Up");

        codelab.addTags(List.of("Web", "ios", "web "));
        step.addTags(List.of("iOS", "android"));

        assertEquals(List.of("ios", "web"), List.copyOf(codelab.getTags()));
        assertEquals(List.of("android", "ios"), List.copyOf(step.getTags()));
    }

    @Test
    @DisplayName("Should expose the slug of a step title")
    void testStepSlug() {
        assertEquals("what-s-next", new Step("What's next?").getSlug());
    }

    @Test
    @DisplayName("Should freeze steps with their document")
    void testFreezePropagates() {
        Codelab codelab = new Codelab();
        Step step = codelab.newStep("One");

        codelab.freeze();

        assertTrue(step.isFrozen());
        assertThrows(IllegalStateException.class, () -> step.append(new TextNode("late")));
        assertThrows(IllegalStateException.class, () -> codelab.setTitle("Renamed"));
        assertThrows(UnsupportedOperationException.class, () -> codelab.getSteps().clear());
    }

    @Test
    @DisplayName("Should case-fold pass-through keys")
    void testParseOptionsCaseFold() {
        ParseOptions options = ParseOptions.passing(List.of(" Product ", ""));

        assertTrue(options.passes("product"));
        assertEquals(1, options.passMetadata().size());
    }
}
