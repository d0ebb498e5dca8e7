package org.netpreserve.sweeper.browser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SelectorSpecTest {
    @Test
    public void testParseText() {
        var spec = SelectorSpec.parse("[data-e2e='user-subtitle']");
        assertEquals("[data-e2e='user-subtitle']", spec.css());
        assertNull(spec.attribute());
        assertTrue(spec.readsText());
    }

    @Test
    public void testParseAttribute() {
        var spec = SelectorSpec.parse("a[href*='/@'] @href");
        assertEquals("a[href*='/@']", spec.css());
        assertEquals("href", spec.attribute());
        assertEquals("a[href*='/@'] @href", spec.toString());
    }

    @Test
    public void testAtSignInsideSelectorIsNotAnAttribute() {
        var spec = SelectorSpec.parse("a[href*='/@user']");
        assertEquals("a[href*='/@user']", spec.css());
        assertNull(spec.attribute());
    }

    @Test
    public void testBlankRejected() {
        assertThrows(IllegalArgumentException.class, () -> SelectorSpec.parse("   "));
    }
}
