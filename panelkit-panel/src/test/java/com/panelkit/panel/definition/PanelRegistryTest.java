package com.panelkit.panel.definition;

import com.panelkit.panel.testing.TestPanel;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PanelRegistryTest {

    private final PanelRegistry registry = new PanelRegistry();

    @Test
    void register_thenGet_returnsPanel() {
        TestPanel panel = new TestPanel("status");
        registry.register(panel);

        assertSame(panel, registry.get("status").orElseThrow());
        assertTrue(registry.get("missing").isEmpty());
        assertTrue(registry.get(null).isEmpty());
    }

    @Test
    void register_blankId_throws() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(new TestPanel(" ")));
        assertThrows(IllegalArgumentException.class, () -> registry.register(null));
    }

    @Test
    void register_uniqueButNotPersistent_throws() {
        assertThrows(IllegalArgumentException.class,
                () -> registry.register(new TestPanel("u").unique(true)));
        assertEquals(0, registry.size());
    }

    @Test
    void register_sameId_overwrites() {
        registry.register(new TestPanel("a"));
        TestPanel second = new TestPanel("a").name("Second");
        registry.register(second);

        assertEquals(1, registry.size());
        assertSame(second, registry.get("a").orElseThrow());
    }

    @Test
    void register_initializeFailure_keepsPanel() {
        AtomicInteger initCalls = new AtomicInteger();
        registry.register(new TestPanel("boom") {
            @Override
            public void initialize() {
                initCalls.incrementAndGet();
                throw new IllegalStateException("init failed");
            }
        });

        assertEquals(1, initCalls.get());
        assertTrue(registry.get("boom").isPresent());
    }
}
