package com.di.moduleflow.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SessionConf Tests")
class SessionConfTest {

    @Test
    @DisplayName("Should restore to a snapshot, dropping keys set since")
    void testRestore() {
        SessionConf conf = new SessionConf(Map.of("a", "1"));
        Map<String, String> before = conf.snapshot();

        conf.set("a", "2");
        conf.set("b", "3");
        conf.restore(before);

        assertEquals(Map.of("a", "1"), conf.snapshot());
    }

    @Test
    @DisplayName("Should parse integers and fall back to the default")
    void testGetInt() {
        SessionConf conf = new SessionConf(Map.of("n", " 42 ", "bad", "x"));
        assertEquals(42, conf.getInt("n", 0));
        assertEquals(7, conf.getInt("missing", 7));
        assertThrows(IllegalStateException.class, () -> conf.getInt("bad", 0));
    }

    @Test
    @DisplayName("Should return an unmodifiable snapshot")
    void testSnapshot_Unmodifiable() {
        SessionConf conf = new SessionConf(Map.of());
        assertThrows(UnsupportedOperationException.class, () -> conf.snapshot().put("k", "v"));
    }
}
