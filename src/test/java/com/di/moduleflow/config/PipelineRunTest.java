package com.di.moduleflow.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineRun Tests")
class PipelineRunTest {

    @Test
    @DisplayName("Should snap at the clock instant with a fresh run id")
    void testStart() {
        Instant now = Instant.parse("2024-03-01T00:00:00Z");
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);

        PipelineRun first = PipelineRun.start(clock);
        PipelineRun second = PipelineRun.start(clock);

        assertEquals(now, first.snapTime());
        assertNotEquals(first.runId(), second.runId());
    }
}
