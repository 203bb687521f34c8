package com.di.moduleflow.dataset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ColumnType Tests")
class ColumnTypeTest {

    @Test
    @DisplayName("Should widen integral values into LONG")
    void testAccepts_Long() {
        assertTrue(ColumnType.LONG.accepts(1));
        assertTrue(ColumnType.LONG.accepts(1L));
        assertFalse(ColumnType.LONG.accepts(1.5));
        assertFalse(ColumnType.INTEGER.accepts(1L));
    }

    @Test
    @DisplayName("Should match temporal and catch-all types")
    void testAccepts_Others() {
        assertTrue(ColumnType.DATE.accepts(LocalDate.of(2024, 1, 1)));
        assertFalse(ColumnType.DATE.accepts(Instant.EPOCH));
        assertTrue(ColumnType.TIMESTAMP.accepts(Instant.EPOCH));
        assertTrue(ColumnType.DOUBLE.accepts(3));
        assertTrue(ColumnType.ANY.accepts(new Object()));
        assertTrue(ColumnType.STRING.accepts(null));
    }
}
