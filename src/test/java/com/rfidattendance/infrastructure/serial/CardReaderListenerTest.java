package com.rfidattendance.infrastructure.serial;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the line parsing of CardReaderListener.
 */
class CardReaderListenerTest {

    @Test
    @DisplayName("Should read a bare line of digits")
    void testBareDigits() {
        assertEquals(Optional.of("0001234567"), CardReaderListener.extractToken("0001234567"));
        assertEquals(Optional.of("0001234567"), CardReaderListener.extractToken("  0001234567 \r"));
    }

    @Test
    @DisplayName("Should strip a label prefix")
    void testLabelledLine() {
        assertEquals(Optional.of("0001234567"), CardReaderListener.extractToken("UID: 0001234567"));
        assertEquals(Optional.of("42"), CardReaderListener.extractToken("card:42"));
    }

    @Test
    @DisplayName("Should ignore lines that are not card reads")
    void testIgnoredLines() {
        assertTrue(CardReaderListener.extractToken(null).isEmpty());
        assertTrue(CardReaderListener.extractToken("").isEmpty());
        assertTrue(CardReaderListener.extractToken("READY").isEmpty());
        assertTrue(CardReaderListener.extractToken("UID: 12AB34").isEmpty());
        assertTrue(CardReaderListener.extractToken("12 34").isEmpty());
    }
}
