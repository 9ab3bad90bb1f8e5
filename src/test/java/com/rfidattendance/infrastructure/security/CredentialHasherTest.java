package com.rfidattendance.infrastructure.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CredentialHasher.
 */
class CredentialHasherTest {

    private final CredentialHasher hasher = new CredentialHasher(1000);

    @Test
    @DisplayName("Should produce iterations$salt$hash with a fresh salt each time")
    void testHashFormat() {
        String first = hasher.hash("secret");
        String second = hasher.hash("secret");

        assertTrue(first.matches("1000\\$[0-9a-f]{32}\\$[0-9a-f]{64}"), first);
        assertFalse(hasher.needsRehash(first));
        assertNotEquals(first, second);
        assertTrue(hasher.matches("secret", first));
        assertTrue(hasher.matches("secret", second));
    }

    @Test
    @DisplayName("Should reject wrong candidates")
    void testRejectsWrongCandidate() {
        String stored = hasher.hash("secret");

        assertFalse(hasher.matches("Secret", stored));
        assertFalse(hasher.matches("", stored));
        assertFalse(hasher.matches(null, stored));
    }

    @Test
    @DisplayName("Should verify legacy SHA-256 digests")
    void testLegacyDigest() {
        String legacy = CredentialHasher.legacyDigest("abc");

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", legacy);
        assertTrue(hasher.isLegacy(legacy));
        assertTrue(hasher.matches("abc", legacy));
        assertTrue(hasher.matches("abc", legacy.toUpperCase()));
        assertFalse(hasher.matches("abd", legacy));
    }

    @Test
    @DisplayName("Should never match malformed stored values")
    void testMalformedStoredValues() {
        assertFalse(hasher.matches("x", ""));
        assertFalse(hasher.matches("x", null));
        assertFalse(hasher.matches("x", "not-a-hash"));
        assertFalse(hasher.matches("x", "zz$zz"));
        assertFalse(hasher.matches("x", "$"));
    }

    @Test
    @DisplayName("Should verify a stored hash with its own iteration count")
    void testStoredIterationsWin() {
        String stored = new CredentialHasher(2000).hash("secret");

        assertTrue(stored.startsWith("2000$"));
        assertTrue(hasher.matches("secret", stored));
        assertFalse(hasher.matches("other", stored));
    }

    @Test
    @DisplayName("Should verify the two-part format with the configured iteration count")
    void testTwoPartFormat() {
        String twoPart = new CredentialHasher(2000).hash("secret").substring("2000$".length());

        assertTrue(hasher.needsRehash(twoPart));
        assertFalse(hasher.matches("secret", twoPart));
        assertTrue(new CredentialHasher(2000).matches("secret", twoPart));
    }

    @Test
    @DisplayName("Should reject invalid iteration counts")
    void testInvalidIterations() {
        String stored = hasher.hash("secret");
        String rest = stored.substring(stored.indexOf('$'));

        assertFalse(hasher.matches("secret", "0" + rest));
        assertFalse(hasher.matches("secret", "abc" + rest));
        assertFalse(hasher.matches("secret", "1000$1000" + rest));
    }

    @Test
    @DisplayName("Should refuse to hash a blank credential")
    void testBlankSecret() {
        assertThrows(IllegalArgumentException.class, () -> hasher.hash(" "));
    }
}
