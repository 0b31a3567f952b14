package com.lead.discovery.graph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FalkorDBConnectionTest {

    @Test
    void literals() {
        assertEquals("null", FalkorDBConnection.formatValue(null));
        assertEquals("42", FalkorDBConnection.formatValue(42L));
        assertEquals("0.5", FalkorDBConnection.formatValue(0.5));
        assertEquals("true", FalkorDBConnection.formatValue(true));
        assertEquals("'EMAIL'", FalkorDBConnection.formatValue("EMAIL"));
    }

    @Test
    void quotesAndBackslashesAreEscaped() {
        assertEquals("'O\\'Brien'", FalkorDBConnection.formatValue("O'Brien"));
        assertEquals("'a\\\\b'", FalkorDBConnection.formatValue("a\\b"));
    }

    @Test
    void collectionsBecomeLists() {
        assertEquals("['a', 'b']", FalkorDBConnection.formatValue(List.of("a", "b")));
        assertEquals("[]", FalkorDBConnection.formatValue(List.of()));
    }
}
