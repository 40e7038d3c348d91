package com.normalform.sentence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SymbolTable.
 */
class SymbolTableTest {

    @Test
    @DisplayName("Declares the six operator symbols in order")
    void shouldDeclareSymbols() {
        assertEquals(List.of("&&", "||", "~", "(", ")", "=>"), List.copyOf(SymbolTable.SYMBOLS.keySet()));
        assertEquals(TokenType.IMPLIES, SymbolTable.typeOf("=>"));
        assertEquals("~", SymbolTable.symbolOf(TokenType.NOT));
    }

    @Test
    @DisplayName("Should match a symbol only at the given position")
    void shouldMatchSymbolAtPosition() {
        assertEquals("=>", SymbolTable.symbolAt("a=>b", 1));
        assertNull(SymbolTable.symbolAt("a=>b", 0));
        assertNull(SymbolTable.symbolAt("a&", 1));
    }

    @Test
    @DisplayName("Should reject symbol sets where one symbol prefixes another")
    void shouldRejectPrefixedSymbols() {
        assertThrows(IllegalStateException.class,
                () -> SymbolTable.checkPrefixFree(List.of("&&", "&")));
        assertThrows(IllegalStateException.class,
                () -> SymbolTable.checkPrefixFree(List.of("~", "")));
        assertDoesNotThrow(() -> SymbolTable.checkPrefixFree(List.of("&&", "||", "=>")));
    }

    @Test
    @DisplayName("Term tokens have no symbol")
    void termHasNoSymbol() {
        assertThrows(IllegalArgumentException.class, () -> SymbolTable.symbolOf(TokenType.TERM));
    }
}
