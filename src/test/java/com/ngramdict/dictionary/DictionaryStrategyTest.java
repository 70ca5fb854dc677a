package com.ngramdict.dictionary;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DictionaryStrategyTest {

    @Test
    void testFromNameIgnoresCaseAndWhitespace() {
        assertEquals(DictionaryStrategy.POOLED, DictionaryStrategy.fromName("pooled"));
        assertEquals(DictionaryStrategy.COPYING, DictionaryStrategy.fromName(" Copying "));
    }

    @Test
    void testFromNameRejectsUnknown() {
        IllegalArgumentException exception =
            assertThrows(IllegalArgumentException.class, () -> DictionaryStrategy.fromName("trie"));
        assertTrue(exception.getMessage().contains("pooled, copying"));
        assertThrows(IllegalArgumentException.class, () -> DictionaryStrategy.fromName(null));
    }

    @Test
    void testBuildCreatesMatchingImplementation() {
        assertInstanceOf(PooledDictionary.class, DictionaryStrategy.POOLED.build(new byte[0]));
        assertInstanceOf(CopyingDictionary.class, DictionaryStrategy.COPYING.build(new byte[0]));
    }
}
