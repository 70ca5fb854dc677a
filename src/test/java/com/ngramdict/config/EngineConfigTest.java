package com.ngramdict.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.ngramdict.dictionary.DictionaryStrategy;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class EngineConfigTest {

    @Test
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertNotNull(config);
        assertEquals(Path.of(Constants.DEFAULT_DICTIONARY_FILE), config.getDictionaryPath());
        assertEquals(Constants.DEFAULT_STRATEGY, config.getStrategy());
        assertEquals(Constants.DEFAULT_MAX_NGRAM_SIZE, config.getMaxNgramSize());
    }

    @Test
    void testSetters() {
        EngineConfig config = new EngineConfig();
        Path newDictionary = Path.of("./words.txt");

        config.setDictionaryPath(newDictionary);
        config.setStrategy(DictionaryStrategy.COPYING);
        config.setMaxNgramSize(5);

        assertEquals(newDictionary, config.getDictionaryPath());
        assertEquals(DictionaryStrategy.COPYING, config.getStrategy());
        assertEquals(5, config.getMaxNgramSize());
    }

    @Test
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(EngineConfig.KEY_DICTIONARY, " /data/cities.txt ");
        properties.setProperty(EngineConfig.KEY_STRATEGY, "copying");
        properties.setProperty(EngineConfig.KEY_MAX_NGRAM_SIZE, "4");

        EngineConfig config = EngineConfig.fromProperties(properties);

        assertEquals(Path.of("/data/cities.txt"), config.getDictionaryPath());
        assertEquals(DictionaryStrategy.COPYING, config.getStrategy());
        assertEquals(4, config.getMaxNgramSize());
    }

    @Test
    void testFromPropertiesKeepsDefaultsForMissingKeys() {
        EngineConfig config = EngineConfig.fromProperties(new Properties());

        assertEquals(Path.of(Constants.DEFAULT_DICTIONARY_FILE), config.getDictionaryPath());
        assertEquals(Constants.DEFAULT_STRATEGY, config.getStrategy());
        assertEquals(Constants.DEFAULT_MAX_NGRAM_SIZE, config.getMaxNgramSize());
    }

    @Test
    void testFromPropertiesRejectsBadValues() {
        Properties badSize = new Properties();
        badSize.setProperty(EngineConfig.KEY_MAX_NGRAM_SIZE, "three");
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromProperties(badSize));

        Properties badStrategy = new Properties();
        badStrategy.setProperty(EngineConfig.KEY_STRATEGY, "trie");
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromProperties(badStrategy));
    }
}
