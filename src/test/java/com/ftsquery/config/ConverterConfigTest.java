package com.ftsquery.config;

import com.ftsquery.query.Conjunction;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConverterConfigTest {

    @Test
    void testDefaults() {
        ConverterConfig config = ConverterConfig.defaults();

        assertNotNull(config);
        assertFalse(config.isStandardStopWords());
        assertTrue(config.getAdditionalStopWords().isEmpty());
        assertEquals(Conjunction.AND, config.getDefaultConjunction());
        assertEquals(Constants.MAX_QUERY_LENGTH, config.getMaxQueryLength());
    }

    @Test
    void testSetters() {
        ConverterConfig config = new ConverterConfig();
        List<String> words = new ArrayList<>(List.of("foo", "bar"));

        config.setStandardStopWords(true);
        config.setAdditionalStopWords(words);
        config.setDefaultConjunction(Conjunction.NEAR);
        config.setMaxQueryLength(128);
        words.add("baz");

        assertTrue(config.isStandardStopWords());
        assertEquals(List.of("foo", "bar"), config.getAdditionalStopWords());
        assertEquals(Conjunction.NEAR, config.getDefaultConjunction());
        assertEquals(128, config.getMaxQueryLength());

        config.setAdditionalStopWords(null);
        assertTrue(config.getAdditionalStopWords().isEmpty());
    }
}
