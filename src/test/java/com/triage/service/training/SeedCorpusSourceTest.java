package com.triage.service.training;

import com.triage.service.anomaly.AnomalyDetector;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SeedCorpusSourceTest {

    @Test
    void testParsesModalitiesAndBareLines() {
        String content = "# comment\n"
                + "simple\tWhat is the capital of France?\n"
                + "\n"
                + "technical\tHow do I configure a reverse proxy?\n"
                + "simple\tHow many days are in a leap year?\n"
                + "Recommend a movie for tonight\n";
        SeedCorpusSource source = new SeedCorpusSource(new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8)));

        Map<String, List<String>> corpus = source.fetch();

        assertEquals(List.of("What is the capital of France?", "How many days are in a leap year?"),
                corpus.get("simple"));
        assertEquals(List.of("How do I configure a reverse proxy?"), corpus.get("technical"));
        assertEquals(List.of("Recommend a movie for tonight"), corpus.get(AnomalyDetector.UNION));
    }

    @Test
    void testMissingResourceContributesNothing() {
        SeedCorpusSource source = new SeedCorpusSource(new ClassPathResource("corpus/does-not-exist.txt"));

        assertTrue(source.fetch().isEmpty());
    }

    @Test
    void testBundledSeedCorpusCoversEveryTier() {
        SeedCorpusSource source = new SeedCorpusSource(new ClassPathResource("corpus/seed-queries.txt"));

        Map<String, List<String>> corpus = source.fetch();

        for (String tier : List.of("simple", "technical", "analytical")) {
            assertTrue(corpus.get(tier).size() >= 10, tier + " has too few seed queries");
        }
    }
}
