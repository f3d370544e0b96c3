package com.triage.service.training;

import com.triage.service.anomaly.AnomalyDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static seed corpus read from a text resource.
 *
 * Format, one query per line:
 *   modality&lt;TAB&gt;query text
 *   query text                (no modality)
 * Blank lines and lines starting with '#' are ignored.
 */
@Slf4j
public class SeedCorpusSource implements HistoricalCorpusSource {

    private final Resource resource;

    public SeedCorpusSource(Resource resource) {
        this.resource = resource;
    }

    @Override
    public String getName() {
        return "seed:" + resource.getDescription();
    }

    @Override
    public Map<String, List<String>> fetch() {
        if (!resource.exists()) {
            log.warn("Seed corpus {} not found, contributing nothing", resource.getDescription());
            return Map.of();
        }
        Map<String, List<String>> corpus = new LinkedHashMap<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                int tab = line.indexOf('\t');
                String modality = tab > 0 ? line.substring(0, tab).trim() : AnomalyDetector.UNION;
                String text = tab > 0 ? line.substring(tab + 1).trim() : trimmed;
                if (!text.isEmpty()) {
                    corpus.computeIfAbsent(modality, k -> new ArrayList<>()).add(text);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read seed corpus " + resource.getDescription(), e);
        }
        log.debug("Loaded seed corpus: {}", corpus.keySet());
        return corpus;
    }
}
