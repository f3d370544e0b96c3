package com.triage.service.feature;

import java.util.Collections;
import java.util.Map;

/**
 * Immutable fitted vocabulary: term positions and inverse document frequencies.
 */
public final class Vocabulary {

    private final Map<String, Integer> positions;
    private final double[] idf;
    private final int documentCount;

    Vocabulary(Map<String, Integer> positions, double[] idf, int documentCount) {
        this.positions = Collections.unmodifiableMap(positions);
        this.idf = idf;
        this.documentCount = documentCount;
    }

    /**
     * Slot of a term, or -1 when the term is not in the vocabulary.
     */
    public int positionOf(String term) {
        Integer position = positions.get(term);
        return position == null ? -1 : position;
    }

    public boolean contains(String term) {
        return positions.containsKey(term);
    }

    double idfAt(int position) {
        return idf[position];
    }

    public int size() {
        return positions.size();
    }

    public int getDocumentCount() {
        return documentCount;
    }

    public Map<String, Integer> getPositions() {
        return positions;
    }
}
