package com.triage.service.training;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded window of recently routed queries, grouped by the profile that served them.
 */
public class RecentQueryCorpusSource implements HistoricalCorpusSource {

    private final int capacity;
    private final Deque<String[]> window = new ArrayDeque<>();

    public RecentQueryCorpusSource(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public String getName() {
        return "recent-queries";
    }

    public synchronized void record(String modality, String text) {
        window.addLast(new String[]{modality, text});
        while (window.size() > capacity) {
            window.removeFirst();
        }
    }

    @Override
    public synchronized Map<String, List<String>> fetch() {
        Map<String, List<String>> corpus = new LinkedHashMap<>();
        for (String[] item : window) {
            corpus.computeIfAbsent(item[0], k -> new ArrayList<>()).add(item[1]);
        }
        return corpus;
    }

    public synchronized int size() {
        return window.size();
    }
}
