package com.triage.service.feature;

import com.triage.exception.NotFittedException;
import com.triage.model.FeatureVector;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns query text into fixed-length feature vectors.
 *
 * Algorithm:
 * 1. fit() keeps the {@code maxFeatures} most frequent non-stop-word terms of the corpus
 * 2. Each kept term gets a smoothed IDF weight: ln((1 + n) / (1 + df)) + 1
 * 3. extract() computes L2-normalized TF-IDF weights over the fitted terms
 * 4. Scalar features (length, token count, average token length, punctuation
 *    density, out-of-vocabulary count) are appended
 *
 * The vocabulary is published atomically; a refit never changes vectors already produced.
 * build() and publish() let a caller hold a new vocabulary back until dependent models are ready.
 */
@Slf4j
public class FeatureExtractor {

    private static final Pattern TERM_PATTERN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxFeatures;
    private final Set<String> stopWords;
    private final AtomicReference<Vocabulary> vocabulary = new AtomicReference<>();

    public FeatureExtractor(int maxFeatures, Collection<String> stopWords) {
        if (maxFeatures < 1) {
            throw new IllegalArgumentException("maxFeatures must be at least 1, got " + maxFeatures);
        }
        this.maxFeatures = maxFeatures;
        this.stopWords = new HashSet<>();
        for (String word : stopWords) {
            this.stopWords.add(word.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Build a new vocabulary from the corpus and publish it.
     *
     * @param corpus query texts, at least one
     * @return the published vocabulary
     */
    public Vocabulary fit(List<String> corpus) {
        Vocabulary fitted = build(corpus);
        publish(fitted);
        return fitted;
    }

    /**
     * Build a vocabulary from the corpus without publishing it. extract(String) keeps
     * using the current vocabulary until {@link #publish(Vocabulary)} is called.
     *
     * @param corpus query texts, at least one
     */
    public Vocabulary build(List<String> corpus) {
        if (corpus == null || corpus.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit feature extractor on an empty corpus");
        }

        Map<String, Integer> termCounts = new HashMap<>();
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (String document : corpus) {
            List<String> terms = terms(document);
            for (String term : terms) {
                termCounts.merge(term, 1, Integer::sum);
            }
            for (String term : new HashSet<>(terms)) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        // Most frequent first, alphabetical among equals
        List<String> selected = termCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(maxFeatures)
                .map(Map.Entry::getKey)
                .toList();

        TreeMap<String, Integer> ordered = new TreeMap<>();
        for (String term : selected) {
            ordered.put(term, 0);
        }
        Map<String, Integer> positions = new HashMap<>();
        double[] idf = new double[ordered.size()];
        int n = corpus.size();
        int position = 0;
        for (String term : ordered.keySet()) {
            positions.put(term, position);
            idf[position] = Math.log((1.0 + n) / (1.0 + documentFrequency.get(term))) + 1.0;
            position++;
        }

        return new Vocabulary(positions, idf, n);
    }

    public void publish(Vocabulary fitted) {
        if (fitted == null) {
            throw new IllegalArgumentException("Cannot publish a null vocabulary");
        }
        vocabulary.set(fitted);
        log.info("Published feature vocabulary from {} documents: {} terms (max {})",
                fitted.getDocumentCount(), fitted.size(), maxFeatures);
    }

    /**
     * Extract the feature vector for a query using the current vocabulary.
     *
     * @throws NotFittedException if fit() has not been called
     */
    public FeatureVector extract(String text) {
        Vocabulary current = vocabulary.get();
        if (current == null) {
            throw new NotFittedException("FeatureExtractor");
        }
        return extract(current, text);
    }

    /**
     * Extract against an explicit vocabulary snapshot.
     */
    public FeatureVector extract(Vocabulary snapshot, String text) {
        String safe = text == null ? "" : text;
        double[] values = new double[dimension()];

        int rare = 0;
        for (String term : terms(safe)) {
            int position = snapshot.positionOf(term);
            if (position < 0) {
                rare++;
            } else {
                values[position] += 1.0;
            }
        }

        double norm = 0.0;
        for (int i = 0; i < snapshot.size(); i++) {
            if (values[i] > 0) {
                values[i] *= snapshot.idfAt(i);
                norm += values[i] * values[i];
            }
        }
        if (norm > 0) {
            norm = Math.sqrt(norm);
            for (int i = 0; i < snapshot.size(); i++) {
                values[i] /= norm;
            }
        }

        String[] tokens = whitespaceTokens(safe);
        int letters = 0;
        for (String token : tokens) {
            letters += token.length();
        }
        int punctuation = 0;
        for (int i = 0; i < safe.length(); i++) {
            char c = safe.charAt(i);
            if (!Character.isLetterOrDigit(c) && !Character.isWhitespace(c)) {
                punctuation++;
            }
        }

        values[scalarIndex(FeatureVector.Scalar.CHAR_LENGTH)] = safe.length();
        values[scalarIndex(FeatureVector.Scalar.TOKEN_COUNT)] = tokens.length;
        values[scalarIndex(FeatureVector.Scalar.AVG_TOKEN_LENGTH)] = (double) letters / Math.max(1, tokens.length);
        values[scalarIndex(FeatureVector.Scalar.PUNCTUATION_DENSITY)] = (double) punctuation / Math.max(1, safe.length());
        values[scalarIndex(FeatureVector.Scalar.RARE_TOKEN_COUNT)] = rare;

        return new FeatureVector(values, maxFeatures);
    }

    public List<FeatureVector> extractAll(Vocabulary snapshot, List<String> texts) {
        List<FeatureVector> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(extract(snapshot, text));
        }
        return vectors;
    }

    public boolean isFitted() {
        return vocabulary.get() != null;
    }

    /**
     * Current vocabulary, or null before the first fit.
     */
    public Vocabulary getVocabulary() {
        return vocabulary.get();
    }

    /**
     * Length of every vector this extractor produces.
     */
    public int dimension() {
        return FeatureVector.dimensionFor(maxFeatures);
    }

    public int getMaxFeatures() {
        return maxFeatures;
    }

    private int scalarIndex(FeatureVector.Scalar scalar) {
        return maxFeatures + scalar.ordinal();
    }

    private List<String> terms(String text) {
        List<String> terms = new ArrayList<>();
        Matcher matcher = TERM_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String term = matcher.group();
            if (!stopWords.contains(term)) {
                terms.add(term);
            }
        }
        return terms;
    }

    private static String[] whitespaceTokens(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return new String[0];
        }
        return WHITESPACE.split(trimmed);
    }
}
