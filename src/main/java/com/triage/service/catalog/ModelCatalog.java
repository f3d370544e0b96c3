package com.triage.service.catalog;

import com.triage.exception.InvalidCatalogException;
import com.triage.model.ModelProfile;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, validated registry of model profiles.
 *
 * Rules checked at construction:
 * - at least one profile, names unique and non-blank
 * - threshold in (0, 1]
 * - min complexity &gt;= 0
 * - resource intensity &gt;= 1
 */
@Slf4j
public final class ModelCatalog {

    /**
     * Cheapest first; among equal cost the higher threshold (more headroom) first.
     */
    public static final Comparator<ModelProfile> COST_ORDER = Comparator
            .comparingInt(ModelProfile::getResourceIntensity)
            .thenComparing(Comparator.comparingDouble(ModelProfile::getThreshold).reversed())
            .thenComparing(ModelProfile::getName);

    private final Map<String, ModelProfile> byName;
    private final List<ModelProfile> ordered;

    public ModelCatalog(Collection<ModelProfile> profiles) {
        if (profiles == null || profiles.isEmpty()) {
            throw new InvalidCatalogException("Model catalog must contain at least one profile");
        }

        Map<String, ModelProfile> names = new LinkedHashMap<>();
        for (ModelProfile profile : profiles) {
            validate(profile);
            if (names.putIfAbsent(profile.getName(), profile) != null) {
                throw new InvalidCatalogException("Duplicate profile name: " + profile.getName());
            }
        }

        List<ModelProfile> sorted = new ArrayList<>(names.values());
        sorted.sort(COST_ORDER);

        this.byName = Collections.unmodifiableMap(names);
        this.ordered = List.copyOf(sorted);

        if (ordered.stream().noneMatch(p -> p.getMinComplexity() == 0.0)) {
            log.warn("Model catalog has no zero-complexity profile; low-complexity queries cannot be routed");
        }
        log.info("Loaded model catalog: {}", ordered.stream().map(ModelProfile::getName).toList());
    }

    /**
     * Profiles whose complexity floor is at most {@code complexity}, cheapest first.
     */
    public List<ModelProfile> eligibleProfiles(double complexity) {
        return ordered.stream()
                .filter(p -> p.getMinComplexity() <= complexity)
                .toList();
    }

    public Optional<ModelProfile> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * All profiles, cheapest first.
     */
    public List<ModelProfile> getProfiles() {
        return ordered;
    }

    public int size() {
        return ordered.size();
    }

    private static void validate(ModelProfile profile) {
        if (profile == null) {
            throw new InvalidCatalogException("Null profile in catalog");
        }
        String name = profile.getName();
        if (name == null || name.isBlank()) {
            throw new InvalidCatalogException("Profile name must not be blank");
        }
        if (profile.getModel() == null || profile.getModel().isBlank()) {
            throw new InvalidCatalogException("Profile '" + name + "' has no model identifier");
        }
        double threshold = profile.getThreshold();
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new InvalidCatalogException("Profile '" + name + "' threshold must be in (0, 1], got " + threshold);
        }
        if (!(profile.getMinComplexity() >= 0.0)) {
            throw new InvalidCatalogException("Profile '" + name + "' min complexity must be >= 0, got "
                    + profile.getMinComplexity());
        }
        if (profile.getResourceIntensity() < 1) {
            throw new InvalidCatalogException("Profile '" + name + "' resource intensity must be >= 1, got "
                    + profile.getResourceIntensity());
        }
    }
}
