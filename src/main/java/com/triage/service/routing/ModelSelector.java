package com.triage.service.routing;

import com.triage.exception.RoutingException;
import com.triage.model.LoadSnapshot;
import com.triage.model.ModelProfile;
import com.triage.service.catalog.ModelCatalog;

import java.util.List;
import java.util.Optional;

/**
 * Pure model-selection rules.
 *
 * 1. risk = anomaly + loadSensitivity * min(1, inFlight / inFlightCapacity)
 * 2. eligible = catalog profiles with minComplexity &lt;= complexity, cheapest first
 * 3. pick the first eligible profile whose threshold &gt;= risk
 * 4. otherwise the most expensive eligible profile
 */
public class ModelSelector {

    private final double loadSensitivity;
    private final int inFlightCapacity;

    public ModelSelector(double loadSensitivity, int inFlightCapacity) {
        if (loadSensitivity < 0 || Double.isNaN(loadSensitivity)) {
            throw new IllegalArgumentException("loadSensitivity must be non-negative, got " + loadSensitivity);
        }
        if (inFlightCapacity < 1) {
            throw new IllegalArgumentException("inFlightCapacity must be at least 1, got " + inFlightCapacity);
        }
        this.loadSensitivity = loadSensitivity;
        this.inFlightCapacity = inFlightCapacity;
    }

    public double riskScore(double anomalyScore, LoadSnapshot load) {
        return anomalyScore + loadSensitivity * normalizedLoad(load);
    }

    public double normalizedLoad(LoadSnapshot load) {
        if (load == null) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0, load.getInFlightRequestCount()) / (double) inFlightCapacity);
    }

    /**
     * @throws RoutingException if no profile is eligible for {@code complexity}
     */
    public ModelProfile select(double complexity, double risk, ModelCatalog catalog) {
        List<ModelProfile> eligible = catalog.eligibleProfiles(complexity);
        if (eligible.isEmpty()) {
            throw new RoutingException("No model profile is eligible for complexity " + complexity);
        }
        for (ModelProfile profile : eligible) {
            if (profile.getThreshold() >= risk) {
                return profile;
            }
        }
        // Most capable fallback; equal cost keeps the higher-threshold profile
        ModelProfile fallback = eligible.get(eligible.size() - 1);
        for (ModelProfile profile : eligible) {
            if (profile.getResourceIntensity() == fallback.getResourceIntensity()) {
                return profile;
            }
        }
        return fallback;
    }

    /**
     * Most expensive eligible profile that is still cheaper than {@code current}, used as the retry target.
     */
    public Optional<ModelProfile> cheaperAlternative(ModelProfile current, double complexity, ModelCatalog catalog) {
        List<ModelProfile> eligible = catalog.eligibleProfiles(complexity);
        ModelProfile best = null;
        for (ModelProfile profile : eligible) {
            if (profile.getResourceIntensity() >= current.getResourceIntensity()) {
                break;
            }
            if (best == null || profile.getResourceIntensity() > best.getResourceIntensity()) {
                best = profile;
            }
        }
        return Optional.ofNullable(best);
    }
}
