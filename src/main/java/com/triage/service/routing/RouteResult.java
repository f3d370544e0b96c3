package com.triage.service.routing;

import com.triage.model.ModelProfile;
import com.triage.model.RoutingDecision;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of routing and executing one query.
 */
@Value
@Builder
public class RouteResult {

    RoutingDecision decision;

    /**
     * Profile that produced the response; differs from the decision's profile after a retry.
     */
    ModelProfile servedBy;

    String responseText;

    boolean cacheHit;

    int attempts;
}
