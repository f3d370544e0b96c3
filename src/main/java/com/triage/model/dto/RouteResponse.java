package com.triage.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outbound routing response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteResponse {

    @JsonProperty("query_id")
    private String queryId;

    @JsonProperty("response_text")
    private String responseText;

    @JsonProperty("selected_model_name")
    private String selectedModelName;

    @JsonProperty("anomaly_score")
    private double anomalyScore;

    @JsonProperty("cache_hit")
    private boolean cacheHit;
}
