package com.triage.telemetry;

import com.triage.config.JacksonConfiguration;
import com.triage.model.LoadSnapshot;
import com.triage.model.ModelProfile;
import com.triage.model.RoutingDecision;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class TelemetryPublisherTest {

    @Test
    void testFailingSinkDoesNotStopOthers() {
        TelemetrySink failing = mock(TelemetrySink.class);
        TelemetrySink healthy = mock(TelemetrySink.class);
        doThrow(new RuntimeException("export failed")).when(failing).recordDecision(any());
        TelemetryPublisher publisher = new TelemetryPublisher(List.of(failing, healthy));

        RoutingDecision decision = decision();
        assertDoesNotThrow(() -> publisher.publishDecision(decision));

        verify(healthy).recordDecision(decision);
    }

    @Test
    void testLoggingSinkRendersDecision() {
        LoggingTelemetrySink sink = new LoggingTelemetrySink(new JacksonConfiguration().objectMapper());

        assertDoesNotThrow(() -> sink.recordDecision(decision()));
        assertDoesNotThrow(() -> sink.recordLoad(LoadSnapshot.initial(Instant.now())));
    }

    private static RoutingDecision decision() {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        return RoutingDecision.builder()
                .queryId("q-1")
                .queryPreview("What is the capital of France?")
                .profile(ModelProfile.builder()
                        .name("simple")
                        .model("mistral")
                        .threshold(0.3)
                        .minComplexity(0)
                        .resourceIntensity(1)
                        .build())
                .anomalyScore(0.12)
                .complexityScore(6)
                .riskScore(0.12)
                .load(LoadSnapshot.initial(now))
                .decidedAt(now)
                .build();
    }
}
