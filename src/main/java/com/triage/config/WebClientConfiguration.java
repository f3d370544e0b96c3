package com.triage.config;

import com.triage.provider.InferenceClient;
import com.triage.provider.OllamaInferenceClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient and inference client wiring.
 */
@Configuration
public class WebClientConfiguration {

    private final TriageProperties properties;

    public WebClientConfiguration(TriageProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getInference().getTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Bean
    public InferenceClient inferenceClient(WebClient webClient) {
        return new OllamaInferenceClient(webClient, properties.getInference());
    }
}
