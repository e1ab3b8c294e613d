package com.dcarunner.ability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Relay client over HTTP: POST {relay}/abilities/{ability}/precheck and /execute with
 * {@code {params, context: {delegatorAddress}}}. Error responses that still carry a protocol body
 * ({@code success:false}) are returned as results; anything else is an {@link AbilityClientException}.
 */
@Slf4j
public class WebClientAbilityClient implements AbilityClient {

    private final String ability;
    private final String relayPath;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public WebClientAbilityClient(String ability, String relayPath, WebClient webClient, ObjectMapper objectMapper) {
        this.ability = ability;
        this.relayPath = relayPath;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String ability() {
        return ability;
    }

    @Override
    public Mono<AbilityResult> precheck(Map<String, Object> params, AbilityContext context) {
        return post("precheck", params, context);
    }

    @Override
    public Mono<AbilityResult> execute(Map<String, Object> params, AbilityContext context) {
        return post("execute", params, context);
    }

    private Mono<AbilityResult> post(String phase, Map<String, Object> params, AbilityContext context) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("params", params);
        body.put("context", Map.of("delegatorAddress", context.delegatorAddress()));
        return webClient.post()
                .uri("/abilities/{ability}/{phase}", relayPath, phase)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .map(json -> parse(phase, json))
                .onErrorResume(WebClientResponseException.class, e -> fromErrorResponse(phase, e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new AbilityClientException(ability + " " + phase + " unreachable: " + e.getMessage(), e));
    }

    private Mono<AbilityResult> fromErrorResponse(String phase, WebClientResponseException e) {
        String responseBody = e.getResponseBodyAsString();
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            if (root.has("success")) {
                return Mono.just(toResult(root));
            }
        } catch (Exception parseFailure) {
            log.debug("{} {} error body is not a protocol response: {}", ability, phase, parseFailure.getMessage());
        }
        return Mono.error(new AbilityClientException(
                ability + " " + phase + " failed with HTTP " + e.getStatusCode().value() + ": " + responseBody, e));
    }

    private AbilityResult parse(String phase, String json) {
        try {
            AbilityResult result = toResult(objectMapper.readTree(json));
            log.debug("{} {} -> success={} error={}", ability, phase, result.success(), result.error());
            return result;
        } catch (Exception e) {
            throw new AbilityClientException(ability + " " + phase + " returned unreadable body", e);
        }
    }

    @SuppressWarnings("unchecked")
    private AbilityResult toResult(JsonNode root) {
        JsonNode error = root.path("error");
        JsonNode result = root.path("result");
        Map<String, Object> resultMap = result.isObject()
                ? objectMapper.convertValue(result, Map.class)
                : Map.of();
        return new AbilityResult(
                root.path("success").asBoolean(false),
                error.isMissingNode() || error.isNull() ? null : (error.isTextual() ? error.asText() : error.toString()),
                resultMap);
    }
}
