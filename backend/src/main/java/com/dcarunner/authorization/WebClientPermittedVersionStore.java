package com.dcarunner.authorization;

import com.dcarunner.authorization.config.AuthorizationProperties;
import com.dcarunner.common.Blocking;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Reads the permitted version from the delegation registry over HTTP. A 404 or a null version means no permission.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebClientPermittedVersionStore implements PermittedVersionStore {

    private final AuthorizationProperties properties;
    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<Integer> getCurrentPermittedVersion(String ownerAddress, String appId) {
        String body;
        try {
            body = Blocking.await(webClientBuilder.build().get()
                            .uri(properties.getRegistryBaseUrl() + "/apps/{appId}/delegators/{owner}/permitted-version",
                                    appId, ownerAddress)
                            .retrieve()
                            .bodyToMono(String.class)
                            .onErrorResume(WebClientResponseException.class, e ->
                                    e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()
                                            ? Mono.empty()
                                            : Mono.error(e)),
                    Duration.ofMillis(properties.getTimeoutMs()), "permitted version " + appId);
        } catch (RuntimeException e) {
            throw new PermittedVersionLookupException(
                    "permitted version lookup failed for " + ownerAddress + ": " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode version = objectMapper.readTree(body).path("permittedVersion");
            if (!version.canConvertToInt()) {
                return Optional.empty();
            }
            log.debug("Permitted version of app {} for {}: {}", appId, ownerAddress, version.asInt());
            return Optional.of(version.asInt());
        } catch (Exception e) {
            throw new PermittedVersionLookupException("unreadable permitted version response: " + body, e);
        }
    }
}
