package com.dcarunner.ability;

import com.dcarunner.ability.config.AbilityProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One relay client per ability, built once per process and shared by all fires.
 */
@Component
public class AbilityClients {

    private final Map<String, AbilityClient> clients = new LinkedHashMap<>();

    @Autowired
    public AbilityClients(AbilityProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        WebClient.Builder builder = webClientBuilder.clone().baseUrl(properties.getRelayBaseUrl());
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            builder.defaultHeader("X-Api-Key", properties.getApiKey());
        }
        WebClient webClient = builder.build();
        for (String ability : AbilityNames.ALL) {
            String path = properties.getRelayPaths().getOrDefault(ability, ability);
            clients.put(ability, new WebClientAbilityClient(ability, path, webClient, objectMapper));
        }
    }

    /** For tests and alternative relays. */
    public AbilityClients(Collection<? extends AbilityClient> abilityClients) {
        abilityClients.forEach(c -> clients.put(c.ability(), c));
    }

    /**
     * @throws IllegalStateException when no client is registered for the ability
     */
    public AbilityClient get(String ability) {
        AbilityClient client = clients.get(ability);
        if (client == null) {
            throw new IllegalStateException("No ability client for " + ability);
        }
        return client;
    }
}
