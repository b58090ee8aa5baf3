package com.rxgate.fulfillmentservice.config;

import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the Keycloak client roles ({@code resource_access.<client>.roles}) of a token.
 */
@Component
@RequiredArgsConstructor
public class ClientRoles {

    public static final String PRESCRIPTION_REVIEWER = "PRESCRIPTION_REVIEWER";

    private final FulfillmentProperties properties;

    public boolean hasRole(Jwt jwt, String role) {
        return extract(jwt).contains(role);
    }

    public List<String> extract(Jwt jwt) {
        String clientId = properties.getSecurity().getClientId();
        return Optional.ofNullable(jwt.getClaim("resource_access"))
                .filter(Map.class::isInstance)
                .map(claim -> (Map<?, ?>) claim)
                .map(accessMap -> accessMap.get(clientId))
                .filter(Map.class::isInstance)
                .map(client -> (Map<?, ?>) client)
                .map(clientMap -> clientMap.get("roles"))
                .filter(List.class::isInstance)
                .map(roles -> (List<?>) roles)
                .map(list -> list.stream()
                        .filter(String.class::isInstance)
                        .map(String.class::cast)
                        .toList())
                .orElse(List.of());
    }
}
