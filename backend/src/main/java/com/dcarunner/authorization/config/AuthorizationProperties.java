package com.dcarunner.authorization.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Delegated-app registry settings. Documented in application.yml under dcarunner.authorization.
 */
@ConfigurationProperties(prefix = "dcarunner.authorization")
@NoArgsConstructor
@Getter
@Setter
public class AuthorizationProperties {

    /** App id new jobs are created under. */
    private String appId;

    /** Registry base URL; queried at /apps/{appId}/delegators/{owner}/permitted-version. */
    private String registryBaseUrl = "http://localhost:8090";

    /** Upper bound for a permitted-version lookup. */
    private long timeoutMs = 5_000;
}
