package com.dcarunner.failure;

import com.dcarunner.domain.OperationKind;

import java.util.Map;

/**
 * The owner has no permitted version for the app (revoked, or never granted). Fatal.
 */
public class AuthorizationRevokedException extends OperationException {

    public static final String CODE = "AUTHORIZATION_REVOKED";

    public AuthorizationRevokedException(OperationKind kind, String ownerAddress, String appId) {
        super(CODE, kind, "authorization revoked for " + ownerAddress + " on app " + appId,
                Map.of("ownerAddress", ownerAddress, "appId", appId), null);
    }
}
