package com.dcarunner.authorization;

import java.util.Optional;

/**
 * Source of truth for which version of an app an owner currently permits.
 */
public interface PermittedVersionStore {

    /**
     * @return the permitted version, or empty when the owner revoked or never granted permission
     * @throws PermittedVersionLookupException when the registry cannot answer
     */
    Optional<Integer> getCurrentPermittedVersion(String ownerAddress, String appId);
}
