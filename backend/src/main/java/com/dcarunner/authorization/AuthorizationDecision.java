package com.dcarunner.authorization;

/**
 * @param versionToRun app version the fire proceeds with
 * @param advanced     true when the job's stored version was raised to versionToRun by this fire
 */
public record AuthorizationDecision(int versionToRun, boolean advanced) {
}
