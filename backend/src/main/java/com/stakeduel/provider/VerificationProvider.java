package com.stakeduel.provider;

/**
 * External identity/age verification, consumed as a yes/no capability.
 */
public interface VerificationProvider {
    boolean isVerified(String accountId);
}
