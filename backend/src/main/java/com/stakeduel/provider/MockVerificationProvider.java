package com.stakeduel.provider;

import com.stakeduel.config.VerificationProperties;
import org.springframework.stereotype.Component;

@Component
public class MockVerificationProvider implements VerificationProvider {

    private final VerificationProperties verificationProperties;

    public MockVerificationProvider(VerificationProperties verificationProperties) {
        this.verificationProperties = verificationProperties;
    }

    @Override
    public boolean isVerified(String accountId) {
        if (verificationProperties.getDeniedAccounts().contains(accountId)) {
            return false;
        }
        return verificationProperties.isAllowAll()
                || verificationProperties.getApprovedAccounts().contains(accountId);
    }
}
