package com.stakeduel.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Settings for the bundled verification provider used in local and test runs.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "stakeduel.verification")
public class VerificationProperties {

    /**
     * When true every account not explicitly denied counts as verified.
     */
    private boolean allowAll = true;

    private Set<String> approvedAccounts = new LinkedHashSet<>();
    private Set<String> deniedAccounts = new LinkedHashSet<>();
}
