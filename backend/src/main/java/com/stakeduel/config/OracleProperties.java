package com.stakeduel.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Price oracle call policy and mock feed fixtures.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "stakeduel.oracle")
public class OracleProperties {

    /**
     * Upper bound on a single feed call; a slower feed aborts the operation.
     */
    private Duration timeout = Duration.ofSeconds(2);

    /**
     * Quotes observed earlier than now minus this age are rejected as stale.
     */
    private Duration maxPriceAge = Duration.ofMinutes(5);

    private Mock mock = new Mock();

    @Getter
    @Setter
    public static class Mock {
        private int precision = 8;
        private Map<String, Long> prices = new LinkedHashMap<>();
    }
}
