package com.modelgate.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Externalized settings under the {@code modelgate} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "modelgate")
public class GatewayProperties {

    private RateLimit rateLimit = new RateLimit();
    @Valid
    private Sync sync = new Sync();
    @Valid
    private Catalog catalog = new Catalog();
    private Admin admin = new Admin();
    private Database database = new Database();

    /**
     * Fallbacks used when a principal row carries no limit or window of its own.
     */
    @Data
    public static class RateLimit {
        private int defaultMax = 200;
        private Duration defaultTimeWindow = Duration.ofHours(24);

        public boolean isUsable() {
            return defaultMax > 0 && defaultTimeWindow != null && !defaultTimeWindow.isNegative()
                    && !defaultTimeWindow.isZero();
        }
    }

    @Data
    public static class Sync {
        /** Below this age the catalog is served and explicit triggers are skipped. */
        @NotNull
        private Duration freshThreshold = Duration.ofHours(1);
        /** At or above this age the read path refreshes before serving. */
        @NotNull
        private Duration criticalThreshold = Duration.ofHours(2);
        /** Lease length of the sync lock; also bounds a single guarded run. */
        @NotNull
        private Duration lockDuration = Duration.ofMinutes(5);
        @NotNull
        private Duration fetchTimeout = Duration.ofSeconds(8);
        private Duration interval = Duration.ofHours(1);
        private Duration initialDelay = Duration.ofSeconds(30);
        private boolean schedulerEnabled = true;
    }

    @Data
    public static class Catalog {
        @NotBlank
        private String baseUrl = "https://openrouter.ai/api/v1";
    }

    @Data
    public static class Admin {
        private String secret;
    }

    @Data
    public static class Database {
        private boolean initializeSchema = true;
    }
}
