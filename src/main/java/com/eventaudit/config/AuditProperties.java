package com.eventaudit.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit configuration, bound from the {@code audit.*} namespace.
 *
 * Passed explicitly into the cache, the TTL policy and each check when
 * they are built. Nothing reads it through a global lookup.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "audit")
public class AuditProperties {

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Spike spike = new Spike();

    @Valid
    private Dropoff dropoff = new Dropoff();

    @Valid
    private Freshness freshness = new Freshness();

    @Valid
    private NullRate nullRate = new NullRate();

    @Valid
    private Checks checks = new Checks();

    @Valid
    private Backend backend = new Backend();

    @Data
    public static class Cache {

        @NotNull
        private Path directory = Path.of(".audit-cache");

        /**
         * Query class to TTL. Classes missing here fail fast on lookup.
         */
        @NotEmpty
        private Map<String, Duration> ttl = defaultTtls();

        /**
         * Upper bound a caller waits on another caller's in-flight load.
         */
        @NotNull
        private Duration waitTimeout = Duration.ofMinutes(5);

        private static Map<String, Duration> defaultTtls() {
            Map<String, Duration> ttls = new LinkedHashMap<>();
            ttls.put("daily_spikes", Duration.ofHours(6));
            ttls.put("null_rates", Duration.ofHours(12));
            ttls.put("event_dropoffs", Duration.ofHours(24));
            ttls.put("freshness", Duration.ofHours(1));
            return ttls;
        }
    }

    @Data
    public static class Spike {

        /** Days of history fetched for the spike series. */
        @Positive
        private int lookbackDays = 60;

        /** Trailing days, excluding the evaluated day, that form the baseline. */
        @Positive
        private int baselineWindowDays = 30;

        /** The k in {@code mean + k * stddev}. */
        @Positive
        private double stddevFactor = 3.0;

        /** Stddev multiple at or above which a spike is critical. */
        @Positive
        private double criticalMultiple = 5.0;

        @Positive
        private int minBaselinePoints = 7;
    }

    @Data
    public static class Dropoff {

        @Positive
        private int periodDays = 7;

        /** Relative decrease that counts as a drop-off. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double threshold = 0.30;

        /** Prior-period volume an event needs for its drop-off to be critical. */
        @DecimalMin("0.0")
        private double minActivityFloor = 100;
    }

    @Data
    public static class Freshness {

        @NotNull
        private Duration latencyBudget = Duration.ofMinutes(60);

        @NotNull
        private Duration warningBudget = Duration.ofMinutes(30);
    }

    @Data
    public static class NullRate {

        @Positive
        private int lookbackDays = 14;

        @Positive
        private int trendWindowDays = 10;

        /** Minimum least-squares slope, in rate units per day. */
        @DecimalMin("0.0")
        private double trendSlopeThreshold = 0.005;

        @Positive
        private int trendMinPoints = 4;

        @Valid
        private List<Profile> profiles = new ArrayList<>();
    }

    /**
     * One configured instance of the null-rate check.
     */
    @Data
    public static class Profile {

        @NotBlank
        private String name;

        @Valid
        @NotEmpty
        private List<FieldThreshold> fields = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldThreshold {

        @NotBlank
        private String field;

        @NotBlank
        private String event;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double warning;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double critical;
    }

    @Data
    public static class Checks {

        /** Attempts per check when the backend is unavailable. */
        @Positive
        private int maxAttempts = 2;

        @NotNull
        private Duration retryWait = Duration.ofMillis(500);
    }

    @Data
    public static class Backend {

        /**
         * Named SQL template per query class. Parameters bind by name.
         */
        private Map<String, String> queries = new LinkedHashMap<>();
    }
}
