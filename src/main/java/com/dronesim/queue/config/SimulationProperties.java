package com.dronesim.queue.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("simulation")
@Data
@Validated
public class SimulationProperties {

    @Valid
    private Store store = new Store();

    @Valid
    private Worker worker = new Worker();

    @Valid
    private Engine engine = new Engine();

    @Data
    public static class Store {
        /**
         * Backing store: {@code memory} or {@code redis}.
         */
        @NotBlank
        private String type = "memory";

        /**
         * Namespace of every Redis key.
         */
        @NotBlank
        private String keyPrefix = "simulation";

        /**
         * Read-assert-write attempts before a concurrent update is reported as a conflict.
         */
        @Min(1)
        private int conflictRetries = 16;

        /**
         * How often an idle Redis queue is re-checked when no wake-up arrives.
         */
        @NotNull
        private Duration recheckInterval = Duration.ofMillis(500);
    }

    @Data
    public static class Worker {
        private boolean enabled = true;

        /**
         * Longest time a single claim waits for work.
         */
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(10);

        @Min(1)
        private int retryAttempts = 5;

        /**
         * Initial backoff between retries of a failed store call; doubled per attempt.
         */
        @NotNull
        private Duration retryBackoff = Duration.ofMillis(500);
    }

    @Data
    public static class Engine {
        @NotEmpty
        private List<String> command = new ArrayList<>(List.of("simulation-engine"));

        private String workingDirectory = ".";

        @NotNull
        private Duration timeout = Duration.ofMinutes(30);
    }
}
