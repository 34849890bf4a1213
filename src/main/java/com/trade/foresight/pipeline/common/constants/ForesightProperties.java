package com.trade.foresight.pipeline.common.constants;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Every pipeline knob, bound from {@code foresight.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "foresight")
public class ForesightProperties {

    /** Active symbols, e.g. BTCUSDT. */
    @NotEmpty
    private List<String> symbols = new ArrayList<>(Arrays.asList("BTCUSDT"));

    /** Model names served by consumers. */
    @NotEmpty
    private List<String> models = new ArrayList<>(Arrays.asList("lightgbm", "tst"));

    /** Version slots served per model. */
    @NotEmpty
    private List<String> versions = new ArrayList<>(Arrays.asList("v1", "v2", "v3"));

    @Valid
    private Paths paths = new Paths();
    @Valid
    private State state = new State();
    @Valid
    private Control control = new Control();
    @Valid
    private Producer producer = new Producer();
    @Valid
    private Consumer consumer = new Consumer();
    @Valid
    private Store store = new Store();
    @Valid
    private Inference inference = new Inference();
    @Valid
    private Market market = new Market();
    @Valid
    private Training training = new Training();
    @Valid
    private Launcher launcher = new Launcher();

    @Data
    public static class Paths {
        /** Root of the price ledgers and prediction logs. */
        @NotBlank
        private String dataDir = "data";
        /** Directory watched by the job dispatcher. */
        @NotBlank
        private String jobsDir = "jobs";
        /** Directory of the file-backed state store. */
        @NotBlank
        private String stateDir = "state";
        @NotBlank
        private String modelsDir = "models";
        @NotBlank
        private String logDir = "logs";
    }

    @Data
    public static class State {
        /** redis | file | memory */
        @NotBlank
        private String backend = "file";
        private String keyPrefix = "fs:";
    }

    @Data
    public static class Control {
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration readTimeout = Duration.ofSeconds(5);
        private Duration waitPollInterval = Duration.ofSeconds(5);
        private Duration producerStartTimeout = Duration.ofSeconds(300);
        private Duration consumerStartTimeout = Duration.ofSeconds(300);
        /** Grace period for a running dispatcher to re-announce itself before start launches one. */
        private Duration dispatcherAnswerTimeout = Duration.ofSeconds(5);
        private Duration dispatcherStartTimeout = Duration.ofSeconds(60);
        private Duration entityShutdownTimeout = Duration.ofSeconds(60);
        private Duration globalShutdownTimeout = Duration.ofSeconds(600);
        /** How long a spawned job id blocks a second spawn of the same descriptor. */
        private Duration jobClaimTtl = Duration.ofMinutes(2);
    }

    @Data
    public static class Producer {
        private Duration emptyFetchSleep = Duration.ofSeconds(60);
        private Duration pauseSleep = Duration.ofSeconds(10);
        private Duration errorSleep = Duration.ofSeconds(10);
        @Min(1)
        private int publishChunk = 1000;
        /** Lookback used when no ledger exists yet. */
        private Duration initialLookback = Duration.ofDays(1);
        @Min(1)
        private int maxInitialSyncRows = 100_000;
    }

    @Data
    public static class Consumer {
        @Min(2)
        private int seqLen = 30;
        @Min(1)
        private int upsertThreshold = 100;
        @Min(1)
        private int inferenceChunk = 5000;
        private Duration monitorInterval = Duration.ofSeconds(5);
        private Duration startPollInterval = Duration.ofSeconds(5);
        private Duration pollTimeout = Duration.ofSeconds(1);
    }

    @Data
    public static class Store {
        @Min(1)
        private int batchLimit = 500;
        private Duration quotaBackoff = Duration.ofSeconds(60);
        @Min(1)
        private int retentionDays = 180;
        /** Create the open_time index on a symbol collection before first use. */
        private boolean ensureIndexes = true;
    }

    @Data
    public static class Inference {
        @NotBlank
        private String baseUrl = "http://fastapi-ml:8000";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(300);
        private Duration availabilityTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Market {
        @NotBlank
        private String baseUrl = "https://api.binance.com";
        @NotBlank
        private String interval = "1m";
        @Min(1)
        private int pageLimit = 1000;
        private Duration pageDelay = Duration.ofMillis(250);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Training {
        @NotEmpty
        private List<String> models = new ArrayList<>(Arrays.asList("lightgbm", "tst"));
        @NotEmpty
        private List<String> coins = new ArrayList<>(Arrays.asList("BTCUSDT"));
        private String aggregateModel = "trl";
        private String aggregateCoin = "ALL";
        @Min(1)
        private int eventRetentionDays = 365;
        private Duration sensorPollInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class Launcher {
        /** Java executable used to start worker processes. */
        private String javaCommand = "java";
        /** Application jar; empty means the jar this process was started from. */
        private String jar = "";
        private List<String> jvmArgs = new ArrayList<>();
        /** Pool size serving queued job descriptors. */
        @Min(1)
        private int workers = 2;
    }
}
