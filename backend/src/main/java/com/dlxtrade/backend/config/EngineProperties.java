package com.dlxtrade.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "engine")
@Data
@Validated
public class EngineProperties {

    private Risk risk = new Risk();
    private Quote quote = new Quote();
    private Execution execution = new Execution();
    private Research research = new Research();
    private Io io = new Io();
    private Websocket websocket = new Websocket();
    private Paper paper = new Paper();

    @Data
    public static class Risk {
        @Min(1)
        private int maxConsecutiveFailures = 5;

        @Min(1)
        private long pauseMinutes = 30;

        @Positive
        private BigDecimal defaultAdverseMove = new BigDecimal("0.01");

        @Positive
        private BigDecimal flatNotionalPerUnit = new BigDecimal("1000");

        @Positive
        private BigDecimal simulatedBalance = new BigDecimal("10000");
    }

    @Data
    public static class Quote {
        @Min(1)
        private long loopIntervalMs = 100;

        @Min(1)
        private long errorBackoffMs = 1000;

        @Min(1)
        private int orderbookDepth = 20;

        // quotes sit at mid +/- halfSpread * spreadFraction
        @Positive
        @DecimalMax("1.0")
        private BigDecimal spreadFraction = new BigDecimal("0.5");

        @Min(0)
        private long snapshotMaxAgeMs = 250;

        @NotBlank
        private String strategyName = "market_making_hft";
    }

    @Data
    public static class Execution {
        @Min(1)
        private long defaultIntervalMs = 5000;

        @Min(1)
        private long exitCheckIntervalMs = 2000;

        @Min(1)
        private int orderbookDepth = 20;

        @Min(1)
        private int exitOrderbookDepth = 5;

        @Positive
        @DecimalMax("1.0")
        private double defaultMinAccuracy = 0.85;

        @Positive
        private BigDecimal defaultTradeSize = new BigDecimal("0.001");

        @Positive
        private BigDecimal assumedAdverseMove = new BigDecimal("0.01");

        @NotBlank
        private String defaultStrategy = "orderbook_imbalance";

        @NotBlank
        private String marketMakingStrategy = "market_making_hft";

        @NotBlank
        private String defaultSymbol = "BTCUSDT";
    }

    @Data
    public static class Research {
        @Min(1)
        private int depth = 10;

        @Positive
        private double imbalanceThreshold = 0.2;
    }

    @Data
    public static class Io {
        @Min(1)
        private long timeoutMs = 5000;

        @Min(1)
        private int maxPoolSize = 64;
    }

    @Data
    public static class Websocket {
        private List<String> allowedOrigins = new ArrayList<>();
    }

    @Data
    public static class Paper {
        private boolean feedEnabled = true;

        @Min(1)
        private long tickIntervalMs = 250;

        private List<String> symbols = new ArrayList<>(List.of("BTCUSDT"));

        @Positive
        private BigDecimal startPrice = new BigDecimal("50000");

        // relative tick size of the simulated mid-price walk
        @Positive
        private BigDecimal volatility = new BigDecimal("0.0005");

        @Min(1)
        private int depth = 20;

        // per-user cap on stored trades, execution logs and activities
        @Min(1)
        private int maxRecords = 1000;
    }
}
