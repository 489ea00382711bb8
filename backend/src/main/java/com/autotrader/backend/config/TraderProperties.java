package com.autotrader.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base trading configuration. The runtime overlay patches a copy of this tree per cycle,
 * so every property name here (in snake_case) is also the override path segment.
 */
@ConfigurationProperties(prefix = "trader")
@Validated
@Data
public class TraderProperties {

    @Valid
    private Trading trading = new Trading();
    @Valid
    private Intraday intraday = new Intraday();
    @Valid
    private PositionManagement positionManagement = new PositionManagement();
    @Valid
    private Ai ai = new Ai();
    private Reddit reddit = new Reddit();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Trading {
        @Min(0)
        private int maxPositions = 5;
        @Min(0)
        private int maxNewPositionsPerCycle = 2;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double maxCashUtilisation = 0.5;
        @NotBlank
        private String cashBudgetTag = "TotalCashValue";
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double riskPerTrade = 0.01;
        @NotEmpty
        private List<String> markets = new ArrayList<>(List.of("US"));
        private Map<String, Double> minCashReserveByCurrency = new LinkedHashMap<>();
        private double maxSharePrice = 20.0;
        private double minSharePrice = 2.0;
        @Min(0)
        private long minAvgVolume = 500_000L;
        private boolean excludeMicrocap = true;
        private double volatilityThreshold = 0.0;
        @Min(1)
        private int symbolTimeoutSeconds = 45;
        @Valid
        private Screener screener = new Screener();
    }

    @Data
    public static class Screener {
        @Min(1)
        private int maxCandidates = 250;
        private List<String> scanCodes = new ArrayList<>(List.of(
                "MOST_ACTIVE", "TOP_PERC_GAIN", "HOT_BY_VOLUME", "HIGH_VS_13W_HI"));
        private boolean includeRedditSymbols = false;
        private List<String> includeSymbols = new ArrayList<>();
        private List<String> excludeSymbols = new ArrayList<>();
    }

    @Data
    public static class Intraday {
        private boolean enabled = true;
        private String barSize = "5 mins";
        private String duration = "2 D";
        private boolean useRth = true;
        @Min(0)
        private int cycleIntervalSeconds = 3600;
        @Min(0)
        private int cycleIntervalSecondsClosed = 1800;
        private double stopAtrMultiplier = 2.0;
        private double takeProfitR = 1.0;
        @Min(0)
        private int flattenMinutesBeforeClose = 10;
    }

    @Data
    public static class PositionManagement {
        @Min(0)
        private int reviewIntervalSeconds = 60;
        @Min(0)
        private int maxAdjustmentsPerPosition = 5;
        @Min(0)
        private int minOrderAgeMinutes = 0;
        private boolean opportunityRotationEnabled = true;
    }

    @Data
    public static class Ai {
        @NotBlank
        private String model = "gpt-4.1-mini";
        private String shortlistSystemPrompt;
        private String buySelectionSystemPrompt;
        private String positionReviewSystemPrompt;
        private String orderReviewSystemPrompt;
    }

    @Data
    public static class Reddit {
        private boolean enabled = false;
        private List<String> subreddits = new ArrayList<>(List.of("stocks", "wallstreetbets", "pennystocks"));
        private int postLimit = 50;
        private int maxSymbols = 50;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private long tickMillis = 1000L;
    }
}
