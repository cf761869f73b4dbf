package com.demoAuto.salesAgent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Tunables for the sales assistant pipeline, bound from the {@code sales-agent} prefix.
 */
@Data
@ConfigurationProperties(prefix = "sales-agent")
public class SalesAgentProperties {

    /**
     * Number of most recent conversation turns handed to the classifier and handlers.
     */
    private int historyTurns = 3;

    private Catalog catalog = new Catalog();

    private Knowledge knowledge = new Knowledge();

    private Finance finance = new Finance();

    private ConversationSettings conversation = new ConversationSettings();

    @Data
    public static class Catalog {
        private String resource = "catalog/vehicles.json";
        private int topK = 3;
        /**
         * When true the catalog handler asks the embedding index first and only falls back
         * to keyword/fuzzy matching if the index is unavailable or returns nothing.
         */
        private boolean semanticSearch = true;
    }

    @Data
    public static class Knowledge {
        private String resource = "knowledge/company_info.md";
        private int topK = 3;
    }

    @Data
    public static class Finance {
        private BigDecimal annualRate = new BigDecimal("0.10");
        private int defaultTermYears = 5;
    }

    @Data
    public static class ConversationSettings {
        private Duration idleTtl = Duration.ofMinutes(30);
        private long maxUsers = 10_000;
    }
}
