package com.myorg.normcontrol.config;

import com.myorg.normcontrol.model.Severity;
import com.myorg.normcontrol.patterns.PatternLibraryLoader;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the analysis pipeline (prefix {@code compliance}).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "compliance")
public class ComplianceProperties {

    public static final int DEFAULT_MAX_TEXT_LENGTH = 200_000;

    /** Minimum compliance score for a document without warnings to pass. */
    private double passThreshold = 80.0;

    /** Page assumed to hold the general data sheet when no page mentions it. */
    private int generalDataFallbackPage = 4;

    /** Upper bound of worker threads; the pool never exceeds the processor count. */
    private int maxConcurrency = 8;

    /** Page text longer than this is truncated before pattern matching. */
    private int maxTextLength = DEFAULT_MAX_TEXT_LENGTH;

    private String patternLibrary = PatternLibraryLoader.DEFAULT_LOCATION;

    private Penalties penalties = new Penalties();

    public int workerThreads() {
        return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), maxConcurrency));
    }

    @Getter
    @Setter
    public static class Penalties {
        private int critical = 20;
        private int high = 15;
        private int warning = 10;
        private int info = 5;

        public int forSeverity(Severity severity) {
            switch (severity) {
                case CRITICAL: return critical;
                case HIGH: return high;
                case WARNING: return warning;
                default: return info;
            }
        }
    }
}
