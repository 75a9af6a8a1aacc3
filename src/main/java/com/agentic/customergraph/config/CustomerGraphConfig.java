package com.agentic.customergraph.config;

import java.time.Duration;
import java.util.Optional;

import com.agentic.customergraph.core.ExtractionSettings;
import com.agentic.customergraph.upload.UploadSettings;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration of the customer graph service, read from application.properties
 * with the prefix "customer-graph".
 *
 * <h2>Configuration Groups:</h2>
 * <ul>
 *   <li><b>extraction</b> - thresholds, similarity provider, quality weights</li>
 *   <li><b>upload</b> - retry budget, backoff, call timeout, parallelism, schedule</li>
 *   <li><b>storage</b> - backend selection and locations</li>
 *   <li><b>llm</b> - chat model settings used by the LLM similarity scorer</li>
 * </ul>
 *
 * <h2>Example Configuration:</h2>
 * <pre>{@code
 * customer-graph.extraction.need-score-threshold=0.3
 * customer-graph.extraction.similarity-provider=lexical
 * customer-graph.upload.max-attempts=5
 * customer-graph.upload.call-timeout=30s
 * customer-graph.storage.backend=sqlite
 * customer-graph.storage.sqlite.path=data/customer-graph.db
 * }</pre>
 *
 * <p>Core classes never see this interface; {@link CustomerGraphProducers}
 * turns it into {@link ExtractionSettings} and {@link UploadSettings}.</p>
 */
@ConfigMapping(prefix = "customer-graph")
public interface CustomerGraphConfig {

    Extraction extraction();

    Upload upload();

    Storage storage();

    Llm llm();

    /**
     * Validates every group. Throws IllegalArgumentException if invalid.
     */
    default void validate() {
        extraction().validate();
        upload().validate();
        storage().validate();
        llm().validate();
    }

    interface Extraction {

        @WithName("need-score-threshold")
        @WithDefault("0.3")
        double needScoreThreshold();

        @WithName("similarity-threshold")
        @WithDefault("0.5")
        double similarityThreshold();

        /**
         * @return lexical, llm or none
         */
        @WithName("similarity-provider")
        @WithDefault("lexical")
        String similarityProvider();

        @WithName("default-file-analysis-confidence")
        @WithDefault("0.8")
        double defaultFileAnalysisConfidence();

        @WithName("default-needs-analysis-confidence")
        @WithDefault("0.7")
        double defaultNeedsAnalysisConfidence();

        QualityWeights weights();

        default ExtractionSettings toSettings() {
            return new ExtractionSettings(
                needScoreThreshold(),
                similarityThreshold(),
                defaultFileAnalysisConfidence(),
                defaultNeedsAnalysisConfidence(),
                weights().typeDiversity(),
                weights().evidenceCoverage(),
                weights().meaningfulRatio());
        }

        default void validate() {
            toSettings();
            String provider = similarityProvider().trim().toLowerCase();
            if (!provider.equals("lexical") && !provider.equals("llm") && !provider.equals("none")) {
                throw new IllegalArgumentException(String.format(
                    "Similarity provider must be one of lexical, llm, none; got '%s'", similarityProvider()));
            }
        }
    }

    interface QualityWeights {

        @WithName("type-diversity")
        @WithDefault("0.4")
        double typeDiversity();

        @WithName("evidence-coverage")
        @WithDefault("0.3")
        double evidenceCoverage();

        @WithName("meaningful-ratio")
        @WithDefault("0.3")
        double meaningfulRatio();
    }

    interface Upload {

        @WithName("max-attempts")
        @WithDefault("5")
        int maxAttempts();

        @WithName("initial-backoff")
        @WithDefault("200ms")
        Duration initialBackoff();

        @WithName("backoff-multiplier")
        @WithDefault("2.0")
        double backoffMultiplier();

        @WithName("max-backoff")
        @WithDefault("5s")
        Duration maxBackoff();

        @WithName("call-timeout")
        @WithDefault("30s")
        Duration callTimeout();

        @WithDefault("4")
        int parallelism();

        Schedule schedule();

        default UploadSettings toSettings() {
            return new UploadSettings(maxAttempts(), initialBackoff(), backoffMultiplier(), maxBackoff(),
                callTimeout(), parallelism());
        }

        default void validate() {
            toSettings();
        }
    }

    interface Schedule {

        /**
         * Whether the periodic bulk upload over every stored customer runs.
         */
        @WithDefault("false")
        boolean enabled();

        @WithDefault("1h")
        String every();
    }

    interface Storage {

        /**
         * @return memory or sqlite
         */
        @WithDefault("memory")
        String backend();

        /**
         * Root directory of the file-system Extraction Store. When absent,
         * snapshots are kept in memory.
         */
        @WithName("root-dir")
        Optional<String> rootDir();

        Sqlite sqlite();

        default void validate() {
            String normalized = backend().trim().toLowerCase();
            if (!normalized.equals("memory") && !normalized.equals("sqlite")) {
                throw new IllegalArgumentException(String.format(
                    "Storage backend must be memory or sqlite, got '%s'", backend()));
            }
            if (sqlite().readPoolSize() < 1) {
                throw new IllegalArgumentException(String.format(
                    "SQLite read pool size must be positive, got %d", sqlite().readPoolSize()));
            }
        }
    }

    interface Sqlite {

        @WithDefault("data/customer-graph.db")
        String path();

        @WithName("read-pool-size")
        @WithDefault("4")
        int readPoolSize();

        @WithName("busy-timeout")
        @WithDefault("30s")
        Duration busyTimeout();

        @WithName("wal-mode")
        @WithDefault("true")
        boolean walMode();
    }

    interface Llm {

        @WithDefault("gpt-4o-mini")
        String model();

        @WithDefault("0.0")
        Double temperature();

        @WithName("max-tokens")
        @WithDefault("16")
        Integer maxTokens();

        default void validate() {
            if (temperature() < 0.0 || temperature() > 2.0) {
                throw new IllegalArgumentException(String.format(
                    "LLM temperature must be between 0.0 and 2.0, got %.2f", temperature()));
            }
            if (maxTokens() < 1) {
                throw new IllegalArgumentException(String.format(
                    "LLM max tokens must be positive, got %d", maxTokens()));
            }
        }
    }
}
