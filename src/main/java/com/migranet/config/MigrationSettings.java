package com.migranet.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * MigrationSettings: every tunable of the migration workflow, validated once at startup.
 *
 * Bound from migranet.* properties. Tests build instances through builder().
 */
@Component
public class MigrationSettings {

    private static final Logger log = LoggerFactory.getLogger(MigrationSettings.class);

    static final int MIN_ATTEMPTS = 1;
    static final int MAX_ATTEMPTS = 10;

    private final int      maxAttempts;
    private final int      memorySolutionLimit;
    private final int      searchMaxResults;
    private final int      warningThreshold;
    private final int      patternLimit;
    private final String   targetSchema;
    private final Duration conversionTimeout;
    private final Duration deploymentTimeout;
    private final Duration searchTimeout;
    private final Duration metadataTimeout;
    private final Duration translatorTimeout;
    private final Path     memoryPath;
    private final int      flushEvery;
    private final Path     unresolvedDir;
    private final boolean  reviewEnabled;

    @Autowired
    public MigrationSettings(
            @Value("${migranet.repair.max-attempts:3}") int maxAttempts,
            @Value("${migranet.repair.memory-solution-limit:3}") int memorySolutionLimit,
            @Value("${migranet.search.max-results:5}") int searchMaxResults,
            @Value("${migranet.conversion.warning-threshold:5}") int warningThreshold,
            @Value("${migranet.conversion.pattern-limit:5}") int patternLimit,
            @Value("${migranet.conversion.target-schema:dbo}") String targetSchema,
            @Value("${migranet.timeouts.conversion-seconds:120}") long conversionSeconds,
            @Value("${migranet.timeouts.deployment-seconds:60}") long deploymentSeconds,
            @Value("${migranet.timeouts.search-seconds:20}") long searchSeconds,
            @Value("${migranet.timeouts.metadata-seconds:30}") long metadataSeconds,
            @Value("${migranet.timeouts.translator-seconds:180}") long translatorSeconds,
            @Value("${migranet.memory.path:migration_memory.json}") String memoryPath,
            @Value("${migranet.memory.flush-every:1}") int flushEvery,
            @Value("${migranet.unresolved.dir:logs/unresolved}") String unresolvedDir,
            @Value("${migranet.review.enabled:true}") boolean reviewEnabled
    ) {
        this(builder()
                .maxAttempts(maxAttempts)
                .memorySolutionLimit(memorySolutionLimit)
                .searchMaxResults(searchMaxResults)
                .warningThreshold(warningThreshold)
                .patternLimit(patternLimit)
                .targetSchema(targetSchema)
                .conversionTimeout(Duration.ofSeconds(conversionSeconds))
                .deploymentTimeout(Duration.ofSeconds(deploymentSeconds))
                .searchTimeout(Duration.ofSeconds(searchSeconds))
                .metadataTimeout(Duration.ofSeconds(metadataSeconds))
                .translatorTimeout(Duration.ofSeconds(translatorSeconds))
                .memoryPath(Path.of(memoryPath))
                .flushEvery(flushEvery)
                .unresolvedDir(Path.of(unresolvedDir))
                .reviewEnabled(reviewEnabled));

        log.info("[Settings] maxAttempts={} warningThreshold={} patternLimit={} targetSchema={} memory={}",
                this.maxAttempts, this.warningThreshold, this.patternLimit, this.targetSchema, this.memoryPath);
    }

    private MigrationSettings(Builder b) {
        if (b.maxAttempts < MIN_ATTEMPTS || b.maxAttempts > MAX_ATTEMPTS) {
            throw new IllegalArgumentException(
                    "migranet.repair.max-attempts must be between " + MIN_ATTEMPTS + " and " + MAX_ATTEMPTS
                    + ", got " + b.maxAttempts);
        }
        requireNonNegative("migranet.repair.memory-solution-limit", b.memorySolutionLimit);
        requireNonNegative("migranet.search.max-results", b.searchMaxResults);
        requireNonNegative("migranet.conversion.warning-threshold", b.warningThreshold);
        requireNonNegative("migranet.conversion.pattern-limit", b.patternLimit);
        if (b.flushEvery < 1) {
            throw new IllegalArgumentException("migranet.memory.flush-every must be at least 1, got " + b.flushEvery);
        }
        requirePositive("conversion", b.conversionTimeout);
        requirePositive("deployment", b.deploymentTimeout);
        requirePositive("search", b.searchTimeout);
        requirePositive("metadata", b.metadataTimeout);
        requirePositive("translator", b.translatorTimeout);

        this.maxAttempts         = b.maxAttempts;
        this.memorySolutionLimit = b.memorySolutionLimit;
        this.searchMaxResults    = b.searchMaxResults;
        this.warningThreshold    = b.warningThreshold;
        this.patternLimit        = b.patternLimit;
        this.targetSchema        = b.targetSchema == null || b.targetSchema.isBlank() ? "dbo" : b.targetSchema.trim();
        this.conversionTimeout   = b.conversionTimeout;
        this.deploymentTimeout   = b.deploymentTimeout;
        this.searchTimeout       = b.searchTimeout;
        this.metadataTimeout     = b.metadataTimeout;
        this.translatorTimeout   = b.translatorTimeout;
        this.memoryPath          = b.memoryPath;
        this.flushEvery          = b.flushEvery;
        this.unresolvedDir       = b.unresolvedDir;
        this.reviewEnabled       = b.reviewEnabled;
    }

    private static void requireNonNegative(String key, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(key + " must not be negative, got " + value);
        }
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("migranet.timeouts." + name + "-seconds must be positive");
        }
    }

    public int      getMaxAttempts()         { return maxAttempts; }
    public int      getMemorySolutionLimit() { return memorySolutionLimit; }
    public int      getSearchMaxResults()    { return searchMaxResults; }
    public int      getWarningThreshold()    { return warningThreshold; }
    public int      getPatternLimit()        { return patternLimit; }
    public String   getTargetSchema()        { return targetSchema; }
    public Duration getConversionTimeout()   { return conversionTimeout; }
    public Duration getDeploymentTimeout()   { return deploymentTimeout; }
    public Duration getSearchTimeout()       { return searchTimeout; }
    public Duration getMetadataTimeout()     { return metadataTimeout; }
    public Duration getTranslatorTimeout()   { return translatorTimeout; }
    public Path     getMemoryPath()          { return memoryPath; }
    public int      getFlushEvery()          { return flushEvery; }
    public Path     getUnresolvedDir()       { return unresolvedDir; }
    public boolean  isReviewEnabled()        { return reviewEnabled; }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int      maxAttempts         = 3;
        private int      memorySolutionLimit = 3;
        private int      searchMaxResults    = 5;
        private int      warningThreshold    = 5;
        private int      patternLimit        = 5;
        private String   targetSchema        = "dbo";
        private Duration conversionTimeout   = Duration.ofSeconds(120);
        private Duration deploymentTimeout   = Duration.ofSeconds(60);
        private Duration searchTimeout       = Duration.ofSeconds(20);
        private Duration metadataTimeout     = Duration.ofSeconds(30);
        private Duration translatorTimeout   = Duration.ofSeconds(180);
        private Path     memoryPath          = Path.of("migration_memory.json");
        private int      flushEvery          = 1;
        private Path     unresolvedDir       = Path.of("logs", "unresolved");
        private boolean  reviewEnabled       = true;

        private Builder() {}

        public Builder maxAttempts(int v)            { this.maxAttempts = v; return this; }
        public Builder memorySolutionLimit(int v)    { this.memorySolutionLimit = v; return this; }
        public Builder searchMaxResults(int v)       { this.searchMaxResults = v; return this; }
        public Builder warningThreshold(int v)       { this.warningThreshold = v; return this; }
        public Builder patternLimit(int v)           { this.patternLimit = v; return this; }
        public Builder targetSchema(String v)        { this.targetSchema = v; return this; }
        public Builder conversionTimeout(Duration v) { this.conversionTimeout = v; return this; }
        public Builder deploymentTimeout(Duration v) { this.deploymentTimeout = v; return this; }
        public Builder searchTimeout(Duration v)     { this.searchTimeout = v; return this; }
        public Builder metadataTimeout(Duration v)   { this.metadataTimeout = v; return this; }
        public Builder translatorTimeout(Duration v) { this.translatorTimeout = v; return this; }
        public Builder memoryPath(Path v)            { this.memoryPath = v; return this; }
        public Builder flushEvery(int v)             { this.flushEvery = v; return this; }
        public Builder unresolvedDir(Path v)         { this.unresolvedDir = v; return this; }
        public Builder reviewEnabled(boolean v)      { this.reviewEnabled = v; return this; }

        public MigrationSettings build() {
            return new MigrationSettings(this);
        }
    }
}
