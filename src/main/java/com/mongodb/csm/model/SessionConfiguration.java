package com.mongodb.csm.model;

import com.mongodb.MongoNamespace;
import com.mongodb.csm.checkpoint.CheckpointConfiguration;
import com.mongodb.csm.exceptions.ConfigurationException;
import com.mongodb.csm.logging.DebugSettings;
import com.mongodb.csm.retry.RetryStrategy;
import org.bson.Document;

import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Everything a change stream session needs to know. Immutable, create it with {@link #builder()}.
 */
public class SessionConfiguration {
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_MAX_AWAIT_TIME = Duration.ofSeconds(1);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private final WatchScope scope;
    private final String database;
    private final @Nullable String collection;
    private final Set<OperationKind> operationTypes;
    private final Document matchFilter;
    private final Document projection;
    private final FullDocumentMode fullDocument;
    private final OutputFormat outputFormat;
    private final int batchSize;
    private final Duration maxAwaitTime;
    private final @Nullable Instant startAtOperationTime;
    private final @Nullable ResumeToken resumeAfter;
    private final CheckpointConfiguration checkpoint;
    private final Duration connectTimeout;
    private final DebugSettings debug;
    private final boolean emitStreamErrors;
    private final RetryStrategy resubscribeStrategy;

    private SessionConfiguration(Builder builder) {
        this.scope = builder.scope;
        this.database = builder.database;
        this.collection = builder.collection;
        this.operationTypes = builder.operationTypes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.operationTypes));
        this.matchFilter = new Document(builder.matchFilter);
        this.projection = new Document(builder.projection);
        this.fullDocument = builder.fullDocument;
        this.outputFormat = builder.outputFormat;
        this.batchSize = builder.batchSize;
        this.maxAwaitTime = builder.maxAwaitTime;
        this.startAtOperationTime = builder.startAtOperationTime;
        this.resumeAfter = builder.resumeAfter;
        this.checkpoint = builder.checkpoint;
        this.connectTimeout = builder.connectTimeout;
        this.debug = builder.debug;
        this.emitStreamErrors = builder.emitStreamErrors;
        this.resubscribeStrategy = builder.resubscribeStrategy;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fails fast on a configuration that cannot produce a valid change stream.
     */
    public void validate() {
        if (scope == null) {
            throw new ConfigurationException("Watch scope is required");
        }
        if (database == null || database.isBlank()) {
            throw new ConfigurationException("Database name is required");
        }
        checkName(() -> MongoNamespace.checkDatabaseNameValidity(database));
        if (scope == WatchScope.COLLECTION && (collection == null || collection.isBlank())) {
            throw new ConfigurationException("Collection name is required when watching a collection");
        }
        if (collection != null) {
            checkName(() -> MongoNamespace.checkCollectionNameValidity(collection));
        }
        if (operationTypes.isEmpty()) {
            throw new ConfigurationException("At least one operation type must be watched");
        }
        if (batchSize < 1) {
            throw new ConfigurationException("Batch size must be a positive integer but was " + batchSize);
        }
        if (maxAwaitTime == null || maxAwaitTime.isNegative()) {
            throw new ConfigurationException("Max await time must not be negative but was " + maxAwaitTime);
        }
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new ConfigurationException("Connect timeout must be positive but was " + connectTimeout);
        }
        Objects.requireNonNull(fullDocument, "fullDocument cannot be null");
        Objects.requireNonNull(outputFormat, "outputFormat cannot be null");
        Objects.requireNonNull(checkpoint, "checkpoint cannot be null");
        if (checkpoint.isEnabled()) {
            var resolved = checkpoint.resolve(database, collection);
            checkName(() -> MongoNamespace.checkDatabaseNameValidity(resolved.database()));
            checkName(() -> MongoNamespace.checkCollectionNameValidity(resolved.collection()));
        }
        Objects.requireNonNull(debug, "debug cannot be null");
        Objects.requireNonNull(resubscribeStrategy, "resubscribeStrategy cannot be null");
    }

    private static void checkName(Runnable check) {
        try {
            check.run();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    public WatchScope getScope() {
        return scope;
    }

    public String getDatabase() {
        return database;
    }

    @Nullable
    public String getCollection() {
        return collection;
    }

    public Set<OperationKind> getOperationTypes() {
        return operationTypes;
    }

    public Document getMatchFilter() {
        return new Document(matchFilter);
    }

    public Document getProjection() {
        return new Document(projection);
    }

    public FullDocumentMode getFullDocument() {
        return fullDocument;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Duration getMaxAwaitTime() {
        return maxAwaitTime;
    }

    @Nullable
    public Instant getStartAtOperationTime() {
        return startAtOperationTime;
    }

    @Nullable
    public ResumeToken getResumeAfter() {
        return resumeAfter;
    }

    public CheckpointConfiguration getCheckpoint() {
        return checkpoint;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public DebugSettings getDebug() {
        return debug;
    }

    public boolean isEmitStreamErrors() {
        return emitStreamErrors;
    }

    public RetryStrategy getResubscribeStrategy() {
        return resubscribeStrategy;
    }

    /**
     * @return a short description of what is watched, e.g. {@code collection shop.orders}
     */
    public String describeTarget() {
        return switch (scope) {
            case COLLECTION -> "collection " + database + "." + collection;
            case DATABASE -> "database " + database;
            case DEPLOYMENT -> "deployment";
        };
    }

    @Override
    public String toString() {
        return "SessionConfiguration{" +
                "scope=" + scope.value() +
                ", database='" + database + '\'' +
                ", collection='" + collection + '\'' +
                ", operationTypes=" + operationTypes +
                ", matchFilter=" + matchFilter.toJson() +
                ", projection=" + projection.toJson() +
                ", fullDocument=" + fullDocument.value() +
                ", outputFormat=" + outputFormat.value() +
                ", batchSize=" + batchSize +
                ", maxAwaitTime=" + maxAwaitTime.toMillis() + " ms" +
                ", startAtOperationTime=" + startAtOperationTime +
                ", resumeAfter=" + (resumeAfter != null) +
                ", checkpoint=" + checkpoint +
                '}';
    }

    public static class Builder {
        private WatchScope scope = WatchScope.COLLECTION;
        private String database;
        private @Nullable String collection;
        private Set<OperationKind> operationTypes = EnumSet.allOf(OperationKind.class);
        private Document matchFilter = new Document();
        private Document projection = new Document();
        private FullDocumentMode fullDocument = FullDocumentMode.DEFAULT;
        private OutputFormat outputFormat = OutputFormat.FULL;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration maxAwaitTime = DEFAULT_MAX_AWAIT_TIME;
        private @Nullable Instant startAtOperationTime;
        private @Nullable ResumeToken resumeAfter;
        private CheckpointConfiguration checkpoint = CheckpointConfiguration.disabled();
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private DebugSettings debug = DebugSettings.disabled();
        private boolean emitStreamErrors;
        private RetryStrategy resubscribeStrategy = RetryStrategy.defaultStrategy();

        private Builder() {
        }

        public Builder scope(WatchScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder database(String database) {
            this.database = database == null ? null : database.trim();
            return this;
        }

        public Builder collection(@Nullable String collection) {
            this.collection = collection == null || collection.isBlank() ? null : collection.trim();
            return this;
        }

        public Builder operationTypes(Collection<OperationKind> operationTypes) {
            this.operationTypes = operationTypes == null || operationTypes.isEmpty()
                    ? EnumSet.noneOf(OperationKind.class)
                    : EnumSet.copyOf(operationTypes);
            return this;
        }

        public Builder operationTypes(OperationKind first, OperationKind... rest) {
            this.operationTypes = EnumSet.of(first, rest);
            return this;
        }

        public Builder matchFilter(@Nullable Document matchFilter) {
            this.matchFilter = matchFilter == null ? new Document() : matchFilter;
            return this;
        }

        public Builder projection(@Nullable Document projection) {
            this.projection = projection == null ? new Document() : projection;
            return this;
        }

        public Builder fullDocument(FullDocumentMode fullDocument) {
            this.fullDocument = fullDocument;
            return this;
        }

        public Builder outputFormat(OutputFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxAwaitTime(Duration maxAwaitTime) {
            this.maxAwaitTime = maxAwaitTime;
            return this;
        }

        public Builder startAtOperationTime(@Nullable Instant startAtOperationTime) {
            this.startAtOperationTime = startAtOperationTime;
            return this;
        }

        public Builder resumeAfter(@Nullable String resumeAfter) {
            this.resumeAfter = resumeAfter == null || resumeAfter.isBlank() ? null : ResumeToken.fromString(resumeAfter);
            return this;
        }

        public Builder checkpoint(CheckpointConfiguration checkpoint) {
            this.checkpoint = checkpoint;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder debug(DebugSettings debug) {
            this.debug = debug;
            return this;
        }

        public Builder emitStreamErrors(boolean emitStreamErrors) {
            this.emitStreamErrors = emitStreamErrors;
            return this;
        }

        public Builder resubscribeStrategy(RetryStrategy resubscribeStrategy) {
            this.resubscribeStrategy = resubscribeStrategy;
            return this;
        }

        /**
         * @throws ConfigurationException if the configuration is invalid
         */
        public SessionConfiguration build() {
            var configuration = new SessionConfiguration(this);
            configuration.validate();
            return configuration;
        }
    }
}
