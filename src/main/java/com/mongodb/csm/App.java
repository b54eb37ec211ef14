package com.mongodb.csm;

import com.mongodb.csm.checkpoint.CheckpointConfiguration;
import com.mongodb.csm.checkpoint.SaveFrequency;
import com.mongodb.csm.converters.ConnectionTargetConverter;
import com.mongodb.csm.converters.FullDocumentModeConverter;
import com.mongodb.csm.converters.InstantConverter;
import com.mongodb.csm.converters.JsonDocumentConverter;
import com.mongodb.csm.converters.OperationKindConverter;
import com.mongodb.csm.converters.OutputFormatConverter;
import com.mongodb.csm.converters.SaveFrequencyConverter;
import com.mongodb.csm.converters.WatchScopeConverter;
import com.mongodb.csm.exceptions.ChangeStreamException;
import com.mongodb.csm.logging.DebugSettings;
import com.mongodb.csm.model.ConnectionTarget;
import com.mongodb.csm.model.FullDocumentMode;
import com.mongodb.csm.model.OperationKind;
import com.mongodb.csm.model.OutputFormat;
import com.mongodb.csm.model.SessionConfiguration;
import com.mongodb.csm.model.WatchScope;
import com.mongodb.csm.pipeline.FluxRecordSink;
import com.mongodb.csm.retry.RetryStrategy;
import com.mongodb.csm.session.ChangeStreamSession;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "csm",
        mixinStandardHelpOptions = true,
        description = "Change stream monitor, prints the changes of a MongoDB collection, database or deployment as JSON lines",
        defaultValueProvider = CommandLine.PropertiesDefaultProvider.class)
class App implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(App.class);
    private static final JsonWriterSettings jsonSettings = JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Option(names = {"--uri"},
            description = "MongoDB connection string",
            defaultValue = "mongodb://localhost:27017",
            converter = ConnectionTargetConverter.class)
    private ConnectionTarget target;

    @Option(names = {"--database"},
            description = "Database to watch, defaults to the database of the connection string")
    private String database;

    @Option(names = {"--collection"},
            description = "Collection to watch, required for the collection scope")
    private String collection;

    @Option(names = {"--scope"},
            description = "collection, database or deployment",
            defaultValue = "collection",
            converter = WatchScopeConverter.class)
    private WatchScope scope;

    @Option(names = {"--operation-types"},
            split = ",",
            description = "Operation types to watch",
            defaultValue = "insert,update,delete,replace",
            converter = OperationKindConverter.class)
    private List<OperationKind> operationTypes;

    @Option(names = {"--match-filter"},
            description = "Additional $match stage, as JSON",
            converter = JsonDocumentConverter.class)
    private Document matchFilter;

    @Option(names = {"--projection"},
            description = "$project stage, as JSON",
            converter = JsonDocumentConverter.class)
    private Document projection;

    @Option(names = {"--full-document"},
            description = "default, updateLookup, whenAvailable or required",
            defaultValue = "default",
            converter = FullDocumentModeConverter.class)
    private FullDocumentMode fullDocument;

    @Option(names = {"--output-format"},
            description = "full, document or simplified",
            defaultValue = "full",
            converter = OutputFormatConverter.class)
    private OutputFormat outputFormat;

    @Option(names = {"--batch-size"},
            defaultValue = "100")
    private Integer batchSize;

    @Option(names = {"--max-await-ms"},
            description = "Max time the server waits for new changes per poll",
            defaultValue = "1000")
    private Long maxAwaitMs;

    @Option(names = {"--start-at"},
            description = "Start at this cluster time (ISO-8601 or epoch seconds)",
            converter = InstantConverter.class)
    private Instant startAt;

    @Option(names = {"--resume-after"},
            description = "Resume token to start after, as JSON or its _data string")
    private String resumeAfter;

    @Option(names = {"--checkpoint"},
            description = "Persist resume tokens and resume from them on restart",
            defaultValue = "false")
    private Boolean checkpoint;

    @Option(names = {"--checkpoint-collection"},
            description = "Resume token collection, defaults to <collection>_resume_tokens")
    private String checkpointCollection;

    @Option(names = {"--checkpoint-database"},
            description = "Resume token database, defaults to the watched database")
    private String checkpointDatabase;

    @Option(names = {"--checkpoint-key"},
            description = "Resume token key, defaults to <database>.<collection>")
    private String checkpointKey;

    @Option(names = {"--save-frequency"},
            description = "every_change, smart or throttled",
            defaultValue = "smart",
            converter = SaveFrequencyConverter.class)
    private SaveFrequency saveFrequency;

    @Option(names = {"--throttle-interval-ms"},
            description = "Interval of the throttled save frequency")
    private Long throttleIntervalMs;

    @Option(names = {"--connect-timeout-ms"},
            defaultValue = "30000")
    private Long connectTimeoutMs;

    @Option(names = {"--debug"},
            description = "Sampled debug logging of events, token changes and skipped saves",
            defaultValue = "false")
    private Boolean debug;

    @Option(names = {"--emit-stream-errors"},
            description = "Emit a record for each change stream error",
            defaultValue = "false")
    private Boolean emitStreamErrors;

    @Option(names = {"--max-resubscribe-attempts"},
            description = "Consecutive resubscribe attempts after a stream error, 0 to stop at the first error",
            defaultValue = "5")
    private Integer maxResubscribeAttempts;

    @Override
    public Integer call() throws Exception {
        SessionConfiguration config;
        try {
            config = sessionConfiguration();
        } catch (ChangeStreamException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        PrintWriter out = spec.commandLine().getOut();
        var sink = new FluxRecordSink();
        sink.records()
                .map(record -> record.payload().toJson(jsonSettings))
                .subscribe(json -> {
                    out.println(json);
                    out.flush();
                });

        ChangeStreamSession session;
        try {
            session = new ChangeStreamSession(target, config, sink).start();
        } catch (ChangeStreamException e) {
            spec.commandLine().getErr().println(e.getMessage());
            sink.close();
            return 1;
        }

        var shutdown = new Thread(session::close, "csm-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdown);

        while (!session.awaitTermination(Duration.ofMinutes(1))) {
            logger.debug("Session {} still {}", session.getId(), session.state());
        }
        sink.close();
        return 0;
    }

    SessionConfiguration sessionConfiguration() {
        String db = database != null ? database : target.connectionString().getDatabase();
        return SessionConfiguration.builder()
                .scope(scope)
                .database(db)
                .collection(collection != null ? collection : target.connectionString().getCollection())
                .operationTypes(operationTypes)
                .matchFilter(matchFilter)
                .projection(projection)
                .fullDocument(fullDocument)
                .outputFormat(outputFormat)
                .batchSize(batchSize)
                .maxAwaitTime(Duration.ofMillis(maxAwaitMs))
                .startAtOperationTime(startAt)
                .resumeAfter(resumeAfter)
                .checkpoint(checkpointConfiguration())
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .debug(debug ? DebugSettings.enabled() : DebugSettings.disabled())
                .emitStreamErrors(emitStreamErrors)
                .resubscribeStrategy(maxResubscribeAttempts < 1
                        ? RetryStrategy.none()
                        : RetryStrategy.backoff(Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, maxResubscribeAttempts))
                .build();
    }

    private CheckpointConfiguration checkpointConfiguration() {
        if (!checkpoint) {
            return CheckpointConfiguration.disabled();
        }
        SaveFrequency frequency = saveFrequency;
        if (throttleIntervalMs != null && "throttled".equals(frequency.value())) {
            frequency = SaveFrequency.throttled(Duration.ofMillis(throttleIntervalMs));
        }
        return CheckpointConfiguration.enabled(checkpointCollection, checkpointDatabase, checkpointKey, frequency);
    }

    public static void main(String... args) {
        int exitCode = new CommandLine(new App()).execute(args);
        System.exit(exitCode);
    }
}
