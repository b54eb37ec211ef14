package com.mongodb.csm.session;

import com.mongodb.MongoException;
import com.mongodb.client.ChangeStreamIterable;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.result.UpdateResult;
import com.mongodb.csm.checkpoint.CheckpointConfiguration;
import com.mongodb.csm.checkpoint.SaveFrequency;
import com.mongodb.csm.connection.CollectionBindings;
import com.mongodb.csm.connection.ConnectionHandle;
import com.mongodb.csm.connection.ConnectionManager;
import com.mongodb.csm.exceptions.ConnectionTimeoutException;
import com.mongodb.csm.exceptions.SubscriptionException;
import com.mongodb.csm.model.ConnectionTarget;
import com.mongodb.csm.model.EmittedRecord;
import com.mongodb.csm.model.OutputFormat;
import com.mongodb.csm.model.SessionConfiguration;
import com.mongodb.csm.retry.RetryStrategy;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Answers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.mockito.stubbing.Answer;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.mongodb.csm.ChangeEventFixtures.insert;
import static com.mongodb.csm.ChangeEventFixtures.token;
import static com.mongodb.csm.ChangeEventFixtures.update;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ChangeStreamSessionTest {

    private static final ConnectionTarget TARGET = ConnectionTarget.of("mongodb://localhost:27017");
    private static final Answer<ChangeStreamDocument<Document>> IDLE = invocation -> {
        Thread.sleep(5);
        return null;
    };

    @Mock
    private ConnectionManager connectionManager;
    @Mock
    private ConnectionHandle handle;
    @Mock
    private CollectionBindings bindings;
    @Mock
    private MongoCollection<Document> orders;
    @Mock
    private MongoCollection<Document> tokens;
    @Mock
    private FindIterable<Document> found;
    @Mock(answer = Answers.RETURNS_SELF)
    private ChangeStreamIterable<Document> changeStream;
    @Mock
    private MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor;
    @Mock
    private MongoChangeStreamCursor<ChangeStreamDocument<Document>> resumedCursor;

    private final List<EmittedRecord> records = new CopyOnWriteArrayList<>();
    private ChangeStreamSession session;

    @BeforeEach
    void setup() {
        when(connectionManager.open(eq(TARGET), any(Duration.class))).thenReturn(handle);
        when(handle.bindings()).thenReturn(bindings);
        when(bindings.collection("shop", "orders")).thenReturn(orders);
        when(bindings.uniquelyIndexedCollection("shop", "orders_resume_tokens", "key")).thenReturn(tokens);
        when(tokens.find(any(Bson.class))).thenReturn(found);
        when(tokens.replaceOne(any(Bson.class), any(Document.class), any(ReplaceOptions.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));
        when(orders.watch(anyList())).thenReturn(changeStream);
        when(changeStream.cursor()).thenReturn(cursor, resumedCursor);
        when(resumedCursor.tryNext()).thenAnswer(IDLE);
    }

    @AfterEach
    void teardown() {
        if (session != null) {
            session.close();
        }
    }

    @Test
    void repeatedResumeTokenIsOfferedOnce() {
        when(cursor.tryNext()).thenReturn(update("T1", 1), update("T1", 1)).thenAnswer(IDLE);
        when(cursor.getResumeToken()).thenReturn(token("T1"));

        session = new ChangeStreamSession(TARGET, config(CheckpointConfiguration.enabled(null, null, "shop.orders", SaveFrequency.smart())).build(),
                records::add, connectionManager, Clock.systemUTC()).start();

        await().atMost(Duration.ofSeconds(5)).until(() -> records.size() == 2);
        assertThat(session.state()).isEqualTo(SessionState.ACTIVE);
        session.close();

        verify(tokens, times(1)).replaceOne(any(Bson.class), any(Document.class), any(ReplaceOptions.class));
    }

    @Test
    void resumesFromTheCheckpointWithoutWritingItAgain() {
        when(found.first()).thenReturn(new Document("key", "shop.orders").append("token", new Document("_data", "T0")));
        when(cursor.tryNext()).thenAnswer(IDLE);
        when(cursor.getResumeToken()).thenReturn(token("T0"));

        session = new ChangeStreamSession(TARGET, config(CheckpointConfiguration.enabled(SaveFrequency.smart())).build(),
                records::add, connectionManager, Clock.systemUTC()).start();

        await().atMost(Duration.ofSeconds(5)).until(() -> token("T0").toJson().equals(String.valueOf(session.lastSeenToken())));
        session.close();

        verify(changeStream).resumeAfter(token("T0"));
        verify(tokens, never()).replaceOne(any(Bson.class), any(Document.class), any(ReplaceOptions.class));
    }

    @Test
    void connectionTimeoutFailsStartupWithoutSubscribing() {
        when(connectionManager.open(eq(TARGET), any(Duration.class))).thenThrow(new ConnectionTimeoutException(Duration.ofSeconds(30)));
        session = new ChangeStreamSession(TARGET, config(CheckpointConfiguration.disabled()).build(),
                records::add, connectionManager, Clock.systemUTC());

        assertThatThrownBy(session::start).isInstanceOf(ConnectionTimeoutException.class);

        assertThat(session.state()).isEqualTo(SessionState.CLOSED);
        verify(orders, never()).watch(anyList());
    }

    @Test
    void failingWatchIsReportedAsSubscriptionFailureAndClosesTheConnection() {
        when(orders.watch(anyList())).thenThrow(new MongoException("The $changeStream stage is only supported on replica sets"));
        session = new ChangeStreamSession(TARGET, config(CheckpointConfiguration.disabled()).build(),
                records::add, connectionManager, Clock.systemUTC());

        assertThatThrownBy(session::start)
                .isInstanceOf(SubscriptionException.class)
                .hasMessageStartingWith("Failed to initialize change stream: ");

        assertThat(session.state()).isEqualTo(SessionState.CLOSED);
        verify(connectionManager, atLeastOnce()).close(handle);
    }

    @Test
    void closeDuringConnectReleasesTheConnectionOpenedAfterwards() {
        when(connectionManager.open(eq(TARGET), any(Duration.class))).thenAnswer(invocation -> {
            session.close();
            return handle;
        });
        session = new ChangeStreamSession(TARGET, config(CheckpointConfiguration.enabled(SaveFrequency.smart())).build(),
                records::add, connectionManager, Clock.systemUTC());

        assertThatThrownBy(session::start)
                .isInstanceOf(SubscriptionException.class)
                .hasMessageContaining("was closed during startup");

        assertThat(session.state()).isEqualTo(SessionState.CLOSED);
        verify(connectionManager).close(handle);
        verify(orders, never()).watch(anyList());
    }

    @Test
    void streamErrorResubscribesAfterTheLastSeenToken() {
        when(cursor.tryNext()).thenReturn(insert("T1", 1, "new")).thenThrow(new MongoException("cursor killed"));
        when(cursor.getResumeToken()).thenReturn(token("T1"));

        session = new ChangeStreamSession(TARGET, config(CheckpointConfiguration.disabled())
                .emitStreamErrors(true)
                .resubscribeStrategy(RetryStrategy.fixed(Duration.ofMillis(10), 3))
                .build(), records::add, connectionManager, Clock.systemUTC()).start();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(changeStream).resumeAfter(token("T1")));
        assertThat(records).extracting(record -> record.payload().get("type")).containsExactly(null, "change_stream_error");
        verify(cursor).close();
        assertThat(session.state()).isEqualTo(SessionState.ACTIVE);
    }

    @Test
    void sessionClosesItselfWhenResubscribingIsNotAllowed() {
        when(cursor.tryNext()).thenThrow(new MongoException("cursor killed"));

        session = new ChangeStreamSession(TARGET, config(CheckpointConfiguration.disabled())
                .resubscribeStrategy(RetryStrategy.none())
                .build(), records::add, connectionManager, Clock.systemUTC()).start();

        await().atMost(Duration.ofSeconds(5)).until(() -> session.state() == SessionState.CLOSED);
        verify(connectionManager).close(handle);
        verify(changeStream, times(1)).cursor();
    }

    @Test
    void closeIsIdempotentAndStopsTheWorker() throws InterruptedException {
        when(cursor.tryNext()).thenAnswer(IDLE);
        session = new ChangeStreamSession(TARGET, config(CheckpointConfiguration.disabled()).build(),
                records::add, connectionManager, Clock.systemUTC()).start();

        session.close();
        session.close();

        assertThat(session.awaitTermination(Duration.ofSeconds(1))).isTrue();
        assertThat(session.state()).isEqualTo(SessionState.CLOSED);
        verify(cursor).close();
        verify(connectionManager, times(1)).close(handle);
        assertThatThrownBy(session::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void checkpointTargetIsResolvedOnce() {
        session = new ChangeStreamSession(TARGET, config(CheckpointConfiguration.enabled(SaveFrequency.throttled())).build(),
                records::add, connectionManager, Clock.systemUTC());

        assertThat(session.getCheckpointTarget()).isNotNull();
        assertThat(session.getCheckpointTarget().key()).isEqualTo("shop.orders");
        assertThat(session.getCheckpointTarget().collection()).isEqualTo("orders_resume_tokens");
    }

    private static SessionConfiguration.Builder config(CheckpointConfiguration checkpoint) {
        return SessionConfiguration.builder()
                .database("shop")
                .collection("orders")
                .outputFormat(OutputFormat.SIMPLIFIED)
                .maxAwaitTime(Duration.ofMillis(10))
                .checkpoint(checkpoint);
    }
}
