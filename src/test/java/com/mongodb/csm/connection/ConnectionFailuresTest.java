package com.mongodb.csm.connection;

import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoSocketOpenException;
import com.mongodb.ServerAddress;
import com.mongodb.csm.exceptions.ConnectionException.Reason;
import org.bson.BsonDocument;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionFailuresTest {

    @Test
    void refusedConnectionIsFoundInTheCauseChain() {
        var failure = new MongoSocketOpenException("Exception opening socket", new ServerAddress(), new ConnectException("Connection refused"));

        assertThat(ConnectionFailures.reasonOf(failure)).isEqualTo(Reason.CONNECTION_REFUSED);
    }

    @Test
    void unauthorizedCommandIsNotAuthorized() {
        var response = BsonDocument.parse("{ok: 0, errmsg: 'not allowed', code: 13, codeName: 'Unauthorized'}");

        assertThat(ConnectionFailures.reasonOf(new MongoCommandException(response, new ServerAddress())))
                .isEqualTo(Reason.NOT_AUTHORIZED);
    }

    @Test
    void messagesAreUsedAsALastResort() {
        assertThat(ConnectionFailures.reasonOf(new MongoException("Authentication failed."))).isEqualTo(Reason.AUTHENTICATION_FAILED);
        assertThat(ConnectionFailures.reasonOf(new MongoException("getaddrinfo ENOTFOUND db1"))).isEqualTo(Reason.HOST_NOT_FOUND);
        assertThat(ConnectionFailures.reasonOf(new MongoException("something else"))).isEqualTo(Reason.UNKNOWN);
    }
}
