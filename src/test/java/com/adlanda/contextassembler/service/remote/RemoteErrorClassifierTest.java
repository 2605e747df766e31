package com.adlanda.contextassembler.service.remote;

import com.adlanda.contextassembler.exception.RemoteCallException;
import com.adlanda.contextassembler.exception.RemoteFatalException;
import com.adlanda.contextassembler.exception.RemoteTransientException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteErrorClassifierTest {

    @Test
    void classify_http429_isTransient() {
        RemoteCallException result = RemoteErrorClassifier.classify(
                new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS));

        assertThat(result).isInstanceOf(RemoteTransientException.class);
        assertThat(result.getStatusCode()).isEqualTo(429);
    }

    @Test
    void classify_statusPrefixedMessage_isParsed() {
        RemoteCallException result = RemoteErrorClassifier.classify(
                new RuntimeException("429 - {\"error\": {\"message\": \"slow down\"}}"));

        assertThat(result).isInstanceOf(RemoteTransientException.class);
        assertThat(result.getStatusCode()).isEqualTo(429);
    }

    @Test
    void classify_rateLimitWordingWithoutStatus_isTransient() {
        RemoteCallException result = RemoteErrorClassifier.classify(
                new IllegalStateException("wrapper", new RuntimeException("Rate limit reached for requests")));

        assertThat(result).isInstanceOf(RemoteTransientException.class);
        assertThat(result.getStatusCode()).isNull();
    }

    @Test
    void classify_http401_isFatalAuthFailure() {
        RemoteCallException result = RemoteErrorClassifier.classify(
                new HttpClientErrorException(HttpStatus.UNAUTHORIZED));

        assertThat(result).isInstanceOf(RemoteFatalException.class);
        assertThat(result.getMessage()).startsWith("Authentication failed");
    }

    @Test
    void classify_serverErrorAndUnknownFailures_areFatal() {
        assertThat(RemoteErrorClassifier.classify(new RuntimeException("500 - internal error")))
                .isInstanceOf(RemoteFatalException.class);
        assertThat(RemoteErrorClassifier.classify(new IllegalArgumentException("bad request body")))
                .isInstanceOf(RemoteFatalException.class);
    }

    @Test
    void classify_alreadyClassified_isReturnedAsIs() {
        RemoteTransientException original = new RemoteTransientException("busy", 429, null);

        assertThat(RemoteErrorClassifier.classify(original)).isSameAs(original);
    }
}
