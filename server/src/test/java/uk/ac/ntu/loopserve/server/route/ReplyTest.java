package uk.ac.ntu.loopserve.server.route;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class ReplyTest {

    @Test
    void classifiesHandlerResults() {
        assertThat(Reply.of(null).kind()).isEqualTo(Reply.Kind.EMPTY);
        assertThat(Reply.of("Hello").kind()).isEqualTo(Reply.Kind.TEXT);
        assertThat(Reply.of(Map.of("a", 1)).kind()).isEqualTo(Reply.Kind.STRUCTURED);
        assertThat(Reply.of(List.of()).kind()).isEqualTo(Reply.Kind.STRUCTURED);
        assertThat(Reply.of(42).kind()).isEqualTo(Reply.Kind.STRUCTURED);
    }

    @Test
    void explicitRepliesPassThrough() {
        Reply created = Reply.json(201, Map.of("id", 7));

        assertThat(Reply.of(created)).isSameAs(created);
        assertThat(created.status()).isEqualTo(201);
    }

    @Test
    void failuresUnwrapFutureWrappers() {
        IllegalStateException root = new IllegalStateException("broken");

        Reply reply = Reply.failure(new CompletionException(new ExecutionException(root)));

        assertThat(reply.kind()).isEqualTo(Reply.Kind.FAILURE);
        assertThat(reply.status()).isEqualTo(500);
        assertThat(reply.cause()).isSameAs(root);
        assertThat(reply.describe()).isEqualTo("Error! java.lang.IllegalStateException: broken");
    }
}
