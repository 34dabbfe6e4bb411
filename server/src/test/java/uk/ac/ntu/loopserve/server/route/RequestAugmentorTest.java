package uk.ac.ntu.loopserve.server.route;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RequestAugmentorTest {

    @Test
    void recognisesJsonContentTypes() {
        assertThat(RequestAugmentor.isJson("application/json")).isTrue();
        assertThat(RequestAugmentor.isJson("Application/JSON; charset=utf-8")).isTrue();
        assertThat(RequestAugmentor.isJson("application/merge-patch+json")).isTrue();
        assertThat(RequestAugmentor.isJson("text/plain")).isFalse();
        assertThat(RequestAugmentor.isJson(null)).isFalse();
    }
}
