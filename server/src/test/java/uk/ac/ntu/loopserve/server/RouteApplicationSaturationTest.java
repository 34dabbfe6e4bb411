package uk.ac.ntu.loopserve.server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uk.ac.ntu.loopserve.server.route.RouteMap;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RouteApplicationSaturationTest {

    private final HttpClient http = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    private final CountDownLatch release = new CountDownLatch(1);
    private final CountDownLatch started = new CountDownLatch(1);
    private RunningService service;

    @BeforeEach
    void start() {
        RouteMap routes = RouteMap.builder()
                .get("/hello", req -> "Hello")
                .get("/slow", req -> {
                    started.countDown();
                    release.await(10, TimeUnit.SECONDS);
                    return "slow";
                })
                .build();
        service = RouteApplication.apply(ServiceConfig.builder(routes)
                .port(0)
                .workers(1)
                .queueCapacity(1)
                .build());
    }

    @AfterEach
    void stop() {
        release.countDown();
        service.close();
    }

    @Test
    void saturatedWorkersAnswerBusyInsteadOfStalling() throws Exception {
        List<CompletableFuture<HttpResponse<String>>> slow = new ArrayList<>();
        slow.add(sendAsync("/slow"));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        slow.add(sendAsync("/slow"));
        awaitQueued(1);

        HttpResponse<String> busy = http.send(request("/hello"), HttpResponse.BodyHandlers.ofString());

        assertThat(busy.statusCode()).isEqualTo(503);
        assertThat(service.shedRequests()).isEqualTo(1);

        release.countDown();
        for (CompletableFuture<HttpResponse<String>> f : slow) {
            HttpResponse<String> resp = f.get(10, TimeUnit.SECONDS);
            assertThat(resp.statusCode()).isEqualTo(200);
            assertThat(resp.body()).isEqualTo("slow");
        }
        assertThat(http.send(request("/hello"), HttpResponse.BodyHandlers.ofString()).body()).isEqualTo("Hello");
    }

    private CompletableFuture<HttpResponse<String>> sendAsync(String path) {
        return http.sendAsync(request(path), HttpResponse.BodyHandlers.ofString());
    }

    private HttpRequest request(String path) {
        return HttpRequest.newBuilder(URI.create(service.baseUrl() + path))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
    }

    private void awaitQueued(int n) throws InterruptedException {
        for (int i = 0; i < 250 && service.queuedRequests() < n; i++) Thread.sleep(20);
        assertThat(service.queuedRequests()).isEqualTo(n);
    }
}
