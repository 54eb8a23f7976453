package com.llmbridge.llm.provider.clients;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Local HTTP server that replays scripted responses and records what it received.
 */
class MockUpstream implements AutoCloseable {

    record RecordedRequest(String method, String uri, Map<String, String> headers, String body) {
    }

    record ScriptedResponse(int status, Map<String, String> headers, List<String> chunks) {

        static ScriptedResponse json(int status, String body) {
            return new ScriptedResponse(status, Map.of("Content-Type", "application/json"), List.of(body));
        }

        static ScriptedResponse eventStream(List<String> events) {
            return new ScriptedResponse(200, Map.of("Content-Type", "text/event-stream"), events);
        }
    }

    private final Queue<ScriptedResponse> responses = new ConcurrentLinkedQueue<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final DisposableServer server;

    MockUpstream() {
        server = HttpServer.create()
            .host("127.0.0.1")
            .port(0)
            .handle((request, response) -> request.receive().aggregate().asString(StandardCharsets.UTF_8)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    Map<String, String> headers = new LinkedHashMap<>();
                    request.requestHeaders().forEach(entry -> headers.put(entry.getKey().toLowerCase(), entry.getValue()));
                    requests.add(new RecordedRequest(request.method().name(), request.uri(), headers, body));

                    ScriptedResponse scripted = responses.poll();
                    if (scripted == null) {
                        scripted = ScriptedResponse.json(500, "{\"error\":{\"message\":\"no scripted response\"}}");
                    }
                    response.status(scripted.status());
                    scripted.headers().forEach(response::header);
                    return response
                        .sendString(Flux.fromIterable(scripted.chunks()).delayElements(Duration.ofMillis(5)),
                            StandardCharsets.UTF_8)
                        .then();
                }))
            .bindNow();
    }

    MockUpstream enqueue(ScriptedResponse response) {
        responses.add(response);
        return this;
    }

    List<RecordedRequest> requests() {
        return new ArrayList<>(requests);
    }

    String baseUrl() {
        return "http://127.0.0.1:" + server.port();
    }

    int port() {
        return server.port();
    }

    @Override
    public void close() {
        server.disposeNow();
    }

    static int unusedPort() {
        DisposableServer placeholder = HttpServer.create().host("127.0.0.1").port(0)
            .handle((request, response) -> Mono.empty())
            .bindNow();
        int port = placeholder.port();
        placeholder.disposeNow();
        return port;
    }
}
