package world.willfrog.tracefetch.fetch.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.tracefetch.common.exception.ApiException;
import world.willfrog.tracefetch.common.exception.ConfigException;
import world.willfrog.tracefetch.common.pojo.run.RawRun;
import world.willfrog.tracefetch.fetch.config.FetchSettingsResolver;
import world.willfrog.tracefetch.fetch.config.TraceFetchProperties;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TraceApiClientTest {

    @Mock
    private FetchSettingsResolver settingsResolver;

    private HttpServer server;
    private boolean serverStopped;
    private TraceApiClient client;
    private final AtomicReference<String> capturedApiKey = new AtomicReference<>();
    private final AtomicReference<String> capturedContentType = new AtomicReference<>();
    private final AtomicReference<String> capturedQuery = new AtomicReference<>();
    private final AtomicReference<String> capturedBody = new AtomicReference<>();
    private final AtomicInteger hits = new AtomicInteger();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/runs/", exchange -> {
            hits.incrementAndGet();
            capturedApiKey.set(exchange.getRequestHeaders().getFirst("X-API-Key"));
            capturedContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            capturedQuery.set(exchange.getRequestURI().getRawQuery());
            capturedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            String path = exchange.getRequestURI().getPath();
            int status = path.endsWith("/missing") ? 404 : 200;
            String body = status == 404
                    ? "{\"detail\":\"Run not found\"}"
                    : "{\"id\":\"r-1\",\"status\":\"success\",\"unknown_field\":1}";
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();

        lenient().when(settingsResolver.apiKey()).thenReturn("ls-test-key");
        lenient().when(settingsResolver.baseUrl()).thenReturn("http://127.0.0.1:" + server.getAddress().getPort());
        client = new TraceApiClient(HttpClient.newHttpClient(), new ObjectMapper(), settingsResolver, new TraceFetchProperties());
    }

    @AfterEach
    void tearDown() {
        if (!serverStopped) {
            server.stop(0);
        }
    }

    @Test
    void execute_shouldSendApiKeyHeaderAndDecodeBody() {
        RawRun run = client.execute(ApiRequest.get("/runs/r-1").withParam("include_messages", "true"), RawRun.class);

        assertEquals("r-1", run.getId());
        assertEquals("success", run.getStatus());
        assertEquals("ls-test-key", capturedApiKey.get());
        assertEquals("application/json", capturedContentType.get());
        assertEquals("include_messages=true", capturedQuery.get());
    }

    @Test
    void executeForTree_shouldPostJsonBody() {
        JsonNode node = client.executeForTree(ApiRequest.post("/runs/query", Map.of("is_root", true)));

        assertEquals("r-1", node.get("id").asText());
        assertEquals("{\"is_root\":true}", capturedBody.get());
    }

    @Test
    void execute_shouldRaiseApiExceptionWithStatusAndBody() {
        ApiException error = assertThrows(ApiException.class,
                () -> client.execute(ApiRequest.get("/runs/missing"), RawRun.class));

        assertEquals(404, error.getStatusCode());
        assertEquals("{\"detail\":\"Run not found\"}", error.getResponseBody());
    }

    @Test
    void execute_shouldFailBeforeNetworkWhenApiKeyMissing() {
        when(settingsResolver.apiKey()).thenThrow(new ConfigException("LANGSMITH_API_KEY not found"));

        assertThrows(ConfigException.class, () -> client.execute(ApiRequest.get("/runs/r-1"), RawRun.class));
        assertEquals(0, hits.get());
    }

    @Test
    void execute_shouldMapConnectionFailureToApiExceptionWithoutStatus() {
        server.stop(0);
        serverStopped = true;

        ApiException error = assertThrows(ApiException.class,
                () -> client.execute(ApiRequest.get("/runs/r-1"), RawRun.class));

        assertEquals(ApiException.NO_STATUS, error.getStatusCode());
    }

    @Test
    void pathWithQuery_shouldEncodeValues() {
        assertEquals("/sessions?name=my%20project%2Fa",
                ApiRequest.get("/sessions").withParam("name", "my project/a").pathWithQuery());
    }
}
