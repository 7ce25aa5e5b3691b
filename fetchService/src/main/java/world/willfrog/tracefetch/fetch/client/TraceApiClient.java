package world.willfrog.tracefetch.fetch.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.tracefetch.common.exception.ApiException;
import world.willfrog.tracefetch.common.exception.TraceFetchException;
import world.willfrog.tracefetch.fetch.config.FetchSettingsResolver;
import world.willfrog.tracefetch.fetch.config.TraceFetchProperties;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * 远端 tracing 服务的唯一出口。
 *
 * <p>每个请求都带上 X-API-Key 和 JSON Content-Type；非 2xx 统一转成 {@link ApiException}，
 * 响应体无论成功失败都完整读出，便于排查。</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TraceApiClient {

    public static final String API_KEY_HEADER = "X-API-Key";

    private final HttpClient traceHttpClient;
    private final ObjectMapper objectMapper;
    private final FetchSettingsResolver settingsResolver;
    private final TraceFetchProperties properties;

    public <T> T execute(ApiRequest request, Class<T> responseType) {
        String body = send(request);
        try {
            return objectMapper.readValue(body, responseType);
        } catch (IOException e) {
            throw new TraceFetchException("response parse failed: " + request.method() + " " + request.path(), e);
        }
    }

    public <T> T execute(ApiRequest request, TypeReference<T> responseType) {
        String body = send(request);
        try {
            return objectMapper.readValue(body, responseType);
        } catch (IOException e) {
            throw new TraceFetchException("response parse failed: " + request.method() + " " + request.path(), e);
        }
    }

    public JsonNode executeForTree(ApiRequest request) {
        String body = send(request);
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new TraceFetchException("response parse failed: " + request.method() + " " + request.path(), e);
        }
    }

    /**
     * 发出请求并返回响应体文本。
     *
     * @throws ApiException 非 2xx，或网络层失败（statusCode = -1）
     */
    public String send(ApiRequest request) {
        // 先取凭证：缺 key 时在发请求前就失败
        String apiKey = settingsResolver.apiKey();
        String url = settingsResolver.baseUrl() + request.pathWithQuery();
        HttpRequest httpRequest = buildRequest(request, url, apiKey);

        long startedAt = System.currentTimeMillis();
        HttpResponse<String> response;
        try {
            response = traceHttpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException("API request interrupted: " + request.method() + " " + request.path(), e);
        } catch (IOException e) {
            throw new ApiException("API request failed: " + request.method() + " " + request.path() + " → " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - startedAt;
        int status = response.statusCode();
        log.debug("{} {} -> {} ({}ms)", request.method(), url, status, elapsed);

        String body = response.body() == null ? "" : response.body();
        if (status < 200 || status >= 300) {
            throw new ApiException("API request failed: " + request.method() + " " + request.path() + " → " + status, status, body);
        }
        return body;
    }

    private HttpRequest buildRequest(ApiRequest request, String url, String apiKey) {
        int timeoutSeconds = properties.getHttp().getRequestTimeoutSeconds();
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds > 0 ? timeoutSeconds : 60))
                .header(API_KEY_HEADER, apiKey)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
        if (request.body() == null) {
            return builder.method(request.method(), HttpRequest.BodyPublishers.noBody()).build();
        }
        String payload;
        try {
            payload = request.body() instanceof String text ? text : objectMapper.writeValueAsString(request.body());
        } catch (IOException e) {
            throw new TraceFetchException("request body serialization failed: " + request.path(), e);
        }
        return builder.method(request.method(), HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8)).build();
    }
}
