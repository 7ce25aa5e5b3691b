package world.willfrog.tracefetch.fetch.client;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次远端调用的描述：方法、路径、查询参数和可选 JSON body。
 */
public record ApiRequest(String method, String path, Map<String, String> params, Object body) {

    public ApiRequest {
        method = method == null || method.isBlank() ? "GET" : method;
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static ApiRequest get(String path) {
        return new ApiRequest("GET", path, Map.of(), null);
    }

    public static ApiRequest post(String path, Object body) {
        return new ApiRequest("POST", path, Map.of(), body);
    }

    public ApiRequest withParam(String key, String value) {
        Map<String, String> next = new LinkedHashMap<>(params);
        next.put(key, value);
        return new ApiRequest(method, path, next, body);
    }

    public String pathWithQuery() {
        if (params.isEmpty()) {
            return path;
        }
        StringBuilder sb = new StringBuilder(path).append('?');
        boolean first = true;
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (!first) {
                sb.append('&');
            }
            sb.append(encode(entry.getKey())).append('=').append(encode(entry.getValue()));
            first = false;
        }
        return sb.toString();
    }

    /**
     * 路径段 / 查询参数编码，空格编码为 %20。
     */
    public static String encode(String value) {
        if (value == null) {
            return "";
        }
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
