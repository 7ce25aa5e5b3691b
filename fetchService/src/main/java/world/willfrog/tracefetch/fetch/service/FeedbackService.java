package world.willfrog.tracefetch.fetch.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.tracefetch.common.exception.ApiException;
import world.willfrog.tracefetch.common.pojo.trace.Feedback;
import world.willfrog.tracefetch.fetch.client.ApiRequest;
import world.willfrog.tracefetch.fetch.client.TraceApiClient;

import java.util.List;

/**
 * 反馈查询，尽力而为：任何失败都记 warn 并返回空列表，不影响 trace 本身的拉取。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeedbackService {

    private static final TypeReference<List<Feedback>> FEEDBACK_LIST = new TypeReference<>() {
    };

    private final TraceApiClient apiClient;
    private final ObjectMapper objectMapper;

    public List<Feedback> fetchFeedback(String runId) {
        try {
            JsonNode root = apiClient.executeForTree(ApiRequest.get("/feedback").withParam("run_id", runId));
            // 兼容两种返回：裸数组，或 {"feedback": [...]}
            JsonNode items = root != null && root.isArray() ? root : root == null ? null : root.get("feedback");
            if (items == null || !items.isArray()) {
                return List.of();
            }
            return objectMapper.convertValue(items, FEEDBACK_LIST);
        } catch (ApiException e) {
            log.warn("Failed to fetch feedback for run {}: {}", runId, e.getStatusCode());
            return List.of();
        } catch (RuntimeException e) {
            log.warn("Failed to fetch feedback for run {}: {}", runId, e.getMessage());
            return List.of();
        }
    }
}
