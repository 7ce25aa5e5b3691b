package world.willfrog.tracefetch.fetch.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.tracefetch.common.exception.ApiException;
import world.willfrog.tracefetch.common.pojo.trace.Feedback;
import world.willfrog.tracefetch.fetch.client.ApiRequest;
import world.willfrog.tracefetch.fetch.client.TraceApiClient;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeedbackServiceTest {

    @Mock
    private TraceApiClient apiClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FeedbackService service;

    @BeforeEach
    void setUp() {
        service = new FeedbackService(apiClient, objectMapper);
    }

    @Test
    void fetchFeedback_shouldAcceptBareArray() throws Exception {
        when(apiClient.executeForTree(any(ApiRequest.class))).thenReturn(objectMapper.readTree(
                "[{\"id\":\"f1\",\"key\":\"correctness\",\"score\":1,\"created_at\":\"2025-01-01T00:00:00Z\",\"extra\":true}]"));

        List<Feedback> feedback = service.fetchFeedback("r-1");

        assertEquals(1, feedback.size());
        assertEquals("correctness", feedback.get(0).getKey());
        assertEquals(1.0, feedback.get(0).getScore());
        assertEquals("2025-01-01T00:00:00Z", feedback.get(0).getCreatedAt());
    }

    @Test
    void fetchFeedback_shouldAcceptWrappedList() throws Exception {
        when(apiClient.executeForTree(any(ApiRequest.class))).thenReturn(objectMapper.readTree(
                "{\"feedback\":[{\"key\":\"a\",\"value\":\"good\"},{\"key\":\"b\",\"correction\":{\"text\":\"x\"}}]}"));

        List<Feedback> feedback = service.fetchFeedback("r-1");

        assertEquals(2, feedback.size());
        assertEquals("good", feedback.get(0).getValue());
    }

    @Test
    void fetchFeedback_shouldCollapseFailuresToEmptyList() throws Exception {
        when(apiClient.executeForTree(any(ApiRequest.class)))
                .thenThrow(new ApiException("API request failed", 500, "oops"))
                .thenReturn(objectMapper.readTree("{\"unexpected\":1}"));

        assertTrue(service.fetchFeedback("r-1").isEmpty());
        assertTrue(service.fetchFeedback("r-1").isEmpty());
    }
}
