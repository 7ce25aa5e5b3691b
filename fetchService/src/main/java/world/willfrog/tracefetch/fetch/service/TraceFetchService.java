package world.willfrog.tracefetch.fetch.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.tracefetch.common.exception.ConfigException;
import world.willfrog.tracefetch.common.pojo.message.Message;
import world.willfrog.tracefetch.common.pojo.run.RawRun;
import world.willfrog.tracefetch.common.pojo.run.ThreadPreviewResponse;
import world.willfrog.tracefetch.common.pojo.trace.Feedback;
import world.willfrog.tracefetch.common.pojo.trace.RunMetadata;
import world.willfrog.tracefetch.common.pojo.trace.ThreadData;
import world.willfrog.tracefetch.common.pojo.trace.TraceData;
import world.willfrog.tracefetch.fetch.client.ApiRequest;
import world.willfrog.tracefetch.fetch.client.TraceApiClient;

import java.util.ArrayList;
import java.util.List;

/**
 * 单条 trace / thread 拉取。失败直接抛给调用方，批量场景的失败隔离在 {@link BulkFetchOrchestrator}。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TraceFetchService {

    private final TraceApiClient apiClient;
    private final RunMetadataExtractor metadataExtractor;
    private final MessageStreamParser messageStreamParser;
    private final FeedbackService feedbackService;

    /**
     * 拉取单条 trace。
     *
     * @param traceId trace（根 run）ID
     * @param options 是否附带元数据 / 反馈
     * @return trace 数据；两个开关都关闭时 metadata、feedback 为 null
     */
    public TraceData fetchTrace(String traceId, FetchTraceOptions options) {
        FetchTraceOptions opts = options == null ? FetchTraceOptions.messagesOnly() : options;
        RawRun run = apiClient.execute(
                ApiRequest.get("/runs/" + ApiRequest.encode(traceId)).withParam("include_messages", "true"),
                RawRun.class);
        if (run == null) {
            run = new RawRun();
        }

        TraceData.TraceDataBuilder result = TraceData.builder()
                .traceId(traceId)
                .messages(extractMessages(run));

        if (opts.needsMetadata()) {
            RunMetadata metadata = metadataExtractor.extract(run);
            List<Feedback> feedback = opts.includeFeedback() && metadataExtractor.hasFeedback(metadata)
                    ? feedbackService.fetchFeedback(traceId)
                    : List.of();
            result.metadata(metadata).feedback(feedback);
        }
        return result.build();
    }

    /**
     * 拉取单个 thread 的完整消息。
     *
     * @param threadId    thread 标识（metadata 里的 thread_id / session_id）
     * @param projectUuid 所属项目 UUID
     */
    public ThreadData fetchThread(String threadId, String projectUuid) {
        if (projectUuid == null || projectUuid.isBlank()) {
            throw new ConfigException("project-uuid required to fetch thread " + threadId);
        }
        ThreadPreviewResponse response = apiClient.execute(
                ApiRequest.get("/runs/threads/" + ApiRequest.encode(threadId))
                        .withParam("select", "all_messages")
                        .withParam("session_id", projectUuid),
                ThreadPreviewResponse.class);

        String blob = response == null || response.getPreviews() == null
                ? null
                : response.getPreviews().getAllMessages();
        return ThreadData.builder()
                .threadId(threadId)
                .messages(messageStreamParser.parse(blob))
                .build();
    }

    /**
     * 优先取 run 上直接带的 messages，没有再取 outputs.messages，不合并。
     */
    List<Message> extractMessages(RawRun run) {
        if (run.getMessages() != null) {
            return run.getMessages();
        }
        if (run.getOutputs() != null && run.getOutputs().getMessages() != null) {
            return run.getOutputs().getMessages();
        }
        return new ArrayList<>();
    }
}
