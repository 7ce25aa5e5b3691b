package world.willfrog.tracefetch.fetch.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.tracefetch.common.exception.ConfigException;
import world.willfrog.tracefetch.common.pojo.run.RawRun;
import world.willfrog.tracefetch.common.pojo.run.RunsQueryResponse;
import world.willfrog.tracefetch.common.pojo.trace.ThreadData;
import world.willfrog.tracefetch.common.pojo.trace.TraceData;
import world.willfrog.tracefetch.fetch.client.ApiRequest;
import world.willfrog.tracefetch.fetch.client.TraceApiClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 批量拉取：先查询根 run 列表，再按 id 有界并发地逐条拉取。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TraceBatchService {

    static final String RUNS_QUERY_PATH = "/runs/query";

    private final TraceApiClient apiClient;
    private final RunQueryBuilder queryBuilder;
    private final ThreadIdCollector threadIdCollector;
    private final BulkFetchOrchestrator orchestrator;
    private final TraceFetchService traceFetchService;
    private final ProjectIdResolver projectIdResolver;

    /**
     * 拉取最近的若干条 trace。查询结果为空时返回空列表。
     *
     * @throws IllegalArgumentException 时间窗口参数非法（在任何网络请求之前）
     */
    public List<TraceData> fetchTraces(FetchTracesOptions options) {
        TimeWindow window = TimeWindow.of(options.getLastNMinutes(), options.getSince());
        String projectUuid = projectIdResolver.resolve(options.getProjectUuid()).orElse(null);

        Map<String, Object> body = queryBuilder.forTraces(options.getLimit(), projectUuid, window);
        List<RawRun> runs = queryRuns(body);
        if (runs.isEmpty()) {
            log.info("No root runs matched (project={})", projectUuid);
            return new ArrayList<>();
        }

        // 查询返回几条就拉几条，重复 id 不合并
        List<String> traceIds = new ArrayList<>(runs.size());
        for (RawRun run : runs) {
            if (run != null && run.getId() != null) {
                traceIds.add(run.getId());
            }
        }
        FetchTraceOptions traceOptions = new FetchTraceOptions(options.isIncludeMetadata(), options.isIncludeFeedback());
        return orchestrator.fetchAll(
                traceIds,
                options.getMaxConcurrent(),
                traceId -> traceFetchService.fetchTrace(traceId, traceOptions),
                options.getProgressListener(),
                "trace");
    }

    /**
     * 拉取项目下最近的若干个 thread。
     *
     * @throws ConfigException 无法确定项目 UUID
     */
    public List<ThreadData> fetchThreads(FetchThreadsOptions options) {
        TimeWindow window = TimeWindow.of(options.getLastNMinutes(), options.getSince());
        String projectUuid = projectIdResolver.resolve(options.getProjectUuid())
                .orElseThrow(() -> new ConfigException(
                        "project-uuid required for fetching threads. Pass --project-uuid or set LANGSMITH_PROJECT_UUID / LANGSMITH_PROJECT"));

        List<RawRun> runs = queryRuns(queryBuilder.forThreads(projectUuid, window));
        List<String> threadIds = threadIdCollector.collect(runs, options.getLimit());
        if (threadIds.isEmpty()) {
            log.info("No threads found in project {} ({} root runs scanned)", projectUuid, runs.size());
            return new ArrayList<>();
        }
        return orchestrator.fetchAll(
                threadIds,
                options.getMaxConcurrent(),
                threadId -> traceFetchService.fetchThread(threadId, projectUuid),
                options.getProgressListener(),
                "thread");
    }

    private List<RawRun> queryRuns(Map<String, Object> body) {
        RunsQueryResponse response = apiClient.execute(ApiRequest.post(RUNS_QUERY_PATH, body), RunsQueryResponse.class);
        if (response == null || response.getRuns() == null) {
            return new ArrayList<>();
        }
        return response.getRuns();
    }
}
