package world.willfrog.tracefetch.fetch.cli;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import world.willfrog.tracefetch.common.exception.ApiException;
import world.willfrog.tracefetch.common.exception.ConfigException;
import world.willfrog.tracefetch.common.pojo.trace.ThreadData;
import world.willfrog.tracefetch.common.pojo.trace.TraceData;
import world.willfrog.tracefetch.fetch.config.FetchSettingsResolver;
import world.willfrog.tracefetch.fetch.config.LocalConfigLoader;
import world.willfrog.tracefetch.fetch.config.TraceFetchProperties;
import world.willfrog.tracefetch.fetch.format.OutputFormat;
import world.willfrog.tracefetch.fetch.format.TraceOutputFormatter;
import world.willfrog.tracefetch.fetch.output.OutputWriter;
import world.willfrog.tracefetch.fetch.service.FetchThreadsOptions;
import world.willfrog.tracefetch.fetch.service.FetchTraceOptions;
import world.willfrog.tracefetch.fetch.service.FetchTracesOptions;
import world.willfrog.tracefetch.fetch.service.ProgressListener;
import world.willfrog.tracefetch.fetch.service.ProjectIdResolver;
import world.willfrog.tracefetch.fetch.service.TraceBatchService;
import world.willfrog.tracefetch.fetch.service.TraceFetchService;

import java.nio.file.Path;
import java.util.List;

/**
 * 命令行入口。
 * <p>
 * 支持的命令：
 * 1. trace &lt;id&gt;：单条 trace；
 * 2. thread &lt;id&gt;：单个 thread；
 * 3. traces [dir] / threads [dir]：批量拉取，给了目录则每条记录写一个 JSON 文件；
 * 4. config show：查看本地配置。
 * <p>
 * 结果写标准输出，提示和进度走日志（stderr）。失败时退出码为 1。
 */
@Component
@ConditionalOnProperty(prefix = "tracefetch.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class FetchCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int MAX_ERROR_BODY_CHARS = 500;

    private final TraceFetchService traceFetchService;
    private final TraceBatchService traceBatchService;
    private final ProjectIdResolver projectIdResolver;
    private final FetchSettingsResolver settingsResolver;
    private final LocalConfigLoader localConfigLoader;
    private final TraceOutputFormatter formatter;
    private final OutputWriter outputWriter;
    private final TraceFetchProperties properties;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            log.error(usage());
            return 1;
        }
        try {
            String command = positional.get(0);
            String argument = positional.size() > 1 ? positional.get(1) : null;
            return switch (command) {
                case "trace" -> runTrace(required(argument, "trace <id>"), args);
                case "thread" -> runThread(required(argument, "thread <id>"), args);
                case "traces" -> runTraces(argument, args);
                case "threads" -> runThreads(argument, args);
                case "config" -> runConfig(argument);
                default -> {
                    log.error("Unknown command: {}\n{}", command, usage());
                    yield 1;
                }
            };
        } catch (ConfigException e) {
            log.error("Configuration error: {}", e.getMessage());
        } catch (ApiException e) {
            log.error("API error ({}): {}", e.getStatusCode(), e.getMessage());
            String body = e.getResponseBody();
            if (body != null && !body.isEmpty()) {
                log.error("Response: {}", body.length() > MAX_ERROR_BODY_CHARS ? body.substring(0, MAX_ERROR_BODY_CHARS) : body);
            }
        } catch (RuntimeException e) {
            log.error("Error: {}", e.getMessage());
            log.debug("Command failed", e);
        }
        return 1;
    }

    private int runTrace(String traceId, ApplicationArguments args) {
        OutputFormat format = format(args);
        TraceData trace = traceFetchService.fetchTrace(traceId,
                new FetchTraceOptions(args.containsOption("include-metadata"), args.containsOption("include-feedback")));
        outputWriter.write(formatter.formatTrace(trace, format) + "\n", option(args, "file"));
        return 0;
    }

    private int runThread(String threadId, ApplicationArguments args) {
        String projectUuid = requireProject(option(args, "project-uuid"));
        OutputFormat format = format(args);
        ThreadData thread = traceFetchService.fetchThread(threadId, projectUuid);
        outputWriter.write(formatter.formatThread(thread, format) + "\n", option(args, "file"));
        return 0;
    }

    private int runTraces(String dir, ApplicationArguments args) {
        int limit = intOption(args, "limit", properties.getFetch().getTraceLimit());
        Path outputDir = dir == null ? null : outputWriter.prepareDirectory(dir, "trace");
        if (outputDir != null) {
            warnFormatIgnored(args);
            log.info("Fetching up to {} recent trace(s)...", limit);
        }
        List<TraceData> traces = traceBatchService.fetchTraces(FetchTracesOptions.builder()
                .limit(limit)
                .projectUuid(option(args, "project-uuid"))
                .lastNMinutes(integerOption(args, "last-n-minutes"))
                .since(option(args, "since"))
                .maxConcurrent(intOption(args, "max-concurrent", properties.getFetch().getMaxConcurrent()))
                .includeMetadata(args.containsOption("include-metadata"))
                .includeFeedback(args.containsOption("include-feedback"))
                .progressListener(progress(args, "trace"))
                .build());
        if (traces.isEmpty()) {
            log.error("No traces found.");
            return 1;
        }

        if (outputDir != null) {
            String pattern = optionOrDefault(args, "filename-pattern", "{trace_id}.json");
            log.info("Found {} trace(s). Saving to {}/", traces.size(), outputDir);
            for (int i = 0; i < traces.size(); i++) {
                TraceData trace = traces.get(i);
                String fileName = outputWriter.fileName(pattern, "trace_id", trace.getTraceId(), i + 1);
                outputWriter.writeToDirectory(outputDir, fileName, formatter.toJson(formatter.tracePayload(trace), true));
                log.info("  Saved {} to {} ({})", trace.getTraceId(), fileName, summary(trace));
            }
            log.info("Successfully saved {} trace(s) to {}/", traces.size(), outputDir);
            return 0;
        }

        OutputFormat format = format(args);
        String content = limit == 1 && traces.size() == 1
                ? formatter.formatTrace(traces.get(0), format)
                : formatter.formatBatch(traces.stream().map(formatter::tracePayload).toList(), format);
        outputWriter.write(content + "\n", option(args, "file"));
        return 0;
    }

    private int runThreads(String dir, ApplicationArguments args) {
        int limit = intOption(args, "limit", properties.getFetch().getThreadLimit());
        String projectUuid = requireProject(option(args, "project-uuid"));
        Path outputDir = dir == null ? null : outputWriter.prepareDirectory(dir, "thread");
        if (outputDir != null) {
            warnFormatIgnored(args);
            log.info("Fetching up to {} recent thread(s)...", limit);
        }
        List<ThreadData> threads = traceBatchService.fetchThreads(FetchThreadsOptions.builder()
                .limit(limit)
                .projectUuid(projectUuid)
                .lastNMinutes(integerOption(args, "last-n-minutes"))
                .since(option(args, "since"))
                .maxConcurrent(intOption(args, "max-concurrent", properties.getFetch().getMaxConcurrent()))
                .progressListener(progress(args, "thread"))
                .build());
        if (threads.isEmpty()) {
            log.error("No threads found.");
            return 1;
        }

        if (outputDir != null) {
            String pattern = optionOrDefault(args, "filename-pattern", "{thread_id}.json");
            log.info("Found {} thread(s). Saving to {}/", threads.size(), outputDir);
            for (int i = 0; i < threads.size(); i++) {
                ThreadData thread = threads.get(i);
                String fileName = outputWriter.fileName(pattern, "thread_id", thread.getThreadId(), i + 1);
                outputWriter.writeToDirectory(outputDir, fileName, formatter.toJson(thread.getMessages(), true));
                log.info("  Saved {} to {} ({} messages)", thread.getThreadId(), fileName, thread.getMessages().size());
            }
            log.info("Successfully saved {} thread(s) to {}/", threads.size(), outputDir);
            return 0;
        }

        OutputFormat format = format(args);
        String content = limit == 1 && threads.size() == 1
                ? formatter.formatThread(threads.get(0), format)
                : formatter.formatBatch(threads, format);
        outputWriter.write(content + "\n", option(args, "file"));
        return 0;
    }

    private int runConfig(String subCommand) {
        if (!"show".equals(subCommand)) {
            log.error("Unknown config command: {}. Available: config show", subCommand);
            return 1;
        }
        outputWriter.write(localConfigLoader.show(), null);
        return 0;
    }

    private String requireProject(String explicitUuid) {
        return projectIdResolver.resolve(explicitUuid)
                .orElseThrow(() -> new ConfigException(
                        "project-uuid required. Pass --project-uuid=<uuid> or set LANGSMITH_PROJECT_UUID / LANGSMITH_PROJECT"));
    }

    private ProgressListener progress(ApplicationArguments args, String itemKind) {
        return args.containsOption("no-progress") ? ProgressListener.NOOP : new LoggingProgressListener(itemKind);
    }

    private OutputFormat format(ApplicationArguments args) {
        String explicit = option(args, "format");
        return explicit == null ? settingsResolver.defaultFormat() : OutputFormat.parse(explicit);
    }

    private void warnFormatIgnored(ApplicationArguments args) {
        if (option(args, "format") != null) {
            log.warn("--format ignored in directory mode (files are always JSON)");
        }
    }

    private String summary(TraceData trace) {
        StringBuilder sb = new StringBuilder();
        sb.append(trace.getMessages() == null ? 0 : trace.getMessages().size()).append(" messages");
        if (trace.getMetadata() != null) {
            String status = trace.getMetadata().getStatus();
            sb.append(", status: ").append(status == null ? "unknown" : status);
        }
        int feedbackCount = trace.getFeedback() == null ? 0 : trace.getFeedback().size();
        if (feedbackCount > 0) {
            sb.append(", ").append(feedbackCount).append(" feedback");
        }
        return sb.toString();
    }

    private String required(String argument, String usage) {
        if (argument == null || argument.isBlank()) {
            throw new IllegalArgumentException("missing argument, usage: " + usage);
        }
        return argument;
    }

    private String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private String optionOrDefault(ApplicationArguments args, String name, String fallback) {
        String value = option(args, name);
        return value == null ? fallback : value;
    }

    private Integer integerOption(ApplicationArguments args, String name) {
        String value = option(args, name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer: " + value);
        }
    }

    private int intOption(ApplicationArguments args, String name, int fallback) {
        Integer value = integerOption(args, name);
        return value == null ? fallback : value;
    }

    private String usage() {
        return """
                Usage:
                  trace <id>      [--format=raw|json|pretty] [--file=path] [--include-metadata] [--include-feedback]
                  thread <id>     [--project-uuid=uuid] [--format=...] [--file=path]
                  traces [dir]    [--limit=n] [--last-n-minutes=n | --since=ts] [--project-uuid=uuid]
                                  [--max-concurrent=n] [--filename-pattern=p] [--include-metadata]
                                  [--include-feedback] [--format=...] [--file=path] [--no-progress]
                  threads [dir]   [--project-uuid=uuid] [--limit=n] [--last-n-minutes=n | --since=ts]
                                  [--max-concurrent=n] [--filename-pattern=p] [--format=...] [--file=path] [--no-progress]
                  config show""";
    }
}
