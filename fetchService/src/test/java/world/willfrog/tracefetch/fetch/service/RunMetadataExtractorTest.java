package world.willfrog.tracefetch.fetch.service;

import org.junit.jupiter.api.Test;
import world.willfrog.tracefetch.common.pojo.run.RawRun;
import world.willfrog.tracefetch.common.pojo.trace.RunMetadata;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunMetadataExtractorTest {

    private final RunMetadataExtractor extractor = new RunMetadataExtractor();

    @Test
    void extract_shouldComputeDurationAndCopyCounters() {
        RawRun run = new RawRun();
        run.setId("r1");
        run.setStatus("success");
        run.setStartTime("2025-01-01T00:00:00Z");
        run.setEndTime("2025-01-01T00:00:01Z");
        run.setPromptTokens(10L);
        run.setTotalCost(0.0123);
        RawRun.Extra extra = new RawRun.Extra();
        extra.setMetadata(Map.of("thread_id", "t-1"));
        run.setExtra(extra);

        RunMetadata metadata = extractor.extract(run);

        assertEquals("success", metadata.getStatus());
        assertEquals(1000L, metadata.getDurationMs());
        assertEquals("t-1", metadata.getCustomMetadata().get("thread_id"));
        assertEquals(10L, metadata.getTokenUsage().getPromptTokens());
        assertNull(metadata.getTokenUsage().getCompletionTokens());
        assertEquals(0.0123, metadata.getCosts().getTotalCost());
        assertNull(metadata.getCosts().getPromptCost());
    }

    @Test
    void extract_shouldLeaveDurationNullWhenEndMissingOrUnparseable() {
        RawRun run = new RawRun();
        run.setStartTime("2025-01-01T00:00:00Z");
        assertNull(extractor.extract(run).getDurationMs());

        run.setEndTime("not-a-time");
        assertNull(extractor.extract(run).getDurationMs());
    }

    @Test
    void extract_shouldUseEmptyMapsWhenExtraAndStatsMissing() {
        RunMetadata metadata = extractor.extract(new RawRun());

        assertNotNull(metadata.getCustomMetadata());
        assertTrue(metadata.getCustomMetadata().isEmpty());
        assertNotNull(metadata.getFeedbackStats());
        assertTrue(metadata.getFeedbackStats().isEmpty());
        assertFalse(metadata.getTokenUsage().hasAny());
        assertFalse(metadata.getCosts().hasAny());
    }

    @Test
    void durationMs_shouldTreatZoneLessTimestampsAsUtc() {
        assertEquals(1500L, extractor.durationMs("2025-01-01T00:00:00", "2025-01-01T00:00:01.500000Z"));
    }

    @Test
    void hasFeedback_shouldRequireSomePositiveNumber() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("correctness", 0);
        stats.put("note", "many");
        RunMetadata metadata = RunMetadata.builder().feedbackStats(stats).build();
        assertFalse(extractor.hasFeedback(metadata));

        stats.put("helpfulness", 0.5);
        assertTrue(extractor.hasFeedback(metadata));

        assertFalse(extractor.hasFeedback(RunMetadata.builder().feedbackStats(Map.of()).build()));
        assertFalse(extractor.hasFeedback(null));
    }
}
