package com.bko.planner.refinement;

import com.bko.planner.config.PlannerProperties;
import com.bko.planner.execution.JsonProcessingService;
import com.bko.planner.execution.TaskPromptService;
import com.bko.planner.graph.TaskType;
import com.bko.planner.storage.ArtifactStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FilePromptArtifactStoreTest {

    @TempDir
    Path tempDir;

    private TaskPromptService promptService;
    private FilePromptArtifactStore store;
    private final RefinementKey key = new RefinementKey("CLABSI", TaskType.EVENT_SUMMARY);

    @BeforeEach
    void setUp() {
        PlannerProperties properties = new PlannerProperties();
        properties.getStorage().setOutputDir(tempDir.toString());
        ObjectMapper objectMapper = new ObjectMapper();
        promptService = new TaskPromptService(new JsonProcessingService(objectMapper));
        store = new FilePromptArtifactStore(new ArtifactStore(properties, objectMapper), promptService);
    }

    @Test
    void testMissingArtifactStartsFromBuiltInPrompt() {
        assertEquals(promptService.defaultTaskPrompt(TaskType.EVENT_SUMMARY).trim(), store.read(key));
    }

    @Test
    void testWrittenArtifactIsRead() throws Exception {
        store.write(key, "Summarize the line course.");

        assertEquals("Summarize the line course.", store.read(key));
        assertEquals("Summarize the line course.",
                Files.readString(tempDir.resolve("prompts/clabsi_event_summary.txt")));
    }

    @Test
    void testPathUsesSlug() {
        assertEquals("prompts/cauti_signal_enrichment.txt",
                FilePromptArtifactStore.path(new RefinementKey("CAUTI ", TaskType.SIGNAL_ENRICHMENT)));
    }
}
