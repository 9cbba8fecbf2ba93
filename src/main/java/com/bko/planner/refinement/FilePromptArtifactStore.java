package com.bko.planner.refinement;

import com.bko.planner.execution.TaskPromptService;
import com.bko.planner.storage.ArtifactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Prompt artifacts as text files under {@code prompts/}. A key with no stored artifact starts
 * from the built-in task prompt.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FilePromptArtifactStore implements PromptArtifactStore {

    private final ArtifactStore artifactStore;
    private final TaskPromptService promptService;

    @Override
    public String read(RefinementKey key) {
        return artifactStore.readText(path(key))
                .orElseGet(() -> promptService.defaultTaskPrompt(key.taskType()).trim());
    }

    @Override
    public void write(RefinementKey key, String prompt) {
        artifactStore.writeText(path(key), prompt);
        log.debug("Stored prompt artifact {}.", path(key));
    }

    static String path(RefinementKey key) {
        return "prompts/" + key.slug() + ".txt";
    }
}
