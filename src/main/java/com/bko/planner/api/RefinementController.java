package com.bko.planner.api;

import com.bko.planner.graph.TaskType;
import com.bko.planner.refinement.RefinementKey;
import com.bko.planner.refinement.RefinementResult;
import com.bko.planner.refinement.RefinementService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/refinements")
public class RefinementController {

    private final RefinementService refinementService;

    public RefinementController(RefinementService refinementService) {
        this.refinementService = refinementService;
    }

    /**
     * Runs a prompt refinement synchronously and returns its result. A run already in progress for
     * the same concern and task type is a conflict.
     */
    @PostMapping
    public RefinementResult refine(@Valid @RequestBody RefineRequest request) {
        RefinementKey key = key(request.concernId(), request.taskType());
        try {
            return refinementService.refine(key, request.batch());
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage(), ex);
        }
    }

    @GetMapping("/{concernId}/{taskType}")
    public RefinementResult lastResult(@PathVariable("concernId") String concernId,
                                       @PathVariable("taskType") String taskType) {
        RefinementKey key = key(concernId, taskType);
        return refinementService.lastResult(key)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No refinement history for " + key.slug()));
    }

    private static RefinementKey key(String concernId, String taskType) {
        try {
            return new RefinementKey(concernId, TaskType.fromKey(taskType));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }
}
