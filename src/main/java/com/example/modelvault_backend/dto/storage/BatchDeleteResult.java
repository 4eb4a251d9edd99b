package com.example.modelvault_backend.dto.storage;

import java.util.List;

/**
 * Per-key outcome of a batch delete. Keys are independent; there is no all-or-nothing guarantee.
 */
public record BatchDeleteResult(List<DeleteOutcome> outcomes) {

    public BatchDeleteResult {
        outcomes = List.copyOf(outcomes);
    }

    public boolean allSucceeded() {
        return outcomes.stream().noneMatch(DeleteOutcome::failed);
    }

    public long failedCount() {
        return outcomes.stream().filter(DeleteOutcome::failed).count();
    }

    public List<String> failedKeys() {
        return outcomes.stream().filter(DeleteOutcome::failed).map(DeleteOutcome::key).toList();
    }
}
