package com.realtyhub.backend.modules.workflow;

import java.util.List;

/**
 * Outcome of a batch operation: items that succeeded, in input order, and one error per failed item.
 */
public record BulkResult<T>(List<T> succeeded, List<BulkItemError> errors) {

    public BulkResult {
        succeeded = List.copyOf(succeeded);
        errors = List.copyOf(errors);
    }

    public int successCount() {
        return succeeded.size();
    }

    public int failureCount() {
        return errors.size();
    }
}
