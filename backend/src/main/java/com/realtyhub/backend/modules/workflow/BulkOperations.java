package com.realtyhub.backend.modules.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

import com.realtyhub.backend.global.error.ProblemException;

/**
 * Sequential batch runner. Domain failures ({@link ProblemException}) are collected per item;
 * anything else aborts the batch.
 */
public final class BulkOperations {

    private BulkOperations() {
    }

    public static <T> BulkResult<T> forEach(List<UUID> ids, Function<UUID, T> operation) {
        List<T> succeeded = new ArrayList<>();
        List<BulkItemError> errors = new ArrayList<>();
        for (UUID id : ids) {
            try {
                succeeded.add(operation.apply(id));
            } catch (ProblemException ex) {
                errors.add(new BulkItemError(id, ex.getCode(), ex.getDetailMessage()));
            }
        }
        return new BulkResult<>(succeeded, errors);
    }
}
