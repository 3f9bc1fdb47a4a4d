package com.realtyhub.backend.modules.workflow.presentation.dto;

import java.util.List;
import java.util.function.Function;

import com.realtyhub.backend.modules.workflow.BulkItemError;
import com.realtyhub.backend.modules.workflow.BulkResult;

public record BulkResponse<T>(
        int successCount,
        int failureCount,
        List<T> succeeded,
        List<BulkItemError> errors
) {

    public static <E, T> BulkResponse<T> from(BulkResult<E> result, Function<E, T> mapper) {
        return new BulkResponse<>(
                result.successCount(),
                result.failureCount(),
                result.succeeded().stream().map(mapper).toList(),
                result.errors()
        );
    }
}
