package com.realtyhub.backend.global.common;

import java.util.Set;

import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.error.ProblemException;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * Normalized paging request: 1-based page, size clamped to the configured maximum, and a sort
 * expression such as {@code -requestedAt} restricted to an allow-list of properties.
 */
public record PageQuery(int page, int size, Sort sort) {

    public static PageQuery of(
            Integer page,
            Integer size,
            String sortExpression,
            Set<String> sortableProperties,
            Sort defaultSort,
            RealtyhubProperties.Pagination pagination
    ) {
        int resolvedPage = page == null || page < 1 ? 1 : page;
        int resolvedSize = size == null || size < 1 ? pagination.defaultSize() : Math.min(size, pagination.maxSize());
        return new PageQuery(resolvedPage, resolvedSize, parseSort(sortExpression, sortableProperties, defaultSort));
    }

    static Sort parseSort(String expression, Set<String> sortableProperties, Sort defaultSort) {
        if (expression == null || expression.isBlank()) {
            return defaultSort;
        }
        String trimmed = expression.trim();
        boolean descending = trimmed.startsWith("-");
        String property = descending ? trimmed.substring(1) : trimmed;
        if (!sortableProperties.contains(property)) {
            throw ProblemException.badRequest("pagination.invalid_sort", "정렬할 수 없는 필드입니다: " + property);
        }
        return descending ? Sort.by(property).descending() : Sort.by(property).ascending();
    }

    public Pageable toPageable() {
        return PageRequest.of(page - 1, size, sort);
    }
}
