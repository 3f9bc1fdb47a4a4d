package com.realtyhub.backend.modules.auth.application;

import java.util.Set;
import java.util.UUID;

import com.realtyhub.backend.global.common.PageQuery;
import com.realtyhub.backend.global.common.PageResponse;
import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.realtyhub.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Admin-facing user lookups.
 */
@Service
@Transactional(readOnly = true)
public class UserDirectoryService {

    private static final Set<String> SORTABLE = Set.of("createdAt", "email", "lastName");
    private static final Sort DEFAULT_SORT = Sort.by(Sort.Direction.DESC, "createdAt");

    private final AppUserRepository appUserRepository;
    private final RealtyhubProperties properties;

    public UserDirectoryService(AppUserRepository appUserRepository, RealtyhubProperties properties) {
        this.appUserRepository = appUserRepository;
        this.properties = properties;
    }

    public PageResponse<UserProfileResponse> listUsers(
            UserRole role,
            Boolean active,
            String search,
            Integer page,
            Integer size,
            String sort
    ) {
        PageQuery query = PageQuery.of(page, size, sort, SORTABLE, DEFAULT_SORT, properties.pagination());
        String searchPattern = (search == null || search.isBlank())
                ? null
                : "%" + search.trim().toLowerCase() + "%";
        return PageResponse.from(
                appUserRepository.search(role, active, searchPattern, query.toPageable()),
                UserProfileResponse::from
        );
    }

    public UserProfileResponse getUser(UUID userId) {
        return appUserRepository.findById(userId)
                .map(UserProfileResponse::from)
                .orElseThrow(() -> ProblemException.notFound("auth.user_not_found", "사용자를 찾을 수 없습니다."));
    }
}
