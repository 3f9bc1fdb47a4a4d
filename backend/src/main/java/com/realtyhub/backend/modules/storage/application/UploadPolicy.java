package com.realtyhub.backend.modules.storage.application;

import java.util.List;

import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.error.ProblemException;

import org.springframework.stereotype.Component;

/**
 * Content-type and size limits for uploaded files ({@code realtyhub.storage.*}).
 */
@Component
public class UploadPolicy {

    private final List<String> allowedContentTypes;
    private final long maxFileSize;

    public UploadPolicy(RealtyhubProperties properties) {
        this.allowedContentTypes = List.copyOf(properties.storage().allowedContentTypes());
        this.maxFileSize = properties.storage().maxFileSize();
    }

    public void check(String fileName, String contentType, long size) {
        if (contentType == null || !allowedContentTypes.contains(contentType.toLowerCase())) {
            throw ProblemException.badRequest("storage.unsupported_type",
                    "허용되지 않는 파일 형식입니다: " + fileName);
        }
        if (size <= 0) {
            throw ProblemException.badRequest("storage.empty_file", "빈 파일은 업로드할 수 없습니다: " + fileName);
        }
        if (size > maxFileSize) {
            throw ProblemException.badRequest("storage.file_too_large",
                    "파일 크기가 " + maxFileSize + " 바이트를 초과합니다: " + fileName);
        }
    }
}
