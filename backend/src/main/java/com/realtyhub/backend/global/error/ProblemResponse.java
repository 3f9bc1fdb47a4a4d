package com.realtyhub.backend.global.error;

import org.springframework.http.HttpStatus;

public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    private static final String TYPE_PREFIX = "https://realtyhub.app/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                TYPE_PREFIX + ProblemException.normalize(safeCode),
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                safeDetail,
                instance,
                safeCode
        );
    }

    public static ProblemResponse from(ProblemException ex, String instance) {
        return of(ex.getHttpStatus(), ex.getCode(), ex.getDetailMessage(), instance);
    }
}
