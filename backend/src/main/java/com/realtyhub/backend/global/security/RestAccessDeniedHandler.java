package com.realtyhub.backend.global.security;

import java.io.IOException;

import com.realtyhub.backend.global.error.ProblemResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

@Component
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final RestAuthenticationEntryPoint entryPoint;

    public RestAccessDeniedHandler(RestAuthenticationEntryPoint entryPoint) {
        this.entryPoint = entryPoint;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        entryPoint.writeProblem(response,
                ProblemResponse.of(HttpStatus.FORBIDDEN, "forbidden", "접근 권한이 없습니다.", request.getRequestURI()));
    }
}
