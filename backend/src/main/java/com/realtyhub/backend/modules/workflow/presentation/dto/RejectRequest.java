package com.realtyhub.backend.modules.workflow.presentation.dto;

/**
 * Reason is validated by the workflow itself so HTTP and programmatic callers get the same error code.
 */
public record RejectRequest(String reason, String notes) {
}
