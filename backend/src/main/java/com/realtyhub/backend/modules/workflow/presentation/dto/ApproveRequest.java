package com.realtyhub.backend.modules.workflow.presentation.dto;

import jakarta.validation.constraints.Size;

public record ApproveRequest(@Size(max = 1000) String notes) {
}
