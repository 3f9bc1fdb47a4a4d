package com.realtyhub.backend.modules.workflow;

import java.util.UUID;

public record BulkItemError(UUID id, String code, String message) {
}
