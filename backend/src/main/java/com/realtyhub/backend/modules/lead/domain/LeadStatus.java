package com.realtyhub.backend.modules.lead.domain;

/**
 * 리드 진행 단계. Any status may follow any other; only CONTACTED carries a side effect.
 */
public enum LeadStatus {
    NEW,
    CONTACTED,
    QUALIFIED,
    CONVERTED,
    CLOSED
}
