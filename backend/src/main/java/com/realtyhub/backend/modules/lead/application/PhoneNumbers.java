package com.realtyhub.backend.modules.lead.application;

import com.realtyhub.backend.global.error.ProblemException;

public final class PhoneNumbers {

    static final int MIN_DIGITS = 10;
    static final int MAX_DIGITS = 15;

    private PhoneNumbers() {
    }

    /**
     * Keeps digits only. {@code "(555) 123-4567"} becomes {@code "5551234567"}.
     *
     * @throws ProblemException 400 {@code lead.invalid_phone} unless 10 to 15 digits remain
     */
    public static String normalize(String raw) {
        String digits = raw == null ? "" : raw.replaceAll("\\D", "");
        if (digits.length() < MIN_DIGITS || digits.length() > MAX_DIGITS) {
            throw ProblemException.badRequest("lead.invalid_phone", "전화번호는 숫자 10~15자리여야 합니다.");
        }
        return digits;
    }
}
