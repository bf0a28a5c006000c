package com.example.interviewreminder.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Participants of an interview who receive a reminder.
 * Every interview produces exactly one reminder job per role.
 */
@Getter
@RequiredArgsConstructor
public enum RecipientRole {

    /**
     * The person being interviewed
     */
    CANDIDATE("candidate", "Candidate"),

    /**
     * The reviewer who owns the interview
     */
    INTERVIEWER("interviewer", "Interviewer");

    private final String code;
    private final String displayName;

    public static RecipientRole fromCode(String code) {
        for (var role : values()) {
            if (role.getCode().equals(code)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown recipient role code: " + code);
    }
}
