package com.example.interviewreminder.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Interview modality, shown in the reminder body.
 */
@Getter
@RequiredArgsConstructor
public enum InterviewType {

    PHONE("Phone interview"),

    VIDEO("Video interview"),

    ONSITE("On-site interview");

    private final String displayName;
}
