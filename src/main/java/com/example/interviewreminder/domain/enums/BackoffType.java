package com.example.interviewreminder.domain.enums;

/**
 * How the delay between attempts grows.
 */
public enum BackoffType {
    FIXED,
    EXPONENTIAL
}
