package com.flowb.social.service;

public enum DeliveryOutcome {
    SENT,
    SKIPPED,
    FAILED
}
