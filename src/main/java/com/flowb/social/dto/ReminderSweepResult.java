package com.flowb.social.dto;

import lombok.Data;

/**
 * Counts from one reminder sweep.
 * {@code waiting} rows were outside the window and stay unsent,
 * {@code consumed} rows were marked sent without a message going out.
 */
@Data
public class ReminderSweepResult {
    private int scanned;
    private int sent;
    private int consumed;
    private int waiting;
}
