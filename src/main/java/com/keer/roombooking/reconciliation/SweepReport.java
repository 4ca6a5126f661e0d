package com.keer.roombooking.reconciliation;

public record SweepReport(int completed, int remindersSent, int reminderFailures) {
}
