package com.mirrorwatch.watch.model;

public record AccountCheckResult(
    String alias,
    String handle,
    AccountCheckOutcome outcome,
    int fetchedCount,
    int newCount,
    int staleCount,
    int suppressedCount,
    int enqueuedTaskCount,
    String endpoint,
    String reasonCode
) {
    public static AccountCheckResult skipped(TrackedAccount account, AccountCheckOutcome outcome, String reasonCode) {
        return new AccountCheckResult(account.alias(), account.handle(), outcome, 0, 0, 0, 0, 0, null, reasonCode);
    }

    public boolean isSuccessful() {
        return outcome == AccountCheckOutcome.CHECKED;
    }
}
