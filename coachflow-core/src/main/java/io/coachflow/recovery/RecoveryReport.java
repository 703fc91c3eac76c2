package io.coachflow.recovery;

/**
 * Outcome of a recovery pass, counted per participant.
 *
 * recovered     : participants with at least one non-terminal flow that recovered cleanly
 * skipped       : participants with no state or only terminal flows
 * errored       : participants whose recovery threw
 * timersRearmed : one-off timers re-armed from markers
 */
public record RecoveryReport(
        int recovered,
        int skipped,
        int errored,
        int timersRearmed
) {
    public static RecoveryReport empty() {
        return new RecoveryReport(0, 0, 0, 0);
    }

    public int total() {
        return recovered + skipped + errored;
    }
}
