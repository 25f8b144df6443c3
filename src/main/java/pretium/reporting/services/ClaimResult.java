package pretium.reporting.services;

/**
 * Outcome of the {@code queued -> processing} compare-and-set. {@link #ALREADY_TAKEN} is a normal race outcome, not an
 * error.
 */
public enum ClaimResult {
    CLAIMED, ALREADY_TAKEN
}
