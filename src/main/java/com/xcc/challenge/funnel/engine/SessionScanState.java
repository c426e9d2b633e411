package com.xcc.challenge.funnel.engine;

import com.xcc.challenge.funnel.model.TimedEvent;

/**
 * Immutable state of the session scan. Each event yields the next state; the
 * event belongs to the {@code currentSession} of the state it produced.
 *
 * @param currentSession   last session id handed out, 0 before the first event
 * @param cumulativeGap    seconds accumulated since the current session started
 * @param previousCustomer customer of the previous event, null before the first event
 */
record SessionScanState(
        long currentSession,
        double cumulativeGap,
        String previousCustomer
) {

    static SessionScanState initial() {
        return new SessionScanState(0L, 0d, null);
    }

    /**
     * - New customer: new session
     * - Gap of a full timeout or more: new session
     * - Shorter gap: accumulate, and open a new session once the total exceeds the timeout.
     *   The excess is not carried into the new session.
     */
    SessionScanState next(TimedEvent event) {
        String customer = event.customerId();
        if (!customer.equals(previousCustomer)) {
            return startSession(customer);
        }

        double timeDiff = event.timeDiff();
        if (timeDiff >= SessionSegmenter.SESSION_TIMEOUT_SECONDS) {
            return startSession(customer);
        }

        double gap = cumulativeGap + timeDiff;
        if (gap > SessionSegmenter.SESSION_TIMEOUT_SECONDS) {
            return startSession(customer);
        }
        return new SessionScanState(currentSession, gap, customer);
    }

    private SessionScanState startSession(String customer) {
        return new SessionScanState(currentSession + 1, 0d, customer);
    }
}
