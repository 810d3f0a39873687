package com.hashfleet.monitor.broadcast;

/**
 * Fan-out of live updates to connected observers.
 */
public interface ReportBroadcaster {

    /**
     * Deliver an update to every current observer. Must not throw because of
     * a single observer's failure.
     */
    void publish(ReportUpdate update);
}
