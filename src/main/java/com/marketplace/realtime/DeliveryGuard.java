package com.marketplace.realtime;

/**
 * Handed to a {@link ChangeEventListener} together with each event. Listeners run without the
 * subscription lock, so by the time a slow listener is ready to commit its result the session
 * may have been stopped or the subscription replaced.
 */
@FunctionalInterface
public interface DeliveryGuard {

    /** Commits unconditionally; for events that do not come from a managed subscription. */
    DeliveryGuard ALWAYS = action -> {
        action.run();
        return true;
    };

    /**
     * Runs {@code action} only while the subscription that delivered the event is still
     * current, atomically with respect to stop and reconnect.
     *
     * @return whether the action ran
     */
    boolean runIfCurrent(Runnable action);
}
