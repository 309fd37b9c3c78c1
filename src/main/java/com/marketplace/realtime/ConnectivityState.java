package com.marketplace.realtime;

/**
 * Aggregate connectivity of a session's subscriptions.
 *
 * <ul>
 *   <li>IDLE -- not started, or stopped</li>
 *   <li>CONNECTING -- handles opening, none failed yet</li>
 *   <li>CONNECTED -- every handle reports CONNECTED</li>
 *   <li>DISCONNECTED -- at least one handle lost; automatic recovery in progress</li>
 *   <li>OFFLINE -- retries exhausted; only {@code reconnect()} resumes</li>
 * </ul>
 */
public enum ConnectivityState {
    IDLE,
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    OFFLINE
}
