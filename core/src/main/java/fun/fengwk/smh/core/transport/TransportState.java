package fun.fengwk.smh.core.transport;

/**
 * Lifecycle of one SSE session transport. Transitions only move forward.
 *
 * @author fengwk
 */
public enum TransportState {

    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED

}
