package in.fxsignal.service.signal;

/**
 * Stages of the signal pipeline, used to label rejections.
 */
public enum SignalGate {
    COOLDOWN,
    DATA,
    BREAKOUT,
    DIRECTION,
    STRENGTH,
    MOMENTUM,
    ENTRY_TIMING,
    RETEST,
    RISK;

    /**
     * Metric label.
     */
    public String label() {
        return name().toLowerCase();
    }
}
