package in.fxsignal.application.port.output;

/**
 * Delivery channel for formatted messages.
 */
public interface NotificationSink {

    /**
     * @return false if delivery failed. Must not throw.
     */
    boolean send(String text);
}
