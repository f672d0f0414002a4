package io.kartlink.uplink;

/**
 * One open, message-oriented connection to the remote collector.
 *
 * <p>{@link #send(String)} and {@link #poll(long)} may be called from
 * different threads; each is only ever called from one thread at a time.
 */
public interface UplinkConnection extends AutoCloseable {
    void send(String text) throws UplinkConnectionException;

    /**
     * Waits up to {@code timeoutMs} for the next inbound text message.
     *
     * @return the message, or null if none arrived in time
     * @throws UplinkConnectionException if the connection is closed or failed
     */
    String poll(long timeoutMs) throws UplinkConnectionException, InterruptedException;

    boolean isOpen();

    @Override
    void close();
}
