package io.kartlink.bus;

/**
 * Port to the vehicle control bus.
 *
 * <p>Inbound frames are only delivered from inside {@link #process()}, on the
 * thread that calls it. Handlers must not block.
 */
public interface BusAdapter {
    /**
     * @return false when the command could not be framed or written
     */
    boolean sendCommand(BusCommand command);

    void registerHandler(HandlerKey key, BusFrameHandler handler);

    /**
     * Dispatches every frame received since the previous call.
     *
     * @return number of frames dispatched
     */
    int process();
}
