package io.kartlink.bus;

@FunctionalInterface
public interface BusFrameHandler {
    void onFrame(BusFrame frame);
}
