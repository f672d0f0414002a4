package io.kartlink.bus;

import io.kartlink.protocol.ProtocolCatalog;
import io.kartlink.protocol.ProtocolIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bus adapter without hardware behind it. Outbound commands are resolved
 * against the catalog and the most recent ones are kept; inbound frames are queued by
 * {@link #inject(BusFrame)} and dispatched on the next {@link #process()}.
 *
 * <p>Used when the collector runs on a host with no bus attached, and as the
 * bus seam in tests.
 */
public final class InMemoryBusAdapter implements BusAdapter {
    private static final Logger log = LoggerFactory.getLogger(InMemoryBusAdapter.class);
    public static final int DEFAULT_SENT_HISTORY = 256;

    private final ProtocolCatalog catalog;
    private final int localNodeId;
    private final Queue<BusFrame> inbound = new ConcurrentLinkedQueue<>();
    private final List<Registration> handlers = new CopyOnWriteArrayList<>();
    private final Deque<SentFrame> sent = new ArrayDeque<>();
    private final AtomicLong sentCount = new AtomicLong();
    private final int sentHistory;

    public InMemoryBusAdapter(ProtocolCatalog catalog, int localNodeId) {
        this(catalog, localNodeId, DEFAULT_SENT_HISTORY);
    }

    /**
     * @param sentHistory how many of the most recent outbound frames {@link #sent()} keeps
     */
    public InMemoryBusAdapter(ProtocolCatalog catalog, int localNodeId, int sentHistory) {
        if (sentHistory < 0) {
            throw new IllegalArgumentException("sentHistory must not be negative");
        }
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.localNodeId = localNodeId;
        this.sentHistory = sentHistory;
    }

    @Override
    public boolean sendCommand(BusCommand command) {
        OptionalInt messageType = catalog.messageTypeId(command.messageType());
        OptionalInt componentType = catalog.componentTypeId(command.componentType());
        OptionalInt componentId = catalog.componentId(command.componentType(), command.componentName());
        OptionalInt commandId = catalog.commandId(command.componentType(), command.commandName());
        OptionalInt valueType = catalog.valueTypeId(command.valueType());
        if (messageType.isEmpty() || componentType.isEmpty() || componentId.isEmpty()
                || commandId.isEmpty() || valueType.isEmpty()) {
            log.warn("Dropping bus command with unresolved names: {}", command);
            return false;
        }
        BusFrame frame = new BusFrame(
                localNodeId,
                messageType.getAsInt(),
                componentType.getAsInt(),
                componentId.getAsInt(),
                commandId.getAsInt(),
                valueType.getAsInt(),
                command.value(),
                command.delayMs()
        );
        int destination = command.destination().orElse(ProtocolIds.GROUP_ALL);
        sentCount.incrementAndGet();
        synchronized (sent) {
            sent.addLast(new SentFrame(destination, frame, command));
            while (sent.size() > sentHistory) {
                sent.removeFirst();
            }
        }
        log.debug("Sent bus frame to node {}: {}", destination, frame);
        return true;
    }

    @Override
    public void registerHandler(HandlerKey key, BusFrameHandler handler) {
        handlers.add(new Registration(Objects.requireNonNull(key, "key"), Objects.requireNonNull(handler, "handler")));
    }

    @Override
    public int process() {
        int dispatched = 0;
        BusFrame frame;
        while ((frame = inbound.poll()) != null) {
            dispatched++;
            for (Registration r : handlers) {
                if (!r.key().matches(frame)) {
                    continue;
                }
                try {
                    r.handler().onFrame(frame);
                } catch (RuntimeException e) {
                    log.error("Bus handler failed for frame {}", frame, e);
                }
            }
        }
        return dispatched;
    }

    public void inject(BusFrame frame) {
        inbound.add(Objects.requireNonNull(frame, "frame"));
    }

    /**
     * Most recent outbound frames, oldest first.
     */
    public List<SentFrame> sent() {
        synchronized (sent) {
            return List.copyOf(sent);
        }
    }

    public List<SentFrame> sentWithCommand(int componentType, int commandId) {
        List<SentFrame> out = new ArrayList<>();
        for (SentFrame s : sent()) {
            if (s.frame().componentType() == componentType && s.frame().commandId() == commandId) {
                out.add(s);
            }
        }
        return out;
    }

    /**
     * Total frames sent since construction, including those no longer kept.
     */
    public long sentCount() {
        return sentCount.get();
    }

    public void clearSent() {
        synchronized (sent) {
            sent.clear();
        }
    }

    public record SentFrame(int destinationNode, BusFrame frame, BusCommand command) {}

    private record Registration(HandlerKey key, BusFrameHandler handler) {}
}
