package io.kartlink.uplink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link UplinkTransport} over the JDK WebSocket client.
 */
public final class WebSocketUplinkTransport implements UplinkTransport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUplinkTransport.class);
    private static final long SEND_TIMEOUT_MS = 30_000L;

    private final HttpClient http;

    public WebSocketUplinkTransport() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    public WebSocketUplinkTransport(HttpClient http) {
        this.http = http;
    }

    @Override
    public UplinkConnection connect(URI remote, Duration timeout) throws UplinkConnectionException {
        String scheme = remote.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("ws") || scheme.equalsIgnoreCase("wss"))) {
            throw new UplinkConnectionException("Unsupported uplink scheme: " + remote);
        }
        InboundListener listener = new InboundListener();
        CompletableFuture<WebSocket> opening = http.newWebSocketBuilder()
                .connectTimeout(timeout)
                .buildAsync(remote, listener);
        try {
            WebSocket ws = opening.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Uplink WebSocket opened to {}", remote);
            return new WebSocketConnection(ws, listener);
        } catch (TimeoutException e) {
            opening.cancel(true);
            throw new UplinkConnectionException("Timed out connecting to " + remote, e);
        } catch (ExecutionException e) {
            throw new UplinkConnectionException("Failed to connect to " + remote, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            opening.cancel(true);
            throw new UplinkConnectionException("Interrupted while connecting to " + remote, e);
        }
    }

    private static final class InboundListener implements WebSocket.Listener {
        private static final String CLOSED = "\u0000closed";

        private final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final AtomicReference<Throwable> failure = new AtomicReference<>();

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                messages.add(partial.toString());
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.info("Uplink WebSocket closed by peer: {} {}", statusCode, reason);
            markClosed();
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            failure.compareAndSet(null, error);
            markClosed();
        }

        void markClosed() {
            if (closed.compareAndSet(false, true)) {
                messages.add(CLOSED);
            }
        }
    }

    private static final class WebSocketConnection implements UplinkConnection {
        private final WebSocket ws;
        private final InboundListener inbound;

        private WebSocketConnection(WebSocket ws, InboundListener inbound) {
            this.ws = ws;
            this.inbound = inbound;
        }

        @Override
        public void send(String text) throws UplinkConnectionException {
            if (!isOpen()) {
                throw closedException();
            }
            try {
                ws.sendText(text, true).get(SEND_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                throw new UplinkConnectionException("Failed to send uplink batch", e.getCause());
            } catch (TimeoutException e) {
                throw new UplinkConnectionException("Timed out sending uplink batch", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UplinkConnectionException("Interrupted while sending uplink batch", e);
            }
        }

        @Override
        public String poll(long timeoutMs) throws UplinkConnectionException, InterruptedException {
            String message = inbound.messages.poll(Math.max(0L, timeoutMs), TimeUnit.MILLISECONDS);
            if (message == null) {
                return null;
            }
            if (message.equals(InboundListener.CLOSED)) {
                inbound.messages.add(InboundListener.CLOSED);
                throw closedException();
            }
            return message;
        }

        @Override
        public boolean isOpen() {
            return !inbound.closed.get() && !ws.isOutputClosed();
        }

        @Override
        public void close() {
            inbound.markClosed();
            if (!ws.isOutputClosed()) {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "collector closing")
                        .orTimeout(1, TimeUnit.SECONDS)
                        .whenComplete((w, e) -> ws.abort());
            } else {
                ws.abort();
            }
        }

        private UplinkConnectionException closedException() {
            Throwable cause = inbound.failure.get();
            return cause == null
                    ? new UplinkConnectionException("Uplink connection closed")
                    : new UplinkConnectionException("Uplink connection failed", cause);
        }
    }
}
