package io.github.drompincen.agentlink.runtime.connection;

import io.github.drompincen.agentlink.protocol.api.ConnectionParams;
import io.github.drompincen.agentlink.runtime.queue.FrameQueue;

import java.util.concurrent.CompletableFuture;

/**
 * One transport handle plus the parameters it was opened with. Each connection owns its own
 * frame queue; the queue is closed when the connection closes.
 */
public class Connection {

    private final long generation;
    private final ConnectionParams params;
    private final FrameQueue queue = new FrameQueue();
    private final CompletableFuture<Connection> opened = new CompletableFuture<>();
    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile Transport transport;
    private volatile String sessionId;
    private boolean transportOpened;
    private boolean handshakeClaimed;

    public Connection(long generation, ConnectionParams params) {
        this.generation = generation;
        this.params = params;
        this.sessionId = params.sessionId();
    }

    public long generation() { return generation; }
    public ConnectionParams params() { return params; }
    public FrameQueue queue() { return queue; }
    public ConnectionState state() { return state; }
    public Transport transport() { return transport; }

    /** The authoritative session id: the requested one until the remote side confirms or replaces it. */
    public String sessionId() { return sessionId; }

    public boolean isOpen() {
        Transport t = transport;
        return state == ConnectionState.OPEN && t != null && t.isOpen();
    }

    /** Completes when the transport opens; fails if it closes first. */
    public CompletableFuture<Connection> whenOpen() {
        return opened;
    }

    /**
     * The transport may report open before the factory returned it. Whichever of attach and
     * {@link #transportOpened()} comes second claims the handshake.
     *
     * @return true when the caller must run the handshake
     */
    synchronized boolean attach(Transport transport) {
        this.transport = transport;
        return claimHandshake();
    }

    /** @return true when the caller must run the handshake */
    synchronized boolean transportOpened() {
        transportOpened = true;
        return claimHandshake();
    }

    private boolean claimHandshake() {
        if (transport == null || !transportOpened || handshakeClaimed) return false;
        handshakeClaimed = true;
        return true;
    }

    boolean markOpen() {
        if (state == ConnectionState.CLOSED) return false;
        state = ConnectionState.OPEN;
        return true;
    }

    /** Releases senders waiting in {@link #whenOpen()}; called once the handshake frames are out. */
    void completeOpen() {
        opened.complete(this);
    }

    void markClosed(String reason) {
        state = ConnectionState.CLOSED;
        queue.close();
        opened.completeExceptionally(new IllegalStateException("Connection closed: " + reason));
    }

    void assignSessionId(String id) {
        this.sessionId = id;
    }

    @Override
    public String toString() {
        return "Connection{gen=" + generation + ", session=" + sessionId + ", state=" + state + "}";
    }
}
