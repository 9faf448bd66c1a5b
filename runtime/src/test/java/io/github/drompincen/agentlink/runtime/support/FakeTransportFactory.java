package io.github.drompincen.agentlink.runtime.support;

import io.github.drompincen.agentlink.runtime.connection.Transport;
import io.github.drompincen.agentlink.runtime.connection.TransportFactory;
import io.github.drompincen.agentlink.runtime.connection.TransportListener;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every opened transport. Tests drive the listener callbacks by hand.
 */
public class FakeTransportFactory implements TransportFactory {

    private final List<FakeTransport> opened = new CopyOnWriteArrayList<>();
    private volatile boolean acceptDuringOpen;

    @Override
    public Transport open(URI target, TransportListener listener) {
        FakeTransport transport = new FakeTransport(target, listener);
        opened.add(transport);
        if (acceptDuringOpen) {
            transport.accept();
        }
        return transport;
    }

    /** The handshake completes before {@link #open} returns its transport. */
    public void acceptDuringOpen() {
        this.acceptDuringOpen = true;
    }

    public List<FakeTransport> opened() {
        return opened;
    }

    public FakeTransport last() {
        return opened.get(opened.size() - 1);
    }

    public int count() {
        return opened.size();
    }

    public static class FakeTransport implements Transport {
        private final URI target;
        private final TransportListener listener;
        private final List<String> sent = new CopyOnWriteArrayList<>();
        private volatile boolean open;
        private volatile Integer closeCode;

        FakeTransport(URI target, TransportListener listener) {
            this.target = target;
            this.listener = listener;
        }

        public URI target() { return target; }
        public List<String> sent() { return sent; }
        public Integer closeCode() { return closeCode; }

        public String query() {
            return target.getRawQuery();
        }

        /** Completes the handshake. */
        public void accept() {
            open = true;
            listener.onOpen();
        }

        public void receive(String json) {
            listener.onText(json);
        }

        /** Remote side closes the transport. */
        public void drop(int code) {
            open = false;
            listener.onClose(code, "dropped");
        }

        @Override
        public void send(String text) throws IOException {
            if (!open) throw new IOException("closed");
            sent.add(text);
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close(int code, String reason) {
            open = false;
            closeCode = code;
        }
    }
}
