package io.github.drompincen.agentlink.runtime.connection;

public interface TransportListener {

    void onOpen();

    void onText(String text);

    void onClose(int code, String reason);

    void onError(Throwable error);
}
