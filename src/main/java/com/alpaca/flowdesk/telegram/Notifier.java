package com.alpaca.flowdesk.telegram;

/** Best-effort delivery of alert text. Never throws. */
public interface Notifier {
    void send(String text);
}
