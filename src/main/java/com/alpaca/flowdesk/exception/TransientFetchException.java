package com.alpaca.flowdesk.exception;

/** Market data could not be fetched right now; the caller skips and carries on. */
public class TransientFetchException extends RuntimeException {
    public TransientFetchException(String message, Throwable cause) { super(message, cause); }
}
