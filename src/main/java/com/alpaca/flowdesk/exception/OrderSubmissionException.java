package com.alpaca.flowdesk.exception;

public class OrderSubmissionException extends RuntimeException {
    private final String symbol;

    public OrderSubmissionException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() { return symbol; }
}
