package com.alpaca.flowdesk.exception;

/** Required startup configuration is missing. Fatal. */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) { super(message); }
}
