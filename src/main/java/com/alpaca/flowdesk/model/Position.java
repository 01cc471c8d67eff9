package com.alpaca.flowdesk.model;

public record Position(String symbol, double quantity, double avgEntryPrice) {}
