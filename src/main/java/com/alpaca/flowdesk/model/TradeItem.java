package com.alpaca.flowdesk.model;

public record TradeItem(String symbol, Side side) {}
