package com.alpaca.flowdesk.model;

public record Candidate(String symbol, Side side, double score, double referencePrice, double rsi, double trendPct) {}
