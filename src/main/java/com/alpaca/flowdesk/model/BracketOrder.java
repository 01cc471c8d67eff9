package com.alpaca.flowdesk.model;

import java.math.BigDecimal;

public record BracketOrder(
        String symbol,
        BigDecimal notional,
        Side side,
        BigDecimal takeProfitPrice,
        BigDecimal stopLossPrice,
        String timeInForce
) {}
