package com.alpaca.flowdesk.broker;

import com.alpaca.flowdesk.model.BracketOrder;
import com.alpaca.flowdesk.model.Position;

import java.util.Optional;
import java.util.Set;

public interface BrokerClient {
    /** @return the broker order id; throws {@link com.alpaca.flowdesk.exception.OrderSubmissionException} */
    String submitBracketOrder(BracketOrder order);
    Set<String> openPositionSymbols();
    Optional<Position> position(String symbol);
    void closePosition(String symbol);
}
