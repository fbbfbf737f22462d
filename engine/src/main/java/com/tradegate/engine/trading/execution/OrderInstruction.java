package com.tradegate.engine.trading.execution;

import com.tradegate.engine.model.AssetClass;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Broker-shaped order. Option fields are {@code null} for non-options orders.
 */
@Value
@Builder
public class OrderInstruction {
    String symbol;
    OrderSide side;
    OrderType orderType;
    TimeInForce timeInForce;
    double quantity;
    Double limitPrice;
    Double stopPrice;
    double bracketStop;
    double bracketTp1;
    Double bracketTp2;
    Double leverage;
    AssetClass assetClass;
    OptionType optionType;
    Double strike;
    LocalDate expiration;
    String clientOrderId;
    String proposalId;
    ExecutionMode executionMode;
}
