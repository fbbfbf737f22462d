package com.tradegate.engine.model;

public record OpenPosition(String symbol, TradeDirection direction, AssetClass assetClass) {
}
