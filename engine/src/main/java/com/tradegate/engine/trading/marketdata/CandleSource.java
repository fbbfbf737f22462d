package com.tradegate.engine.trading.marketdata;

import com.tradegate.engine.model.AssetClass;

import java.util.List;

/**
 * Historical bars from an external market-data vendor. Implementations may throw on transport failure.
 */
public interface CandleSource {

    List<Candle> recentCandles(String symbol, AssetClass assetClass, int bars);
}
