package com.tradegate.engine.trading.pipeline;

import com.tradegate.engine.model.AssetClass;

import java.util.OptionalDouble;

public interface VolatilityProvider {

    /** Empty when no ATR can be produced for the symbol. */
    OptionalDouble fetchAtr(String symbol, AssetClass assetClass);
}
