package com.tradegate.engine.service.risk;

import com.tradegate.engine.model.AssetClass;

/**
 * Maps a symbol to the correlation cluster it trades with.
 */
public interface ClusterResolver {

    String resolve(String symbol, AssetClass assetClass);
}
