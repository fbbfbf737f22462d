package com.tradegate.engine.trading.pipeline;

import com.tradegate.engine.model.OpenPosition;

import java.util.List;
import java.util.Optional;

/**
 * Account state lookups backed by the trade journal. Implementations may throw on storage failure.
 */
public interface AccountDataProvider {

    Optional<Double> latestEquity(String accountId);

    List<OpenPosition> openPositions(String accountId);

    /** Realized P&L today in account currency; losses are negative. */
    double dailyRealizedPnl(String accountId);

    /** Sum of dollar risk across open positions. */
    double openRiskTotal(String accountId);
}
