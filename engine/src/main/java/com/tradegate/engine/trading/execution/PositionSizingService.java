package com.tradegate.engine.trading.execution;

import com.tradegate.engine.config.ExecutionProperties;
import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.TradeDirection;
import com.tradegate.engine.model.TradeIntent;
import com.tradegate.engine.util.DecimalUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class PositionSizingService {

    private static final double FOREX_LOT = 1000.0;
    private static final double KELLY_FRACTION = 0.25;

    private final ExecutionProperties properties;

    /**
     * Caller-side limits. Any field may be {@code null}.
     */
    public record SizingLimits(Double stopPrice, Double governorRiskPerTrade, Long governorMaxPositionSize, Double leverage) {

        public static SizingLimits none() {
            return new SizingLimits(null, null, null, null);
        }
    }

    public PositionSizingResult size(TradeIntent intent, SizingLimits limits) {
        SizingLimits effective = limits == null ? SizingLimits.none() : limits;
        double equity = intent.getAccountEquity() != null && intent.getAccountEquity() > 0
                ? intent.getAccountEquity()
                : properties.getDefaultEquity();
        double riskPct = resolveRiskPct(intent, effective);
        double leverage = resolveLeverage(intent, effective);
        double entry = intent.getEntryPrice();
        double stop = resolveStop(intent, effective);
        double riskPerUnit = Math.abs(entry - stop);

        if (riskPerUnit <= 0 || entry <= 0 || !Double.isFinite(riskPerUnit)) {
            log.warn("Cannot size {}: entry {} stop {}", intent.getSymbol(), entry, stop);
            return new PositionSizingResult(0, 0, 0, 0, equity, riskPct, 0, leverage, false, false);
        }

        double dollarRisk = equity * riskPct;
        double rawQuantity = dollarRisk / riskPerUnit;
        double quantity = rawQuantity;

        boolean governorCapped = false;
        if (effective.governorMaxPositionSize() != null && quantity > effective.governorMaxPositionSize()) {
            quantity = effective.governorMaxPositionSize();
            governorCapped = true;
        }

        double maxNotional = equity * properties.getMaxNotionalPct() * leverage;
        boolean notionalCapped = false;
        if (quantity * entry > maxNotional) {
            quantity = maxNotional / entry;
            notionalCapped = true;
        }

        quantity = roundToLot(quantity, intent.getAssetClass());
        double totalRisk = DecimalUtils.round2(quantity * riskPerUnit);
        double notional = DecimalUtils.round2(quantity * entry);

        log.debug("Sized {} qty={} raw={} risk=${} notional=${} lev={}",
                intent.getSymbol(), quantity, rawQuantity, totalRisk, notional, leverage);
        return new PositionSizingResult(
                quantity,
                DecimalUtils.round(rawQuantity, 4),
                DecimalUtils.round(riskPerUnit, 6),
                totalRisk,
                equity,
                riskPct,
                notional,
                leverage,
                governorCapped,
                notionalCapped
        );
    }

    /**
     * Kelly advisory ceiling in dollars: equity x min(quarter-Kelly, riskPct).
     */
    public double kellyMaxRisk(double equity, double riskPct, double winRate, double avgWin, double avgLoss) {
        if (avgLoss <= 0 || avgWin <= 0 || winRate <= 0 || winRate >= 1) {
            return equity * riskPct;
        }
        double b = avgWin / avgLoss;
        double kelly = (b * winRate - (1 - winRate)) / b;
        double capped = Math.min(Math.max(0, kelly) * KELLY_FRACTION, riskPct);
        return equity * capped;
    }

    private double resolveRiskPct(TradeIntent intent, SizingLimits limits) {
        if (intent.getRiskPct() != null && intent.getRiskPct() > 0) {
            return intent.getRiskPct();
        }
        if (limits.governorRiskPerTrade() != null) {
            return Math.max(0, limits.governorRiskPerTrade());
        }
        return properties.getDefaultRiskPct();
    }

    private static double resolveLeverage(TradeIntent intent, SizingLimits limits) {
        Double leverage = limits.leverage() != null ? limits.leverage() : intent.getLeverage();
        return leverage == null ? 1.0 : Math.max(1.0, leverage);
    }

    private static double resolveStop(TradeIntent intent, SizingLimits limits) {
        if (limits.stopPrice() != null) {
            return limits.stopPrice();
        }
        if (intent.getStopPrice() != null) {
            return intent.getStopPrice();
        }
        double multiple = intent.getAssetClass() == AssetClass.CRYPTO ? 2.0 : 1.5;
        double distance = intent.getAtr() * multiple;
        return intent.getDirection() == TradeDirection.SHORT
                ? intent.getEntryPrice() + distance
                : intent.getEntryPrice() - distance;
    }

    static double roundToLot(double quantity, AssetClass assetClass) {
        if (quantity <= 0 || !Double.isFinite(quantity)) {
            return 0;
        }
        if (assetClass == AssetClass.CRYPTO) {
            return DecimalUtils.floor(quantity, 4);
        }
        if (assetClass == AssetClass.FOREX) {
            return Math.floor(quantity / FOREX_LOT) * FOREX_LOT;
        }
        return Math.floor(quantity);
    }
}
