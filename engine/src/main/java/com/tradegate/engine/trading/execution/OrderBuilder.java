package com.tradegate.engine.trading.execution;

import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.OptionsStructure;
import com.tradegate.engine.model.TradeDirection;
import com.tradegate.engine.model.TradeIntent;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Maps upstream results onto an {@link OrderInstruction}. Makes no sizing or risk decisions of its own.
 */
@Service
public class OrderBuilder {

    private static final ZoneId MARKET_ZONE = ZoneId.of("America/New_York");

    private final Clock clock;

    public OrderBuilder() {
        this(Clock.system(MARKET_ZONE));
    }

    OrderBuilder(Clock clock) {
        this.clock = clock;
    }

    public OrderInstruction build(TradeIntent intent,
                                  PositionSizingResult sizing,
                                  ExitPlan exits,
                                  LeverageResult leverage,
                                  OptionsSelection options,
                                  String proposalId,
                                  ExecutionMode mode,
                                  LocalDate tradeDate) {
        OrderInstruction.OrderInstructionBuilder builder = OrderInstruction.builder()
                .symbol(intent.getSymbol())
                .side(intent.getDirection() == TradeDirection.SHORT ? OrderSide.SELL : OrderSide.BUY)
                .orderType(OrderType.LIMIT)
                .timeInForce(intent.getAssetClass() == AssetClass.CRYPTO ? TimeInForce.GTC : TimeInForce.DAY)
                .limitPrice(intent.getEntryPrice())
                .quantity(sizing.quantity())
                .bracketStop(exits.stopPrice())
                .bracketTp1(exits.takeProfit1())
                .bracketTp2(exits.takeProfit2())
                .assetClass(intent.getAssetClass())
                .clientOrderId(clientOrderId(proposalId, intent.getSymbol()))
                .proposalId(proposalId)
                .executionMode(mode == null ? ExecutionMode.DRY_RUN : mode);

        if (leverage != null && leverage.recommendedLeverage() > 1) {
            builder.leverage(leverage.recommendedLeverage());
        }

        if (options != null) {
            LocalDate expiryBase = tradeDate != null ? tradeDate : LocalDate.now(clock);
            builder.optionType(optionType(options.structure(), intent.getDirection()))
                    .strike(roundStrike(options.strike()))
                    .expiration(expiryBase.plusDays(options.dte()))
                    .quantity(contracts(options, sizing.totalRiskUsd()));
        }
        return builder.build();
    }

    static String clientOrderId(String proposalId, String symbol) {
        String prefix = proposalId.length() > 8 ? proposalId.substring(0, 8) : proposalId;
        return "TG-" + prefix + "-" + symbol;
    }

    static OptionType optionType(OptionsStructure structure, TradeDirection direction) {
        return switch (structure) {
            case LONG_CALL, CALL_DEBIT_SPREAD -> OptionType.CALL;
            case LONG_PUT, PUT_DEBIT_SPREAD -> OptionType.PUT;
            case IRON_CONDOR, STRADDLE, STRANGLE, NONE -> direction == TradeDirection.SHORT ? OptionType.PUT : OptionType.CALL;
        };
    }

    static double roundStrike(double price) {
        double increment = price < 100 ? 1 : price < 500 ? 5 : 10;
        return Math.round(price / increment) * increment;
    }

    static double contracts(OptionsSelection options, double riskBudgetUsd) {
        if (options.maxLossPerContract() <= 0) {
            return 0;
        }
        return Math.floor(riskBudgetUsd / options.maxLossPerContract());
    }
}
