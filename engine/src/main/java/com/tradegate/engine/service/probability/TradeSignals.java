package com.tradegate.engine.service.probability;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class TradeSignals {
    @Singular
    Map<SignalType, SignalInput> signals;

    public SignalInput get(SignalType type) {
        return signals.get(type);
    }

    public static TradeSignals none() {
        return TradeSignals.builder().build();
    }
}
