package com.tradegate.engine.trading.marketdata;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class Candle {
    double open;
    double high;
    double low;
    double close;
    long volume;
    Instant timestamp;
}
