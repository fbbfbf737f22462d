package com.tradegate.engine.trading.marketdata;

import com.tradegate.engine.config.ExecutionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

@Service
@RequiredArgsConstructor
public class AtrCalculator {

    private final ExecutionProperties properties;

    public OptionalDouble atr(List<Candle> candles) {
        return wilderAtr(candles, properties.getAtr().getPeriod());
    }

    /**
     * Wilder ATR: seeded with the simple mean of the first {@code period} true ranges, then smoothed.
     * Empty when there are fewer than {@code period + 1} bars or the result is not positive.
     */
    public static OptionalDouble wilderAtr(List<Candle> candles, int period) {
        if (candles == null || period < 1 || candles.size() < period + 1) {
            return OptionalDouble.empty();
        }
        List<Candle> sorted = new ArrayList<>(candles);
        sorted.sort(Comparator.comparing(Candle::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder())));

        List<Double> trueRanges = new ArrayList<>(sorted.size() - 1);
        for (int i = 1; i < sorted.size(); i++) {
            Candle current = sorted.get(i);
            double prevClose = sorted.get(i - 1).getClose();
            trueRanges.add(Math.max(current.getHigh() - current.getLow(),
                    Math.max(Math.abs(current.getHigh() - prevClose), Math.abs(current.getLow() - prevClose))));
        }

        double atr = trueRanges.subList(0, period).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        for (int i = period; i < trueRanges.size(); i++) {
            atr = (atr * (period - 1) + trueRanges.get(i)) / period;
        }
        return atr > 0 && Double.isFinite(atr) ? OptionalDouble.of(atr) : OptionalDouble.empty();
    }
}
