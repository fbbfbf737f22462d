package com.tradegate.engine.trading.marketdata;

import com.tradegate.engine.config.ExecutionProperties;
import com.tradegate.engine.config.ResilienceProperties;
import com.tradegate.engine.exception.CircuitOpenException;
import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.service.resilience.CircuitBreakerRegistryService;
import com.tradegate.engine.trading.pipeline.VolatilityProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ATR per symbol and asset class, computed from vendor candles behind the market-data breakers
 * and cached for the configured TTL.
 */
@Service
@Slf4j
public class CachingAtrProvider implements VolatilityProvider {

    private final CandleSource candleSource;
    private final AtrCalculator atrCalculator;
    private final CircuitBreakerRegistryService breakers;
    private final ExecutionProperties properties;
    private final Clock clock;
    private final Map<String, CachedAtr> cache = new ConcurrentHashMap<>();

    @Autowired
    public CachingAtrProvider(CandleSource candleSource,
                              AtrCalculator atrCalculator,
                              CircuitBreakerRegistryService breakers,
                              ExecutionProperties properties) {
        this(candleSource, atrCalculator, breakers, properties, Clock.systemUTC());
    }

    CachingAtrProvider(CandleSource candleSource,
                       AtrCalculator atrCalculator,
                       CircuitBreakerRegistryService breakers,
                       ExecutionProperties properties,
                       Clock clock) {
        this.candleSource = candleSource;
        this.atrCalculator = atrCalculator;
        this.breakers = breakers;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public OptionalDouble fetchAtr(String symbol, AssetClass assetClass) {
        String key = assetClass + ":" + symbol;
        Instant now = clock.instant();
        CachedAtr cached = cache.get(key);
        if (cached != null && now.isBefore(cached.expiresAt())) {
            return OptionalDouble.of(cached.atr());
        }

        String breakerName = assetClass == AssetClass.CRYPTO ? ResilienceProperties.CRYPTO_DATA : ResilienceProperties.MARKET_DATA;
        int period = properties.getAtr().getPeriod();
        try {
            List<Candle> candles = breakers.breaker(breakerName)
                    .call(() -> candleSource.recentCandles(symbol, assetClass, period * 3));
            OptionalDouble atr = atrCalculator.atr(candles);
            if (atr.isPresent()) {
                cache.put(key, new CachedAtr(atr.getAsDouble(), now.plus(properties.getAtr().getCacheTtl())));
            } else {
                log.warn("Insufficient candles for ATR on {} ({} bars)", symbol, candles == null ? 0 : candles.size());
            }
            return atr;
        } catch (CircuitOpenException e) {
            log.warn("ATR lookup for {} skipped: {}", symbol, e.getMessage());
            return OptionalDouble.empty();
        } catch (RuntimeException e) {
            log.warn("ATR lookup for {} failed: {}", symbol, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    public void evict(String symbol, AssetClass assetClass) {
        cache.remove(assetClass + ":" + symbol);
    }

    private record CachedAtr(double atr, Instant expiresAt) {
    }
}
