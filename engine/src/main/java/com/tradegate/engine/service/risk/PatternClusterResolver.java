package com.tradegate.engine.service.risk;

import com.tradegate.engine.config.RiskProperties;
import com.tradegate.engine.model.AssetClass;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Cluster lookup from configured symbol lists. Crypto pairs are reduced to their base asset first,
 * so {@code BTC-USD} and {@code BTCUSDT} both resolve as {@code BTC}.
 */
@Service
@RequiredArgsConstructor
public class PatternClusterResolver implements ClusterResolver {

    private static final List<String> QUOTE_SUFFIXES = List.of("-USDT", "/USDT", "USDT", "-USD", "/USD", "USD");

    private final RiskProperties riskProperties;

    @Override
    public String resolve(String symbol, AssetClass assetClass) {
        RiskProperties.Clusters clusters = riskProperties.getClusters();
        boolean crypto = assetClass != null && assetClass.isCrypto();
        String fallback = crypto ? clusters.getCryptoFallback() : clusters.getEquityFallback();
        if (symbol == null || symbol.isBlank()) {
            return fallback;
        }
        String normalized = normalize(symbol, crypto);
        Map<String, List<String>> table = crypto ? clusters.getCrypto() : clusters.getEquity();
        for (Map.Entry<String, List<String>> entry : table.entrySet()) {
            if (entry.getValue() != null && entry.getValue().contains(normalized)) {
                return entry.getKey();
            }
        }
        return fallback;
    }

    private static String normalize(String symbol, boolean crypto) {
        String upper = symbol.trim().toUpperCase(Locale.ROOT);
        if (!crypto) {
            return upper;
        }
        for (String suffix : QUOTE_SUFFIXES) {
            if (upper.length() > suffix.length() && upper.endsWith(suffix)) {
                return upper.substring(0, upper.length() - suffix.length());
            }
        }
        return upper;
    }
}
