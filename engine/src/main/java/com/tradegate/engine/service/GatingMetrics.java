package com.tradegate.engine.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
@RequiredArgsConstructor
public class GatingMetrics {

    private final MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, AtomicLong> outcomesByCode = new ConcurrentHashMap<>();

    public void recordPipelineOutcome(String code) {
        outcomesByCode.computeIfAbsent(code, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("tradegate_pipeline_outcomes_total")
                .tag("code", code)
                .register(meterRegistry)
                .increment();
    }

    public void recordCircuitTransition(String name, String toState) {
        Counter.builder("tradegate_circuit_transitions_total")
                .tag("name", name)
                .tag("to", toState)
                .register(meterRegistry)
                .increment();
    }

    public void recordCircuitRejection(String name) {
        Counter.builder("tradegate_circuit_rejections_total")
                .tag("name", name)
                .register(meterRegistry)
                .increment();
    }

    public Map<String, Long> outcomeCounts() {
        Map<String, Long> snapshot = new ConcurrentHashMap<>();
        outcomesByCode.forEach((code, count) -> snapshot.put(code, count.get()));
        return snapshot;
    }
}
