package com.tradegate.engine.trading.execution;

import com.tradegate.engine.model.OptionsStructure;

import java.util.List;

public record OptionsSelection(
        OptionsStructure structure,
        int dte,
        double delta,
        double strike,
        double premiumEstimate,
        double maxLossPerContract,
        double maxLossUsd,
        List<String> notes
) {

    public String notesText() {
        return String.join(" | ", notes);
    }
}
