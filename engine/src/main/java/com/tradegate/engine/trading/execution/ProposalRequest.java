package com.tradegate.engine.trading.execution;

import com.tradegate.engine.model.TradeIntent;
import com.tradegate.engine.service.risk.PermissionContext;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ProposalRequest {
    TradeIntent intent;
    @Builder.Default
    PermissionContext permissionContext = PermissionContext.builder().build();
    @Builder.Default
    ExposureSnapshot exposure = ExposureSnapshot.none();
    @Builder.Default
    ExecutionMode mode = ExecutionMode.DRY_RUN;
    /** Evaluation time; {@code null} means now. */
    Instant asOf;
}
