package com.inventory.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-run invocation options, resolved once before the task graph is built.
 */
@Value
@Builder(toBuilder = true)
public class RunOptions {
    String inputSource;
    boolean enableAlerts;
    boolean enableEmailChannel;
    boolean enableReport;
}
