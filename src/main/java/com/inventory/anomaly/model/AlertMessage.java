package com.inventory.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * Formatted alert, rendered once per dispatch and shared read-only by every channel.
 */
@Value
@Builder
public class AlertMessage {
    String title;
    String text;
    String html;
}
