package com.inventory.anomaly.controller;

import com.inventory.anomaly.config.AlertChannelConfig;
import com.inventory.anomaly.config.PipelineConfig;
import com.inventory.anomaly.config.SeverityThresholdConfig;
import com.inventory.anomaly.config.SeverityThresholdConfig.Thresholds;
import com.inventory.anomaly.model.ChannelKind;
import com.inventory.anomaly.service.AnomalyAlertService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime configuration (severity policy, alert channels)")
public class ConfigController {

    private final SeverityThresholdConfig severityConfig;
    private final AlertChannelConfig alertConfig;
    private final PipelineConfig pipelineConfig;
    private final AnomalyAlertService alertService;

    public ConfigController(SeverityThresholdConfig severityConfig,
                            AlertChannelConfig alertConfig,
                            PipelineConfig pipelineConfig,
                            AnomalyAlertService alertService) {
        this.severityConfig = severityConfig;
        this.alertConfig = alertConfig;
        this.pipelineConfig = pipelineConfig;
        this.alertService = alertService;
    }

    // ── Severity ──

    @Operation(summary = "Get severity thresholds",
            description = "Lower bounds are inclusive: score >= critical is CRITICAL, >= high is HIGH, " +
                    ">= minAlertable is MEDIUM, anything lower is not alert-worthy.")
    @GetMapping("/severity")
    public ResponseEntity<Map<String, Object>> getSeverity() {
        Thresholds t = severityConfig.snapshot();
        return ResponseEntity.ok(Map.of(
                "minAlertable", t.getMinAlertable(),
                "high", t.getHigh(),
                "critical", t.getCritical()
        ));
    }

    @Operation(summary = "Update severity thresholds",
            description = "Changes apply to the next classification but reset on restart.")
    @PutMapping("/severity")
    public ResponseEntity<?> updateSeverity(@RequestBody Map<String, Object> body) {
        Thresholds current = severityConfig.snapshot();
        Double min = toDouble(body, "minAlertable", current.getMinAlertable());
        Double high = toDouble(body, "high", current.getHigh());
        Double critical = toDouble(body, "critical", current.getCritical());

        if (min == null) return badRequest("minAlertable must be a number", "minAlertable");
        if (high == null) return badRequest("high must be a number", "high");
        if (critical == null) return badRequest("critical must be a number", "critical");

        String problem = SeverityThresholdConfig.validate(min, high, critical);
        if (problem != null) {
            return badRequest(problem, "severity");
        }

        severityConfig.apply(min, high, critical);
        return getSeverity();
    }

    // ── Alert channels (read-only) ──

    @Operation(summary = "Get alert channel status",
            description = "Whether each channel is configured. Endpoints and credentials are never returned.")
    @GetMapping("/channels")
    public ResponseEntity<Map<String, Object>> getChannels() {
        Map<String, Object> channels = new LinkedHashMap<>();
        alertService.channelStatus().forEach((kind, configured) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("configured", configured);
            if (kind == ChannelKind.EMAIL) {
                entry.put("enabledByDefault", pipelineConfig.isEnableEmailChannel());
                entry.put("recipients", alertConfig.getEmail().getTo().size());
            }
            channels.put(kind.getKey(), entry);
        });

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("alertsEnabledByDefault", pipelineConfig.isEnableAlerts());
        response.put("maxListedAnomalies", alertConfig.getMaxListedAnomalies());
        response.put("channels", channels);
        return ResponseEntity.ok(response);
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    // null when present but not numeric
    private Double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return null; }
    }
}
