package com.inventory.anomaly.report;

import com.inventory.anomaly.config.PipelineConfig;
import com.inventory.anomaly.model.AnomalyRecord;
import com.inventory.anomaly.model.Severity;
import com.inventory.anomaly.repository.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Self-contained HTML report: executive summary, severity breakdown, the top
 * anomalies by score and anomaly counts per product.
 */
@Component
public class HtmlReportRenderer implements ReportRenderer {

    private static final Logger log = LoggerFactory.getLogger(HtmlReportRenderer.class);

    static final String TITLE = "Inventory and Consumption Anomaly Report";
    static final int MAX_TABLE_ROWS = 50;

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final ArtifactStore artifactStore;
    private final PipelineConfig config;

    public HtmlReportRenderer(ArtifactStore artifactStore, PipelineConfig config) {
        this.artifactStore = artifactStore;
        this.config = config;
    }

    @Override
    public String render(ReportInput input) throws IOException {
        Path path = Path.of(config.getReportDir(), "anomaly_report_" + input.getRunId() + ".html");
        String location = artifactStore.writeText(path, toHtml(input));
        log.info("Report written to {}", location);
        return location;
    }

    String toHtml(ReportInput input) {
        List<AnomalyRecord> flagged = input.getRecords().stream()
                .filter(AnomalyRecord::isAnomaly)
                .sorted(Comparator.comparingDouble(AnomalyRecord::getAnomalyScore).reversed())
                .toList();
        int total = input.getRecords().size();

        StringBuilder sb = new StringBuilder();
        sb.append("<!DOCTYPE html>\n<html><head><meta charset=\"utf-8\"><title>").append(TITLE)
                .append("</title>\n<style>")
                .append("body{font-family:Helvetica,Arial,sans-serif;margin:2em;}")
                .append("table{border-collapse:collapse;}th,td{border:1px solid #999;padding:4px 8px;text-align:center;}")
                .append("th{background:#34495e;color:#fff;}tr:nth-child(even) td{background:#f8f9fa;}")
                .append("</style></head><body>\n");
        sb.append("<h1>").append(TITLE).append("</h1>\n");
        sb.append("<p><i>Generated ").append(TIMESTAMP.format(input.getGeneratedAt()))
                .append(" for run ").append(HtmlUtils.htmlEscape(input.getRunId())).append("</i></p>\n");

        sb.append("<h2>Executive summary</h2>\n<p>");
        sb.append("<b>Records analysed:</b> ").append(total).append("<br/>");
        sb.append("<b>Anomalies detected:</b> ").append(flagged.size())
                .append(String.format(Locale.ROOT, " (%.2f%%)", total == 0 ? 0.0 : flagged.size() * 100.0 / total))
                .append("<br/>");
        if (!flagged.isEmpty()) {
            double avg = flagged.stream().mapToDouble(AnomalyRecord::getAnomalyScore).average().orElse(0.0);
            sb.append(String.format(Locale.ROOT, "<b>Average anomaly score:</b> %.4f<br/>", avg));
            sb.append(String.format(Locale.ROOT, "<b>Max anomaly score:</b> %.4f<br/>",
                    flagged.get(0).getAnomalyScore()));
        }
        sb.append("<b>Forecast models trained:</b> ").append(input.getModelsTrained());
        if (input.getForecastFailures() != null && !input.getForecastFailures().isEmpty()) {
            sb.append(" (failed: ").append(HtmlUtils.htmlEscape(String.join(", ", input.getForecastFailures())))
                    .append(')');
        }
        sb.append("</p>\n");

        sb.append("<h2>Severity breakdown</h2>\n<table><tr><th>Severity</th><th>Anomalies</th></tr>");
        severityCounts(flagged).forEach((severity, count) ->
                sb.append("<tr><td>").append(severity.getLabel()).append("</td><td>").append(count).append("</td></tr>"));
        sb.append("</table>\n");

        sb.append("<h2>Anomaly details</h2>\n");
        if (flagged.isEmpty()) {
            sb.append("<p>No anomalies detected.</p>\n");
        } else {
            sb.append("<table><tr><th>Date</th><th>Product</th><th>Consumption</th><th>Stock</th>")
                    .append("<th>Score</th><th>Severity</th></tr>");
            flagged.stream().limit(MAX_TABLE_ROWS).forEach(r -> sb.append("<tr>")
                    .append("<td>").append(r.getDate()).append("</td>")
                    .append("<td>").append(HtmlUtils.htmlEscape(r.getProductId())).append("</td>")
                    .append(String.format(Locale.ROOT, "<td>%.2f</td><td>%.2f</td><td>%.4f</td>",
                            r.getConsumption(), r.getStock(), r.getAnomalyScore()))
                    .append("<td>").append(r.getSeverity().getLabel()).append("</td></tr>"));
            sb.append("</table>\n");
            if (flagged.size() > MAX_TABLE_ROWS) {
                sb.append("<p>Showing ").append(MAX_TABLE_ROWS).append(" of ").append(flagged.size())
                        .append(" anomalies.</p>\n");
            }

            sb.append("<h2>Anomalies per product</h2>\n<table><tr><th>Product</th><th>Anomalies</th></tr>");
            perProduct(flagged).forEach((product, count) -> sb.append("<tr><td>")
                    .append(HtmlUtils.htmlEscape(product)).append("</td><td>").append(count).append("</td></tr>"));
            sb.append("</table>\n");
        }

        sb.append("<p><i>Generated automatically by Inventory Anomaly Detector</i></p>\n</body></html>\n");
        return sb.toString();
    }

    private static Map<Severity, Integer> severityCounts(List<AnomalyRecord> flagged) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) {
            counts.put(s, 0);
        }
        flagged.forEach(r -> counts.merge(r.getSeverity(), 1, Integer::sum));
        return counts;
    }

    private static Map<String, Integer> perProduct(List<AnomalyRecord> flagged) {
        Map<String, Integer> counts = new TreeMap<>();
        flagged.forEach(r -> counts.merge(r.getProductId(), 1, Integer::sum));
        return counts;
    }
}
