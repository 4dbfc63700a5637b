package com.inventory.anomaly.alert;

import com.inventory.anomaly.config.AlertChannelConfig;
import com.inventory.anomaly.model.AlertMessage;
import com.inventory.anomaly.model.AnomalyRecord;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Renders alert-worthy records into a plain-text body (webhooks, email fallback)
 * and an HTML table (email, Teams). Records are listed highest score first and
 * capped at {@code alerts.max-listed-anomalies}.
 */
@Component
public class AlertMessageFormatter {

    private static final String RULE = "=".repeat(60);
    private static final String THIN_RULE = "-".repeat(60);

    private final AlertChannelConfig config;

    public AlertMessageFormatter(AlertChannelConfig config) {
        this.config = config;
    }

    public AlertMessage format(List<AnomalyRecord> records) {
        List<AnomalyRecord> ranked = records.stream()
                .sorted(Comparator.comparingDouble(AnomalyRecord::getAnomalyScore).reversed())
                .toList();
        return AlertMessage.builder()
                .title(config.getTitle())
                .text(formatText(ranked))
                .html(formatHtml(ranked))
                .build();
    }

    String formatText(List<AnomalyRecord> ranked) {
        int total = ranked.size();
        if (total == 0) {
            return "No anomalies detected.";
        }
        int listed = Math.min(total, config.getMaxListedAnomalies());

        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("ALERT: ").append(total).append(" ANOMALY(IES) DETECTED\n");
        sb.append(RULE).append("\n\n");

        sb.append("Statistics:\n");
        sb.append(String.format(Locale.ROOT, "  - Average score: %.4f%n", average(ranked)));
        sb.append(String.format(Locale.ROOT, "  - Max score: %.4f%n", ranked.get(0).getAnomalyScore()));

        sb.append('\n').append(THIN_RULE).append('\n');
        sb.append("ANOMALY DETAILS:\n");
        sb.append(THIN_RULE).append("\n\n");

        for (int i = 0; i < listed; i++) {
            AnomalyRecord r = ranked.get(i);
            sb.append('[').append(i + 1).append("] Anomaly\n");
            sb.append("-".repeat(40)).append('\n');
            sb.append("  Date: ").append(r.getDate()).append('\n');
            sb.append("  Product: ").append(r.getProductId()).append('\n');
            sb.append(String.format(Locale.ROOT, "  Consumption: %.2f%n", r.getConsumption()));
            sb.append(String.format(Locale.ROOT, "  Stock: %.2f%n", r.getStock()));
            sb.append(String.format(Locale.ROOT, "  Score: %.4f (%s)%n%n",
                    r.getAnomalyScore(), r.getSeverity().getLabel()));
        }

        if (total > listed) {
            sb.append("... and ").append(total - listed).append(" more anomaly(ies) not listed.\n");
        }

        sb.append(RULE).append('\n');
        sb.append("Total: ").append(total).append(" anomaly(ies) detected\n");
        sb.append(RULE);
        return sb.toString();
    }

    String formatHtml(List<AnomalyRecord> ranked) {
        int listed = Math.min(ranked.size(), config.getMaxListedAnomalies());

        StringBuilder sb = new StringBuilder();
        sb.append("<html><body>");
        sb.append("<h2>").append(HtmlUtils.htmlEscape(config.getTitle())).append("</h2>");
        sb.append("<p>").append(ranked.size()).append(" anomaly(ies) detected.</p>");
        sb.append("<table border=\"1\" cellpadding=\"4\" cellspacing=\"0\">");
        sb.append("<tr><th>Date</th><th>Product</th><th>Consumption</th><th>Stock</th>")
                .append("<th>Score</th><th>Severity</th></tr>");
        for (int i = 0; i < listed; i++) {
            AnomalyRecord r = ranked.get(i);
            sb.append("<tr>")
                    .append("<td>").append(r.getDate()).append("</td>")
                    .append("<td>").append(HtmlUtils.htmlEscape(String.valueOf(r.getProductId()))).append("</td>")
                    .append(String.format(Locale.ROOT, "<td>%.2f</td>", r.getConsumption()))
                    .append(String.format(Locale.ROOT, "<td>%.2f</td>", r.getStock()))
                    .append(String.format(Locale.ROOT, "<td>%.4f</td>", r.getAnomalyScore()))
                    .append("<td>").append(r.getSeverity().getLabel()).append("</td>")
                    .append("</tr>");
        }
        sb.append("</table>");
        if (ranked.size() > listed) {
            sb.append("<p>... and ").append(ranked.size() - listed).append(" more not listed.</p>");
        }
        sb.append("</body></html>");
        return sb.toString();
    }

    private static double average(List<AnomalyRecord> records) {
        return records.stream().mapToDouble(AnomalyRecord::getAnomalyScore).average().orElse(0.0);
    }
}
