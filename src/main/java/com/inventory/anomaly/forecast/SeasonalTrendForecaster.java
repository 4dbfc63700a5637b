package com.inventory.anomaly.forecast;

import com.inventory.anomaly.config.PipelineConfig;
import com.inventory.anomaly.engine.ValidationException;
import com.inventory.anomaly.model.FeatureRow;
import com.inventory.anomaly.model.ForecastPoint;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Least-squares trend with weekly multiplicative seasonality and a residual-based
 * 95% prediction interval.
 */
@Component
public class SeasonalTrendForecaster implements Forecaster {

    private static final double Z_95 = 1.96;

    private final PipelineConfig.Forecasting settings;

    public SeasonalTrendForecaster(PipelineConfig pipelineConfig) {
        this.settings = pipelineConfig.getForecasting();
    }

    @Override
    public ForecastModel train(String productId, List<FeatureRow> series) {
        int n = series.size();
        if (n < Math.max(2, settings.getMinTrainingPoints())) {
            throw new ValidationException("Product " + productId + ": " + n
                    + " observation(s), need at least " + Math.max(2, settings.getMinTrainingPoints()));
        }

        LocalDate origin = series.get(0).getDate();
        double[] t = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            FeatureRow p = series.get(i);
            if (!Double.isFinite(p.getValue())) {
                throw new ValidationException("Product " + productId + ": missing value on " + p.getDate());
            }
            t[i] = p.getDate().toEpochDay() - origin.toEpochDay();
            y[i] = p.getValue();
        }

        double meanT = Arrays.stream(t).average().orElse(0.0);
        double meanY = Arrays.stream(y).average().orElse(0.0);
        double sxx = 0.0;
        double sxy = 0.0;
        for (int i = 0; i < n; i++) {
            sxx += (t[i] - meanT) * (t[i] - meanT);
            sxy += (t[i] - meanT) * (y[i] - meanY);
        }
        double slope = sxx == 0.0 ? 0.0 : sxy / sxx;
        double intercept = meanY - slope * meanT;

        double[] factors = weeklyFactors(series, meanY);

        double sse = 0.0;
        for (int i = 0; i < n; i++) {
            int dow = series.get(i).getDate().getDayOfWeek().getValue() - 1;
            double residual = y[i] - (intercept + slope * t[i]) * factors[dow];
            sse += residual * residual;
        }
        double residualStd = n > 2 ? Math.sqrt(sse / (n - 2)) : 0.0;

        return ForecastModel.builder()
                .productId(productId)
                .origin(origin)
                .lastObserved(series.get(n - 1).getDate())
                .intercept(intercept)
                .slope(slope)
                .weeklyFactors(factors)
                .residualStd(residualStd)
                .trainingPoints(n)
                .build();
    }

    @Override
    public List<ForecastPoint> forecast(ForecastModel model, int horizonDays) {
        List<ForecastPoint> points = new ArrayList<>(horizonDays);
        double margin = Z_95 * model.getResidualStd();
        for (int d = 1; d <= horizonDays; d++) {
            LocalDate date = model.getLastObserved().plusDays(d);
            double yhat = model.predict(date);
            points.add(ForecastPoint.builder()
                    .productId(model.getProductId())
                    .date(date)
                    .predicted(yhat)
                    .lower(yhat - margin)
                    .upper(yhat + margin)
                    .build());
        }
        return points;
    }

    // Ratio of each weekday's mean to the overall mean; weekdays never observed stay at 1
    private static double[] weeklyFactors(List<FeatureRow> series, double overallMean) {
        double[] factors = new double[7];
        Arrays.fill(factors, 1.0);
        if (overallMean == 0.0) {
            return factors;
        }

        double[] sum = new double[7];
        int[] count = new int[7];
        for (FeatureRow p : series) {
            int dow = p.getDate().getDayOfWeek().getValue() - 1;
            sum[dow] += p.getValue();
            count[dow]++;
        }

        double total = 0.0;
        for (int d = 0; d < 7; d++) {
            if (count[d] > 0) {
                factors[d] = (sum[d] / count[d]) / overallMean;
            }
            total += factors[d];
        }
        double norm = total / 7.0;
        if (norm > 0.0) {
            for (int d = 0; d < 7; d++) factors[d] /= norm;
        }
        return factors;
    }
}
