package com.inventory.anomaly.service;

import com.inventory.anomaly.model.DailyAggregate;
import com.inventory.anomaly.model.InventoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Rolls raw rows up to one row per (product, day). Missing cells are left out
 * of the statistics; a day with no value for a column reports 0 for it.
 */
@Service
public class DailyAggregator {

    private static final Logger log = LoggerFactory.getLogger(DailyAggregator.class);

    public List<DailyAggregate> aggregate(List<InventoryRecord> records) {
        Map<String, Map<LocalDate, List<InventoryRecord>>> groups = new TreeMap<>();
        for (InventoryRecord r : records) {
            groups.computeIfAbsent(r.getProductId(), k -> new TreeMap<>())
                    .computeIfAbsent(r.getDate(), k -> new ArrayList<>())
                    .add(r);
        }

        List<DailyAggregate> aggregates = new ArrayList<>();
        groups.forEach((product, days) -> days.forEach((date, rows) -> {
            DoubleSummaryStatistics consumption = rows.stream()
                    .map(InventoryRecord::getConsumption).filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue).summaryStatistics();
            DoubleSummaryStatistics stock = rows.stream()
                    .map(InventoryRecord::getStock).filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue).summaryStatistics();

            aggregates.add(DailyAggregate.builder()
                    .productId(product)
                    .date(date)
                    .consumptionMean(consumption.getCount() > 0 ? consumption.getAverage() : 0.0)
                    .consumptionSum(consumption.getSum())
                    .consumptionMin(consumption.getCount() > 0 ? consumption.getMin() : 0.0)
                    .consumptionMax(consumption.getCount() > 0 ? consumption.getMax() : 0.0)
                    .stockMean(stock.getCount() > 0 ? stock.getAverage() : 0.0)
                    .stockMin(stock.getCount() > 0 ? stock.getMin() : 0.0)
                    .stockMax(stock.getCount() > 0 ? stock.getMax() : 0.0)
                    .recordCount(rows.size())
                    .build());
        }));

        log.info("Aggregated {} raw row(s) into {} daily product row(s)", records.size(), aggregates.size());
        return aggregates;
    }
}
