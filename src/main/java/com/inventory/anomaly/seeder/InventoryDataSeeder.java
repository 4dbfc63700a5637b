package com.inventory.anomaly.seeder;

import com.inventory.anomaly.config.PipelineConfig;
import com.inventory.anomaly.model.InventoryRecord;
import com.inventory.anomaly.repository.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Writes a synthetic inventory file to the configured input source when none
 * exists, so a fresh checkout can run the pipeline end to end.
 * Only active with {@code pipeline.seed.enabled=true}; an existing file is never touched.
 *
 * Each product gets a base consumption and stock level, then per day:
 *   - consumption = base x trend x weekly x monthly seasonality x noise
 *   - stock is restocked on the 1st of the month and drawn down by consumption
 *   - with probability {@code anomaly-rate}: a 2-4x consumption spike, or stock
 *     dropped to 10% / tripled
 */
@Component
@ConditionalOnProperty(prefix = "pipeline.seed", name = "enabled", havingValue = "true")
@Order(1)
public class InventoryDataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(InventoryDataSeeder.class);

    private final PipelineConfig config;
    private final ArtifactStore artifactStore;

    public InventoryDataSeeder(PipelineConfig config, ArtifactStore artifactStore) {
        this.config = config;
        this.artifactStore = artifactStore;
    }

    @Override
    public void run(String... args) throws Exception {
        seedIfMissing();
    }

    /**
     * @return true if a file was written, false if the input source already existed
     */
    public boolean seedIfMissing() throws IOException {
        Path target = Path.of(config.getInputSource());
        if (Files.exists(target)) {
            log.info("Input source {} exists, skipping seeding", target);
            return false;
        }

        List<InventoryRecord> records = generate();
        artifactStore.writeCsv(target, records, InventoryRecord.class);
        log.info("Seeded {} with {} synthetic row(s) for {} product(s)",
                target, records.size(), config.getSeed().getProducts());
        return true;
    }

    List<InventoryRecord> generate() {
        PipelineConfig.Seed seed = config.getSeed();
        LocalDate start = LocalDate.parse(seed.getStartDate());
        LocalDate end = LocalDate.parse(seed.getEndDate());
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("pipeline.seed.end-date is before start-date");
        }
        Random random = new Random(seed.getRandomSeed());

        List<InventoryRecord> records = new ArrayList<>();
        for (int p = 1; p <= seed.getProducts(); p++) {
            String productId = String.format("PROD_%03d", p);
            double baseConsumption = uniform(random, 10, 50);
            double baseStock = uniform(random, 500, 2000);
            double yearlyTrend = uniform(random, -0.1, 0.1);
            double stock = baseStock;

            for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
                long day = ChronoUnit.DAYS.between(start, date);
                double trend = 1 + (day / 365.0) * yearlyTrend;
                // Monday = 0
                int dayOfWeek = date.getDayOfWeek().getValue() - 1;
                double weekly = 1 + 0.2 * Math.sin(2 * Math.PI * dayOfWeek / 7);
                double monthly = 1 + 0.15 * Math.sin(2 * Math.PI * date.getDayOfMonth() / 30);
                double noise = uniform(random, 0.85, 1.15);

                double consumption = Math.max(0, round2(baseConsumption * trend * weekly * monthly * noise));

                if (date.getDayOfMonth() == 1) {
                    stock = baseStock + uniform(random, -100, 100);
                }
                stock -= consumption;
                // emergency restock
                if (stock < 0) {
                    stock = uniform(random, 100, 500);
                }

                if (random.nextDouble() < seed.getAnomalyRate()) {
                    if (random.nextBoolean()) {
                        consumption *= uniform(random, 2, 4);
                    } else {
                        stock *= random.nextBoolean() ? 0.1 : 3;
                    }
                }

                records.add(InventoryRecord.builder()
                        .date(date)
                        .productId(productId)
                        .stock(round2(Math.max(0, stock)))
                        .consumption(round2(consumption))
                        .build());
            }
        }
        return records;
    }

    private static double uniform(Random random, double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
