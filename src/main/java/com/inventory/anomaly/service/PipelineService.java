package com.inventory.anomaly.service;

import org.springframework.beans.factory.annotation.Autowired;
import com.inventory.anomaly.config.PipelineConfig;
import com.inventory.anomaly.engine.ExecutionReport;
import com.inventory.anomaly.engine.RetryPolicy;
import com.inventory.anomaly.engine.RunResultAccumulator;
import com.inventory.anomaly.engine.Task;
import com.inventory.anomaly.engine.TaskContext;
import com.inventory.anomaly.engine.TaskGraphExecutor;
import com.inventory.anomaly.forecast.ForecastingResult;
import com.inventory.anomaly.model.ChannelKind;
import com.inventory.anomaly.model.ConsumptionPoint;
import com.inventory.anomaly.model.DailyAggregate;
import com.inventory.anomaly.model.DetectionResult;
import com.inventory.anomaly.model.DispatchOutcome;
import com.inventory.anomaly.model.FeatureRow;
import com.inventory.anomaly.model.InventoryRecord;
import com.inventory.anomaly.model.RunOptions;
import com.inventory.anomaly.model.RunRequest;
import com.inventory.anomaly.model.RunResult;
import com.inventory.anomaly.report.ReportInput;
import com.inventory.anomaly.report.ReportRenderer;
import com.inventory.anomaly.repository.PipelineRunRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point of a pipeline run. Resolves the run options, declares the task graph
 * for them and hands it to the executor. Task failures never escape: they end up in
 * the returned result. The only exception thrown is {@link PipelineSetupException},
 * before anything has run.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    public static final String LOAD_DATA = "load_data";
    public static final String CLEAN_DATA = "clean_data";
    public static final String CREATE_FEATURES = "create_features";
    public static final String TRAIN_FORECAST_MODELS = "train_forecast_models";
    public static final String AGGREGATE_DATA = "aggregate_data";
    public static final String DETECT_ANOMALIES = "detect_anomalies";
    public static final String SEND_ALERTS = "send_alerts";
    public static final String GENERATE_REPORT = "generate_report";

    private static final DateTimeFormatter RUN_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final PipelineConfig config;
    private final TaskGraphExecutor executor;
    private final InventoryDataLoader loader;
    private final ConsumptionCleaner cleaner;
    private final LagFeatureBuilder featureBuilder;
    private final ForecastingService forecastingService;
    private final DailyAggregator aggregator;
    private final AnomalyDetectionService detectionService;
    private final AnomalyAlertService alertService;
    private final ReportRenderer reportRenderer;
    private final PipelineRunRepository runRepository;
    private final Clock clock;

    @Autowired
    public PipelineService(PipelineConfig config, TaskGraphExecutor executor,
                           InventoryDataLoader loader, ConsumptionCleaner cleaner,
                           LagFeatureBuilder featureBuilder, ForecastingService forecastingService,
                           DailyAggregator aggregator, AnomalyDetectionService detectionService,
                           AnomalyAlertService alertService, ReportRenderer reportRenderer,
                           PipelineRunRepository runRepository) {
        this(config, executor, loader, cleaner, featureBuilder, forecastingService, aggregator,
                detectionService, alertService, reportRenderer, runRepository, Clock.systemUTC());
    }

    PipelineService(PipelineConfig config, TaskGraphExecutor executor,
                    InventoryDataLoader loader, ConsumptionCleaner cleaner,
                    LagFeatureBuilder featureBuilder, ForecastingService forecastingService,
                    DailyAggregator aggregator, AnomalyDetectionService detectionService,
                    AnomalyAlertService alertService, ReportRenderer reportRenderer,
                    PipelineRunRepository runRepository, Clock clock) {
        this.config = config;
        this.executor = executor;
        this.loader = loader;
        this.cleaner = cleaner;
        this.featureBuilder = featureBuilder;
        this.forecastingService = forecastingService;
        this.aggregator = aggregator;
        this.detectionService = detectionService;
        this.alertService = alertService;
        this.reportRenderer = reportRenderer;
        this.runRepository = runRepository;
        this.clock = clock;
    }

    @Observed(name = "pipeline.run", contextualName = "run-pipeline")
    public RunResult run(RunRequest request) {
        RunOptions options = resolveOptions(request);
        requireReadable(options.getInputSource());

        String runId = newRunId();
        log.info("=== Pipeline run {} started (input={}, alerts={}, email={}, report={}) ===",
                runId, options.getInputSource(), options.isEnableAlerts(),
                options.isEnableEmailChannel(), options.isEnableReport());

        RunResultAccumulator accumulator = new RunResultAccumulator(runId, clock.millis());
        ExecutionReport report = executor.execute(buildTasks(runId, options), accumulator);
        RunResult result = report.getResult();

        log.info("=== Pipeline run {} finished: status={}, records={}, anomalies={} ({}%), models={} ===",
                runId, result.getStatus().toJson(), result.getTotalRecords(), result.getAnomaliesDetected(),
                result.getAnomalyPercentage(), result.getModelsTrained());

        runRepository.save(result);
        return result;
    }

    RunOptions resolveOptions(RunRequest request) {
        RunRequest r = request != null ? request : new RunRequest();
        return RunOptions.builder()
                .inputSource(r.getInputSource() != null && !r.getInputSource().isBlank()
                        ? r.getInputSource() : config.getInputSource())
                .enableAlerts(r.getEnableAlerts() != null ? r.getEnableAlerts() : config.isEnableAlerts())
                .enableEmailChannel(r.getEnableEmailChannel() != null
                        ? r.getEnableEmailChannel() : config.isEnableEmailChannel())
                .enableReport(r.getEnableReport() != null ? r.getEnableReport() : config.isEnableReport())
                .build();
    }

    /**
     * Declares the graph for one run. Declaration order is execution order; the
     * alert and report branches are declared only when enabled.
     */
    List<Task<?>> buildTasks(String runId, RunOptions options) {
        RetryPolicy required = config.getRequired().toPolicy();
        RetryPolicy optional = config.getOptional().toPolicy();
        List<Task<?>> tasks = new ArrayList<>();

        tasks.add(Task.<List<InventoryRecord>>builder()
                .id(LOAD_DATA)
                .work(ctx -> loader.load(options.getInputSource()))
                .retryPolicy(required)
                .required(true)
                .build());

        tasks.add(Task.<List<ConsumptionPoint>>builder()
                .id(CLEAN_DATA)
                .dependsOn(LOAD_DATA)
                .work(ctx -> cleaner.clean(listOutput(ctx, LOAD_DATA)))
                .retryPolicy(required)
                .required(true)
                .build());

        tasks.add(Task.<List<FeatureRow>>builder()
                .id(CREATE_FEATURES)
                .dependsOn(CLEAN_DATA)
                .work(ctx -> featureBuilder.build(listOutput(ctx, CLEAN_DATA)))
                .retryPolicy(required)
                .required(true)
                .build());

        tasks.add(Task.<ForecastingResult>builder()
                .id(TRAIN_FORECAST_MODELS)
                .dependsOn(CREATE_FEATURES)
                .work(ctx -> forecastingService.trainAll(listOutput(ctx, CREATE_FEATURES)))
                .retryPolicy(required)
                .required(true)
                .contribution((forecast, acc) -> acc.recordForecasting(
                        forecast.modelsTrained(), forecast.getFailedProducts(), forecast.getForecastArtifact()))
                .build());

        tasks.add(Task.<List<DailyAggregate>>builder()
                .id(AGGREGATE_DATA)
                .dependsOn(LOAD_DATA)
                .work(ctx -> aggregator.aggregate(listOutput(ctx, LOAD_DATA)))
                .retryPolicy(required)
                .required(true)
                .build());

        tasks.add(Task.<DetectionResult>builder()
                .id(DETECT_ANOMALIES)
                .dependsOn(AGGREGATE_DATA)
                .work(ctx -> detectionService.detect(listOutput(ctx, AGGREGATE_DATA)))
                .retryPolicy(required)
                .required(true)
                .contribution((detection, acc) -> {
                    acc.recordDetection(detection.getRecords().size(), detection.getAnomaliesDetected());
                    acc.recordDetectionArtifacts(detection.getAnomaliesArtifact(),
                            detection.getAnomaliesOnlyArtifact(), detection.getModelArtifact());
                })
                .build());

        if (options.isEnableAlerts()) {
            tasks.add(Task.<Map<ChannelKind, DispatchOutcome>>builder()
                    .id(SEND_ALERTS)
                    .dependsOn(TRAIN_FORECAST_MODELS)
                    .dependsOn(DETECT_ANOMALIES)
                    .work(ctx -> alertService.sendAlerts(
                            ctx.output(DETECT_ANOMALIES, DetectionResult.class).getRecords(), options))
                    .retryPolicy(optional)
                    .required(false)
                    .contribution((outcomes, acc) -> acc.recordAlertOutcomes(outcomes))
                    .build());
        }

        if (options.isEnableReport()) {
            tasks.add(Task.<String>builder()
                    .id(GENERATE_REPORT)
                    .dependsOn(TRAIN_FORECAST_MODELS)
                    .dependsOn(DETECT_ANOMALIES)
                    .work(ctx -> {
                        ForecastingResult forecast = ctx.output(TRAIN_FORECAST_MODELS, ForecastingResult.class);
                        return reportRenderer.render(ReportInput.builder()
                                .runId(runId)
                                .generatedAt(clock.instant())
                                .records(ctx.output(DETECT_ANOMALIES, DetectionResult.class).getRecords())
                                .modelsTrained(forecast.modelsTrained())
                                .forecastFailures(forecast.getFailedProducts())
                                .build());
                    })
                    .retryPolicy(optional)
                    .required(false)
                    .contribution((path, acc) -> acc.recordReport(path))
                    .build());
        }

        return tasks;
    }

    private static void requireReadable(String inputSource) {
        Path path = Path.of(inputSource);
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new PipelineSetupException("Input source is missing or unreadable: " + inputSource);
        }
    }

    private String newRunId() {
        return "run-" + LocalDateTime.now(clock.withZone(ZoneOffset.UTC)).format(RUN_ID_TIME)
                + "-" + UUID.randomUUID().toString().substring(0, 4);
    }

    @SuppressWarnings("unchecked")
    private static <E> List<E> listOutput(TaskContext ctx, String taskId) {
        return (List<E>) ctx.output(taskId, List.class);
    }
}
