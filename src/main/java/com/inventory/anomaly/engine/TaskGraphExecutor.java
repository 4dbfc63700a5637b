package com.inventory.anomaly.engine;

import com.inventory.anomaly.config.MetricsConfig;
import com.inventory.anomaly.model.RunResult;
import com.inventory.anomaly.model.RunStatus;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs a statically declared task graph once, in declaration order.
 *
 * <p>Rules, all enforced here rather than at the call sites:
 * <ul>
 *   <li>A task starts only when every predecessor SUCCEEDED; otherwise it is SKIPPED.</li>
 *   <li>A required task that exhausts its retries fails the run and halts the critical
 *       path: every later required task is SKIPPED without being attempted.</li>
 *   <li>An optional task that exhausts its retries is FAILED but the run status is untouched.</li>
 *   <li>Each attempt emits exactly one log event and one metric, in attempt order.</li>
 * </ul>
 */
@Component
public class TaskGraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphExecutor.class);

    private final RetryPolicyEngine retryEngine;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public TaskGraphExecutor(RetryPolicyEngine retryEngine, Tracer tracer, MetricsConfig metricsConfig) {
        this.retryEngine = retryEngine;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
    }

    public ExecutionReport execute(List<Task<?>> tasks, RunResultAccumulator accumulator) {
        validateGraph(tasks);

        Map<String, TaskExecution> executions = new LinkedHashMap<>();
        TaskContext context = new TaskContext();
        boolean runFailed = false;

        for (Task<?> task : tasks) {
            TaskExecution execution = new TaskExecution(task);
            executions.put(task.getId(), execution);

            String blocker = firstUnsatisfiedDependency(task, executions);
            if (blocker != null) {
                skip(execution, "predecessor '" + blocker + "' did not succeed");
                continue;
            }
            if (runFailed && task.isRequired()) {
                skip(execution, "critical path halted by an earlier required failure");
                continue;
            }

            run(task, execution, context, accumulator);

            if (execution.getState() == TaskState.FAILED && task.isRequired()) {
                runFailed = true;
            }
        }

        RunStatus status = runFailed ? RunStatus.FAILED : RunStatus.SUCCEEDED;
        Map<String, TaskState> states = new LinkedHashMap<>();
        executions.forEach((id, execution) -> states.put(id, execution.getState()));

        RunResult result = accumulator.seal(status, states);
        metricsConfig.recordRun(status, result.getAnomaliesDetected(), result.getAnomalyPercentage());
        return new ExecutionReport(result, Collections.unmodifiableMap(executions));
    }

    private <T> void run(Task<T> task, TaskExecution execution, TaskContext context,
                         RunResultAccumulator accumulator) {
        execution.start();

        Span span = tracer.nextSpan()
                .name("pipeline.task." + task.getId())
                .tag("task.required", String.valueOf(task.isRequired()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            T output = retryEngine.executeWithRetry(
                    () -> task.getWork().execute(context),
                    task.getRetryPolicy(),
                    attempt -> onAttempt(task, execution, attempt));

            context.put(task.getId(), output);
            task.getContribution().accept(output, accumulator);
            execution.succeed();
        } catch (RetryExhaustedException e) {
            execution.fail(e.getMessage());
            span.error(e);
            if (task.isRequired()) {
                log.error("Required task {} failed after {} attempt(s); run will be marked failed",
                        task.getId(), e.getAttempts(), e.getCause());
            } else {
                log.warn("Optional task {} failed after {} attempt(s); run status unaffected: {}",
                        task.getId(), e.getAttempts(), e.getMessage());
            }
        } finally {
            span.tag("task.attempts", String.valueOf(execution.getAttempts().size()));
            span.tag("task.state", execution.getState().toJson());
            span.end();
        }
    }

    private void onAttempt(Task<?> task, TaskExecution execution, TaskAttempt attempt) {
        execution.recordAttempt(attempt);
        metricsConfig.recordTaskAttempt(task.getId(), attempt.isSuccess());
        if (attempt.isSuccess()) {
            log.info("task={} attempt={} outcome=success", task.getId(), attempt.getAttemptNumber());
        } else {
            log.warn("task={} attempt={} outcome=failure error={}",
                    task.getId(), attempt.getAttemptNumber(), attempt.getError());
        }
    }

    private void skip(TaskExecution execution, String reason) {
        execution.skip(reason);
        metricsConfig.recordTaskSkipped(execution.getTaskId());
        log.info("task={} skipped: {}", execution.getTaskId(), reason);
    }

    private String firstUnsatisfiedDependency(Task<?> task, Map<String, TaskExecution> executions) {
        for (String dependency : task.getDependencies()) {
            if (executions.get(dependency).getState() != TaskState.SUCCEEDED) {
                return dependency;
            }
        }
        return null;
    }

    /**
     * Declaration order must be a topological order: ids are unique and every
     * dependency refers to a task declared earlier.
     */
    static void validateGraph(List<Task<?>> tasks) {
        Set<String> declared = new HashSet<>();
        for (Task<?> task : tasks) {
            for (String dependency : task.getDependencies()) {
                if (!declared.contains(dependency)) {
                    throw new IllegalArgumentException("Task '" + task.getId() + "' depends on '" + dependency
                            + "', which is not declared before it");
                }
            }
            if (!declared.add(task.getId())) {
                throw new IllegalArgumentException("Duplicate task id '" + task.getId() + "'");
            }
        }
    }
}
