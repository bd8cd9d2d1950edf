package dev.reciperunner.engine;

import dev.reciperunner.context.Context;
import dev.reciperunner.context.ContextStore;
import dev.reciperunner.exception.InvalidRecipeException;
import dev.reciperunner.exception.StepExecutionException;
import dev.reciperunner.exception.StepResolutionException;
import dev.reciperunner.exception.StepTimeoutException;
import dev.reciperunner.model.ExecutionOptions;
import dev.reciperunner.model.ExecutionStatistics;
import dev.reciperunner.model.RecipeExecutionResult;
import dev.reciperunner.model.RecipeSpec;
import dev.reciperunner.model.RetryPolicy;
import dev.reciperunner.model.StepExecutionResult;
import dev.reciperunner.model.StepOutcome;
import dev.reciperunner.model.StepSpec;
import dev.reciperunner.model.StepStatus;
import dev.reciperunner.resolver.StepCallable;
import dev.reciperunner.resolver.StepInvocation;
import dev.reciperunner.resolver.StepResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Executes a validated {@link RecipeSpec} against a {@link Context}.
 *
 * <p>Steps start in ascending {@code idx} order. Each attempt runs on a worker
 * thread so its timeout can be enforced without the step's cooperation; a step's
 * retries fully resolve before the next step starts. Per-step failures never
 * escape {@link #run}: they are captured in the step's result and the run halts or
 * continues according to {@link ExecutionOptions#continueOnError()}.
 *
 * <p>{@link #cancel()} is cooperative. It stops new steps and new retries from
 * starting and cuts retry sleeps short, but an attempt already in flight runs to
 * completion or to its timeout.
 *
 * <p>With {@link ExecutionOptions#dependencyParallel()} the plan is instead
 * executed in dependency layers, steps within a layer running concurrently.
 */
public final class RecipeRunner implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RecipeRunner.class);

    /** Attribution used for every context write made by the engine. */
    public static final String WHO = "recipe-runner";

    private final StepResolver resolver;
    private final Duration defaultTimeout;
    private final ExecutionHistory history;
    private final ContextStore contextStore;
    private final Clock clock;
    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();
    private final Set<CancellationSignal> activeRuns = ConcurrentHashMap.newKeySet();
    private final ExecutorService workers;

    public RecipeRunner(StepResolver resolver) {
        this(resolver, null);
    }

    /**
     * @param defaultTimeout bound for attempts of steps that declare no timeout; null for none
     */
    public RecipeRunner(StepResolver resolver, Duration defaultTimeout) {
        this(resolver, defaultTimeout, ExecutionHistory.DEFAULT_LIMIT, null, Clock.systemUTC());
    }

    /**
     * @param historyLimit number of past results kept for introspection
     * @param contextStore store the context is flushed to after every step; null for none
     */
    public RecipeRunner(StepResolver resolver, Duration defaultTimeout, int historyLimit,
                        ContextStore contextStore, Clock clock) {
        this.resolver = Objects.requireNonNull(resolver, "Step resolver cannot be null");
        this.defaultTimeout = defaultTimeout;
        this.history = new ExecutionHistory(historyLimit);
        this.contextStore = contextStore;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.workers = Executors.newCachedThreadPool(daemonThreads("recipe-step"));
    }

    public RecipeRunner addListener(ExecutionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    /**
     * Run every step of {@code spec}.
     *
     * @throws InvalidRecipeException if the spec carries validation errors; nothing runs
     */
    public RecipeExecutionResult run(RecipeSpec spec, Context context, ExecutionOptions options)
            throws InvalidRecipeException {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(options, "options");
        if (!spec.isValid()) {
            throw new InvalidRecipeException(spec.name(), spec.validationMessages());
        }

        var signal = new CancellationSignal();
        activeRuns.add(signal);
        try {
            RecipeExecutionResult result = new Execution(spec, context, options, signal).execute();
            history.record(result);
            notifyListeners(l -> l.onRunFinished(result));
            return result;
        } finally {
            activeRuns.remove(signal);
        }
    }

    /** Ask every in-flight run on this runner to stop starting new work. */
    public void cancel() {
        logger.info("Cancellation requested for {} active run(s)", activeRuns.size());
        activeRuns.forEach(CancellationSignal::cancel);
    }

    public boolean isCancellationRequested() {
        return activeRuns.stream().anyMatch(CancellationSignal::isCancelled);
    }

    public ExecutionStatistics getExecutionStatistics() {
        return history.statistics();
    }

    /** Up to {@code limit} most recent results, oldest first. */
    public List<RecipeExecutionResult> getExecutionHistory(int limit) {
        return history.recent(limit);
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void shutdown() {
        workers.shutdownNow();
        logger.debug("Recipe runner shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    /** State of a single {@link #run} call. Only the coordinating thread mutates it. */
    private final class Execution {
        private final RecipeSpec spec;
        private final Context context;
        private final ExecutionOptions options;
        private final CancellationSignal signal;
        private final Map<String, StepExecutionResult> results = new LinkedHashMap<>();
        private final List<String> globalErrors = new ArrayList<>();
        private final List<String> globalWarnings = new ArrayList<>();

        Execution(RecipeSpec spec, Context context, ExecutionOptions options, CancellationSignal signal) {
            this.spec = spec;
            this.context = context;
            this.options = options;
            this.signal = signal;
        }

        RecipeExecutionResult execute() {
            Instant start = clock.instant();
            logger.info("Starting recipe '{}' ({} step(s), {})", spec.name(), spec.steps().size(),
                options.dependencyParallel() ? "dependency-parallel" : "sequential");
            seedContext(start);
            notifyListeners(l -> l.onRunStarted(spec));

            if (options.dependencyParallel()) {
                executeInBatches();
            } else {
                executeSequentially();
            }

            List<StepExecutionResult> ordered = spec.steps().stream().map(s -> results.get(s.name())).toList();
            boolean cancelled = ordered.stream().anyMatch(r -> r.status() == StepStatus.CANCELLED);
            var result = new RecipeExecutionResult(spec.name(), ordered, globalErrors, globalWarnings,
                start, clock.instant(), cancelled);
            finalizeContext(result);
            logger.info("Recipe '{}' finished: success={}, {} succeeded, {} failed, {} skipped, {} cancelled in {}s",
                spec.name(), result.overallSuccess(), result.count(StepStatus.SUCCEEDED),
                result.count(StepStatus.FAILED) + result.count(StepStatus.TIMED_OUT),
                result.count(StepStatus.SKIPPED), result.count(StepStatus.CANCELLED),
                "%.3f".formatted(result.executionTimeSeconds()));
            return result;
        }

        private void executeSequentially() {
            List<StepSpec> plan = spec.steps();
            for (int i = 0; i < plan.size(); i++) {
                StepSpec step = plan.get(i);
                if (signal.isCancelled()) {
                    cancelRemaining(plan.subList(i, plan.size()), step.name());
                    return;
                }

                StepExecutionResult result = filterReason(step)
                    .map(reason -> skipped(step, reason))
                    .orElseGet(() -> executeStep(step));
                record(result);

                if (result.status() == StepStatus.CANCELLED) {
                    cancelRemaining(plan.subList(i + 1, plan.size()), step.name());
                    return;
                }
                if (result.status().isFailure() && !options.continueOnError()) {
                    haltRemaining(plan.subList(i + 1, plan.size()), step.name());
                    return;
                }
            }
        }

        private void executeInBatches() {
            Map<String, StepSpec> byName = new LinkedHashMap<>();
            spec.steps().forEach(s -> byName.put(s.name(), s));
            List<List<String>> batches = DependencyGraph.of(spec.steps()).executionBatches();

            Set<String> blocked = new HashSet<>();
            ExecutorService pool = Executors.newFixedThreadPool(options.maxParallelSteps(), daemonThreads("recipe-batch"));
            try {
                for (int b = 0; b < batches.size(); b++) {
                    List<StepSpec> batch = batches.get(b).stream().map(byName::get).toList();
                    if (signal.isCancelled()) {
                        cancelRemaining(remainingFrom(batches, b, byName), batch.get(0).name());
                        return;
                    }
                    logger.debug("Starting batch {} of {}: {}", b + 1, batches.size(), batches.get(b));

                    Map<StepSpec, Future<StepExecutionResult>> running = new LinkedHashMap<>();
                    Map<StepSpec, StepExecutionResult> finished = new LinkedHashMap<>();
                    for (StepSpec step : batch) {
                        var reason = filterReason(step);
                        var blocker = step.dependsOn().stream().filter(blocked::contains).findFirst();
                        if (reason.isPresent()) {
                            finished.put(step, skipped(step, reason.get()));
                        } else if (blocker.isPresent()) {
                            blocked.add(step.name());
                            finished.put(step,
                                skipped(step, "dependency '%s' did not succeed".formatted(blocker.get())));
                        } else {
                            running.put(step, pool.submit(() -> executeStep(step)));
                        }
                    }

                    boolean halt = false;
                    for (StepSpec step : batch) {
                        StepExecutionResult result = finished.containsKey(step)
                            ? finished.get(step)
                            : await(step, running.get(step));
                        record(result);
                        if (result.status().isFailure() || result.status() == StepStatus.CANCELLED) {
                            blocked.add(step.name());
                        }
                        if (result.status().isFailure() && !options.continueOnError()) {
                            halt = true;
                        }
                    }

                    if (halt) {
                        String failed = batch.stream()
                            .filter(s -> results.get(s.name()).status().isFailure())
                            .map(StepSpec::name).findFirst().orElse("?");
                        haltRemaining(remainingFrom(batches, b + 1, byName), failed);
                        return;
                    }
                }
            } finally {
                pool.shutdownNow();
            }
        }

        private StepExecutionResult await(StepSpec step, Future<StepExecutionResult> future) {
            try {
                return future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                signal.cancel();
                future.cancel(true);
                return cancelledBeforeStart(step, "coordinator interrupted");
            } catch (ExecutionException e) {
                logger.error("Step '{}' crashed the batch worker", step.name(), e.getCause());
                Instant now = clock.instant();
                return new StepExecutionResult(step.name(), StepStatus.FAILED, 1, now, now,
                    describe(e.getCause()), null);
            }
        }

        private List<StepSpec> remainingFrom(List<List<String>> batches, int from, Map<String, StepSpec> byName) {
            return batches.subList(from, batches.size()).stream()
                .flatMap(List::stream)
                .map(byName::get)
                .toList();
        }

        /**
         * Resolve and run one step, retrying per its policy. Never throws for a
         * step-level failure.
         */
        private StepExecutionResult executeStep(StepSpec step) {
            RetryPolicy retry = options.retryPolicyFor(step);
            Duration timeout = options.timeoutFor(step, defaultTimeout);
            var state = new StepRunState(step.name(), retry.maxAttempts());
            StepCallable callable = null;

            while (true) {
                state.startAttempt(clock.instant());
                int attempt = state.attempts();
                notifyListeners(l -> l.onStepStarted(step, attempt));
                logger.info("Running step '{}' (idx {}), attempt {}/{}", step.name(), step.idx(),
                    attempt, retry.maxAttempts());

                boolean retryable = true;
                try {
                    if (callable == null) {
                        callable = resolve(step);
                    }
                    Object output = invoke(callable, step, attempt, timeout);
                    state.succeed(output, clock.instant());
                    logger.info("Step '{}' succeeded on attempt {}", step.name(), attempt);
                    break;
                } catch (StepResolutionException e) {
                    state.fail("Cannot resolve step callable: " + e.getMessage(), clock.instant());
                    retryable = options.retryResolutionFailures();
                } catch (StepTimeoutException e) {
                    state.timeOut(e.getMessage(), clock.instant());
                } catch (StepExecutionException e) {
                    state.fail(e.getMessage(), clock.instant());
                    logger.debug("Step '{}' attempt {} failure details", step.name(), attempt, e.getCause());
                }
                logger.warn("Step '{}' attempt {}/{} {}: {}", step.name(), attempt, retry.maxAttempts(),
                    state.status() == StepStatus.TIMED_OUT ? "timed out" : "failed", state.error());

                if (!retryable || !state.canRetry()) {
                    break;
                }
                if (waitBeforeRetry(retry.delay())) {
                    state.cancel("cancelled before retry", clock.instant());
                    logger.info("Step '{}' retries cancelled", step.name());
                    break;
                }
            }
            return state.toResult();
        }

        /** Any resolver crash counts as a resolution failure of this step. */
        private StepCallable resolve(StepSpec step) throws StepResolutionException {
            try {
                return resolver.resolve(step.moduleRef(), step.functionRef());
            } catch (RuntimeException | LinkageError e) {
                logger.debug("Resolver {} crashed on step '{}'", resolver.getName(), step.name(), e);
                throw new StepResolutionException(step.moduleRef(), step.functionRef(),
                    "%s resolver failed: %s".formatted(resolver.getName(), describe(e)), e);
            }
        }

        private Object invoke(StepCallable callable, StepSpec step, int attempt, Duration timeout)
                throws StepTimeoutException, StepExecutionException {
            var invocation = new StepInvocation(step.name(), attempt, step.args(), context, signal::isCancelled);
            Future<StepOutcome> future = workers.submit(() -> callable.call(invocation));

            StepOutcome outcome;
            try {
                outcome = timeout == null
                    ? future.get()
                    : future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                throw new StepTimeoutException(step.name(), attempt, timeout);
            } catch (ExecutionException e) {
                throw new StepExecutionException(step.name(), attempt, describe(e.getCause()), e.getCause());
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                signal.cancel();
                throw new StepExecutionException(step.name(), attempt, "Interrupted while waiting for step", e);
            }

            if (outcome instanceof StepOutcome.Failure failure) {
                String reason = failure.error() != null ? failure.error() : "step reported failure";
                throw new StepExecutionException(step.name(), attempt, reason);
            }
            return outcome instanceof StepOutcome.Success success ? success.output() : null;
        }

        /** @return true if cancellation was requested before or during the delay */
        private boolean waitBeforeRetry(Duration delay) {
            try {
                return signal.awaitCancellation(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                signal.cancel();
                return true;
            }
        }

        private Optional<String> filterReason(StepSpec step) {
            if (options.excludes(step.name())) {
                return Optional.of("excluded by step filter");
            }
            if (!step.enabled()) {
                return Optional.of("step disabled");
            }
            return Optional.empty();
        }

        private StepExecutionResult skipped(StepSpec step, String reason) {
            var state = new StepRunState(step.name(), 1);
            state.skip(reason);
            return state.toResult();
        }

        private StepExecutionResult cancelledBeforeStart(StepSpec step, String reason) {
            var state = new StepRunState(step.name(), 1);
            state.cancel(reason, clock.instant());
            return state.toResult();
        }

        private void haltRemaining(List<StepSpec> remaining, String failedStep) {
            String reason = "not started: run halted after step '%s' failed".formatted(failedStep);
            for (StepSpec step : remaining) {
                record(skipped(step, reason));
            }
            if (!remaining.isEmpty()) {
                logger.warn("Halting recipe '{}' after step '{}' failed; {} step(s) skipped",
                    spec.name(), failedStep, remaining.size());
            }
        }

        private void cancelRemaining(List<StepSpec> remaining, String nextStep) {
            for (StepSpec step : remaining) {
                record(cancelledBeforeStart(step, "cancelled before start"));
            }
            if (!remaining.isEmpty()) {
                globalWarnings.add("Execution cancelled before step '%s'".formatted(nextStep));
                logger.info("Recipe '{}' cancelled; {} step(s) not started", spec.name(), remaining.size());
            }
        }

        private void record(StepExecutionResult result) {
            results.put(result.stepName(), result);
            if (result.status().isFailure()) {
                globalErrors.add("Step '%s' %s after %d attempt(s): %s".formatted(result.stepName(),
                    result.status() == StepStatus.TIMED_OUT ? "timed out" : "failed",
                    result.attempts(), result.error()));
            }

            String prefix = "steps." + result.stepName() + ".";
            context.set(prefix + "status", result.status().name(), WHO);
            context.set(prefix + "attempts", result.attempts(), WHO);
            if (result.output() != null) {
                context.set(prefix + "output", result.output(), WHO);
            }
            if (result.error() != null) {
                context.set(prefix + "error", result.error(), WHO);
            }
            flushContext();
            notifyListeners(l -> l.onStepFinished(result));
        }

        private void seedContext(Instant start) {
            context.set("recipe.name", spec.name(), WHO);
            context.set("recipe.version", spec.metadata().version(), WHO);
            context.set("recipe.source", spec.metadata().sourcePath(), WHO);
            context.set("recipe.content_hash", spec.metadata().contentHash(), WHO);
            context.set("recipe.started_at", start.toString(), WHO);
        }

        private void finalizeContext(RecipeExecutionResult result) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("overall_success", result.overallSuccess());
            summary.put("cancelled", result.cancelled());
            summary.put("succeeded", result.count(StepStatus.SUCCEEDED));
            summary.put("failed", result.count(StepStatus.FAILED));
            summary.put("timed_out", result.count(StepStatus.TIMED_OUT));
            summary.put("skipped", result.count(StepStatus.SKIPPED));
            summary.put("cancelled_steps", result.count(StepStatus.CANCELLED));
            summary.put("success_rate", result.successRate());
            summary.put("execution_time_seconds", result.executionTimeSeconds());
            summary.put("global_errors", result.globalErrors());
            context.set("recipe.finished_at", result.endTime().toString(), WHO);
            context.set("recipe.summary", summary, WHO);
            flushContext();
        }

        private void flushContext() {
            if (contextStore == null) {
                return;
            }
            try {
                context.flushTo(contextStore);
            } catch (IOException | RuntimeException e) {
                logger.warn("Context flush failed: {}", e.toString());
                globalWarnings.add("Context flush failed: " + e.getMessage());
            }
        }
    }

    private void notifyListeners(Consumer<ExecutionListener> event) {
        for (ExecutionListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Execution listener {} failed: {}", listener.getClass().getSimpleName(), e.toString());
            }
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() == null
            ? error.getClass().getSimpleName()
            : error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
