package work.canopy.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.canopy.api.StepFailure;
import work.canopy.api.StepResult;
import work.canopy.model.Experiment;
import work.canopy.model.StepDefinition;
import work.canopy.plan.ExecutionPlan;

/**
 * Drives steps through an {@link ExecutionPlan}. With one slot, steps run strictly in plan order; with more, steps
 * whose dependencies have all completed run concurrently, launched in lexicographic order. The first failure stops
 * new launches; steps already running are allowed to finish.
 */
public final class StepScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(StepScheduler.class);

    private final ExecutionPlan plan;
    private final Map<String, StepDefinition> steps = new HashMap<>();
    private final Function<StepDefinition, StepResult> runner;
    private final int maxParallelSteps;

    public StepScheduler(ExecutionPlan plan, Experiment experiment, Function<StepDefinition, StepResult> runner, int maxParallelSteps) {
        this.plan = Objects.requireNonNull(plan, "plan");
        this.runner = Objects.requireNonNull(runner, "runner");
        if (maxParallelSteps < 1) {
            throw new IllegalArgumentException("maxParallelSteps must be at least 1");
        }
        this.maxParallelSteps = maxParallelSteps;
        experiment.steps().forEach(step -> steps.put(step.id(), step));
    }

    public Outcome run() {
        return maxParallelSteps == 1 ? runSequentially() : runConcurrently();
    }

    private Outcome runSequentially() {
        var results = new LinkedHashMap<String, StepResult>();
        var completed = new ArrayList<String>();
        for (var stepId : plan.stepsInOrder()) {
            var result = runGuarded(stepId);
            results.put(stepId, result);
            if (!result.success()) {
                return new Outcome(completed, Optional.of(stepId), results);
            }
            completed.add(stepId);
        }
        return new Outcome(completed, Optional.empty(), results);
    }

    private Outcome runConcurrently() {
        var results = new LinkedHashMap<String, StepResult>();
        var completed = new ArrayList<String>();
        Optional<String> failedStep = Optional.empty();

        var pending = new HashMap<String, Integer>();
        var dependants = new HashMap<String, List<String>>();
        var ready = new TreeSet<String>();
        for (var stepId : plan.stepsInOrder()) {
            var deps = plan.dependenciesOf(stepId);
            pending.put(stepId, deps.size());
            deps.forEach(dep -> dependants.computeIfAbsent(dep, key -> new ArrayList<>()).add(stepId));
            if (deps.isEmpty()) {
                ready.add(stepId);
            }
        }

        var threadIds = new AtomicInteger();
        var pool = Executors.newFixedThreadPool(maxParallelSteps, task -> {
            var thread = new Thread(task, "canopy-step-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        var completion = new ExecutorCompletionService<StepResult>(pool);
        int inFlight = 0;
        try {
            while (true) {
                while (failedStep.isEmpty() && !ready.isEmpty() && inFlight < maxParallelSteps) {
                    var stepId = ready.pollFirst();
                    LOG.debug("Launching step '{}'", stepId);
                    completion.submit(() -> runGuarded(stepId));
                    inFlight++;
                }
                if (inFlight == 0) {
                    break;
                }
                var result = completion.take().get();
                inFlight--;
                results.put(result.stepId(), result);
                if (!result.success()) {
                    if (failedStep.isEmpty()) {
                        failedStep = Optional.of(result.stepId());
                    }
                    continue;
                }
                completed.add(result.stepId());
                for (var dependant : dependants.getOrDefault(result.stepId(), List.of())) {
                    if (pending.merge(dependant, -1, Integer::sum) == 0) {
                        ready.add(dependant);
                    }
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running steps", ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Step execution failed unexpectedly", ex.getCause());
        } finally {
            pool.shutdownNow();
        }
        return new Outcome(completed, failedStep, results);
    }

    private StepResult runGuarded(String stepId) {
        try {
            return runner.apply(steps.get(stepId));
        } catch (RuntimeException ex) {
            LOG.error("Step '{}' raised an unexpected error", stepId, ex);
            return StepResult.failed(stepId, StepFailure.PRIMITIVE_EXECUTION, null, ex.toString());
        }
    }

    /**
     * @param completedSteps successful steps in the order they finished
     * @param results every attempted step, in the order they finished
     */
    public record Outcome(List<String> completedSteps, Optional<String> failedStep, Map<String, StepResult> results) {
        public Outcome {
            completedSteps = List.copyOf(completedSteps);
            results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        }

        public boolean success() {
            return failedStep.isEmpty();
        }
    }
}
