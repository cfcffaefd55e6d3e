package org.foldcalc.calculator.batch;

import org.foldcalc.calculator.api.EvaluationException;
import org.foldcalc.calculator.api.ICalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates many independent lines, optionally on a fixed-size worker pool.
 * <p>
 * Lines share no state, so they can be evaluated in any order; outcomes are always
 * returned in input order. Blank lines are skipped and produce no outcome.
 */
public class BatchEvaluator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchEvaluator.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final ICalculator calculator;
    private final int parallelism;
    private final ExecutorService executorService;

    /**
     * Creates a new BatchEvaluator.
     * @param calculator The calculator used for every line. Must be thread-safe if {@code parallelism > 1}.
     * @param parallelism The number of worker threads; {@code 1} evaluates on the calling thread.
     */
    public BatchEvaluator(ICalculator calculator, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.parallelism = parallelism;
        this.executorService = parallelism > 1 ? Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory()) : null;
    }

    /**
     * Evaluates all non-blank lines.
     * @param lines The input lines.
     * @return One outcome per non-blank line, in input order.
     * @throws InterruptedException if the calling thread is interrupted while waiting for workers.
     */
    public List<LineOutcome> evaluateAll(List<String> lines) throws InterruptedException {
        List<PendingLine> pending = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (!lines.get(i).isBlank()) {
                pending.add(new PendingLine(i + 1, lines.get(i)));
            }
        }
        log.debug("Evaluating {} of {} lines with parallelism {}", pending.size(), lines.size(), parallelism);

        List<LineOutcome> outcomes = new ArrayList<>(pending.size());
        if (executorService == null) {
            for (PendingLine line : pending) {
                outcomes.add(evaluateLine(line));
            }
            return outcomes;
        }

        List<Callable<LineOutcome>> tasks = new ArrayList<>(pending.size());
        for (PendingLine line : pending) {
            tasks.add(() -> evaluateLine(line));
        }
        // invokeAll returns the futures in task order.
        for (Future<LineOutcome> future : executorService.invokeAll(tasks)) {
            try {
                outcomes.add(future.get());
            } catch (ExecutionException e) {
                throw new IllegalStateException("Batch worker failed unexpectedly", e.getCause());
            }
        }
        return outcomes;
    }

    private LineOutcome evaluateLine(PendingLine pending) {
        try {
            return new LineOutcome.Success(pending.lineNumber(), pending.line(), calculator.evaluate(pending.line()));
        } catch (EvaluationException e) {
            return new LineOutcome.Failure(pending.lineNumber(), pending.line(), e);
        }
    }

    @Override
    public void close() {
        if (executorService == null) {
            return;
        }
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Batch workers did not terminate within {} seconds, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record PendingLine(int lineNumber, String line) {}

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "batch-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
