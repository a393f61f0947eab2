package qctl.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qctl.exception.EmptyStateSpaceException;
import qctl.exception.UnsupportedFormulaException;
import qctl.formula.FormulaTree;
import qctl.graph.StateGraph;

import java.util.*;
import java.util.concurrent.*;

/**
 * Evaluates several formulas against one state graph on a fixed thread pool.
 * The graph is shared read-only; each task runs its own {@link DegreeEvaluator}.
 */
public class BatchEvaluator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BatchEvaluator.class);

    private final ExecutorService executor;
    private final int threads;

    public BatchEvaluator(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        this.threads = threads;
        this.executor = threads == 1 ? Executors.newSingleThreadExecutor() : Executors.newFixedThreadPool(threads);
    }

    public int getThreads() {
        return threads;
    }

    /**
     * Results are returned in the order of {@code formulas}. The first failing
     * formula's exception is rethrown; remaining tasks are cancelled.
     */
    public List<EvaluationResult> evaluateAll(StateGraph graph, List<FormulaTree> formulas)
            throws UnsupportedFormulaException, EmptyStateSpaceException {
        logger.info("Evaluating {} formula(s) on {} thread(s)", formulas.size(), threads);
        List<Future<EvaluationResult>> futures = new ArrayList<>(formulas.size());
        for (FormulaTree formula : formulas) {
            futures.add(executor.submit(() -> new DegreeEvaluator(graph).evaluate(formula)));
        }

        List<EvaluationResult> results = new ArrayList<>(formulas.size());
        try {
            for (Future<EvaluationResult> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while evaluating formulas", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof UnsupportedFormulaException) throw (UnsupportedFormulaException) cause;
            if (cause instanceof EmptyStateSpaceException) throw (EmptyStateSpaceException) cause;
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Formula evaluation failed", cause);
        }
        return results;
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> f : futures) {
            f.cancel(true);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
