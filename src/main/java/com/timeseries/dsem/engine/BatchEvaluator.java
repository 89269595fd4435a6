package com.timeseries.dsem.engine;

import com.timeseries.dsem.api.SolverOptions;
import com.timeseries.dsem.util.ErrorRateLimiter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Evaluates many parameter vectors in parallel, e.g. during a line search or a
 * parametric bootstrap.
 *
 * <p>
 * Each task assembles its own {@link PathMatrixSet} and {@link EffectSolver};
 * the only shared objects are the immutable assembler and options. A failed
 * vector does not abort the batch: its exception is recorded in the matching
 * {@link Evaluation} and logged (throttled).
 */
public final class BatchEvaluator implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(BatchEvaluator.class);
    private static final AtomicInteger POOL_ID = new AtomicInteger();

    private final PathMatrixAssembler assembler;
    private final SolverOptions options;
    private final ExecutorService executor;
    private final ErrorRateLimiter limiter = new ErrorRateLimiter(log, 1000);

    public BatchEvaluator(PathMatrixAssembler assembler, SolverOptions options) {
        this.assembler = assembler;
        this.options = options;
        int threads = Math.max(1, options.getParallelism());
        this.executor = Executors.newFixedThreadPool(threads, daemonFactory());
    }

    private static ThreadFactory daemonFactory() {
        int pool = POOL_ID.incrementAndGet();
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "dsem-eval-" + pool + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** Total effects for lags {@code 0..horizon} under every vector. */
    public List<Evaluation> totalEffects(List<double[]> vectors, int horizon) {
        return evaluate(vectors, solver -> solver.totalEffects(horizon));
    }

    /**
     * Runs {@code query} against a solver built for each vector. Results are in
     * input order.
     *
     * @throws IllegalStateException if the calling thread is interrupted while
     *                               waiting
     */
    public List<Evaluation> evaluate(List<double[]> vectors, Function<EffectSolver, EffectTable> query) {
        List<Future<EffectTable>> futures = new ArrayList<>(vectors.size());
        for (double[] theta : vectors) {
            double[] own = theta.clone();
            futures.add(executor.submit(() -> query.apply(new EffectSolver(assembler.assemble(own), options))));
        }

        List<Evaluation> out = new ArrayList<>(vectors.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                out.add(new Evaluation(i, vectors.get(i).clone(), futures.get(i).get(), null));
            } catch (ExecutionException e) {
                RuntimeException cause = e.getCause() instanceof RuntimeException re ? re
                        : new IllegalStateException(e.getCause());
                limiter.log("Evaluation " + i + " failed: " + cause.getMessage(), cause);
                out.add(new Evaluation(i, vectors.get(i).clone(), null, cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while waiting for batch evaluation", e);
            }
        }
        return out;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /**
     * Outcome for one vector: exactly one of {@code effects} and {@code error} is
     * non-null.
     */
    public record Evaluation(int index, double[] parameters, EffectTable effects, RuntimeException error) {
        public boolean succeeded() {
            return error == null;
        }
    }
}
