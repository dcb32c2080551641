package de.mirkosertic.pwstrength;

import de.mirkosertic.pwstrength.dictionary.DictionarySource;
import de.mirkosertic.pwstrength.matcher.Matcher;
import de.mirkosertic.pwstrength.model.Match;
import de.mirkosertic.pwstrength.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Estimates password strength.
 *
 * <p>Every matcher of the ensemble scans the password in parallel; once all of them are done the
 * {@link MinimumEntropySearch} picks the cheapest decomposition and derives crack time and score.</p>
 *
 * <p>To evaluate many passwords, create one instance and call {@link #evaluate(String, CancellationToken)}
 * repeatedly: dictionaries and keyboard graphs are built on first use and reused afterwards. For a
 * single password {@link #evaluate(String, List, CancellationToken)} builds and releases everything
 * around one evaluation.</p>
 */
public class PasswordStrengthEstimator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PasswordStrengthEstimator.class);

    private final MatcherEnsemble ensemble;
    private final MatcherExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * Estimator with its own worker pool, shut down by {@link #close()}.
     */
    public PasswordStrengthEstimator(final MatcherEnsemble ensemble) {
        this(ensemble, new MatcherExecutorService(MatcherExecutorService.defaultPoolSize(ensemble.size())), true);
    }

    /**
     * Estimator on a shared worker pool. {@link #close()} leaves the pool running.
     */
    public PasswordStrengthEstimator(final MatcherEnsemble ensemble, final MatcherExecutorService executor) {
        this(ensemble, executor, false);
    }

    private PasswordStrengthEstimator(final MatcherEnsemble ensemble, final MatcherExecutorService executor,
                                      final boolean ownsExecutor) {
        this.ensemble = ensemble;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        logger.info("Password strength estimator created with {} matchers", ensemble.size());
    }

    /**
     * Evaluate one password against the given dictionaries with a temporary estimator.
     *
     * @return the result, or empty if {@code cancel} was signalled
     */
    public static Optional<Result> evaluate(final String password, final List<DictionarySource> dictionaries,
                                            final CancellationToken cancel) {
        final MatcherEnsemble ensemble = MatcherEnsemble.builder()
                .dictionaries(dictionaries)
                .build();
        try (final PasswordStrengthEstimator estimator = new PasswordStrengthEstimator(ensemble)) {
            return estimator.evaluate(password, cancel);
        }
    }

    /**
     * Evaluate {@code password}.
     *
     * @return the result, or empty if {@code cancel} was signalled before the evaluation finished
     */
    public Optional<Result> evaluate(final String password, final CancellationToken cancel) {
        if (cancel.isCancellationRequested()) {
            return Optional.empty();
        }
        final long start = System.nanoTime();

        final List<Matcher> matchers = ensemble.getMatchers();
        final List<Future<List<Match>>> futures = new ArrayList<>(matchers.size());
        for (final Matcher matcher : matchers) {
            futures.add(executor.submit(() -> matcher.match(password, cancel)));
        }

        final List<Match> candidates = new ArrayList<>();
        boolean cancelled = false;
        for (int index = 0; index < futures.size(); index++) {
            try {
                candidates.addAll(futures.get(index).get());
            } catch (final ExecutionException e) {
                if (e.getCause() instanceof CancellationException) {
                    cancelled = true;
                } else {
                    // One broken matcher must not take the others down
                    logger.warn("Matcher {} failed, ignoring its matches",
                            matchers.get(index).getClass().getSimpleName(), e.getCause());
                }
            } catch (final CancellationException e) {
                cancelled = true;
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                logger.debug("Interrupted while waiting for matchers");
                return Optional.empty();
            }
        }

        if (cancelled || cancel.isCancellationRequested()) {
            logger.debug("Evaluation cancelled");
            return Optional.empty();
        }

        final Result result = MinimumEntropySearch.search(password, candidates, start);
        logger.debug("Evaluated password of length {} from {} candidate matches in {} ms: entropy={}, score={}",
                password.length(), candidates.size(), result.calcTimeMs(), result.entropy(), result.score());
        return Optional.of(result);
    }

    /**
     * Evaluate {@code password} without cancellation.
     */
    public Result evaluate(final String password) {
        return evaluate(password, CancellationToken.NONE)
                .orElseThrow(() -> new IllegalStateException("Evaluation without cancellation produced no result"));
    }

    public MatcherEnsemble getEnsemble() {
        return ensemble;
    }

    /**
     * Release cached dictionaries and graphs and, if owned, shut down the worker pool.
     */
    @Override
    public void close() {
        ensemble.dispose();
        if (ownsExecutor) {
            executor.shutdown();
        }
    }
}
