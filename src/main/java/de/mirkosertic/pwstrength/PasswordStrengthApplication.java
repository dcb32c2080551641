package de.mirkosertic.pwstrength;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.pwstrength.config.EstimatorConfig;
import de.mirkosertic.pwstrength.config.LoggingConfigurator;
import de.mirkosertic.pwstrength.model.Match;
import de.mirkosertic.pwstrength.model.Result;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry point.
 * Evaluates the passwords given as arguments, or one password per line from standard input, and prints
 * one JSON object per password to standard output.
 */
public class PasswordStrengthApplication implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PasswordStrengthApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_STARTUP_FAILURE = 1;
    static final int EXIT_TIMEOUT = 2;

    private final EstimatorConfig config;
    private final PasswordStrengthEstimator estimator;
    private final @Nullable MatcherExecutorService configuredExecutor;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService timeoutScheduler;

    public PasswordStrengthApplication(final EstimatorConfig config) {
        this.config = config;

        final MatcherEnsemble ensemble = config.toEnsembleBuilder().build();
        if (config.getThreadPoolSize() > 0) {
            this.configuredExecutor = new MatcherExecutorService(config.getThreadPoolSize());
            this.estimator = new PasswordStrengthEstimator(ensemble, configuredExecutor);
        } else {
            this.configuredExecutor = null;
            this.estimator = new PasswordStrengthEstimator(ensemble);
        }

        this.objectMapper = new ObjectMapper();
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread thread = new Thread(r, "evaluation-timeout");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Evaluate all passwords and write their results.
     *
     * @return the process exit code
     */
    public int run(final List<String> passwords, final PrintStream out) throws JsonProcessingException {
        int exitCode = EXIT_OK;
        for (final String password : passwords) {
            final Optional<Result> result = evaluateWithTimeout(password);
            if (result.isPresent()) {
                out.println(objectMapper.writeValueAsString(toJson(result.get())));
            } else {
                final ObjectNode timedOut = objectMapper.createObjectNode();
                timedOut.put("password", password);
                timedOut.put("timedOut", true);
                out.println(objectMapper.writeValueAsString(timedOut));
                exitCode = EXIT_TIMEOUT;
            }
        }
        out.flush();
        return exitCode;
    }

    Optional<Result> evaluateWithTimeout(final String password) {
        final CancellationToken cancel = CancellationToken.create();
        final long timeoutMs = config.getEvaluationTimeoutMs();
        ScheduledFuture<?> timeout = null;
        if (timeoutMs > 0) {
            timeout = timeoutScheduler.schedule(cancel::cancel, timeoutMs, TimeUnit.MILLISECONDS);
        }
        try {
            return estimator.evaluate(password, cancel);
        } finally {
            if (timeout != null) {
                timeout.cancel(false);
            }
        }
    }

    ObjectNode toJson(final Result result) {
        final ObjectNode node = objectMapper.createObjectNode();
        node.put("password", result.password());
        node.put("entropy", result.entropy());
        node.put("crackTime", result.crackTime());
        node.put("crackTimeDisplay", result.crackTimeInfo().toString());
        node.put("score", result.score());
        node.put("calcTimeMs", result.calcTimeMs());
        final ArrayNode sequence = node.putArray("matchSequence");
        for (final Match match : result.matchSequence()) {
            final ObjectNode matchNode = objectMapper.valueToTree(match);
            matchNode.put("pattern", match.pattern().id());
            sequence.add(matchNode);
        }
        return node;
    }

    /**
     * @return the pool sized by {@code thread-pool-size}, {@code null} when the estimator sizes its own
     */
    @Nullable MatcherExecutorService getConfiguredExecutor() {
        return configuredExecutor;
    }

    @Override
    public void close() {
        timeoutScheduler.shutdownNow();
        estimator.close();
        if (configuredExecutor != null) {
            configuredExecutor.shutdown();
        }
    }

    static List<String> readPasswords(final BufferedReader reader) throws IOException {
        final List<String> passwords = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            passwords.add(line);
        }
        return passwords;
    }

    public static void main(final String[] args) {
        boolean verbose = false;
        final List<String> passwords = new ArrayList<>();
        for (final String arg : args) {
            if ("-v".equals(arg) || "--verbose".equals(arg)) {
                verbose = true;
            } else {
                passwords.add(arg);
            }
        }

        // Configure logging FIRST, before any other code that might log
        LoggingConfigurator.configure(verbose);

        final PasswordStrengthApplication app;
        try {
            app = new PasswordStrengthApplication(EstimatorConfig.load());
        } catch (final RuntimeException e) {
            System.err.println("Failed to start password strength estimator: " + e.getMessage());
            logger.debug("Startup failure", e);
            System.exit(EXIT_STARTUP_FAILURE);
            return;
        }

        int exitCode;
        try (app) {
            if (passwords.isEmpty()) {
                passwords.addAll(readPasswords(new BufferedReader(
                        new InputStreamReader(System.in, StandardCharsets.UTF_8))));
            }
            exitCode = app.run(passwords, System.out);
        } catch (final IOException e) {
            System.err.println("Failed to evaluate passwords: " + e.getMessage());
            exitCode = EXIT_STARTUP_FAILURE;
        }
        System.exit(exitCode);
    }
}
