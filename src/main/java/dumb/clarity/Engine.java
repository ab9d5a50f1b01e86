package dumb.clarity;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.clarity.util.Json;
import dumb.clarity.util.Log;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

import static dumb.clarity.util.Log.error;
import static dumb.clarity.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * Runs the contradiction and fallacy halves of each request on a shared worker pool and joins them into one
 * {@link Analysis}. Requests share no mutable state; any number may be in flight at once.
 */
public final class Engine implements AutoCloseable {

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;
    private static final AtomicInteger threads = new AtomicInteger();

    public final Config config;
    private final ExecutorService exe;

    public Engine() {
        this(Config.DEFAULT);
    }

    public Engine(Config config) {
        this.config = requireNonNull(config);
        this.exe = Executors.newFixedThreadPool(config.workerCount(), r -> {
            var t = new Thread(r, "clarity-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public Analysis analyze(Request request) {
        return analyze(Batch.of(request), new Budget.Cancellation());
    }

    public Analysis analyze(Request request, Budget.Cancellation cancellation) {
        return analyze(Batch.of(request), cancellation);
    }

    public Analysis analyze(Batch batch) {
        return analyze(batch, new Budget.Cancellation());
    }

    /** Never throws for bad input or exhausted budgets; those are reported as warnings and {@code degraded}. */
    public Analysis analyze(Batch batch, Budget.Cancellation cancellation) {
        // Budgets start now so that time spent queued for a worker counts against the request.
        var solverBudget = budget(cancellation);
        var graphBudget = budget(cancellation);

        var sat = CompletableFuture.supplyAsync(() -> guarded("contradiction",
                () -> Contradictions.detect(batch, config, solverBudget),
                w -> new Contradictions.Outcome(Contradictions.Status.UNKNOWN, List.of(), true, List.of(w))), exe);
        var graph = CompletableFuture.supplyAsync(() -> guarded("fallacy",
                () -> Fallacies.detect(batch, config, graphBudget),
                w -> new Fallacies.Outcome(List.of(), List.of(), Map.of(), List.of(),
                        new Graph.Order(batch.propositions.stream().map(Proposition::id).toList(), false), true, List.of(w))), exe);

        var c = sat.join();
        var f = graph.join();

        var warnings = new ArrayList<>(batch.warnings);
        warnings.addAll(c.warnings());
        warnings.addAll(f.warnings());
        var degraded = c.degraded() || f.degraded();
        var analysis = new Analysis(c.status(), c.contradictions(), f.fallacies(), f.biases(), degraded, warnings,
                f.order().ids(), f.order().complete(), f.centrality(), Scores.of(batch, c.contradictions(), f));

        message("Analyzed " + batch.size() + " propositions: " + c.status().label() + ", "
                + c.contradictions().size() + " contradiction(s), " + f.fallacies().size() + " fallacy(ies), "
                + f.biases().size() + " bias(es)"
                + (degraded ? ", degraded" : ""));
        return analysis;
    }

    private Budget budget(Budget.Cancellation cancellation) {
        return new Budget(config.solverStepLimit(), config.timeoutMillis(), cancellation);
    }

    static <T> T guarded(String half, Supplier<T> task, Function<Warning, T> failed) {
        try {
            return task.get();
        } catch (RuntimeException | StackOverflowError e) {
            error("Unexpected failure in " + half + " analysis: " + e);
            return failed.apply(new Warning("request", Warning.Reason.INTERNAL_ERROR, half + " analysis failed: " + e));
        }
    }

    @Override
    public void close() {
        if (exe.isShutdown()) return;
        exe.shutdown();
        try {
            if (!exe.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                error("Analysis workers did not terminate gracefully, forcing shutdown.");
                exe.shutdownNow();
            }
        } catch (InterruptedException e) {
            error("Interrupted while waiting for analysis workers to shut down.");
            exe.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static void main(String[] args) {
        String configFile = null, requestFile = null;

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-c", "--config" -> configFile = args[++i];
                    case "-h", "--help" -> printUsageAndExit();
                    default -> {
                        if (requestFile == null && !args[i].startsWith("-")) requestFile = args[i];
                        else Log.warning("Unknown option: " + args[i]);
                    }
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                error("Missing value for " + args[i - 1]);
                printUsageAndExit();
            }
        }
        if (requestFile == null) printUsageAndExit();

        // stdout carries the result
        Log.setSink((level, msg) -> System.err.println("[" + level + "] " + msg));

        try {
            var config = configFile == null ? Config.DEFAULT : Config.load(Path.of(configFile));
            var request = Json.obj(Files.readString(Path.of(requestFile)), Request.class);
            try (var engine = new Engine(config)) {
                System.out.println(Json.str(engine.analyze(request)));
            }
        } catch (JsonProcessingException e) {
            error("Malformed JSON: " + e.getOriginalMessage());
            System.exit(1);
        } catch (IOException | IllegalArgumentException e) {
            error("Cannot start analysis: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void printUsageAndExit() {
        System.err.printf("Usage: java %s [-c config.json] request.json%n", Engine.class.getName());
        System.exit(1);
    }
}
