package dumb.clarity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.clarity.util.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Engine settings. Any subset of fields may be given as JSON; the rest keep their defaults.
 *
 * @param solverStepLimit      DPLL nodes plus propagation passes allowed per request half
 * @param timeoutMillis        wall-clock limit per request, 0 for none
 * @param maxCycleLength       longest circular-reasoning cycle enumerated
 * @param maxCycles            cycles reported before enumeration stops as degraded
 * @param loadBearingThreshold normalized betweenness above which an assumption is load-bearing
 * @param attacksPolicy        whether {@code attacks} edges constrain satisfiability
 * @param minSupportStrength   weakest {@code supports} edge lowered to a clause
 * @param maxContradictions    independent minimal cores reported per request
 * @param maxCnfClauses        clause limit for a single expression's CNF
 * @param workers              analysis worker threads, 0 for one per core
 */
public record Config(long solverStepLimit, long timeoutMillis, int maxCycleLength, int maxCycles,
                     double loadBearingThreshold, AttacksPolicy attacksPolicy,
                     Relationship.Strength minSupportStrength, int maxContradictions, int maxCnfClauses,
                     int workers) {

    public static final Config DEFAULT = new Config(200_000, 5_000, 8, 256, 0.3, AttacksPolicy.INERT,
            Relationship.Strength.MODERATE, 5, 512, 0);

    public Config {
        if (attacksPolicy == null) attacksPolicy = AttacksPolicy.INERT;
        if (minSupportStrength == null) minSupportStrength = Relationship.Strength.MODERATE;
        if (maxCycleLength < 2) throw new IllegalArgumentException("maxCycleLength must be at least 2: " + maxCycleLength);
        if (maxContradictions < 1) throw new IllegalArgumentException("maxContradictions must be positive: " + maxContradictions);
        if (maxCnfClauses < 1) throw new IllegalArgumentException("maxCnfClauses must be positive: " + maxCnfClauses);
    }

    public static Config parse(String json) throws JsonProcessingException {
        var merged = (ObjectNode) Json.node(DEFAULT);
        var given = Json.the.readTree(json);
        if (given instanceof ObjectNode o) merged.setAll(o);
        else throw new IllegalArgumentException("Configuration must be a JSON object");
        return Json.obj(merged, Config.class);
    }

    public static Config load(Path file) throws IOException {
        return parse(Files.readString(file));
    }

    public int workerCount() {
        return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
    }

    public Config withTimeoutMillis(long timeoutMillis) {
        return new Config(solverStepLimit, timeoutMillis, maxCycleLength, maxCycles, loadBearingThreshold, attacksPolicy, minSupportStrength, maxContradictions, maxCnfClauses, workers);
    }

    public Config withSolverStepLimit(long solverStepLimit) {
        return new Config(solverStepLimit, timeoutMillis, maxCycleLength, maxCycles, loadBearingThreshold, attacksPolicy, minSupportStrength, maxContradictions, maxCnfClauses, workers);
    }

    public Config withAttacksPolicy(AttacksPolicy attacksPolicy) {
        return new Config(solverStepLimit, timeoutMillis, maxCycleLength, maxCycles, loadBearingThreshold, attacksPolicy, minSupportStrength, maxContradictions, maxCnfClauses, workers);
    }

    public Config withCycleLimits(int maxCycleLength, int maxCycles) {
        return new Config(solverStepLimit, timeoutMillis, maxCycleLength, maxCycles, loadBearingThreshold, attacksPolicy, minSupportStrength, maxContradictions, maxCnfClauses, workers);
    }

    public enum AttacksPolicy {
        INERT,
        CONTRADICTS
    }
}
