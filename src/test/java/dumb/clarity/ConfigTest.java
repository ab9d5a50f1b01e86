package dumb.clarity;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest extends AbstractTest {

    @Test
    void missingFieldsKeepTheirDefaults() throws JsonProcessingException {
        var c = Config.parse("{\"timeoutMillis\": 250}");
        assertEquals(250, c.timeoutMillis());
        assertEquals(Config.DEFAULT.solverStepLimit(), c.solverStepLimit());
        assertEquals(Config.DEFAULT.loadBearingThreshold(), c.loadBearingThreshold());
        assertEquals(Config.AttacksPolicy.INERT, c.attacksPolicy());
        assertEquals(Relationship.Strength.MODERATE, c.minSupportStrength());
    }

    @Test
    void emptyObjectIsTheDefault() throws JsonProcessingException {
        assertEquals(Config.DEFAULT, Config.parse("{}"));
    }

    @Test
    void loadsFromFile() throws IOException, URISyntaxException {
        var c = Config.load(Path.of(ConfigTest.class.getResource("/test-config.json").toURI()));
        assertEquals(4, c.maxCycleLength());
        assertEquals(Config.AttacksPolicy.CONTRADICTS, c.attacksPolicy());
        assertEquals(Relationship.Strength.WEAK, c.minSupportStrength());
        assertEquals(2, c.workerCount());
    }

    @Test
    void writtenFilesRoundTrip(@TempDir Path dir) throws IOException {
        var file = dir.resolve("clarity.json");
        Files.writeString(file, "{\"maxContradictions\": 2, \"maxCnfClauses\": 64}");
        var c = Config.load(file);
        assertEquals(2, c.maxContradictions());
        assertEquals(64, c.maxCnfClauses());
    }

    @ParameterizedTest
    @ValueSource(strings = {"{\"maxCycleLength\": 1}", "{\"maxContradictions\": 0}", "{\"maxCnfClauses\": -3}", "{\"timeoutMillis\": \"soon\"}"})
    void invalidValuesAreRejected(String json) {
        assertThrows(JsonProcessingException.class, () -> Config.parse(json));
    }

    @Test
    void nonObjectIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Config.parse("[1, 2]"));
    }

    @Test
    void workersDefaultToTheProcessorCount() {
        assertEquals(Runtime.getRuntime().availableProcessors(), Config.DEFAULT.workerCount());
    }

    @Test
    void copies() {
        var c = Config.DEFAULT.withTimeoutMillis(10).withSolverStepLimit(99).withCycleLimits(3, 7);
        assertEquals(10, c.timeoutMillis());
        assertEquals(99, c.solverStepLimit());
        assertEquals(3, c.maxCycleLength());
        assertEquals(7, c.maxCycles());
        assertEquals(Config.DEFAULT.maxContradictions(), c.maxContradictions());
    }
}
