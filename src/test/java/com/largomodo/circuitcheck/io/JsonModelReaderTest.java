package com.largomodo.circuitcheck.io;

import com.largomodo.circuitcheck.architecture.DynamicArchitecture;
import com.largomodo.circuitcheck.architecture.GateInfo;
import com.largomodo.circuitcheck.circuit.Circuit;
import com.largomodo.circuitcheck.circuit.Instruction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JsonModelReaderTest {

    private static final Path FIXTURES = Paths.get("src/test/resources/fixtures");

    private final JsonModelReader reader = new JsonModelReader();

    @TempDir
    Path tempDir;

    @Test
    void readsArchitectureSnapshot() throws IOException {
        DynamicArchitecture arch = reader.readArchitecture(FIXTURES.resolve("architecture-star.json"));

        assertEquals(UUID.fromString("26c5e70f-bea0-43af-bd37-6212ec7d04cb"), arch.calibrationSetId());
        assertEquals(List.of("QB1", "QB2", "QB3"), arch.qubits());
        assertEquals(List.of("CR1"), arch.computationalResonators());
        assertEquals(List.of("prx", "cz", "move", "measure"), List.copyOf(arch.gates().keySet()));

        GateInfo cz = arch.gate("cz").orElseThrow();
        assertEquals("tgss", cz.defaultImplementation());
        assertEquals("crf", cz.defaultImplementationFor(List.of("QB3", "CR1")));
        assertEquals(List.of(List.of("QB1", "CR1"), List.of("QB2", "CR1")),
                cz.implementations().get("tgss").loci());
    }

    @Test
    void readsCircuitBatch() throws IOException {
        List<Circuit> circuits = reader.readCircuits(FIXTURES.resolve("circuits-valid.json"));

        assertEquals(2, circuits.size());
        assertEquals("ghz", circuits.get(0).name());
        assertEquals(6, circuits.get(0).instructions().size());

        Instruction prx = circuits.get(0).instructions().get(0);
        assertEquals("prx", prx.name());
        assertEquals(List.of("q0"), prx.qubits());
        assertEquals(0.25, ((Number) prx.args().get("angle_t")).doubleValue());
        assertNull(prx.implementation());

        Instruction explicit = circuits.get(1).instructions().get(0);
        assertEquals("drag_gaussian", explicit.implementation());
        assertInstanceOf(Number.class, explicit.args().get("angle_t"));

        assertEquals("m", circuits.get(1).instructions().get(1).args().get("key"));
    }

    @Test
    void readsQubitMapping() throws IOException {
        Map<String, String> mapping = reader.readQubitMapping(FIXTURES.resolve("mapping.json"));

        assertEquals(Map.of("q0", "QB1", "q1", "QB2", "res", "CR1"), mapping);
    }

    @Test
    void missingArgsAndResonatorsDefaultToEmpty() {
        DynamicArchitecture arch = reader.parseArchitecture(
                "{\"calibration_set_id\": \"26c5e70f-bea0-43af-bd37-6212ec7d04cb\", \"qubits\": [\"QB1\"], \"gates\": {}}");
        List<Circuit> circuits = reader.parseCircuits(
                "[{\"name\": \"c\", \"instructions\": [{\"name\": \"barrier\", \"qubits\": [\"QB1\"]}]}]");

        assertTrue(arch.computationalResonators().isEmpty());
        assertTrue(arch.gates().isEmpty());
        assertTrue(circuits.get(0).instructions().get(0).args().isEmpty());
    }

    @Test
    void nonStringArgumentValuesKeptForLaterChecks() {
        List<Circuit> circuits = reader.parseCircuits(
                "[{\"name\": \"c\", \"instructions\": [{\"name\": \"measure\", \"qubits\": [\"QB1\"],"
                        + " \"args\": {\"key\": 3, \"flag\": true, \"nothing\": null}}]}]");

        Map<String, Object> args = circuits.get(0).instructions().get(0).args();
        assertEquals(3, ((Number) args.get("key")).intValue());
        assertEquals(Boolean.TRUE, args.get("flag"));
        assertTrue(args.containsKey("nothing"));
        assertNull(args.get("nothing"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "not json",
            "{}",
            "{\"calibration_set_id\": \"nope\", \"qubits\": []}",
            "{\"calibration_set_id\": \"26c5e70f-bea0-43af-bd37-6212ec7d04cb\", \"qubits\": [1]}",
            "{\"calibration_set_id\": \"26c5e70f-bea0-43af-bd37-6212ec7d04cb\", \"qubits\": [\"A\"],"
                    + " \"computational_resonators\": [\"A\"]}",
            "{\"calibration_set_id\": \"26c5e70f-bea0-43af-bd37-6212ec7d04cb\", \"qubits\": [\"QB1\"],"
                    + " \"gates\": {\"prx\": {\"implementations\": {}, \"default_implementation\": \"x\"}}}",
            "{\"calibration_set_id\": \"26c5e70f-bea0-43af-bd37-6212ec7d04cb\", \"qubits\": [\"QB1\"],"
                    + " \"gates\": {\"prx\": {\"implementations\": {\"x\": {\"loci\": [[]]}},"
                    + " \"default_implementation\": \"x\"}}}"
    })
    void malformedArchitectureRejected(String json) {
        assertThrows(ModelFormatException.class, () -> reader.parseArchitecture(json));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{}",
            "[{\"instructions\": []}]",
            "[{\"name\": \"c\"}]",
            "[{\"name\": \"c\", \"instructions\": [{\"qubits\": [\"QB1\"]}]}]",
            "[{\"name\": \"c\", \"instructions\": [{\"name\": \"\", \"qubits\": [\"QB1\"]}]}]",
            "[{\"name\": \"c\", \"instructions\": [{\"name\": \"prx\", \"qubits\": \"QB1\"}]}]",
            "[{\"name\": \"c\", \"instructions\": [{\"name\": \"prx\", \"qubits\": [\"QB1\"], \"args\": []}]}]"
    })
    void malformedCircuitsRejected(String json) {
        assertThrows(ModelFormatException.class, () -> reader.parseCircuits(json));
    }

    @ParameterizedTest
    @ValueSource(strings = {"[]", "{\"q0\": 1}", "{\"q0\": null}"})
    void malformedMappingRejected(String json) {
        assertThrows(ModelFormatException.class, () -> reader.parseQubitMapping(json));
    }

    @Test
    void invalidJsonFileNamesTheFile() throws IOException {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "[{\"name\": ");

        ModelFormatException e = assertThrows(ModelFormatException.class, () -> reader.readCircuits(broken));
        assertTrue(e.getMessage().contains("broken.json"), e.getMessage());
    }

    @Test
    void missingFileIsIoError() {
        assertThrows(IOException.class, () -> reader.readArchitecture(tempDir.resolve("absent.json")));
    }
}
