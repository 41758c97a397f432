package com.largomodo.circuitcheck;

import com.largomodo.circuitcheck.architecture.DynamicArchitecture;
import com.largomodo.circuitcheck.circuit.Circuit;
import com.largomodo.circuitcheck.io.JsonModelReader;
import com.largomodo.circuitcheck.io.ModelFormatException;
import com.largomodo.circuitcheck.validation.CircuitBatchValidator;
import com.largomodo.circuitcheck.validation.CircuitValidationException;
import com.largomodo.circuitcheck.validation.MoveGateValidationMode;
import com.largomodo.circuitcheck.validation.QubitMapping;
import com.largomodo.circuitcheck.validation.ValidationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for validating a circuit batch against an architecture snapshot.
 * <p>
 * Uses Picocli for argument parsing with automatic help generation. Input documents are JSON
 * files; the architecture snapshot is typically saved from the server for the calibration set
 * the batch will run on.
 * <p>
 * Exit codes: 0 when the batch is valid, 1 when it is not (or an input cannot be read),
 * 2 for invalid command line arguments.
 */
@Command(
        name = "circuitcheck",
        mixinStandardHelpOptions = true,
        resourceBundle = "circuitcheck.circuitcheck",
        version = "${bundle:application.version}",
        header = "Validates quantum circuits against a dynamic quantum architecture.",
        description = {
                "Checks that every circuit in a batch can run on the calibration-dependent architecture" +
                        " described by an architecture snapshot: qubit mapping, gate loci and implementations," +
                        " measurement keys and MOVE sandwiches.",
                "",
                "Validation stops at the first violation, which is reported with its circuit index."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:All circuits are valid",
                "1:Validation failed, or an input file could not be read",
                "2:Invalid command line arguments"
        }
)
public class CircuitCheck implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CircuitCheck.class);

    @Parameters(index = "0", paramLabel = "CIRCUITS",
            description = "JSON file holding the circuit batch (an array of circuits).")
    File circuitsPath;

    @Option(names = {"-a", "--architecture"}, required = true, paramLabel = "FILE",
            description = "JSON file holding the dynamic quantum architecture snapshot.")
    File architecturePath;

    @Option(names = {"-m", "--qubit-mapping"}, paramLabel = "FILE",
            description = {
                    "JSON object mapping logical qubit names to physical qubit names.",
                    "Omit if the circuits already use physical names."
            })
    File mappingPath;

    @Option(names = "--move-validation", defaultValue = "STRICT",
            description = {
                    "MOVE sandwich validation mode.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    MoveGateValidationMode moveValidation;

    @Option(names = "--allow-open-sandwiches",
            description = "Accept circuits that end while a qubit state is still parked in a resonator.")
    boolean allowOpenSandwiches;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    private final JsonModelReader reader;
    private final CircuitBatchValidator validator;

    public CircuitCheck() {
        this(new JsonModelReader(), new CircuitBatchValidator());
    }

    CircuitCheck(JsonModelReader reader, CircuitBatchValidator validator) {
        this.reader = reader;
        this.validator = validator;
    }

    public static void main(String[] args) {
        CommandLine cmd = new CommandLine(new CircuitCheck());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        requireReadableFile(circuitsPath, "Circuit file");
        requireReadableFile(architecturePath, "Architecture file");
        if (mappingPath != null) {
            requireReadableFile(mappingPath, "Qubit mapping file");
        }

        ValidationOptions options = new ValidationOptions(moveValidation, !allowOpenSandwiches);

        DynamicArchitecture architecture;
        List<Circuit> circuits;
        QubitMapping mapping;
        try {
            architecture = reader.readArchitecture(architecturePath.toPath());
            circuits = reader.readCircuits(circuitsPath.toPath());
            mapping = mappingPath == null
                    ? QubitMapping.NONE
                    : QubitMapping.of(reader.readQubitMapping(mappingPath.toPath()));
        } catch (ModelFormatException | IOException e) {
            log.error("ERROR: Cannot read input: {}", e.getMessage());
            return 1;
        }

        log.debug("Loaded {} circuit(s); architecture {}", circuits.size(), architecture);

        try {
            validator.validate(architecture, circuits, mapping, options);
        } catch (CircuitValidationException e) {
            log.error("INVALID [{}]: {}", e.reason().code(), e.getMessage());
            return 1;
        }

        log.info("Valid: {} circuit(s) against calibration set {}", circuits.size(), architecture.calibrationSetId());
        return 0;
    }

    private void requireReadableFile(File file, String label) {
        if (!file.exists()) {
            throw new ParameterException(spec.commandLine(),
                    label + " does not exist: " + file.getAbsolutePath());
        }
        if (!file.isFile()) {
            throw new ParameterException(spec.commandLine(),
                    label + " is not a file: " + file.getAbsolutePath());
        }
        if (!file.canRead()) {
            throw new ParameterException(spec.commandLine(),
                    label + " is not readable (check permissions): " + file.getAbsolutePath());
        }
    }
}
