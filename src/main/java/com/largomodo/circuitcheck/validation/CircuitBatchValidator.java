package com.largomodo.circuitcheck.validation;

import com.largomodo.circuitcheck.architecture.DynamicArchitecture;
import com.largomodo.circuitcheck.circuit.Circuit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;

/**
 * Validates a batch of circuits against one dynamic architecture snapshot.
 * <p>
 * Pipeline:
 * 1. Static shape checks for every circuit (architecture-independent)
 * 2. Qubit mapping, once for the batch
 * 3. Per circuit, in batch order: loci and measurement keys instruction by instruction, then MOVE sandwiches
 * <p>
 * Fails fast: the first violation aborts the batch and is reported with its circuit index.
 * Instances hold no mutable state and may be shared across threads.
 */
public class CircuitBatchValidator {

    private static final Logger log = LoggerFactory.getLogger(CircuitBatchValidator.class);

    private final CircuitRule staticRule;
    private final QubitMappingValidator mappingValidator;
    private final List<CircuitRule> circuitRules;

    public CircuitBatchValidator() {
        this(new StaticCircuitValidator(),
                new QubitMappingValidator(),
                List.of(new CircuitInstructionValidator(), new MoveSandwichTracker()));
    }

    /**
     * @param staticRule       architecture-independent rule run over every circuit before the mapping check
     * @param mappingValidator batch-wide qubit mapping validator
     * @param circuitRules     rules applied to each circuit in order
     */
    public CircuitBatchValidator(CircuitRule staticRule,
                                 QubitMappingValidator mappingValidator,
                                 List<CircuitRule> circuitRules) {
        this.staticRule = staticRule;
        this.mappingValidator = mappingValidator;
        this.circuitRules = List.copyOf(circuitRules);
    }

    /**
     * Validates circuits that already use physical qubit names, with execution settings.
     */
    public void validate(DynamicArchitecture architecture, List<Circuit> circuits) {
        validate(architecture, circuits, QubitMapping.NONE, ValidationOptions.forExecution());
    }

    public void validate(DynamicArchitecture architecture,
                         List<Circuit> circuits,
                         Map<String, String> qubitMapping,
                         ValidationOptions options) {
        validate(architecture, circuits, QubitMapping.of(qubitMapping), options);
    }

    /**
     * Validates the batch; returns normally only if every circuit passes every rule.
     *
     * @param architecture architecture snapshot to check against
     * @param circuits     circuits in batch order
     * @param mapping      logical to physical mapping applied to all circuits
     * @param options      MOVE validation mode and sandwich closure setting
     * @throws CircuitValidationException describing the first violation
     */
    public void validate(DynamicArchitecture architecture,
                         List<Circuit> circuits,
                         QubitMapping mapping,
                         ValidationOptions options) {
        ValidationContext context = new ValidationContext(architecture, mapping, options);
        log.debug("Validating {} circuit(s) against calibration set {} ({}, mustCloseSandwiches={})",
                circuits.size(), architecture.calibrationSetId(),
                context.options().moveValidation(), context.options().mustCloseSandwiches());

        try {
            for (int i = 0; i < circuits.size(); i++) {
                runRule(staticRule, context, circuits.get(i), i);
            }

            mappingValidator.validate(architecture, circuits, context.mapping());

            for (int i = 0; i < circuits.size(); i++) {
                Circuit circuit = circuits.get(i);
                for (CircuitRule rule : circuitRules) {
                    runRule(rule, context, circuit, i);
                }
                log.debug("Circuit {} '{}' passed ({} instructions)", i, circuit.name(), circuit.instructions().size());
            }
        } catch (CircuitValidationException e) {
            log.debug("Validation failed [{}]: {}", e.reason(), e.getMessage());
            throw e;
        }
    }

    private static void runRule(CircuitRule rule, ValidationContext context, Circuit circuit, int index) {
        MDC.put("circuit", circuit.name());
        try {
            rule.check(context, circuit);
        } catch (CircuitValidationException e) {
            throw e.failure().circuitIndex() == null ? e.atCircuit(index) : e;
        } finally {
            MDC.remove("circuit");
        }
    }
}
