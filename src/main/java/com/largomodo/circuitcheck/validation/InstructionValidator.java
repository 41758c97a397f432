package com.largomodo.circuitcheck.validation;

import com.largomodo.circuitcheck.architecture.DynamicArchitecture;
import com.largomodo.circuitcheck.architecture.GateImplementationInfo;
import com.largomodo.circuitcheck.architecture.GateInfo;
import com.largomodo.circuitcheck.circuit.Instruction;
import com.largomodo.circuitcheck.operation.NativeOperation;
import com.largomodo.circuitcheck.operation.SupportedOperations;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks that each instruction uses a calibrated implementation on an allowed locus.
 * <p>
 * Locus semantics follow the operation's flags:
 * <ul>
 *   <li>no calibration needed: any architecture component, no gate lookup</li>
 *   <li>factorizable: each component on its own must appear in some allowed locus</li>
 *   <li>symmetric: any permutation of an allowed locus</li>
 *   <li>otherwise: exact, ordered match</li>
 * </ul>
 */
public class InstructionValidator {

    /**
     * Validates one instruction against the architecture snapshot.
     *
     * @param architecture architecture to check against
     * @param instruction  instruction as written in the circuit
     * @param mapping      qubit mapping applied to the locus before any check
     * @throws CircuitValidationException if the instruction cannot run on this architecture
     */
    public void validate(DynamicArchitecture architecture, Instruction instruction, QubitMapping mapping) {
        NativeOperation op = SupportedOperations.find(instruction.name())
                .orElseThrow(() -> ValidationFailure.builder(FailureReason.UNKNOWN_OPERATION,
                                "Unknown quantum operation '" + instruction.name() + "'.")
                        .instruction(instruction)
                        .operation(instruction.name())
                        .toException());

        List<String> mapped = mapping.apply(instruction.qubits());

        if (op.noCalibrationNeeded()) {
            checkLocusComponents(instruction, mapping, mapped, architecture.components(), instruction.name(),
                    "does not exist on the QPU");
            return;
        }

        GateInfo gateInfo = architecture.gate(instruction.name())
                .orElseThrow(() -> ValidationFailure.builder(FailureReason.UNSUPPORTED_OPERATION,
                                "Operation '" + instruction.name()
                                        + "' is not supported by the dynamic quantum architecture.")
                        .instruction(instruction)
                        .operation(instruction.name())
                        .mappedLocus(mapping.isPresent() ? mapped : null)
                        .toException());

        List<List<String>> allowedLoci;
        String resolvedName;
        if (instruction.implementation() != null) {
            GateImplementationInfo implInfo = gateInfo.implementations().get(instruction.implementation());
            if (implInfo == null) {
                throw ValidationFailure.builder(FailureReason.UNSUPPORTED_IMPLEMENTATION,
                                "Operation '" + instruction.name() + "' implementation '"
                                        + instruction.implementation()
                                        + "' is not supported by the dynamic quantum architecture.")
                        .instruction(instruction)
                        .operation(instruction.name() + "." + instruction.implementation())
                        .mappedLocus(mapping.isPresent() ? mapped : null)
                        .toException();
            }
            allowedLoci = implInfo.loci();
            resolvedName = instruction.name() + "." + instruction.implementation();
        } else {
            // any implementation will do
            allowedLoci = gateInfo.loci();
            resolvedName = instruction.name();
        }

        if (op.factorizable()) {
            Set<String> allowedComponents = allowedLoci.stream()
                    .flatMap(Collection::stream)
                    .collect(Collectors.toSet());
            checkLocusComponents(instruction, mapping, mapped, allowedComponents, resolvedName,
                    "is not allowed as locus for '" + resolvedName + "'");
            return;
        }

        boolean allowed = op.symmetric()
                ? allowedLoci.stream().anyMatch(locus -> isPermutation(locus, mapped))
                : allowedLoci.contains(mapped);
        if (!allowed) {
            String locusText = mapping.isPresent()
                    ? instruction.qubits() + " = " + mapped
                    : instruction.qubits().toString();
            throw ValidationFailure.builder(FailureReason.LOCUS_NOT_ALLOWED,
                            locusText + " is not allowed as locus for '" + resolvedName + "'")
                    .instruction(instruction)
                    .operation(resolvedName)
                    .mappedLocus(mapping.isPresent() ? mapped : null)
                    .toException();
        }
    }

    private static void checkLocusComponents(Instruction instruction,
                                             QubitMapping mapping,
                                             List<String> mapped,
                                             Set<String> allowedComponents,
                                             String resolvedName,
                                             String problem) {
        for (int i = 0; i < mapped.size(); i++) {
            String physical = mapped.get(i);
            if (!allowedComponents.contains(physical)) {
                String logical = instruction.qubits().get(i);
                String componentText = mapping.isPresent() ? logical + " = " + physical : logical;
                throw ValidationFailure.builder(FailureReason.LOCUS_NOT_ALLOWED,
                                instruction + ": Component " + componentText + " " + problem + ".")
                        .instruction(instruction)
                        .operation(resolvedName)
                        .mappedLocus(mapping.isPresent() ? mapped : null)
                        .component(physical)
                        .toException();
            }
        }
    }

    // multiset equality
    private static boolean isPermutation(List<String> allowed, List<String> candidate) {
        if (allowed.size() != candidate.size()) {
            return false;
        }
        List<String> a = new ArrayList<>(allowed);
        List<String> b = new ArrayList<>(candidate);
        a.sort(null);
        b.sort(null);
        return a.equals(b);
    }
}
