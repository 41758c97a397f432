package com.largomodo.circuitcheck.validation;

import com.largomodo.circuitcheck.architecture.DynamicArchitecture;
import com.largomodo.circuitcheck.circuit.Circuit;
import com.largomodo.circuitcheck.circuit.Instruction;
import com.largomodo.circuitcheck.operation.NativeOperation;
import com.largomodo.circuitcheck.operation.OperationRole;
import com.largomodo.circuitcheck.operation.SupportedOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks MOVE sandwiches over one circuit's instruction stream.
 * <p>
 * A MOVE on {@code (qubit, resonator)} into a free resonator parks the qubit's state there
 * (sandwich open); the next MOVE on the same pair brings it back (sandwich close). While a state
 * is parked, only operations whose role the {@link MoveGateValidationMode} allows may touch
 * that qubit.
 * <p>
 * All loci are translated through the qubit mapping first, so occupancy is tracked on physical
 * names. Occupancy state is local to one {@link #check} call.
 */
public class MoveSandwichTracker implements CircuitRule {

    private static final Logger log = LoggerFactory.getLogger(MoveSandwichTracker.class);

    @Override
    public void check(ValidationContext context, Circuit circuit) {
        MoveGateValidationMode mode = context.options().moveValidation();
        if (!mode.isEnabled()) {
            return;
        }

        DynamicArchitecture architecture = context.architecture();
        QubitMapping mapping = context.mapping();
        boolean moveSupported = SupportedOperations.namesWithRole(OperationRole.MOVE).stream()
                .anyMatch(architecture::supports);
        if (!moveSupported) {
            for (Instruction instruction : circuit.instructions()) {
                if (isMove(instruction)) {
                    throw ValidationFailure.builder(FailureReason.MOVE_UNSUPPORTED,
                                    "MOVE instruction is not supported by the given device architecture.")
                            .instruction(instruction)
                            .operation(instruction.name())
                            .toException();
                }
            }
            return;
        }

        Occupancy occupancy = new Occupancy();
        for (Instruction instruction : circuit.instructions()) {
            List<String> locus = mapping.apply(instruction.qubits());
            if (isMove(instruction)) {
                applyMove(architecture, mapping, occupancy, instruction, locus);
            } else if (!occupancy.isEmpty()) {
                checkNotParked(mode, mapping, occupancy, instruction, locus);
            }
        }

        if (context.options().mustCloseSandwiches() && !occupancy.isEmpty()) {
            throw ValidationFailure.builder(FailureReason.MOVE_UNCLOSED_SANDWICH,
                            "Circuit ends while qubit state(s) are still in a resonator: " + occupancy + ".")
                    .qubits(occupancy.movedQubits())
                    .toException();
        }
        if (!occupancy.isEmpty()) {
            log.debug("Circuit '{}' leaves MOVE sandwiches open: {}", circuit.name(), occupancy);
        }
    }

    private static void applyMove(DynamicArchitecture architecture,
                                  QubitMapping mapping,
                                  Occupancy occupancy,
                                  Instruction instruction,
                                  List<String> locus) {
        if (locus.size() != 2 || !architecture.isQubit(locus.get(0)) || !architecture.isResonator(locus.get(1))) {
            throw failure(FailureReason.MOVE_INVALID_LOCUS,
                    "MOVE instructions are only allowed between qubit and resonator, not " + instruction.qubits() + ".",
                    mapping, instruction, locus).toException();
        }
        String qubit = locus.get(0);
        String resonator = locus.get(1);

        String occupant = occupancy.occupant(resonator);
        if (occupant == null) {
            if (occupancy.isParked(qubit)) {
                throw failure(FailureReason.MOVE_SPLIT_STATE,
                        "MOVE instruction " + instruction.qubits() + ": state of " + instruction.qubits().get(0)
                                + " is in another resonator: " + occupancy + ".",
                        mapping, instruction, locus)
                        .component(qubit)
                        .toException();
            }
            occupancy.park(resonator, qubit);
        } else {
            if (!occupant.equals(qubit)) {
                throw failure(FailureReason.MOVE_MISMATCHED_CLOSE,
                        "MOVE instruction " + instruction.qubits() + " to an already occupied resonator: "
                                + occupancy + ".",
                        mapping, instruction, locus)
                        .component(resonator)
                        .toException();
            }
            occupancy.release(resonator);
        }
    }

    private static void checkNotParked(MoveGateValidationMode mode,
                                       QubitMapping mapping,
                                       Occupancy occupancy,
                                       Instruction instruction,
                                       List<String> locus) {
        NativeOperation op = SupportedOperations.find(instruction.name()).orElse(null);
        if (op != null && mode.allowsInSandwich(op.role())) {
            return;
        }
        Set<String> overlap = new LinkedHashSet<>(locus);
        overlap.retainAll(occupancy.movedQubits());
        if (!overlap.isEmpty()) {
            throw failure(FailureReason.MOVE_QUBIT_IN_USE,
                    "Instruction " + instruction.name() + " acts on " + instruction.qubits()
                            + " while the state(s) of " + overlap + " are in a resonator. "
                            + "Current resonator occupation: " + occupancy + ".",
                    mapping, instruction, locus)
                    .qubits(overlap)
                    .toException();
        }
    }

    private static boolean isMove(Instruction instruction) {
        return SupportedOperations.hasRole(instruction.name(), OperationRole.MOVE);
    }

    private static ValidationFailure.Builder failure(FailureReason reason,
                                                     String message,
                                                     QubitMapping mapping,
                                                     Instruction instruction,
                                                     List<String> locus) {
        return ValidationFailure.builder(reason, message)
                .instruction(instruction)
                .operation(instruction.name())
                .mappedLocus(mapping.isPresent() ? locus : null);
    }

    /**
     * Resonator to parked qubit, plus the set of parked qubits.
     * A qubit is in {@code moved} iff some entry of {@code resonatorToQubit} names it.
     */
    private static final class Occupancy {
        private final Map<String, String> resonatorToQubit = new LinkedHashMap<>();
        private final Set<String> moved = new LinkedHashSet<>();

        String occupant(String resonator) {
            return resonatorToQubit.get(resonator);
        }

        boolean isParked(String qubit) {
            return moved.contains(qubit);
        }

        boolean isEmpty() {
            return resonatorToQubit.isEmpty();
        }

        Set<String> movedQubits() {
            return moved;
        }

        void park(String resonator, String qubit) {
            resonatorToQubit.put(resonator, qubit);
            moved.add(qubit);
        }

        void release(String resonator) {
            String qubit = resonatorToQubit.remove(resonator);
            moved.remove(qubit);
        }

        @Override
        public String toString() {
            return resonatorToQubit.toString();
        }
    }
}
