package com.largomodo.circuitcheck.validation;

import com.largomodo.circuitcheck.architecture.DynamicArchitecture;
import com.largomodo.circuitcheck.circuit.Instruction;
import com.largomodo.circuitcheck.fixtures.TestArchitectures;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.largomodo.circuitcheck.fixtures.Ops.*;
import static org.junit.jupiter.api.Assertions.*;

class InstructionValidatorTest {

    private final InstructionValidator validator = new InstructionValidator();
    private final DynamicArchitecture lattice = TestArchitectures.lattice();

    private CircuitValidationException rejects(DynamicArchitecture arch, Instruction instruction, QubitMapping mapping) {
        return assertThrows(CircuitValidationException.class, () -> validator.validate(arch, instruction, mapping));
    }

    @Test
    void unknownOperation() {
        CircuitValidationException e = rejects(lattice, Instruction.of("cnot", "QB1", "QB2"), QubitMapping.NONE);

        assertEquals(FailureReason.UNKNOWN_OPERATION, e.reason());
        assertEquals("cnot", e.failure().operation());
    }

    @Test
    void operationMissingFromArchitecture() {
        CircuitValidationException e = rejects(lattice, move("QB1", "QB2"), QubitMapping.NONE);

        assertEquals(FailureReason.UNSUPPORTED_OPERATION, e.reason());
    }

    @Test
    void unknownImplementation() {
        CircuitValidationException e = rejects(lattice, cz("QB1", "QB2").withImplementation("slepian"),
                QubitMapping.NONE);

        assertEquals(FailureReason.UNSUPPORTED_IMPLEMENTATION, e.reason());
        assertEquals("cz.slepian", e.failure().operation());
    }

    @Test
    void symmetricGateAcceptsReversedLocus() {
        assertDoesNotThrow(() -> validator.validate(lattice, cz("QB2", "QB1"), QubitMapping.NONE));
        assertDoesNotThrow(() -> validator.validate(lattice, cz("QB1", "QB2"), QubitMapping.NONE));
    }

    @Test
    void symmetricGateRejectsUndeclaredPair() {
        CircuitValidationException e = rejects(lattice, cz("QB1", "QB3"), QubitMapping.NONE);

        assertEquals(FailureReason.LOCUS_NOT_ALLOWED, e.reason());
        assertEquals(List.of("QB1", "QB3"), e.failure().locus());
        assertNull(e.failure().mappedLocus());
        assertEquals("cz", e.failure().operation());
    }

    @Test
    void withoutImplementationAnyImplementationLocusIsAllowed() {
        // (QB3, QB4) is only declared for crf, not for the default tgss
        assertDoesNotThrow(() -> validator.validate(lattice, cz("QB4", "QB3"), QubitMapping.NONE));
    }

    @Test
    void namedImplementationRestrictsLoci() {
        assertDoesNotThrow(() -> validator.validate(lattice, cz("QB3", "QB4").withImplementation("crf"),
                QubitMapping.NONE));

        CircuitValidationException e = rejects(lattice, cz("QB1", "QB2").withImplementation("crf"),
                QubitMapping.NONE);
        assertEquals(FailureReason.LOCUS_NOT_ALLOWED, e.reason());
        assertEquals("cz.crf", e.failure().operation());
    }

    @Test
    void nonSymmetricGateRequiresExactOrder() {
        DynamicArchitecture star = TestArchitectures.star();

        assertDoesNotThrow(() -> validator.validate(star, move("QB1", "R1"), QubitMapping.NONE));
        CircuitValidationException e = rejects(star, Instruction.of("move", "R1", "QB1"), QubitMapping.NONE);
        assertEquals(FailureReason.LOCUS_NOT_ALLOWED, e.reason());
    }

    @Test
    void factorizableChecksComponentsIndividually() {
        // no measure locus lists QB1..QB4 together, but each is calibrated on its own
        assertDoesNotThrow(() -> validator.validate(lattice, measure("m", "QB1", "QB3", "QB4"), QubitMapping.NONE));

        CircuitValidationException e = rejects(lattice, measure("m", "QB1", "QB5"), QubitMapping.NONE);
        assertEquals(FailureReason.LOCUS_NOT_ALLOWED, e.reason());
        assertEquals("QB5", e.failure().component());
    }

    @Test
    void factorizableWithNamedImplementation() {
        assertDoesNotThrow(() -> validator.validate(lattice, prx("QB2").withImplementation("drag_crf"),
                QubitMapping.NONE));

        CircuitValidationException e = rejects(lattice, prx("QB3").withImplementation("drag_crf"),
                QubitMapping.NONE);
        assertEquals("prx.drag_crf", e.failure().operation());
        assertEquals("QB3", e.failure().component());
    }

    @Test
    void singleQubitGateOutsideTwoQubitDevice() {
        DynamicArchitecture twoQubit = TestArchitectures.twoQubit();

        assertDoesNotThrow(() -> validator.validate(twoQubit, prx("QB1"), QubitMapping.NONE));
        CircuitValidationException e = rejects(twoQubit, prx("QB3"), QubitMapping.NONE);
        assertEquals(FailureReason.LOCUS_NOT_ALLOWED, e.reason());
        assertEquals("QB3", e.failure().component());
        assertTrue(e.getMessage().contains("QB3"));
    }

    @Test
    void noCalibrationOperationRunsOnAnyComponent() {
        DynamicArchitecture star = TestArchitectures.star();

        assertDoesNotThrow(() -> validator.validate(star, barrier("QB1", "R1", "QB3"), QubitMapping.NONE));

        CircuitValidationException e = rejects(star, barrier("QB1", "QB9"), QubitMapping.NONE);
        assertEquals(FailureReason.LOCUS_NOT_ALLOWED, e.reason());
        assertEquals("QB9", e.failure().component());
        assertTrue(e.getMessage().contains("does not exist on the QPU"));
    }

    @Test
    void noCalibrationOperationNeedsNoGateEntry() {
        assertFalse(lattice.supports("barrier"));
        assertDoesNotThrow(() -> validator.validate(lattice, barrier("QB1", "QB4"), QubitMapping.NONE));
    }

    @Test
    void mappingIsAppliedBeforeLocusCheck() {
        QubitMapping mapping = QubitMapping.of(Map.of("a", "QB3", "b", "QB2"));

        assertDoesNotThrow(() -> validator.validate(lattice, cz("a", "b"), mapping));

        QubitMapping bad = QubitMapping.of(Map.of("a", "QB1", "b", "QB3"));
        CircuitValidationException e = rejects(lattice, cz("a", "b"), bad);
        assertEquals(List.of("a", "b"), e.failure().locus());
        assertEquals(List.of("QB1", "QB3"), e.failure().mappedLocus());
        assertTrue(e.getMessage().contains("[a, b] = [QB1, QB3]"), e.getMessage());
    }

    @Test
    void mappedComponentFailureReportsBothNames() {
        QubitMapping mapping = QubitMapping.of(Map.of("q0", "QB9"));

        CircuitValidationException e = rejects(lattice, measure("m", "q0"), mapping);
        assertEquals("QB9", e.failure().component());
        assertTrue(e.getMessage().contains("q0 = QB9"), e.getMessage());
    }

    @Test
    void unmappedQubitFailsWhenMappingPresent() {
        QubitMapping mapping = QubitMapping.of(Map.of("q0", "QB1"));

        CircuitValidationException e = rejects(lattice, cz("q0", "q1"), mapping);
        assertEquals(FailureReason.UNMAPPED_QUBITS, e.reason());
        assertEquals(Set.of("q1"), e.failure().qubits());
    }

    @Property
    void symmetricGateAcceptsExactlyDeclaredPairsInEitherOrder(@ForAll("latticeQubits") String a,
                                                              @ForAll("latticeQubits") String b) {
        Assume.that(!a.equals(b));
        Set<String> pair = Set.of(a, b);
        boolean declared = pair.equals(Set.of("QB1", "QB2"))
                || pair.equals(Set.of("QB2", "QB3"))
                || pair.equals(Set.of("QB3", "QB4"));

        if (declared) {
            assertDoesNotThrow(() -> validator.validate(lattice, cz(a, b), QubitMapping.NONE));
        } else {
            CircuitValidationException e = rejects(lattice, cz(a, b), QubitMapping.NONE);
            assertEquals(FailureReason.LOCUS_NOT_ALLOWED, e.reason());
        }
    }

    @Property
    void factorizableAcceptsIffEveryComponentIsCalibrated(@ForAll("componentSets") List<String> locus) {
        boolean allCalibrated = Set.of("QB1", "QB2", "QB3", "QB4").containsAll(locus);
        Instruction instruction = measure("m", locus.toArray(new String[0]));

        if (allCalibrated) {
            assertDoesNotThrow(() -> validator.validate(lattice, instruction, QubitMapping.NONE));
        } else {
            CircuitValidationException e = rejects(lattice, instruction, QubitMapping.NONE);
            assertEquals(FailureReason.LOCUS_NOT_ALLOWED, e.reason());
            assertFalse(Set.of("QB1", "QB2", "QB3", "QB4").contains(e.failure().component()));
        }
    }

    @Provide
    Arbitrary<String> latticeQubits() {
        return Arbitraries.of("QB1", "QB2", "QB3", "QB4", "QB5");
    }

    @Provide
    Arbitrary<List<String>> componentSets() {
        return Arbitraries.of("QB1", "QB2", "QB3", "QB4", "QB5", "QB6")
                .list().uniqueElements().ofMinSize(1).ofMaxSize(4);
    }
}
