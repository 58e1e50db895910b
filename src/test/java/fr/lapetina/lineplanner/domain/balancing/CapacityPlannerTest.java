package fr.lapetina.lineplanner.domain.balancing;

import fr.lapetina.lineplanner.domain.exception.InvalidDemandException;
import fr.lapetina.lineplanner.domain.exception.MalformedOperationException;
import fr.lapetina.lineplanner.domain.model.BalancedOperation;
import fr.lapetina.lineplanner.domain.model.LayoutErrorType;
import fr.lapetina.lineplanner.domain.model.Operation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CapacityPlannerTest {

    private CapacityPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new CapacityPlanner();
    }

    private static Operation op(String opNo, double smv) {
        return new Operation(opNo, "Op " + opNo, "SNLS", smv, "Cuff");
    }

    @Nested
    @DisplayName("machine counts")
    class MachineCounts {

        @Test
        @DisplayName("should need one machine when SMV equals takt time")
        void shouldNeedOneMachineAtTakt() {
            List<BalancedOperation> result = planner.plan(List.of(op("10", 1.0)), 480, 480);

            assertThat(result).hasSize(1);
            assertThat(result.get(0).requiredMachines()).isEqualTo(1);
        }

        @Test
        @DisplayName("should round up to the next whole machine")
        void shouldRoundUp() {
            // 1.3 * 1000 / 480 = 2.708
            List<BalancedOperation> result = planner.plan(List.of(op("10", 1.3)), 1000, 480);

            assertThat(result.get(0).requiredMachines()).isEqualTo(3);
        }

        @Test
        @DisplayName("should keep one machine for operations without timing data")
        void shouldKeepOneMachineForZeroSmv() {
            List<BalancedOperation> result = planner.plan(List.of(op("10", 0.0)), 5000, 480);

            assertThat(result.get(0).requiredMachines()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep one machine for tiny SMV")
        void shouldKeepOneMachineForTinySmv() {
            List<BalancedOperation> result = planner.plan(List.of(op("10", 0.01)), 10, 480);

            assertThat(result.get(0).requiredMachines()).isEqualTo(1);
        }

        @Test
        @DisplayName("should not add a machine for floating point noise")
        void shouldIgnoreFloatingPointNoise() {
            // 1.1 * 100 / 10 evaluates to 11.000000000000002
            List<BalancedOperation> result = planner.plan(List.of(op("10", 1.1)), 100, 10);

            assertThat(result.get(0).requiredMachines()).isEqualTo(11);
        }

        @Test
        @DisplayName("should match ceil(T x D / W) across a range of inputs")
        void shouldMatchFormula() {
            double[] smvs = {0.25, 0.5, 0.75, 1.0, 1.5, 2.25, 3.0, 4.5};
            int[] targets = {120, 480, 960, 1500};
            for (double smv : smvs) {
                for (int target : targets) {
                    int expected = Math.max(1, (int) Math.ceil(smv * target / 480.0));
                    int actual = planner.plan(List.of(op("10", smv)), target, 480).get(0).requiredMachines();
                    assertThat(actual)
                            .as("smv=%s target=%s", smv, target)
                            .isEqualTo(expected);
                }
            }
        }

        @Test
        @DisplayName("should preserve input order without merging duplicates")
        void shouldPreserveOrder() {
            List<Operation> ops = List.of(op("30", 2.0), op("10", 1.0), op("30", 2.0));

            List<BalancedOperation> result = planner.plan(ops, 480, 480);

            assertThat(result).extracting(b -> b.operation().opNo()).containsExactly("30", "10", "30");
            assertThat(result).extracting(BalancedOperation::requiredMachines).containsExactly(2, 1, 2);
        }

        @Test
        @DisplayName("should return an empty list for no operations")
        void shouldHandleEmptyInput() {
            assertThat(planner.plan(List.of(), 480, 480)).isEmpty();
        }
    }

    @Nested
    @DisplayName("machine limit")
    class MachineLimit {

        @Test
        @DisplayName("should reject an operation whose count would exceed an int")
        void shouldRejectHugeSmv() {
            List<Operation> ops = List.of(op("10", 1.0), op("20", 1e10));

            assertThatThrownBy(() -> planner.plan(ops, 480, 480))
                    .isInstanceOfSatisfying(MalformedOperationException.class, e -> {
                        assertThat(e.getIndex()).isEqualTo(1);
                        assertThat(e.getMessage()).contains("10000000000 machines");
                    });
        }

        @Test
        @DisplayName("should reject counts that overflow a double")
        void shouldRejectOverflowingProduct() {
            assertThatThrownBy(() -> planner.plan(List.of(op("10", Double.MAX_VALUE)), 1000, 1))
                    .isInstanceOf(MalformedOperationException.class);
        }

        @Test
        @DisplayName("should accept a count exactly at the limit")
        void shouldAcceptCountAtLimit() {
            CapacityPlanner small = new CapacityPlanner(new OperationValidator(), 5);

            assertThat(small.plan(List.of(op("10", 5.0)), 480, 480).get(0).requiredMachines()).isEqualTo(5);
            assertThatThrownBy(() -> small.plan(List.of(op("10", 5.5)), 480, 480))
                    .isInstanceOf(MalformedOperationException.class)
                    .hasMessageContaining("limit of 5");
        }

        @Test
        @DisplayName("should keep the default limit")
        void shouldExposeDefaultLimit() {
            assertThat(planner.getMaxMachinesPerOperation())
                    .isEqualTo(CapacityPlanner.DEFAULT_MAX_MACHINES_PER_OPERATION);
        }
    }

    @Nested
    @DisplayName("demand validation")
    class DemandValidation {

        @Test
        @DisplayName("should reject zero target output")
        void shouldRejectZeroTarget() {
            assertThatThrownBy(() -> planner.plan(List.of(op("10", 1.0)), 0, 480))
                    .isInstanceOf(InvalidDemandException.class)
                    .satisfies(e -> assertThat(((InvalidDemandException) e).getErrorType())
                            .isEqualTo(LayoutErrorType.INVALID_DEMAND));
        }

        @Test
        @DisplayName("should reject negative working minutes")
        void shouldRejectNegativeWorkingMinutes() {
            assertThatThrownBy(() -> planner.plan(List.of(op("10", 1.0)), 480, -1))
                    .isInstanceOf(InvalidDemandException.class);
        }

        @Test
        @DisplayName("should reject NaN demand")
        void shouldRejectNaN() {
            assertThatThrownBy(() -> planner.plan(List.of(), Double.NaN, 480))
                    .isInstanceOf(InvalidDemandException.class);
        }

        @Test
        @DisplayName("should check demand before operations")
        void shouldCheckDemandFirst() {
            List<Operation> ops = new ArrayList<>();
            ops.add(null);

            assertThatThrownBy(() -> planner.plan(ops, 0, 480))
                    .isInstanceOf(InvalidDemandException.class);
        }

        @Test
        @DisplayName("should compute takt time")
        void shouldComputeTaktTime() {
            assertThat(CapacityPlanner.taktTime(1200, 480)).isCloseTo(0.4, within(1e-12));
        }
    }

    @Test
    @DisplayName("should propagate malformed operations")
    void shouldPropagateMalformedOperation() {
        List<Operation> ops = List.of(op("10", 1.0), new Operation("20", "Bad", " ", 1.0, "Cuff"));

        assertThatThrownBy(() -> planner.plan(ops, 480, 480))
                .isInstanceOf(MalformedOperationException.class)
                .hasMessageContaining("index 1");
    }
}
