package org.grouping;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.ortools.Loader;
import com.google.ortools.sat.CpSolverStatus;
import java.util.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** ソルバー実行と状態変換のテスト */
public final class SolverDriverTest {

    @BeforeEach
    public void setUp() {
        Loader.loadNativeLibraries();
    }

    @Test
    public void testStatusMapping() {
        assertThat(SolverDriver.toSolveStatus(CpSolverStatus.OPTIMAL, null)).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(SolverDriver.toSolveStatus(CpSolverStatus.FEASIBLE, null)).isEqualTo(SolveStatus.FEASIBLE);
        assertThat(SolverDriver.toSolveStatus(CpSolverStatus.INFEASIBLE, null)).isEqualTo(SolveStatus.INFEASIBLE);
        assertThat(SolverDriver.toSolveStatus(CpSolverStatus.UNKNOWN, null))
                .isEqualTo(SolveStatus.TIMEOUT_NO_SOLUTION);
    }

    @Test
    public void testModelInvalidIsProgrammingError() {
        assertThrows(IllegalStateException.class,
                () -> SolverDriver.toSolveStatus(CpSolverStatus.MODEL_INVALID, null));
    }

    @Test
    public void testSolveReturnsAssignmentAndPenalties() {
        List<Person> people = TestPeople.ofSexes("FFMMF");
        PartitionConfig config = PartitionConfig.groups(3)
                .compositionMode(PartitionConfig.CompositionMode.MIXED)
                .timeLimitSeconds(10)
                .build();
        List<Bin> bins = config.resolveBins(people.size());
        AssignmentModel am = AssignmentModelBuilder.build(people, bins, config);
        Objective objective = ObjectiveComposer.compose(am, config, Collections.emptySet());

        SolveOutcome outcome = SolverDriver.solve(am, objective, config);

        assertThat(outcome.status).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(outcome.binOf).hasLength(5);
        for (int b : outcome.binOf) {
            assertThat(b).isIn(Arrays.asList(0, 1));
        }
        assertThat(outcome.penalties.keySet())
                .containsExactly(PenaltyWeights.SIZE_BALANCE, PenaltyWeights.SEX_BALANCE).inOrder();
        long sum = outcome.penalties.values().stream().mapToLong(Long::longValue).sum();
        assertThat(outcome.objectiveValue).isEqualTo(sum);
    }

    @Test
    public void testInfeasibleRaisesWithoutPartialResult() {
        List<Person> people = TestPeople.ofSexes("FFFMM");
        PartitionConfig config = PartitionConfig.classes(2).sizeRange(3, 5).timeLimitSeconds(10).build();
        List<Bin> bins = config.resolveBins(people.size());
        AssignmentModel am = AssignmentModelBuilder.build(people, bins, config);
        Objective objective = ObjectiveComposer.compose(am, config, Collections.emptySet());

        PartitionFailedException e = assertThrows(PartitionFailedException.class,
                () -> SolverDriver.solve(am, objective, config));

        assertThat(e.getStatus()).isEqualTo(SolveStatus.INFEASIBLE);
    }

    @Test
    public void testTimeoutFailureNamesTimeLimit() {
        PartitionConfig config = PartitionConfig.groups(3).timeLimitSeconds(2.5).build();

        PartitionFailedException timeout = assertThrows(PartitionFailedException.class,
                () -> SolverDriver.requireSolution(SolveStatus.TIMEOUT_NO_SOLUTION, config));
        PartitionFailedException infeasible = assertThrows(PartitionFailedException.class,
                () -> SolverDriver.requireSolution(SolveStatus.INFEASIBLE, config));

        assertThat(timeout.getStatus()).isEqualTo(SolveStatus.TIMEOUT_NO_SOLUTION);
        assertThat(timeout).hasMessageThat().contains("2.5");
        assertThat(timeout).hasMessageThat().contains("制限時間");
        assertThat(infeasible).hasMessageThat().doesNotContain("2.5");
        SolverDriver.requireSolution(SolveStatus.FEASIBLE, config);
        SolverDriver.requireSolution(SolveStatus.OPTIMAL, config);
    }

    @Test
    public void testTinyTimeLimitReportsTimeout() {
        // 60人・6クラス、各クラス10人かつ男女4人以上、科目は分散させる
        String[] subjects = new String[60];
        StringBuilder sexes = new StringBuilder();
        for (int i = 0; i < 60; i++) {
            sexes.append(i % 2 == 0 ? 'F' : 'M');
            subjects[i] = "s" + (i % 12);
        }
        List<Person> people = TestPeople.withAttribute(sexes.toString(), "subject", subjects);
        PartitionConfig config = PartitionConfig.classes(6)
                .sizeRange(10, 10)
                .sexBounds(Person.Sex.F, 4, 6)
                .sexBounds(Person.Sex.M, 4, 6)
                .spreadAttribute("subject")
                .capRule("subject", 1)
                .numWorkers(1)
                .timeLimitSeconds(1e-9)
                .build();
        List<Bin> bins = config.resolveBins(people.size());
        AssignmentModel am = AssignmentModelBuilder.build(people, bins, config);
        Objective objective = ObjectiveComposer.compose(am, config, Collections.emptySet());

        PartitionFailedException e = assertThrows(PartitionFailedException.class,
                () -> SolverDriver.solve(am, objective, config));

        assertThat(e.getStatus()).isEqualTo(SolveStatus.TIMEOUT_NO_SOLUTION);
        assertThat(e).hasMessageThat().contains("制限時間");
    }

    @Test
    public void testFailureStatusMustNotCarrySolution() {
        assertThrows(IllegalArgumentException.class,
                () -> new PartitionFailedException(SolveStatus.FEASIBLE, "x"));
    }
}
