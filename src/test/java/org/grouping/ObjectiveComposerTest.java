package org.grouping;

import static com.google.common.truth.Truth.assertThat;

import com.google.ortools.Loader;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import java.util.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** ペナルティ項の単体テスト（割り当てを固定して値を確認） */
public final class ObjectiveComposerTest {

    @BeforeEach
    public void setUp() {
        Loader.loadNativeLibraries();
    }

    /** binOf[p] の枠に固定して解き、項名 → 重みなしの値を返す */
    private static Map<String, Long> evaluateFixed(List<Person> people, PartitionConfig config,
                                                   Collection<PriorPairing> pairs, int... binOf) {
        List<Bin> bins = config.resolveBins(people.size());
        AssignmentModel am = AssignmentModelBuilder.build(people, bins, config);
        Objective objective = ObjectiveComposer.compose(am, config, pairs);
        for (Person p : people) {
            am.model.addEquality(am.assign[p.id][binOf[p.id]], 1);
        }
        CpSolver solver = new CpSolver();
        solver.getParameters().setMaxTimeInSeconds(10.0);
        CpSolverStatus status = solver.solve(am.model);
        assertThat(status).isEqualTo(CpSolverStatus.OPTIMAL);

        Map<String, Long> values = new LinkedHashMap<>();
        for (PenaltyTerm term : objective.terms) {
            values.put(term.name, solver.value(term.expression));
        }
        values.put("total", solver.value(objective.total));
        return values;
    }

    @Test
    public void testGroupSizeDeviationAgainstGroupSize() {
        List<Person> people = TestPeople.ofSexes("FFMM");
        PartitionConfig config = PartitionConfig.groups(3).build();

        Map<String, Long> values = evaluateFixed(people, config, Collections.emptySet(), 0, 0, 0, 1);

        // |3-3| + |1-3|
        assertThat(values.get(PenaltyWeights.SIZE_BALANCE)).isEqualTo(2L);
    }

    @Test
    public void testClassSizeDeviationUsesNearerTarget() {
        List<Person> people = TestPeople.ofSexes("FFFFFMMMMM");
        PartitionConfig config = PartitionConfig.classes(3).build();

        // 4,4,2: floor=3, ceil=4 → 0 + 0 + 1
        Map<String, Long> values = evaluateFixed(people, config, Collections.emptySet(),
                0, 0, 0, 0, 1, 1, 1, 1, 2, 2);

        assertThat(values.get(PenaltyWeights.SIZE_BALANCE)).isEqualTo(1L);
    }

    @Test
    public void testSpreadCountsExtraBinsPerValue() {
        List<Person> people = TestPeople.withAttribute("FFFMMM", "subject",
                "math", "math", "art", "art", "art", null);
        PartitionConfig config = PartitionConfig.classes(3).spreadAttribute("subject").build();

        // math: 枠0のみ → 0、art: 枠0,1,2 → 2、空値は対象外
        Map<String, Long> values = evaluateFixed(people, config, Collections.emptySet(),
                0, 0, 0, 1, 2, 2);

        assertThat(values.get(PenaltyWeights.spread("subject"))).isEqualTo(2L);
    }

    @Test
    public void testCapExcessPerBinAndValue() {
        List<Person> people = TestPeople.withAttribute("FFFFMM", "origin",
                "DK", "DK", "DK", "DK", "SE", "SE");
        PartitionConfig config = PartitionConfig.classes(2).capRule("origin", 2)
                .weight(PenaltyWeights.cap("origin"), 7).build();

        // 枠0: DK 4人 → 超過2、枠1: SE 2人 → 0
        Map<String, Long> values = evaluateFixed(people, config, Collections.emptySet(),
                0, 0, 0, 0, 1, 1);

        assertThat(values.get(PenaltyWeights.cap("origin"))).isEqualTo(2L);
        // size: 4,2 → floor=ceil=3 → 1 + 1 = 2（重み2）、cap: 2 × 7
        assertThat(values.get("total")).isEqualTo(2L * 2 + 2L * 7);
    }

    @Test
    public void testSexBalanceOnlyInMixedMode() {
        List<Person> people = TestPeople.ofSexes("FFFM");
        PartitionConfig mixed = PartitionConfig.groups(4)
                .compositionMode(PartitionConfig.CompositionMode.MIXED).build();
        PartitionConfig plain = PartitionConfig.groups(4).build();

        Map<String, Long> mixedValues = evaluateFixed(people, mixed, Collections.emptySet(), 0, 0, 0, 0);
        Map<String, Long> plainValues = evaluateFixed(people, plain, Collections.emptySet(), 0, 0, 0, 0);

        assertThat(mixedValues.get(PenaltyWeights.SEX_BALANCE)).isEqualTo(2L);
        assertThat(plainValues).doesNotContainKey(PenaltyWeights.SEX_BALANCE);
    }

    @Test
    public void testPriorPairingCountsTogetherBins() {
        List<Person> people = TestPeople.ofSexes("FFMM");
        Set<PriorPairing> pairs = new HashSet<>(Arrays.asList(
                new PriorPairing("P0", "P1"),
                new PriorPairing("P2", "P3"),
                new PriorPairing("P0", "Unknown")));
        PartitionConfig config = PartitionConfig.groups(2).build();

        Map<String, Long> values = evaluateFixed(people, config, pairs, 0, 0, 1, 1);

        assertThat(values.get(PenaltyWeights.PRIOR_PAIRING)).isEqualTo(2L);
        assertThat(values.get("total")).isEqualTo(2L * PenaltyWeights.DEFAULT_PRIOR_PAIRING_WEIGHT);
    }

    @Test
    public void testDuplicateNameResolvesToLastPerson() {
        List<Person> people = Arrays.asList(
                new Person(0, "Ann", Person.Sex.F),
                new Person(1, "Bob", Person.Sex.M),
                new Person(2, "Ann ", Person.Sex.F),
                new Person(3, "Cid", Person.Sex.M));

        List<int[]> resolved = ObjectiveComposer.resolvePairs(people,
                Collections.singleton(new PriorPairing("Ann", "Bob")));

        // 同名の場合は名簿で後ろの人（ID 2）
        assertThat(resolved).hasSize(1);
        assertThat(resolved.get(0)).asList().containsExactly(2, 1).inOrder();
    }

    @Test
    public void testDistinctValuesSortedWithoutBlanks() {
        List<Person> people = TestPeople.withAttribute("FFFF", "language", "fr", " de ", "", "fr");

        assertThat(ObjectiveComposer.distinctValues(people, "language")).containsExactly("de", "fr").inOrder();
    }
}
