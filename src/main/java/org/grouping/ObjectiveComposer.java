package org.grouping;

import com.google.ortools.sat.*;
import java.util.*;
import java.util.logging.Logger;

/**
 * ソフト制約（ペナルティ項）の構築と目的関数の合成
 *
 * - size_balance: 枠人数と目標人数の差
 * - spread:属性: 同じ属性値の人がまたがる枠数 - 1
 * - cap:属性: 属性値ごとの推奨上限の超過人数
 * - sex_balance: 枠内の男女差（男女混合モードのみ）
 * - prior_pairing: 過去の同席ペアが再び同じ枠になった回数
 */
public class ObjectiveComposer {
    private static final Logger LOGGER = Logger.getLogger(ObjectiveComposer.class.getName());

    public static Objective compose(AssignmentModel am, PartitionConfig config,
                                    Collection<PriorPairing> priorPairings) {
        List<PenaltyTerm> terms = new ArrayList<>();

        terms.add(new PenaltyTerm(PenaltyWeights.SIZE_BALANCE,
                config.weightOf(PenaltyWeights.SIZE_BALANCE),
                sizeBalance(am, config)));

        for (String attribute : config.spreadAttributes) {
            String name = PenaltyWeights.spread(attribute);
            terms.add(new PenaltyTerm(name, config.weightOf(name), categorySpread(am, attribute)));
        }

        for (PartitionConfig.CapRule rule : config.capRules) {
            String name = PenaltyWeights.cap(rule.attribute);
            terms.add(new PenaltyTerm(name, config.weightOf(name), categoryCapExcess(am, rule)));
        }

        if (config.compositionMode == PartitionConfig.CompositionMode.MIXED) {
            terms.add(new PenaltyTerm(PenaltyWeights.SEX_BALANCE,
                    config.weightOf(PenaltyWeights.SEX_BALANCE),
                    sexBalance(am)));
        }

        if (priorPairings != null && !priorPairings.isEmpty()) {
            terms.add(new PenaltyTerm(PenaltyWeights.PRIOR_PAIRING,
                    config.weightOf(PenaltyWeights.PRIOR_PAIRING),
                    priorPairing(am, priorPairings)));
        }

        LinearExprBuilder total = LinearExpr.newBuilder();
        for (PenaltyTerm term : terms) {
            total.addTerm(term.expression, term.weight);
            LOGGER.fine("ペナルティ項: " + term);
        }
        LinearExpr objective = total.build();
        am.model.minimize(objective);

        LOGGER.info(String.format("目的関数を構築: %d項 %s", terms.size(), terms));
        return new Objective(terms, objective);
    }

    /**
     * 人数バランス
     * グループ分け: |人数 - groupSize|
     * クラス分け: floor(N/K), ceil(N/K) のうち近い方との差
     */
    static LinearExpr sizeBalance(AssignmentModel am, PartitionConfig config) {
        CpModel model = am.model;
        int n = am.personCount();
        int k = am.binCount();
        List<IntVar> deviations = new ArrayList<>();

        if (config.variant == PartitionConfig.Variant.GROUPS) {
            int target = config.groupSize;
            for (Bin bin : am.bins) {
                IntVar dev = model.newIntVar(0, Math.max(target, n), "size_dev_b" + bin.index);
                model.addAbsEquality(dev, LinearExpr.newBuilder()
                        .add(am.binSize(bin.index)).add(-target).build());
                deviations.add(dev);
            }
        } else {
            int targetFloor = n / k;
            int targetCeil = (n + k - 1) / k;
            for (Bin bin : am.bins) {
                IntVar devFloor = model.newIntVar(0, n, "dev_floor_b" + bin.index);
                IntVar devCeil = model.newIntVar(0, n, "dev_ceil_b" + bin.index);
                model.addAbsEquality(devFloor, LinearExpr.newBuilder()
                        .add(am.binSize(bin.index)).add(-targetFloor).build());
                model.addAbsEquality(devCeil, LinearExpr.newBuilder()
                        .add(am.binSize(bin.index)).add(-targetCeil).build());
                IntVar dev = model.newIntVar(0, n, "size_dev_b" + bin.index);
                model.addMinEquality(dev, new IntVar[]{devFloor, devCeil});
                deviations.add(dev);
            }
        }
        return LinearExpr.sum(deviations.toArray(new IntVar[0]));
    }

    /**
     * 同じ属性値をまとめる: 値ごとに (その値を含む枠数 - 1)
     */
    static LinearExpr categorySpread(AssignmentModel am, String attribute) {
        CpModel model = am.model;
        LinearExprBuilder spread = LinearExpr.newBuilder();

        for (String value : distinctValues(am.people, attribute)) {
            List<BoolVar> hasInBin = new ArrayList<>();
            for (Bin bin : am.bins) {
                LinearExpr count = am.countWithValue(bin.index, attribute, value);
                BoolVar has = model.newBoolVar(String.format("has_%s_%s_b%d", attribute, value, bin.index));
                model.addGreaterOrEqual(count, 1).onlyEnforceIf(has);
                model.addEquality(count, 0).onlyEnforceIf(has.not());
                hasInBin.add(has);
            }
            spread.addSum(hasInBin.toArray(new BoolVar[0])).add(-1);
        }
        return spread.build();
    }

    /**
     * 属性値の偏り防止: 枠・値ごとに max(0, 人数 - 上限)
     */
    static LinearExpr categoryCapExcess(AssignmentModel am, PartitionConfig.CapRule rule) {
        CpModel model = am.model;
        int n = am.personCount();
        List<IntVar> excesses = new ArrayList<>();

        for (String value : distinctValues(am.people, rule.attribute)) {
            for (Bin bin : am.bins) {
                IntVar excess = model.newIntVar(0, n,
                        String.format("excess_%s_%s_b%d", rule.attribute, value, bin.index));
                model.addGreaterOrEqual(excess, LinearExpr.newBuilder()
                        .add(am.countWithValue(bin.index, rule.attribute, value))
                        .add(-rule.maxPerBin).build());
                excesses.add(excess);
            }
        }
        return LinearExpr.sum(excesses.toArray(new IntVar[0]));
    }

    /**
     * 男女バランス: 枠ごとに |女性数 - 男性数|
     */
    static LinearExpr sexBalance(AssignmentModel am) {
        CpModel model = am.model;
        int n = am.personCount();
        List<IntVar> imbalances = new ArrayList<>();

        for (Bin bin : am.bins) {
            LinearExpr femaleCount = am.count(bin.index, p -> p.sex == Person.Sex.F);
            LinearExpr maleCount = am.count(bin.index, p -> p.sex == Person.Sex.M);
            IntVar imbalance = model.newIntVar(0, n, "imbalance_b" + bin.index);
            model.addAbsEquality(imbalance, LinearExpr.newBuilder()
                    .add(femaleCount).addTerm(maleCount, -1).build());
            imbalances.add(imbalance);
        }
        return LinearExpr.sum(imbalances.toArray(new IntVar[0]));
    }

    /**
     * 過去の同席ペア回避: ペア・枠ごとに「2人とも所属」指標
     */
    static LinearExpr priorPairing(AssignmentModel am, Collection<PriorPairing> priorPairings) {
        CpModel model = am.model;
        List<BoolVar> together = new ArrayList<>();
        List<int[]> resolved = resolvePairs(am.people, priorPairings);

        for (int[] pair : resolved) {
            for (Bin bin : am.bins) {
                BoolVar both = model.newBoolVar(
                        String.format("prior_%d_%d_b%d", pair[0], pair[1], bin.index));
                model.addMultiplicationEquality(both, am.assign[pair[0]][bin.index], am.assign[pair[1]][bin.index]);
                together.add(both);
            }
        }

        int skipped = priorPairings.size() - resolved.size();
        if (skipped > 0) {
            LOGGER.fine(String.format("名簿にいないペアをスキップ: %d件", skipped));
        }
        LOGGER.info(String.format("過去の同席ペア: %d件中 %d件を対象", priorPairings.size(), resolved.size()));
        return LinearExpr.sum(together.toArray(new BoolVar[0]));
    }

    /**
     * 属性値の一覧（空値を除きソート済み）
     */
    static List<String> distinctValues(List<Person> people, String attribute) {
        SortedSet<String> values = new TreeSet<>();
        for (Person p : people) {
            String v = p.valueOf(attribute);
            if (!v.isEmpty()) {
                values.add(v);
            }
        }
        return new ArrayList<>(values);
    }

    /**
     * ペアの名前を人IDに解決（名簿にいない名前・同一人物はスキップ）
     * 同名の人がいる場合は名簿順で最後の人
     */
    static List<int[]> resolvePairs(List<Person> people, Collection<PriorPairing> priorPairings) {
        Map<String, Integer> nameToId = new HashMap<>();
        for (Person p : people) {
            nameToId.put(p.name.trim(), p.id);
        }
        List<int[]> resolved = new ArrayList<>();
        for (PriorPairing pairing : priorPairings) {
            Integer id1 = nameToId.get(pairing.first);
            Integer id2 = nameToId.get(pairing.second);
            if (id1 == null || id2 == null || id1.equals(id2)) {
                continue;
            }
            resolved.add(new int[]{id1, id2});
        }
        return resolved;
    }
}
