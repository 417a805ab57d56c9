package org.grouping;

import com.google.ortools.sat.*;
import java.util.*;
import java.util.logging.Logger;

/**
 * 割り当て変数とハード制約の構築
 *
 * ハード制約:
 * 1. 各人はちょうど1つの枠に所属
 * 2. 各枠の人数は [minSize, maxSize]
 * 3. 属性値ごとの人数範囲（設定時のみ）
 * 4. 男女別モード: 各枠は女性のみ or 男性のみ
 * 5. 男女混合モード: 男女とも枠数以上いる場合のみ、各枠に男女1人以上
 */
public class AssignmentModelBuilder {
    private static final Logger LOGGER = Logger.getLogger(AssignmentModelBuilder.class.getName());

    static {
        com.google.ortools.Loader.loadNativeLibraries();
    }

    public static AssignmentModel build(List<Person> people, List<Bin> bins, PartitionConfig config) {
        CpModel model = new CpModel();
        int n = people.size();
        int k = bins.size();

        BoolVar[][] assign = new BoolVar[n][k];
        for (Person p : people) {
            for (int b = 0; b < k; b++) {
                assign[p.id][b] = model.newBoolVar(String.format("p%d_b%d", p.id, b));
            }
        }
        AssignmentModel am = new AssignmentModel(model, people, bins, assign);

        // 制約1: 各人はちょうど1枠
        for (Person p : people) {
            model.addExactlyOne(assign[p.id]);
        }

        // 制約2: 枠の人数範囲
        for (Bin bin : bins) {
            model.addLinearConstraint(am.binSize(bin.index), bin.minSize, bin.maxSize);
        }

        // 制約3: 属性値ごとの人数範囲
        for (PartitionConfig.CompositionBound bound : config.compositionBounds) {
            for (Bin bin : bins) {
                model.addLinearConstraint(
                        am.countWithValue(bin.index, bound.attribute, bound.value),
                        bound.min, bound.max);
            }
        }

        switch (config.compositionMode) {
            case SAME_SEX:
                addSameSexConstraints(am);
                break;
            case MIXED:
                addMixedConstraints(am);
                break;
            default:
                break;
        }

        LOGGER.info(String.format("モデル構築完了: %d人 × %d枠, 構成制約=%d件, モード=%s",
                n, k, config.compositionBounds.size(), config.compositionMode.displayName));
        return am;
    }

    /**
     * 制約4: 男女別（枠ごとに「女性のみ」指標を用意し、反対側の人数を0に固定）
     */
    private static void addSameSexConstraints(AssignmentModel am) {
        for (Bin bin : am.bins) {
            LinearExpr femaleCount = am.count(bin.index, p -> p.sex == Person.Sex.F);
            LinearExpr maleCount = am.count(bin.index, p -> p.sex == Person.Sex.M);
            BoolVar femaleOnly = am.model.newBoolVar("female_only_b" + bin.index);
            am.model.addEquality(maleCount, 0).onlyEnforceIf(femaleOnly);
            am.model.addEquality(femaleCount, 0).onlyEnforceIf(femaleOnly.not());
        }
    }

    /**
     * 制約5: 男女混合（男女いずれかが枠数未満なら制約自体を追加しない）
     */
    private static void addMixedConstraints(AssignmentModel am) {
        int k = am.binCount();
        long females = am.people.stream().filter(p -> p.sex == Person.Sex.F).count();
        long males = am.people.stream().filter(p -> p.sex == Person.Sex.M).count();

        if (females < k || males < k) {
            LOGGER.warning(String.format(
                    "男女混合制約をスキップ: 女性=%d人, 男性=%d人, 枠数=%d", females, males, k));
            return;
        }

        for (Bin bin : am.bins) {
            am.model.addGreaterOrEqual(am.count(bin.index, p -> p.sex == Person.Sex.F), 1);
            am.model.addGreaterOrEqual(am.count(bin.index, p -> p.sex == Person.Sex.M), 1);
        }
    }
}
