package org.grouping;

import java.util.*;
import java.util.logging.Logger;

/**
 * グループ／クラス割り振りのエントリーポイント
 *
 * ★処理フロー（1リクエスト1回、状態は保持しない）:
 * 1. 入力チェック（IDが 0..N-1 の連番か）
 * 2. 枠の決定（グループ数 = ceil(N / groupSize) またはクラス数固定）
 * 3. ハード制約の構築
 * 4. ソフト制約（ペナルティ項）の合成
 * 5. CP-SATで求解（制限時間付き）
 * 6. 枠ごとの所属者リストへ変換
 */
public class GroupPartitioner {
    private static final Logger LOGGER = Logger.getLogger(GroupPartitioner.class.getName());

    public static Partition partition(List<Person> people, PartitionConfig config) {
        return partition(people, config, Collections.emptySet());
    }

    /**
     * @param people        正規化済みの対象者（IDは入力順に 0..N-1）
     * @param config        割り振り設定
     * @param priorPairings 過去に同じ枠だった名前のペア（null可）
     * @return 枠順の割り振り結果（グループ分けで対象者0人なら空のグループ1つ、目的値0・内訳なし）
     * @throws InvalidConfigurationException IDが連番でない場合
     * @throws PartitionFailedException      解なし・時間切れの場合
     */
    public static Partition partition(List<Person> people, PartitionConfig config,
                                      Collection<PriorPairing> priorPairings) {
        validateIds(people);
        Collection<PriorPairing> pairs = priorPairings != null ? priorPairings : Collections.emptySet();

        LOGGER.info(String.format("=== 割り振り開始: %d人, %s ===", people.size(), config));

        if (people.isEmpty() && config.variant == PartitionConfig.Variant.GROUPS) {
            // 対象者なし: ソルバーを呼ばず空のグループを1つ返す（ペナルティ内訳なし、目的値0）
            List<Bin> bins = Collections.singletonList(new Bin(0, "Group 1", 0, config.groupSize));
            List<List<Person>> members = Collections.singletonList(Collections.emptyList());
            LOGGER.info("=== 対象者なし: 空のグループを1つ返します ===");
            return new Partition(bins, members, SolveStatus.OPTIMAL, 0, Collections.emptyMap());
        }

        List<Bin> bins = config.resolveBins(people.size());
        LOGGER.info("枠: " + bins);

        AssignmentModel model = AssignmentModelBuilder.build(people, bins, config);
        Objective objective = ObjectiveComposer.compose(model, config, pairs);
        SolveOutcome outcome = SolverDriver.solve(model, objective, config);
        Partition partition = ResultMaterializer.materialize(people, bins, outcome);

        LOGGER.info(String.format("=== 割り振り完了: %s, ペナルティ合計=%d %s, %.2f秒 ===",
                outcome.status.displayName, outcome.objectiveValue, outcome.penalties, outcome.wallTimeSeconds));
        return partition;
    }

    private static void validateIds(List<Person> people) {
        for (int i = 0; i < people.size(); i++) {
            Person p = people.get(i);
            if (p == null) {
                throw new InvalidConfigurationException(i + "番目の対象者が null です");
            }
            if (p.id != i) {
                throw new InvalidConfigurationException(String.format(
                        "対象者IDは入力順の連番(0..N-1)にしてください: %d番目のIDが %d", i, p.id));
            }
        }
    }
}
