package org.grouping;

import com.google.ortools.sat.*;
import java.util.*;
import java.util.logging.Logger;

/**
 * CP-SATソルバーの実行（制限時間付き）
 *
 * 制限時間内に見つかった実行可能解は最適性が証明されていなくても採用する。
 * 解なし・時間切れの場合は部分解を返さずに例外とする。
 */
public class SolverDriver {
    private static final Logger LOGGER = Logger.getLogger(SolverDriver.class.getName());

    static {
        com.google.ortools.Loader.loadNativeLibraries();
    }

    public static SolveOutcome solve(AssignmentModel am, Objective objective, PartitionConfig config) {
        CpSolver solver = new CpSolver();
        solver.getParameters().setMaxTimeInSeconds(config.timeLimitSeconds);
        if (config.numWorkers > 0) {
            solver.getParameters().setNumSearchWorkers(config.numWorkers);
        }
        if (config.randomSeed != null) {
            solver.getParameters().setRandomSeed(config.randomSeed);
        }
        if (config.logSearchProgress) {
            solver.getParameters().setLogSearchProgress(true);
            solver.setLogCallback(line -> LOGGER.fine("[CP-SAT] " + line));
        }

        LOGGER.info(String.format("ソルバー実行: 制限時間=%.1f秒", config.timeLimitSeconds));
        CpSolverStatus cpStatus = solver.solve(am.model);
        SolveStatus status = toSolveStatus(cpStatus, solver);
        LOGGER.info(String.format("ソルバー終了: %s (%s), %.2f秒",
                status.displayName, cpStatus, solver.wallTime()));

        requireSolution(status, config);

        int[] binOf = extractAssignment(am, solver);

        Map<String, Long> penalties = new LinkedHashMap<>();
        for (PenaltyTerm term : objective.terms) {
            penalties.put(term.name, solver.value(term.expression) * term.weight);
        }
        long objectiveValue = solver.value(objective.total);

        return new SolveOutcome(status, binOf, objectiveValue, penalties, solver.wallTime());
    }

    /**
     * 解がなければ状態に応じたメッセージで例外
     */
    static void requireSolution(SolveStatus status, PartitionConfig config) {
        if (status.hasSolution()) {
            return;
        }
        String message = status == SolveStatus.INFEASIBLE
                ? "ハード制約を満たす割り振りがありません。人数・枠数・構成条件を見直してください。"
                : String.format("制限時間(%.1f秒)内に解が見つかりませんでした。制限時間を延ばすかソフト制約を緩めてください。",
                        config.timeLimitSeconds);
        throw new PartitionFailedException(status, message);
    }

    /**
     * CP-SATの状態を変換（MODEL_INVALID はモデル構築の不具合）
     */
    static SolveStatus toSolveStatus(CpSolverStatus cpStatus, CpSolver solver) {
        switch (cpStatus) {
            case OPTIMAL:
                return SolveStatus.OPTIMAL;
            case FEASIBLE:
                return SolveStatus.FEASIBLE;
            case INFEASIBLE:
                return SolveStatus.INFEASIBLE;
            case UNKNOWN:
                return SolveStatus.TIMEOUT_NO_SOLUTION;
            default:
                throw new IllegalStateException("不正なモデルです: " + cpStatus
                        + (solver != null ? " " + solver.getSolutionInfo() : ""));
        }
    }

    /**
     * 変数値から各人の所属枠を取得（ちょうど1枠であることを再確認）
     */
    private static int[] extractAssignment(AssignmentModel am, CpSolver solver) {
        int[] binOf = new int[am.personCount()];
        for (Person p : am.people) {
            int found = -1;
            for (int b = 0; b < am.binCount(); b++) {
                if (solver.booleanValue(am.assign[p.id][b])) {
                    if (found >= 0) {
                        throw new IllegalStateException(String.format(
                                "%s が複数の枠(%d, %d)に割り当てられています", p, found, b));
                    }
                    found = b;
                }
            }
            if (found < 0) {
                throw new IllegalStateException(p + " がどの枠にも割り当てられていません");
            }
            binOf[p.id] = found;
        }
        return binOf;
    }
}
