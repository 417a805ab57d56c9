package org.grouping;

/**
 * ソルバーの終了状態
 */
public enum SolveStatus {
    OPTIMAL("最適解"),
    FEASIBLE("実行可能解"),
    INFEASIBLE("解なし"),
    TIMEOUT_NO_SOLUTION("時間切れ（解なし）");

    public final String displayName;

    SolveStatus(String displayName) {
        this.displayName = displayName;
    }

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
