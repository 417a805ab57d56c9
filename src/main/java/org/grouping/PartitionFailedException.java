package org.grouping;

/**
 * 割り振りの解が得られなかった場合の例外
 * INFEASIBLE: 入力・設定を見直す必要あり
 * TIMEOUT_NO_SOLUTION: 制限時間を延ばすかソフト制約を緩める
 */
public class PartitionFailedException extends RuntimeException {
    private final SolveStatus status;

    public PartitionFailedException(SolveStatus status, String message) {
        super(message);
        if (status.hasSolution()) {
            throw new IllegalArgumentException("解ありの状態では失敗にできません: " + status);
        }
        this.status = status;
    }

    public SolveStatus getStatus() {
        return status;
    }
}
