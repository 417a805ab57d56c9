package org.grouping;

import java.util.*;

/**
 * ソルバーの実行結果（解ありの場合のみ生成）
 */
public final class SolveOutcome {
    public final SolveStatus status;
    /** binOf[personId] = 枠インデックス */
    public final int[] binOf;
    public final long objectiveValue;
    /** ペナルティ項名 → 重み付きペナルティ */
    public final Map<String, Long> penalties;
    public final double wallTimeSeconds;

    public SolveOutcome(SolveStatus status, int[] binOf, long objectiveValue,
                        Map<String, Long> penalties, double wallTimeSeconds) {
        this.status = status;
        this.binOf = binOf.clone();
        this.objectiveValue = objectiveValue;
        this.penalties = Collections.unmodifiableMap(new LinkedHashMap<>(penalties));
        this.wallTimeSeconds = wallTimeSeconds;
    }
}
