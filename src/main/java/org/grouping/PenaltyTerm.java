package org.grouping;

import com.google.ortools.sat.LinearExpr;

/**
 * 重み付きペナルティ項（式は非負の整数値をとる）
 */
public final class PenaltyTerm {
    public final String name;
    public final int weight;
    public final LinearExpr expression;

    public PenaltyTerm(String name, int weight, LinearExpr expression) {
        this.name = name;
        this.weight = weight;
        this.expression = expression;
    }

    @Override
    public String toString() {
        return name + " x" + weight;
    }
}
