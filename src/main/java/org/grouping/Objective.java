package org.grouping;

import com.google.ortools.sat.LinearExpr;
import java.util.*;

/**
 * 目的関数（ペナルティ項の重み付き和）
 */
public final class Objective {
    public final List<PenaltyTerm> terms;
    public final LinearExpr total;

    Objective(List<PenaltyTerm> terms, LinearExpr total) {
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
        this.total = total;
    }
}
