package org.grouping;

import com.google.ortools.sat.*;
import java.util.*;
import java.util.function.Predicate;

/**
 * CP-SATモデルと割り当て変数 x[人][枠] の組
 */
public final class AssignmentModel {
    public final CpModel model;
    public final List<Person> people;
    public final List<Bin> bins;
    /** x[p][b] = 1 なら人 p は枠 b に所属 */
    public final BoolVar[][] assign;

    AssignmentModel(CpModel model, List<Person> people, List<Bin> bins, BoolVar[][] assign) {
        this.model = model;
        this.people = people;
        this.bins = bins;
        this.assign = assign;
    }

    public int personCount() {
        return people.size();
    }

    public int binCount() {
        return bins.size();
    }

    /**
     * 枠 b の所属人数
     */
    public LinearExpr binSize(int b) {
        return count(b, p -> true);
    }

    /**
     * 枠 b のうち条件を満たす人の人数
     */
    public LinearExpr count(int b, Predicate<Person> filter) {
        List<BoolVar> vars = new ArrayList<>();
        for (Person p : people) {
            if (filter.test(p)) {
                vars.add(assign[p.id][b]);
            }
        }
        return LinearExpr.sum(vars.toArray(new BoolVar[0]));
    }

    /**
     * 枠 b のうち attribute = value の人数
     */
    public LinearExpr countWithValue(int b, String attribute, String value) {
        return count(b, p -> value.equals(p.valueOf(attribute)));
    }
}
