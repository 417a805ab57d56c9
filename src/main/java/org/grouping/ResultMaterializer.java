package org.grouping;

import java.util.*;

/**
 * ソルバーの変数値を枠ごとの所属者リストに変換
 */
public class ResultMaterializer {

    public static Partition materialize(List<Person> people, List<Bin> bins, SolveOutcome outcome) {
        List<List<Person>> members = new ArrayList<>();
        for (int b = 0; b < bins.size(); b++) {
            members.add(new ArrayList<>());
        }
        for (Person p : people) {
            members.get(outcome.binOf[p.id]).add(p);
        }

        int total = members.stream().mapToInt(List::size).sum();
        if (total != people.size()) {
            throw new IllegalStateException(String.format(
                    "割り振り人数(%d)が入力人数(%d)と一致しません", total, people.size()));
        }
        return new Partition(bins, members, outcome.status, outcome.objectiveValue, outcome.penalties);
    }
}
