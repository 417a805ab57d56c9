package org.grouping;

import java.util.*;

/**
 * 割り振り結果（枠順、枠内は入力順）
 */
public final class Partition {
    public final List<Bin> bins;
    /** members.get(b) = 枠 b の所属者（入力と同一インスタンス） */
    public final List<List<Person>> members;
    public final SolveStatus status;
    public final long objectiveValue;
    /** ペナルティ項名 → 重み付きペナルティ */
    public final Map<String, Long> penalties;

    public Partition(List<Bin> bins, List<List<Person>> members, SolveStatus status,
                     long objectiveValue, Map<String, Long> penalties) {
        if (bins.size() != members.size()) {
            throw new IllegalArgumentException(String.format(
                    "枠数(%d)と所属リスト数(%d)が一致しません", bins.size(), members.size()));
        }
        this.bins = Collections.unmodifiableList(new ArrayList<>(bins));
        List<List<Person>> copy = new ArrayList<>();
        for (List<Person> group : members) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(group)));
        }
        this.members = Collections.unmodifiableList(copy);
        this.status = status;
        this.objectiveValue = objectiveValue;
        this.penalties = Collections.unmodifiableMap(new LinkedHashMap<>(penalties));
    }

    public int binCount() {
        return bins.size();
    }

    public int totalPeople() {
        return members.stream().mapToInt(List::size).sum();
    }

    public List<Person> membersOf(int binIndex) {
        return members.get(binIndex);
    }

    /**
     * 人の所属枠インデックス（見つからなければ -1）
     */
    public int binOf(Person person) {
        for (int b = 0; b < members.size(); b++) {
            for (Person p : members.get(b)) {
                if (p == person) {
                    return b;
                }
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(status.displayName).append(" objective=").append(objectiveValue);
        for (int b = 0; b < bins.size(); b++) {
            sb.append("\n  ").append(bins.get(b).label).append(": ");
            List<String> names = new ArrayList<>();
            for (Person p : members.get(b)) {
                names.add(p.name);
            }
            sb.append(names);
        }
        return sb.toString();
    }
}
