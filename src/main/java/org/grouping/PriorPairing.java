package org.grouping;

import java.util.*;

/**
 * 過去に同じグループだった2人の組（順序なし）
 * 名前は前後空白を除去し、辞書順に並べて保持する
 */
public final class PriorPairing {
    public final String first;
    public final String second;

    public PriorPairing(String nameA, String nameB) {
        String a = nameA != null ? nameA.trim() : "";
        String b = nameB != null ? nameB.trim() : "";
        if (a.isEmpty() || b.isEmpty()) {
            throw new IllegalArgumentException("ペアの名前が空です: '" + nameA + "', '" + nameB + "'");
        }
        if (a.equals(b)) {
            throw new IllegalArgumentException("同じ名前同士のペアは作れません: " + a);
        }
        if (a.compareTo(b) <= 0) {
            this.first = a;
            this.second = b;
        } else {
            this.first = b;
            this.second = a;
        }
    }

    /**
     * 過去のグループ（名前のリスト）から同席ペアを抽出
     */
    public static Set<PriorPairing> fromGroups(Collection<? extends Collection<String>> groups) {
        Set<PriorPairing> pairs = new LinkedHashSet<>();
        for (Collection<String> group : groups) {
            List<String> names = new ArrayList<>();
            for (String name : group) {
                if (name == null || name.trim().isEmpty()) continue;
                names.add(name.trim());
            }
            for (int i = 0; i < names.size(); i++) {
                for (int j = i + 1; j < names.size(); j++) {
                    if (names.get(i).equals(names.get(j))) continue;
                    pairs.add(new PriorPairing(names.get(i), names.get(j)));
                }
            }
        }
        return pairs;
    }

    /**
     * 前回の割り振り結果から同席ペアを抽出
     */
    public static Set<PriorPairing> fromPartition(Partition partition) {
        List<List<String>> groups = new ArrayList<>();
        for (List<Person> members : partition.members) {
            List<String> names = new ArrayList<>();
            for (Person p : members) {
                names.add(p.name);
            }
            groups.add(names);
        }
        return fromGroups(groups);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PriorPairing)) return false;
        PriorPairing other = (PriorPairing) o;
        return first.equals(other.first) && second.equals(other.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
