package org.grouping;

import java.util.*;

/**
 * 割り振り結果のペナルティ再計算（ソルバーを使わない）
 * 項目名と値は ObjectiveComposer が構築する目的関数と一致する
 */
public class PenaltyScorer {

    /**
     * 再計算結果
     */
    public static final class Score {
        public final Map<String, Long> penalties;
        public final long total;

        Score(Map<String, Long> penalties) {
            this.penalties = Collections.unmodifiableMap(new LinkedHashMap<>(penalties));
            this.total = penalties.values().stream().mapToLong(Long::longValue).sum();
        }

        @Override
        public String toString() {
            return total + " " + penalties;
        }
    }

    public static Score score(Partition partition, PartitionConfig config,
                              Collection<PriorPairing> priorPairings) {
        return score(partition.members, config, priorPairings);
    }

    public static Score score(List<List<Person>> members, PartitionConfig config,
                              Collection<PriorPairing> priorPairings) {
        List<Person> people = new ArrayList<>();
        for (List<Person> group : members) {
            people.addAll(group);
        }
        people.sort(Comparator.comparingInt(p -> p.id));

        Map<String, Long> penalties = new LinkedHashMap<>();
        penalties.put(PenaltyWeights.SIZE_BALANCE,
                config.weightOf(PenaltyWeights.SIZE_BALANCE) * sizeBalance(members, people.size(), config));

        for (String attribute : config.spreadAttributes) {
            String name = PenaltyWeights.spread(attribute);
            penalties.put(name, config.weightOf(name) * categorySpread(members, people, attribute));
        }

        for (PartitionConfig.CapRule rule : config.capRules) {
            String name = PenaltyWeights.cap(rule.attribute);
            penalties.put(name, config.weightOf(name) * categoryCapExcess(members, people, rule));
        }

        if (config.compositionMode == PartitionConfig.CompositionMode.MIXED) {
            penalties.put(PenaltyWeights.SEX_BALANCE,
                    config.weightOf(PenaltyWeights.SEX_BALANCE) * sexBalance(members));
        }

        if (priorPairings != null && !priorPairings.isEmpty()) {
            penalties.put(PenaltyWeights.PRIOR_PAIRING,
                    config.weightOf(PenaltyWeights.PRIOR_PAIRING) * priorPairing(members, people, priorPairings));
        }
        return new Score(penalties);
    }

    private static long sizeBalance(List<List<Person>> members, int n, PartitionConfig config) {
        long total = 0;
        if (config.variant == PartitionConfig.Variant.GROUPS) {
            for (List<Person> group : members) {
                total += Math.abs(group.size() - config.groupSize);
            }
        } else {
            int k = members.size();
            int targetFloor = n / k;
            int targetCeil = (n + k - 1) / k;
            for (List<Person> group : members) {
                total += Math.min(Math.abs(group.size() - targetFloor), Math.abs(group.size() - targetCeil));
            }
        }
        return total;
    }

    private static long categorySpread(List<List<Person>> members, List<Person> people, String attribute) {
        long total = 0;
        for (String value : ObjectiveComposer.distinctValues(people, attribute)) {
            int binsWithValue = 0;
            for (List<Person> group : members) {
                if (group.stream().anyMatch(p -> value.equals(p.valueOf(attribute)))) {
                    binsWithValue++;
                }
            }
            total += binsWithValue - 1;
        }
        return total;
    }

    private static long categoryCapExcess(List<List<Person>> members, List<Person> people,
                                          PartitionConfig.CapRule rule) {
        long total = 0;
        for (String value : ObjectiveComposer.distinctValues(people, rule.attribute)) {
            for (List<Person> group : members) {
                long count = group.stream().filter(p -> value.equals(p.valueOf(rule.attribute))).count();
                total += Math.max(0, count - rule.maxPerBin);
            }
        }
        return total;
    }

    private static long sexBalance(List<List<Person>> members) {
        long total = 0;
        for (List<Person> group : members) {
            long females = group.stream().filter(p -> p.sex == Person.Sex.F).count();
            long males = group.size() - females;
            total += Math.abs(females - males);
        }
        return total;
    }

    private static long priorPairing(List<List<Person>> members, List<Person> people,
                                     Collection<PriorPairing> priorPairings) {
        Map<Integer, Integer> binOfId = new HashMap<>();
        for (int b = 0; b < members.size(); b++) {
            for (Person p : members.get(b)) {
                binOfId.put(p.id, b);
            }
        }
        long total = 0;
        for (int[] pair : ObjectiveComposer.resolvePairs(people, priorPairings)) {
            if (binOfId.get(pair[0]).equals(binOfId.get(pair[1]))) {
                total++;
            }
        }
        return total;
    }
}
