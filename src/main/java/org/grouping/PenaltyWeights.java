package org.grouping;

import java.util.*;

/**
 * ソフト制約の重み（ペナルティ名 → 非負整数）
 */
public final class PenaltyWeights {

    public static final String SIZE_BALANCE = "size_balance";
    public static final String SEX_BALANCE = "sex_balance";
    public static final String PRIOR_PAIRING = "prior_pairing";
    public static final String SPREAD_PREFIX = "spread:";
    public static final String CAP_PREFIX = "cap:";

    // グループ分けの既定値
    public static final int DEFAULT_GROUP_SIZE_WEIGHT = 1;
    public static final int DEFAULT_SEX_BALANCE_WEIGHT = 2;
    public static final int DEFAULT_PRIOR_PAIRING_WEIGHT = 10;

    // クラス分けの既定値
    public static final int DEFAULT_CLASS_SIZE_WEIGHT = 2;
    public static final int DEFAULT_SPREAD_WEIGHT = 5;
    public static final int DEFAULT_CAP_WEIGHT = 5;

    private final Map<String, Integer> weights;

    public PenaltyWeights(Map<String, Integer> weights) {
        this.weights = Collections.unmodifiableMap(new TreeMap<>(weights));
    }

    public static PenaltyWeights empty() {
        return new PenaltyWeights(Collections.emptyMap());
    }

    public static String spread(String attribute) {
        return SPREAD_PREFIX + attribute;
    }

    public static String cap(String attribute) {
        return CAP_PREFIX + attribute;
    }

    public int get(String termName, int defaultWeight) {
        Integer w = weights.get(termName);
        return w != null ? w : defaultWeight;
    }

    public boolean contains(String termName) {
        return weights.containsKey(termName);
    }

    public Map<String, Integer> asMap() {
        return weights;
    }

    /**
     * 既存の重みに上書きした新しいインスタンスを返す
     */
    public PenaltyWeights with(String termName, int weight) {
        Map<String, Integer> copy = new HashMap<>(weights);
        copy.put(termName, weight);
        return new PenaltyWeights(copy);
    }

    @Override
    public String toString() {
        return weights.toString();
    }
}
