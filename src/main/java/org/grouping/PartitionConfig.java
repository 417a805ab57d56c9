package org.grouping;

import java.util.*;

/**
 * 割り振り設定（不変）
 *
 * グループ分け: 1グループ最大 groupSize 人、グループ数 = ceil(N / groupSize)
 * クラス分け: クラス数固定、各クラス [minSize, maxSize] 人
 */
public final class PartitionConfig {

    public static final double DEFAULT_TIME_LIMIT_SECONDS = 30.0;

    /**
     * 割り振りの種類
     */
    public enum Variant {
        GROUPS("グループ分け"),
        CLASSES("クラス分け");

        public final String displayName;

        Variant(String displayName) {
            this.displayName = displayName;
        }
    }

    /**
     * 男女構成のハード制約モード
     */
    public enum CompositionMode {
        NONE("指定なし"),
        SAME_SEX("男女別"),
        MIXED("男女混合");

        public final String displayName;

        CompositionMode(String displayName) {
            this.displayName = displayName;
        }
    }

    /**
     * 属性値ごとの1枠あたり人数の下限・上限（ハード制約）
     */
    public static final class CompositionBound {
        public final String attribute;
        public final String value;
        public final int min;
        public final int max;

        public CompositionBound(String attribute, String value, int min, int max) {
            this.attribute = attribute;
            this.value = value;
            this.min = min;
            this.max = max;
        }

        @Override
        public String toString() {
            return String.format("%s=%s [%d..%s]", attribute, value, min,
                    max == Integer.MAX_VALUE ? "∞" : String.valueOf(max));
        }
    }

    /**
     * 属性値ごとの1枠あたり推奨上限（超過分をペナルティ化）
     */
    public static final class CapRule {
        public final String attribute;
        public final int maxPerBin;

        public CapRule(String attribute, int maxPerBin) {
            this.attribute = attribute;
            this.maxPerBin = maxPerBin;
        }

        @Override
        public String toString() {
            return attribute + "<=" + maxPerBin;
        }
    }

    public final Variant variant;
    public final int groupSize;
    public final int binCount;
    public final List<String> labels;
    public final int minSize;
    public final int maxSize;
    public final CompositionMode compositionMode;
    public final List<CompositionBound> compositionBounds;
    public final List<String> spreadAttributes;
    public final List<CapRule> capRules;
    public final PenaltyWeights weights;
    public final double timeLimitSeconds;
    public final int numWorkers;
    public final Integer randomSeed;
    public final boolean logSearchProgress;

    private PartitionConfig(Builder b) {
        this.variant = b.variant;
        this.groupSize = b.groupSize;
        this.labels = Collections.unmodifiableList(new ArrayList<>(b.labels));
        this.binCount = b.labels.isEmpty() ? b.binCount : b.labels.size();
        this.minSize = b.variant == Variant.GROUPS ? 0 : b.minSize;
        this.maxSize = b.variant == Variant.GROUPS ? b.groupSize : b.maxSize;
        this.compositionMode = b.compositionMode;
        this.compositionBounds = Collections.unmodifiableList(new ArrayList<>(b.compositionBounds));
        this.spreadAttributes = Collections.unmodifiableList(new ArrayList<>(b.spreadAttributes));
        this.capRules = Collections.unmodifiableList(new ArrayList<>(b.capRules));
        this.weights = b.weights;
        this.timeLimitSeconds = b.timeLimitSeconds;
        this.numWorkers = b.numWorkers;
        this.randomSeed = b.randomSeed;
        this.logSearchProgress = b.logSearchProgress;
    }

    public static Builder groups(int groupSize) {
        Builder b = new Builder(Variant.GROUPS);
        b.groupSize = groupSize;
        return b;
    }

    public static Builder classes(int binCount) {
        Builder b = new Builder(Variant.CLASSES);
        b.binCount = binCount;
        return b;
    }

    public static Builder classes(List<String> labels) {
        Builder b = new Builder(Variant.CLASSES);
        b.labels.addAll(labels);
        b.binCount = labels.size();
        return b;
    }

    /**
     * 人数 n に対する枠のリストを作成
     * グループ分けでは ceil(n / groupSize) 枠（上限を必ず守れる最小の枠数）
     * groupSize が Integer.MAX_VALUE でも桁あふれしない
     */
    public List<Bin> resolveBins(int n) {
        int k;
        if (variant == Variant.GROUPS) {
            k = n <= 0 ? 0 : (n - 1) / groupSize + 1;
        } else {
            k = binCount;
        }
        List<Bin> bins = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            String label;
            if (i < labels.size()) {
                label = labels.get(i);
            } else {
                label = (variant == Variant.GROUPS ? "Group " : "Class ") + (i + 1);
            }
            bins.add(new Bin(i, label, minSize, maxSize));
        }
        return bins;
    }

    /**
     * ペナルティ項の重み（未設定なら種類別の既定値）
     */
    public int weightOf(String termName) {
        int defaultWeight;
        if (PenaltyWeights.SIZE_BALANCE.equals(termName)) {
            defaultWeight = variant == Variant.GROUPS
                    ? PenaltyWeights.DEFAULT_GROUP_SIZE_WEIGHT
                    : PenaltyWeights.DEFAULT_CLASS_SIZE_WEIGHT;
        } else if (PenaltyWeights.SEX_BALANCE.equals(termName)) {
            defaultWeight = PenaltyWeights.DEFAULT_SEX_BALANCE_WEIGHT;
        } else if (PenaltyWeights.PRIOR_PAIRING.equals(termName)) {
            defaultWeight = PenaltyWeights.DEFAULT_PRIOR_PAIRING_WEIGHT;
        } else if (termName.startsWith(PenaltyWeights.SPREAD_PREFIX)) {
            defaultWeight = PenaltyWeights.DEFAULT_SPREAD_WEIGHT;
        } else if (termName.startsWith(PenaltyWeights.CAP_PREFIX)) {
            defaultWeight = PenaltyWeights.DEFAULT_CAP_WEIGHT;
        } else {
            throw new IllegalArgumentException("不明なペナルティ項: " + termName);
        }
        return weights.get(termName, defaultWeight);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(variant.displayName);
        if (variant == Variant.GROUPS) {
            sb.append(" groupSize=").append(groupSize);
        } else {
            sb.append(" classes=").append(binCount)
                    .append(" size=[").append(minSize).append("..")
                    .append(maxSize == Integer.MAX_VALUE ? "∞" : String.valueOf(maxSize)).append("]");
        }
        sb.append(" mode=").append(compositionMode.displayName);
        if (!compositionBounds.isEmpty()) sb.append(" bounds=").append(compositionBounds);
        if (!spreadAttributes.isEmpty()) sb.append(" spread=").append(spreadAttributes);
        if (!capRules.isEmpty()) sb.append(" caps=").append(capRules);
        if (!weights.asMap().isEmpty()) sb.append(" weights=").append(weights);
        sb.append(" timeLimit=").append(timeLimitSeconds).append("s");
        return sb.toString();
    }

    /**
     * 設定ビルダー
     */
    public static final class Builder {
        private final Variant variant;
        private int groupSize;
        private int binCount;
        private final List<String> labels = new ArrayList<>();
        private int minSize = 0;
        private int maxSize = Integer.MAX_VALUE;
        private CompositionMode compositionMode = CompositionMode.NONE;
        private final List<CompositionBound> compositionBounds = new ArrayList<>();
        private final List<String> spreadAttributes = new ArrayList<>();
        private final List<CapRule> capRules = new ArrayList<>();
        private PenaltyWeights weights = PenaltyWeights.empty();
        private double timeLimitSeconds = DEFAULT_TIME_LIMIT_SECONDS;
        private int numWorkers = 0;
        private Integer randomSeed;
        private boolean logSearchProgress;

        private Builder(Variant variant) {
            this.variant = variant;
        }

        public Builder sizeRange(int minSize, int maxSize) {
            this.minSize = minSize;
            this.maxSize = maxSize;
            return this;
        }

        public Builder compositionMode(CompositionMode mode) {
            this.compositionMode = mode;
            return this;
        }

        public Builder compositionBound(String attribute, String value, int min, int max) {
            this.compositionBounds.add(new CompositionBound(attribute, value, min, max));
            return this;
        }

        /**
         * 性別ごとの1枠あたり人数範囲（sex 属性の構成制約）
         */
        public Builder sexBounds(Person.Sex sex, int min, int max) {
            return compositionBound(Person.SEX_ATTRIBUTE, sex.name(), min, max);
        }

        public Builder spreadAttribute(String attribute) {
            this.spreadAttributes.add(attribute);
            return this;
        }

        public Builder capRule(String attribute, int maxPerBin) {
            this.capRules.add(new CapRule(attribute, maxPerBin));
            return this;
        }

        public Builder weights(PenaltyWeights weights) {
            this.weights = weights;
            return this;
        }

        public Builder weight(String termName, int weight) {
            this.weights = this.weights.with(termName, weight);
            return this;
        }

        public Builder timeLimitSeconds(double seconds) {
            this.timeLimitSeconds = seconds;
            return this;
        }

        public Builder numWorkers(int numWorkers) {
            this.numWorkers = numWorkers;
            return this;
        }

        public Builder randomSeed(Integer randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder logSearchProgress(boolean logSearchProgress) {
            this.logSearchProgress = logSearchProgress;
            return this;
        }

        public PartitionConfig build() {
            validate();
            return new PartitionConfig(this);
        }

        private void validate() {
            if (variant == Variant.GROUPS) {
                if (groupSize <= 0) {
                    throw new InvalidConfigurationException("グループ人数は1以上にしてください: " + groupSize);
                }
            } else {
                if (binCount <= 0) {
                    throw new InvalidConfigurationException("クラス数は1以上にしてください: " + binCount);
                }
                if (!labels.isEmpty() && labels.size() != binCount) {
                    throw new InvalidConfigurationException(String.format(
                            "クラス名の数(%d)とクラス数(%d)が一致しません", labels.size(), binCount));
                }
                if (minSize < 0) {
                    throw new InvalidConfigurationException("クラス人数の下限が負です: " + minSize);
                }
                if (minSize > maxSize) {
                    throw new InvalidConfigurationException(String.format(
                            "クラス人数の下限(%d)が上限(%d)を超えています", minSize, maxSize));
                }
            }
            for (CompositionBound bound : compositionBounds) {
                requireAttributeName(bound.attribute);
                if (bound.value == null || bound.value.trim().isEmpty()) {
                    throw new InvalidConfigurationException("構成制約の属性値が空です: " + bound.attribute);
                }
                if (bound.min < 0 || bound.min > bound.max) {
                    throw new InvalidConfigurationException("構成制約の範囲が不正です: " + bound);
                }
            }
            for (String attribute : spreadAttributes) {
                requireAttributeName(attribute);
            }
            for (CapRule rule : capRules) {
                requireAttributeName(rule.attribute);
                if (rule.maxPerBin < 0) {
                    throw new InvalidConfigurationException("上限ルールの値が負です: " + rule);
                }
            }
            for (Map.Entry<String, Integer> e : weights.asMap().entrySet()) {
                if (!isKnownTerm(e.getKey())) {
                    throw new InvalidConfigurationException("重みの対象となるペナルティ項がありません: " + e.getKey());
                }
                if (e.getValue() == null || e.getValue() < 0) {
                    throw new InvalidConfigurationException(
                            "重みは0以上にしてください: " + e.getKey() + "=" + e.getValue());
                }
            }
            if (!(timeLimitSeconds > 0)) {
                throw new InvalidConfigurationException("制限時間は正の値にしてください: " + timeLimitSeconds);
            }
            if (numWorkers < 0) {
                throw new InvalidConfigurationException("ワーカー数が負です: " + numWorkers);
            }
        }

        // 固定の項、または設定済み属性に対する spread:/cap: の項
        private boolean isKnownTerm(String termName) {
            if (PenaltyWeights.SIZE_BALANCE.equals(termName)
                    || PenaltyWeights.SEX_BALANCE.equals(termName)
                    || PenaltyWeights.PRIOR_PAIRING.equals(termName)) {
                return true;
            }
            for (String attribute : spreadAttributes) {
                if (PenaltyWeights.spread(attribute).equals(termName)) {
                    return true;
                }
            }
            for (CapRule rule : capRules) {
                if (PenaltyWeights.cap(rule.attribute).equals(termName)) {
                    return true;
                }
            }
            return false;
        }

        private static void requireAttributeName(String attribute) {
            if (attribute == null || attribute.trim().isEmpty()) {
                throw new InvalidConfigurationException("属性名が空です");
            }
        }
    }
}
