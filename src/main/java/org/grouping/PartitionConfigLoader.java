package org.grouping;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * プロパティファイルから割り振り設定を読み込む
 *
 * 例:
 * <pre>
 * partition.variant=classes
 * classes.labels=Class_A,Class_B
 * classes.minSize=20
 * classes.maxSize=32
 * composition.minFemale=3
 * spread.attributes=subject,language
 * cap.origin.maxPerBin=2
 * weight.size_balance=2
 * solver.timeLimitSeconds=30
 * </pre>
 */
public class PartitionConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(PartitionConfigLoader.class.getName());

    /** クラス分けの既定設定（クラスパス上） */
    public static final String CLASS_PLANNING_RESOURCE = "class-planning.properties";

    private static final Pattern CAP_KEY = Pattern.compile("^cap\\.(.+)\\.maxPerBin$");
    private static final String WEIGHT_PREFIX = "weight.";

    public static PartitionConfig load(Path file) throws IOException {
        LOGGER.info("設定ファイルを読み込み: " + file.toAbsolutePath());
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    public static PartitionConfig loadResource(String resourceName) throws IOException {
        InputStream in = PartitionConfigLoader.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            throw new InvalidConfigurationException("設定リソースが見つかりません: " + resourceName);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    public static PartitionConfig load(Reader reader) throws IOException {
        Properties props = new Properties();
        props.load(reader);
        return fromProperties(props);
    }

    public static PartitionConfig fromProperties(Properties props) {
        String variant = required(props, "partition.variant").trim().toLowerCase(Locale.ROOT);
        PartitionConfig.Builder builder;
        switch (variant) {
            case "groups":
                builder = PartitionConfig.groups(intValue(props, "groups.size", 0));
                break;
            case "classes":
                List<String> labels = listValue(props, "classes.labels");
                builder = labels.isEmpty()
                        ? PartitionConfig.classes(intValue(props, "classes.count", 0))
                        : PartitionConfig.classes(labels);
                builder.sizeRange(intValue(props, "classes.minSize", 0),
                        intValue(props, "classes.maxSize", Integer.MAX_VALUE));
                break;
            default:
                throw new InvalidConfigurationException(
                        "partition.variant は groups または classes を指定してください: " + variant);
        }

        String mode = props.getProperty("composition.mode");
        if (mode != null && !mode.trim().isEmpty()) {
            try {
                builder.compositionMode(PartitionConfig.CompositionMode.valueOf(
                        mode.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException(
                        "composition.mode の値が不正です: " + mode, e);
            }
        }

        addSexBounds(props, builder, Person.Sex.F, "composition.minFemale", "composition.maxFemale");
        addSexBounds(props, builder, Person.Sex.M, "composition.minMale", "composition.maxMale");

        for (String attribute : listValue(props, "spread.attributes")) {
            builder.spreadAttribute(attribute);
        }

        for (String key : new TreeSet<>(props.stringPropertyNames())) {
            Matcher m = CAP_KEY.matcher(key);
            if (m.matches()) {
                builder.capRule(m.group(1), intValue(props, key, 0));
            } else if (key.startsWith(WEIGHT_PREFIX)) {
                builder.weight(key.substring(WEIGHT_PREFIX.length()), intValue(props, key, 0));
            }
        }

        builder.timeLimitSeconds(doubleValue(props, "solver.timeLimitSeconds",
                PartitionConfig.DEFAULT_TIME_LIMIT_SECONDS));
        builder.numWorkers(intValue(props, "solver.workers", 0));
        if (props.getProperty("solver.randomSeed") != null) {
            builder.randomSeed(intValue(props, "solver.randomSeed", 0));
        }
        builder.logSearchProgress(Boolean.parseBoolean(
                props.getProperty("solver.logSearchProgress", "false").trim()));

        PartitionConfig config = builder.build();
        LOGGER.info("設定: " + config);
        return config;
    }

    private static void addSexBounds(Properties props, PartitionConfig.Builder builder,
                                     Person.Sex sex, String minKey, String maxKey) {
        if (props.getProperty(minKey) == null && props.getProperty(maxKey) == null) {
            return;
        }
        builder.sexBounds(sex, intValue(props, minKey, 0), intValue(props, maxKey, Integer.MAX_VALUE));
    }

    private static String required(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidConfigurationException("必須の設定がありません: " + key);
        }
        return value;
    }

    private static int intValue(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key + " は整数で指定してください: " + value, e);
        }
    }

    private static double doubleValue(Properties props, String key, double defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key + " は数値で指定してください: " + value, e);
        }
    }

    private static List<String> listValue(Properties props, String key) {
        String value = props.getProperty(key);
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        for (String part : value.split(",")) {
            if (!part.trim().isEmpty()) {
                result.add(part.trim());
            }
        }
        return result;
    }
}
