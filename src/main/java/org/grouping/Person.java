package org.grouping;

import java.util.*;

/**
 * 割り振り対象者（ソルバー内部の連番IDを持つ不変レコード）
 */
public final class Person {

    /** {@link #valueOf(String)} で性別コードを返す予約属性名 */
    public static final String SEX_ATTRIBUTE = "sex";

    /**
     * 性別
     */
    public enum Sex {
        F("女性"),
        M("男性");

        public final String displayName;

        Sex(String displayName) {
            this.displayName = displayName;
        }
    }

    public final int id;
    public final String name;
    public final Sex sex;
    public final Map<String, String> attributes;

    public Person(int id, String name, Sex sex, Map<String, String> attributes) {
        this.id = id;
        this.name = name != null ? name : "";
        this.sex = Objects.requireNonNull(sex, "sex");
        this.attributes = attributes != null
                ? Collections.unmodifiableMap(new HashMap<>(attributes))
                : Collections.emptyMap();
    }

    public Person(int id, String name, Sex sex) {
        this(id, name, sex, null);
    }

    /**
     * 属性値を取得（前後空白除去済み、未設定は空文字）
     */
    public String valueOf(String attribute) {
        if (SEX_ATTRIBUTE.equals(attribute)) {
            return sex.name();
        }
        String value = attributes.get(attribute);
        return value != null ? value.trim() : "";
    }

    @Override
    public String toString() {
        return name + " (#" + id + ", " + sex + (attributes.isEmpty() ? "" : ", " + attributes) + ")";
    }
}
