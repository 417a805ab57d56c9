package org.grouping;

import java.util.*;

/** テスト用の対象者リスト作成 */
final class TestPeople {
    private TestPeople() {}

    /** 性別コード1文字につき1人（名前は P0, P1, ...） */
    static List<Person> ofSexes(String sexes) {
        List<Person> people = new ArrayList<>();
        for (char c : sexes.toCharArray()) {
            int id = people.size();
            people.add(new Person(id, "P" + id, Person.Sex.valueOf(String.valueOf(c))));
        }
        return people;
    }

    static List<Person> withAttribute(String sexes, String attribute, String... values) {
        List<Person> people = new ArrayList<>();
        for (int i = 0; i < sexes.length(); i++) {
            Map<String, String> attrs = new HashMap<>();
            if (values[i] != null) {
                attrs.put(attribute, values[i]);
            }
            people.add(new Person(i, "P" + i, Person.Sex.valueOf(String.valueOf(sexes.charAt(i))), attrs));
        }
        return people;
    }

    static long count(List<Person> members, Person.Sex sex) {
        return members.stream().filter(p -> p.sex == sex).count();
    }

    static Person byName(List<Person> people, String name) {
        for (Person p : people) {
            if (p.name.equals(name)) {
                return p;
            }
        }
        throw new NoSuchElementException(name);
    }
}
