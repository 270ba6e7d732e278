package ru.javaboys.skillmatch.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Неизменяемая таблица групп синонимов: каноническое имя навыка и его варианты.
 * Все имена хранятся нормализованными (нижний регистр, без пробелов по краям).
 */
public final class SynonymTable {

    private static final Map<String, List<String>> DEFAULT_GROUPS = defaultGroups();

    private final Map<String, Set<String>> groups;

    private SynonymTable(Map<String, Set<String>> groups) {
        this.groups = groups;
    }

    public static SynonymTable of(Map<String, ? extends Iterable<String>> source) {
        Map<String, Set<String>> groups = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((canonical, variants) -> {
                if (canonical == null || canonical.isBlank()) return;
                Set<String> members = new LinkedHashSet<>();
                members.add(normalize(canonical));
                if (variants != null) {
                    for (String v : variants) {
                        if (v != null && !v.isBlank()) members.add(normalize(v));
                    }
                }
                groups.merge(normalize(canonical), members, (a, b) -> {
                    Set<String> merged = new LinkedHashSet<>(a);
                    merged.addAll(b);
                    return merged;
                });
            });
        }
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        groups.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(v)));
        return new SynonymTable(Collections.unmodifiableMap(frozen));
    }

    public static SynonymTable defaults() {
        return of(DEFAULT_GROUPS);
    }

    public static SynonymTable empty() {
        return of(Map.of());
    }

    /**
     * Оба имени (уже нормализованные) входят в одну группу, как каноническое или как вариант.
     */
    public boolean sameGroup(String first, String second) {
        for (Set<String> members : groups.values()) {
            if (members.contains(first) && members.contains(second)) {
                return true;
            }
        }
        return false;
    }

    public Map<String, Set<String>> groups() {
        return groups;
    }

    public int size() {
        return groups.size();
    }

    /**
     * Имена, попавшие больше чем в одну группу. Непустой результат: таблица неоднозначна.
     */
    public List<String> conflicts() {
        Map<String, Integer> seen = new HashMap<>();
        List<String> conflicts = new ArrayList<>();
        for (Set<String> members : groups.values()) {
            for (String m : members) {
                if (seen.merge(m, 1, Integer::sum) == 2) {
                    conflicts.add(m);
                }
            }
        }
        return conflicts;
    }

    public static String normalize(String s) {
        return s.toLowerCase(Locale.ROOT).trim();
    }

    private static Map<String, List<String>> defaultGroups() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("javascript", List.of("js", "ecmascript", "es6", "es2015", "es2020"));
        m.put("typescript", List.of("ts"));
        m.put("react", List.of("reactjs", "react.js"));
        m.put("vue", List.of("vuejs", "vue.js"));
        m.put("angular", List.of("angularjs"));
        m.put("node", List.of("nodejs", "node.js"));
        m.put("python", List.of("py"));
        m.put("java", List.of("jvm"));
        m.put("c#", List.of("csharp", "c-sharp"));
        m.put("c++", List.of("cpp", "cplusplus"));
        m.put("postgresql", List.of("postgres", "psql"));
        m.put("mongodb", List.of("mongo"));
        m.put("mysql", List.of("sql"));
        m.put("aws", List.of("amazon web services"));
        m.put("gcp", List.of("google cloud platform", "google cloud"));
        m.put("azure", List.of("microsoft azure"));
        m.put("docker", List.of("containerization"));
        m.put("kubernetes", List.of("k8s"));
        m.put("git", List.of("version control"));
        return Collections.unmodifiableMap(m);
    }
}
