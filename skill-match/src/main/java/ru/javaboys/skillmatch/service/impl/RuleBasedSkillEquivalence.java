package ru.javaboys.skillmatch.service.impl;

import ru.javaboys.skillmatch.service.SkillEquivalence;
import ru.javaboys.skillmatch.service.SynonymTable;

/**
 * Точное совпадение, затем группы синонимов, затем вхождение подстроки.
 * <p>
 * Шаг с подстрокой даёт ложные совпадения на очень коротких именах ("c" и "objective-c").
 * Известное ограничение.
 */
public class RuleBasedSkillEquivalence implements SkillEquivalence {

    private final SynonymTable synonyms;

    public RuleBasedSkillEquivalence(SynonymTable synonyms) {
        this.synonyms = synonyms;
    }

    @Override
    public boolean equivalent(String first, String second) {
        if (first == null || second == null) return false;
        String s1 = SynonymTable.normalize(first);
        String s2 = SynonymTable.normalize(second);
        if (s1.isEmpty() || s2.isEmpty()) return false;

        if (s1.equals(s2)) return true;
        if (synonyms.sameGroup(s1, s2)) return true;
        return s1.contains(s2) || s2.contains(s1);
    }
}
