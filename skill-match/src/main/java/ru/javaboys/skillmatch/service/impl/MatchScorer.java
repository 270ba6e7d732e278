package ru.javaboys.skillmatch.service.impl;

import ru.javaboys.skillmatch.dto.Skill;
import ru.javaboys.skillmatch.dto.SkillMatch;
import ru.javaboys.skillmatch.service.SkillEquivalence;
import ru.javaboys.skillmatch.service.SynonymTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Оценка навыков кандидата относительно обязательных и желательных навыков вакансии.
 * <p>
 * score = round(required * 0.7 + preferred * 0.3), где каждая часть это покрытие 0..100,
 * умноженное на коэффициент владения в [0.7, 1.3]. Пустой список обязательных навыков считается
 * покрытым полностью, пустой список желательных ничего не добавляет. Без I/O и без состояния.
 */
public class MatchScorer {

    public static final double REQUIRED_WEIGHT = 0.7;
    public static final double PREFERRED_WEIGHT = 0.3;
    public static final int NEUTRAL_PROFICIENCY = 50;

    private static final double MIN_FACTOR = 0.7;
    private static final double MAX_FACTOR = 1.3;

    private final SkillEquivalence equivalence;
    private final boolean proficiencyWeighting;

    public MatchScorer(SkillEquivalence equivalence, boolean proficiencyWeighting) {
        this.equivalence = equivalence;
        this.proficiencyWeighting = proficiencyWeighting;
    }

    public SkillMatch score(List<Skill> candidateSkills, List<Skill> requiredSkills, List<Skill> preferredSkills) {
        List<Skill> owned = nz(candidateSkills);
        List<Skill> required = nz(requiredSkills);
        List<Skill> preferred = nz(preferredSkills);

        List<Skill> matchedRequired = new ArrayList<>();
        List<Skill> matchedRequiredOwned = new ArrayList<>();
        List<Skill> skillGaps = new ArrayList<>();
        for (Skill rs : required) {
            Skill cs = findMatch(owned, rs);
            if (cs != null) {
                matchedRequired.add(rs);
                matchedRequiredOwned.add(cs);
            } else {
                skillGaps.add(rs);
            }
        }

        List<Skill> matchedPreferred = new ArrayList<>();
        List<Skill> matchedPreferredOwned = new ArrayList<>();
        for (Skill ps : preferred) {
            Skill cs = findMatch(owned, ps);
            if (cs != null) {
                matchedPreferred.add(ps);
                matchedPreferredOwned.add(cs);
            }
        }

        double requiredCoverage = required.isEmpty() ? 100.0 : 100.0 * matchedRequired.size() / required.size();
        double preferredCoverage = preferred.isEmpty() ? 0.0 : 100.0 * matchedPreferred.size() / preferred.size();

        double weightedRequired = requiredCoverage * adjust(matchedRequiredOwned);
        double weightedPreferred = preferredCoverage * adjust(matchedPreferredOwned);

        int score = clamp((int) Math.round(weightedRequired * REQUIRED_WEIGHT + weightedPreferred * PREFERRED_WEIGHT));

        List<Skill> matching = new ArrayList<>(matchedRequired.size() + matchedPreferred.size());
        matching.addAll(matchedRequired);
        matching.addAll(matchedPreferred);
        return new SkillMatch(score, Collections.unmodifiableList(matching), Collections.unmodifiableList(skillGaps));
    }

    /**
     * Навык кандидата для навыка вакансии или {@code null}. Сначала точное совпадение имени
     * по всему списку, только потом синонимы и подстроки.
     */
    public Skill findMatch(List<Skill> candidateSkills, Skill jobSkill) {
        if (jobSkill == null || jobSkill.getName() == null) return null;
        String wanted = SynonymTable.normalize(jobSkill.getName());
        for (Skill cs : candidateSkills) {
            if (cs != null && cs.getName() != null && SynonymTable.normalize(cs.getName()).equals(wanted)) {
                return cs;
            }
        }
        for (Skill cs : candidateSkills) {
            if (cs != null && cs.getName() != null && equivalence.equivalent(cs.getName(), jobSkill.getName())) {
                return cs;
            }
        }
        return null;
    }

    /**
     * Коэффициент владения по совпавшим навыкам кандидата. Нейтральный (1.0) для пустого набора
     * или при выключенном учёте владения.
     */
    double adjust(List<Skill> matched) {
        if (!proficiencyWeighting || matched.isEmpty()) {
            return 1.0;
        }
        double total = 0;
        for (Skill s : matched) {
            total += normalizedProficiency(s);
        }
        double avg = total / matched.size();
        double factor = MIN_FACTOR + (avg / 100.0) * 0.6;
        return Math.max(MIN_FACTOR, Math.min(MAX_FACTOR, factor));
    }

    public boolean isProficiencyWeighting() {
        return proficiencyWeighting;
    }

    /**
     * Числовой уровень, ограниченный 0..100. Категориальный уровень или отсутствие значения
     * дают нейтральную середину.
     */
    public static int normalizedProficiency(Skill skill) {
        if (skill == null || skill.getProficiency() == null) {
            return NEUTRAL_PROFICIENCY;
        }
        return clamp(skill.getProficiency());
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(100, v));
    }

    private static List<Skill> nz(List<Skill> list) {
        return list == null ? List.of() : list;
    }
}
