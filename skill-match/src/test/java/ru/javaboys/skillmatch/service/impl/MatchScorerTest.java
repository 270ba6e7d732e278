package ru.javaboys.skillmatch.service.impl;

import org.junit.jupiter.api.Test;
import ru.javaboys.skillmatch.dto.Skill;
import ru.javaboys.skillmatch.dto.SkillMatch;
import ru.javaboys.skillmatch.service.SkillEquivalence;
import ru.javaboys.skillmatch.service.SynonymTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static ru.javaboys.skillmatch.MatchingFixtures.scorer;
import static ru.javaboys.skillmatch.MatchingFixtures.skills;

class MatchScorerTest {

    private final MatchScorer scorer = scorer(true);

    @Test
    void fullMatchScoresHundred() {
        SkillMatch m = scorer.score(skills("React", "JavaScript", "TypeScript"),
                skills("React", "JavaScript"), skills("TypeScript"));

        assertThat(m.getScore()).isEqualTo(100);
        assertThat(m.getMatchingSkills()).hasSize(3);
        assertThat(m.getSkillGaps()).isEmpty();
    }

    @Test
    void requiredOnlyMatchScoresSeventy() {
        SkillMatch m = scorer.score(skills("React", "JavaScript"),
                skills("React", "JavaScript"), skills("TypeScript"));

        assertThat(m.getScore()).isEqualTo(70);
        assertThat(m.getMatchingSkills()).extracting(Skill::getName).containsExactly("React", "JavaScript");
        assertThat(m.getSkillGaps()).isEmpty();
    }

    @Test
    void noMatchScoresZeroAndReportsAllRequiredAsGaps() {
        SkillMatch m = scorer.score(skills("Vue.js", "Python"),
                skills("React", "JavaScript"), skills("TypeScript"));

        assertThat(m.getScore()).isZero();
        assertThat(m.getMatchingSkills()).isEmpty();
        assertThat(m.getSkillGaps()).extracting(Skill::getName).containsExactly("React", "JavaScript");
    }

    @Test
    void emptyRequiredListIsFullyCovered() {
        SkillMatch m = scorer.score(skills("Python"), List.of(), skills("Python"));

        assertThat(m.getScore()).isEqualTo(100);
    }

    @Test
    void emptyRequiredAndPreferredGiveSeventy() {
        SkillMatch m = scorer.score(skills("Python"), List.of(), List.of());

        assertThat(m.getScore()).isEqualTo(70);
        assertThat(m.getMatchingSkills()).isEmpty();
    }

    @Test
    void emptyCandidateSkillsDoNotThrow() {
        SkillMatch m = scorer.score(List.of(), skills("React"), skills("TypeScript"));

        assertThat(m.getScore()).isZero();
        assertThat(m.getSkillGaps()).hasSize(1);
    }

    @Test
    void nullListsAreTreatedAsEmpty() {
        SkillMatch m = scorer.score(null, null, null);

        assertThat(m.getScore()).isEqualTo(70);
        assertThat(m.getSkillGaps()).isEmpty();
    }

    @Test
    void synonymMatchScoresLikeExactMatch() {
        SkillMatch exact = scorer.score(skills("JavaScript"), skills("JavaScript"), List.of());
        SkillMatch synonym = scorer.score(skills("js"), skills("JavaScript"), List.of());

        assertThat(exact.getScore()).isEqualTo(70);
        assertThat(synonym.getScore()).isEqualTo(exact.getScore());
        assertThat(synonym.getMatchingSkills()).extracting(Skill::getName).containsExactly("JavaScript");
    }

    @Test
    void partialRequiredCoverage() {
        SkillMatch m = scorer.score(skills("React"), skills("React", "Node.js"), List.of());

        assertThat(m.getScore()).isEqualTo(35);
        assertThat(m.getSkillGaps()).extracting(Skill::getName).containsExactly("Node.js");
    }

    @Test
    void highProficiencyRaisesScore() {
        SkillMatch m = scorer.score(List.of(Skill.of("React", 100), Skill.of("JavaScript", 100)),
                skills("React", "JavaScript"), List.of());

        assertThat(m.getScore()).isEqualTo(91);
    }

    @Test
    void lowProficiencyLowersScore() {
        SkillMatch m = scorer.score(List.of(Skill.of("React", 0), Skill.of("JavaScript", 0)),
                skills("React", "JavaScript"), List.of());

        assertThat(m.getScore()).isEqualTo(49);
    }

    @Test
    void proficiencyIsAveragedOverMatchedSkillsOnly() {
        List<Skill> owned = List.of(Skill.of("React", 80), Skill.of("JavaScript", 100), Skill.of("Go", 0));

        SkillMatch m = scorer.score(owned, skills("React", "JavaScript"), List.of());

        assertThat(m.getScore()).isEqualTo(87);
    }

    @Test
    void requiredAndPreferredAreAdjustedSeparately() {
        List<Skill> owned = List.of(Skill.of("React", 80), Skill.of("TypeScript", 20));

        SkillMatch m = scorer.score(owned, skills("React", "JavaScript"), skills("TypeScript"));

        assertThat(m.getScore()).isEqualTo(66);
    }

    @Test
    void scoreIsClampedToHundred() {
        List<Skill> owned = List.of(Skill.of("React", 100), Skill.of("TypeScript", 100));

        SkillMatch m = scorer.score(owned, skills("React"), skills("TypeScript"));

        assertThat(m.getScore()).isEqualTo(100);
    }

    @Test
    void outOfRangeProficiencyIsClamped() {
        SkillMatch high = scorer.score(List.of(Skill.of("React", 500)), skills("React", "Vue"), List.of());
        SkillMatch max = scorer.score(List.of(Skill.of("React", 100)), skills("React", "Vue"), List.of());

        assertThat(high.getScore()).isEqualTo(max.getScore());
    }

    @Test
    void categoricalLevelIsNeutral() {
        Skill expert = Skill.builder().name("React").level("expert").build();
        Skill beginner = Skill.builder().name("JavaScript").level("beginner").build();

        SkillMatch m = scorer.score(List.of(expert, beginner), skills("React", "JavaScript"), List.of());

        assertThat(m.getScore()).isEqualTo(70);
    }

    @Test
    void disabledWeightingGivesPureCoverage() {
        MatchScorer plain = scorer(false);

        SkillMatch m = plain.score(List.of(Skill.of("React", 0), Skill.of("JavaScript", 0)),
                skills("React", "JavaScript"), List.of());

        assertThat(plain.isProficiencyWeighting()).isFalse();
        assertThat(m.getScore()).isEqualTo(70);
    }

    @Test
    void adjustmentIsBoundedAndNeutralForEmptySet() {
        assertThat(scorer.adjust(List.of())).isEqualTo(1.0);
        assertThat(scorer.adjust(List.of(Skill.of("a", 50)))).isEqualTo(1.0);
        assertThat(scorer.adjust(List.of(Skill.of("a", 0)))).isEqualTo(0.7);
        assertThat(scorer.adjust(List.of(Skill.of("a", 100)))).isBetween(0.7, 1.3);
    }

    @Test
    void exactNameWinsOverEarlierFuzzyMatch() {
        List<Skill> owned = List.of(Skill.of("React Native", 10), Skill.of("React", 90));

        assertThat(scorer.findMatch(owned, Skill.of("react")).getName()).isEqualTo("React");
        // 100 * (0.7 + 0.9 * 0.6) * 0.7 = 86.8
        SkillMatch m = scorer.score(owned, skills("React"), List.of());
        assertThat(m.getScore()).isEqualTo(87);
    }

    @Test
    void resultListsAreReadOnly() {
        SkillMatch m = scorer.score(skills("React"), skills("React", "JavaScript"), List.of());

        assertThatThrownBy(() -> m.getMatchingSkills().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> m.getSkillGaps().add(Skill.of("Go"))).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void fuzzyMatchUsesFirstEquivalentSkill() {
        List<Skill> owned = List.of(Skill.of("React Native", 10), Skill.of("ReactJS", 90));

        assertThat(scorer.findMatch(owned, Skill.of("React")).getName()).isEqualTo("React Native");
    }

    @Test
    void scoreStaysInRangeAndGapsPartitionRequired() {
        Random random = new Random(42);
        String[] vocabulary = {"React", "JavaScript", "js", "TypeScript", "ts", "Node.js", "Python",
                "Go", "Kubernetes", "k8s", "PostgreSQL", "psql", "Docker", "AWS", "Vue.js"};
        SkillEquivalence equivalence = new RuleBasedSkillEquivalence(SynonymTable.defaults());

        for (int i = 0; i < 300; i++) {
            List<Skill> owned = randomSkills(random, vocabulary, true);
            List<Skill> required = randomSkills(random, vocabulary, false);
            List<Skill> preferred = randomSkills(random, vocabulary, false);

            SkillMatch m = scorer.score(owned, required, preferred);

            assertThat(m.getScore()).isBetween(0, 100);
            for (Skill r : required) {
                boolean covered = owned.stream().anyMatch(o -> equivalence.equivalent(o.getName(), r.getName()));
                assertThat(m.getSkillGaps().contains(r)).isEqualTo(!covered);
            }
            int matchedPreferred = (int) preferred.stream()
                    .filter(p -> owned.stream().anyMatch(o -> equivalence.equivalent(o.getName(), p.getName())))
                    .count();
            assertThat(m.getMatchingSkills()).hasSize(required.size() - m.getSkillGaps().size() + matchedPreferred);
            assertThat(scorer.score(owned, required, preferred)).isEqualTo(m);
        }
    }

    private static List<Skill> randomSkills(Random random, String[] vocabulary, boolean withProficiency) {
        int n = random.nextInt(5);
        List<Skill> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            String name = vocabulary[random.nextInt(vocabulary.length)];
            out.add(withProficiency && random.nextBoolean() ? Skill.of(name, random.nextInt(101)) : Skill.of(name));
        }
        return out;
    }
}
