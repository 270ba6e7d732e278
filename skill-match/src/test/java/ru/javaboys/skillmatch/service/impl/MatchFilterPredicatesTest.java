package ru.javaboys.skillmatch.service.impl;

import org.junit.jupiter.api.Test;
import ru.javaboys.skillmatch.dto.Candidate;
import ru.javaboys.skillmatch.dto.JobRequirement;
import ru.javaboys.skillmatch.dto.MatchFilters;
import ru.javaboys.skillmatch.entity.SeniorityLevelEnum;

import java.time.LocalDate;
import java.util.List;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static ru.javaboys.skillmatch.MatchingFixtures.candidate;
import static ru.javaboys.skillmatch.MatchingFixtures.job;
import static ru.javaboys.skillmatch.MatchingFixtures.skills;

class MatchFilterPredicatesTest {

    @Test
    void noFiltersAcceptEverything() {
        assertThat(MatchFilterPredicates.forCandidates(null).test(candidate("a"))).isTrue();
        assertThat(MatchFilterPredicates.forCandidates(MatchFilters.none()).test(candidate("a"))).isTrue();
        assertThat(MatchFilterPredicates.forJobs(null).test(job("j", List.of(), List.of()))).isTrue();
    }

    @Test
    void skillAllowListNeedsOneCaseInsensitiveHit() {
        Predicate<Candidate> p = MatchFilterPredicates.forCandidates(
                MatchFilters.builder().skills(List.of("python", " REACT ")).build());

        assertThat(p.test(candidate("a", "React", "Go"))).isTrue();
        assertThat(p.test(candidate("b", "Go"))).isFalse();
        assertThat(p.test(candidate("c"))).isFalse();
    }

    @Test
    void experienceLevelMustBeListed() {
        Predicate<Candidate> p = MatchFilterPredicates.forCandidates(MatchFilters.builder()
                .experienceLevels(List.of(SeniorityLevelEnum.MIDDLE, SeniorityLevelEnum.SENIOR)).build());
        Candidate middle = candidate("m");
        middle.setExperienceLevel(SeniorityLevelEnum.MIDDLE);
        Candidate junior = candidate("j");
        junior.setExperienceLevel(SeniorityLevelEnum.JUNIOR);

        assertThat(p.test(middle)).isTrue();
        assertThat(p.test(junior)).isFalse();
        assertThat(p.test(candidate("unknown"))).isFalse();
    }

    @Test
    void locationMatchesBySubstring() {
        Predicate<Candidate> p = MatchFilterPredicates.forCandidates(MatchFilters.builder().location("berlin").build());
        Candidate berlin = candidate("b");
        berlin.setLocation("Berlin, Germany");

        assertThat(p.test(berlin)).isTrue();
        assertThat(p.test(candidate("nowhere"))).isFalse();
    }

    @Test
    void availabilityWindowMustOverlap() {
        Predicate<Candidate> p = MatchFilterPredicates.forCandidates(MatchFilters.builder()
                .availableFrom(LocalDate.of(2026, 3, 1))
                .availableUntil(LocalDate.of(2026, 3, 31))
                .build());

        Candidate always = candidate("always");
        Candidate later = candidate("later");
        later.setAvailableFrom(LocalDate.of(2026, 4, 1));
        Candidate gone = candidate("gone");
        gone.setAvailableUntil(LocalDate.of(2026, 2, 28));
        Candidate overlapping = candidate("overlap");
        overlapping.setAvailableFrom(LocalDate.of(2026, 3, 31));
        overlapping.setAvailableUntil(LocalDate.of(2026, 5, 1));

        assertThat(p.test(always)).isTrue();
        assertThat(p.test(later)).isFalse();
        assertThat(p.test(gone)).isFalse();
        assertThat(p.test(overlapping)).isTrue();
    }

    @Test
    void jobFiltersLookAtRequiredAndPreferredSkillsAndRemoteFlag() {
        JobRequirement job = job("j", skills("Go"), skills("Kubernetes"));
        job.setRemoteAllowed(true);

        assertThat(MatchFilterPredicates.forJobs(MatchFilters.builder().skills(List.of("kubernetes")).build()).test(job)).isTrue();
        assertThat(MatchFilterPredicates.forJobs(MatchFilters.builder().skills(List.of("java")).build()).test(job)).isFalse();
        assertThat(MatchFilterPredicates.forJobs(MatchFilters.builder().remoteOnly(true).build()).test(job)).isTrue();
        job.setRemoteAllowed(false);
        assertThat(MatchFilterPredicates.forJobs(MatchFilters.builder().remoteOnly(true).build()).test(job)).isFalse();
        assertThat(MatchFilterPredicates.forJobs(MatchFilters.builder().remoteOnly(false).build()).test(job)).isTrue();
    }
}
