package ru.javaboys.skillmatch.service.impl;

import ru.javaboys.skillmatch.dto.Candidate;
import ru.javaboys.skillmatch.dto.JobRequirement;
import ru.javaboys.skillmatch.dto.MatchFilters;
import ru.javaboys.skillmatch.dto.Skill;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Фильтры запроса по атрибутам. На оценку не смотрят,
 * порог минимальной оценки применяет {@link MatchEngine}.
 */
public final class MatchFilterPredicates {

    private MatchFilterPredicates() {
    }

    public static Predicate<Candidate> forCandidates(MatchFilters filters) {
        if (filters == null) return c -> true;
        return c -> c != null
                && hasAnySkill(c.getSkills(), filters.getSkills())
                && levelAllowed(c.getExperienceLevel(), filters.getExperienceLevels())
                && locationMatches(c.getLocation(), filters.getLocation())
                && (!Boolean.TRUE.equals(filters.getRemoteOnly()) || c.isOpenToRemote())
                && available(c, filters.getAvailableFrom(), filters.getAvailableUntil());
    }

    /**
     * Те же фильтры для обратного направления. Окно доступности относится к кандидатам,
     * для вакансий оно не применяется.
     */
    public static Predicate<JobRequirement> forJobs(MatchFilters filters) {
        if (filters == null) return j -> true;
        return j -> j != null
                && hasAnySkill(allSkills(j), filters.getSkills())
                && levelAllowed(j.getExperienceLevel(), filters.getExperienceLevels())
                && locationMatches(j.getLocation(), filters.getLocation())
                && (!Boolean.TRUE.equals(filters.getRemoteOnly()) || j.isRemoteAllowed());
    }

    private static boolean hasAnySkill(List<Skill> skills, List<String> allowList) {
        if (allowList == null || allowList.isEmpty()) return true;
        if (skills == null) return false;
        for (Skill s : skills) {
            if (s == null || s.getName() == null) continue;
            String name = s.getName().trim();
            for (String allowed : allowList) {
                if (allowed != null && name.equalsIgnoreCase(allowed.trim())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static <E> boolean levelAllowed(E level, List<E> allowed) {
        if (allowed == null || allowed.isEmpty()) return true;
        return level != null && allowed.contains(level);
    }

    private static boolean locationMatches(String location, String wanted) {
        if (wanted == null || wanted.isBlank()) return true;
        return location != null
                && location.toLowerCase(Locale.ROOT).contains(wanted.trim().toLowerCase(Locale.ROOT));
    }

    // окно пересекается с периодом доступности кандидата; открытые границы не ограничивают
    private static boolean available(Candidate c, LocalDate from, LocalDate until) {
        if (until != null && c.getAvailableFrom() != null && c.getAvailableFrom().isAfter(until)) {
            return false;
        }
        return from == null || c.getAvailableUntil() == null || !c.getAvailableUntil().isBefore(from);
    }

    private static List<Skill> allSkills(JobRequirement j) {
        return Stream.of(j.getRequiredSkills(), j.getPreferredSkills())
                .filter(Objects::nonNull)
                .flatMap(List::stream)
                .toList();
    }
}
