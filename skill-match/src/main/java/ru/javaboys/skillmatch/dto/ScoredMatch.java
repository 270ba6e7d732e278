package ru.javaboys.skillmatch.dto;

/**
 * Строка рейтинга, независимо от направления подбора.
 */
public interface ScoredMatch {
    MatchResult getMatch();
}
