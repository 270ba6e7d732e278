package ru.javaboys.skillmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CandidateMatch implements ScoredMatch {
    private Candidate candidate;
    private MatchResult match;
}
