package ru.javaboys.skillmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobMatch implements ScoredMatch {
    private JobRequirement job;
    private MatchResult match;
}
