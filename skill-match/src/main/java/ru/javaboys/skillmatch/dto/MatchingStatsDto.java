package ru.javaboys.skillmatch.dto;

import lombok.Data;
import ru.javaboys.skillmatch.entity.FitEnum;

import java.util.List;
import java.util.Map;

@Data
public class MatchingStatsDto {
    private int totalMatches;
    private double averageScore;
    private Map<FitEnum, Integer> fitDistribution;
    private List<SkillFrequencyDto> topMatchedSkills;
}
