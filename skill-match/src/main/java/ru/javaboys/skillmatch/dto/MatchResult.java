package ru.javaboys.skillmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.javaboys.skillmatch.entity.FitEnum;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchResult {
    private String candidateId;
    private String jobId;
    private int score;
    private List<Skill> matchingSkills;
    private List<Skill> skillGaps;
    private FitEnum overallFit;
}
