package ru.javaboys.skillmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class SkillMatch {
    private int score; // 0..100
    private List<Skill> matchingSkills;
    private List<Skill> skillGaps;
}
