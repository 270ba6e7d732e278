package ru.javaboys.skillmatch.dto;

import lombok.Data;

import java.util.List;

@Data
public class SkillGapReportDto {
    private List<Skill> criticalGaps;     // required, которых нет у кандидата
    private List<Skill> minorGaps;        // preferred, которых нет у кандидата
    private List<Skill> strengths;        // навыки кандидата с высокой оценкой
    private List<String> recommendations;
    private String summary;               // текстовая выжимка для быстрого чтения
}
