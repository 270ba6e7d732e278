package ru.javaboys.skillmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SkillFrequencyDto {
    private String name;
    private int count;
}
