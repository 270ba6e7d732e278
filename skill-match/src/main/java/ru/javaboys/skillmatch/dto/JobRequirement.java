package ru.javaboys.skillmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.javaboys.skillmatch.entity.SeniorityLevelEnum;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRequirement {
    private String id;
    private String title;

    @Builder.Default
    private List<Skill> requiredSkills = new ArrayList<>();

    @Builder.Default
    private List<Skill> preferredSkills = new ArrayList<>();

    private SeniorityLevelEnum experienceLevel;
    private String location;
    private boolean remoteAllowed;
}
