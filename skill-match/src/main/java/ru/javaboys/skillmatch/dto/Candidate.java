package ru.javaboys.skillmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.javaboys.skillmatch.entity.SeniorityLevelEnum;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Candidate {
    private String id;
    private String name;
    private String email;

    @Builder.Default
    private List<Skill> skills = new ArrayList<>();

    private SeniorityLevelEnum experienceLevel;
    private String location;
    private boolean openToRemote;
    private LocalDate availableFrom;
    private LocalDate availableUntil;
}
