package ru.javaboys.skillmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.javaboys.skillmatch.entity.SeniorityLevelEnum;

import java.time.LocalDate;
import java.util.List;

/**
 * Необязательные фильтры запроса подбора. Поля независимы, {@code null} означает "не задано".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchFilters {
    private List<String> skills;                       // allow-list, достаточно одного совпадения
    private List<SeniorityLevelEnum> experienceLevels;
    private String location;
    private Boolean remoteOnly;
    private Integer minMatchScore;
    private LocalDate availableFrom;                   // окно доступности
    private LocalDate availableUntil;

    public static MatchFilters none() {
        return new MatchFilters();
    }

    public static MatchFilters minScore(int minMatchScore) {
        return MatchFilters.builder().minMatchScore(minMatchScore).build();
    }
}
