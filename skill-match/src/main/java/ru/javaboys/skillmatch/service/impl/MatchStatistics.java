package ru.javaboys.skillmatch.service.impl;

import org.springframework.stereotype.Component;
import ru.javaboys.skillmatch.dto.MatchingStatsDto;
import ru.javaboys.skillmatch.dto.ScoredMatch;
import ru.javaboys.skillmatch.dto.Skill;
import ru.javaboys.skillmatch.dto.SkillFrequencyDto;
import ru.javaboys.skillmatch.entity.FitEnum;
import ru.javaboys.skillmatch.service.SynonymTable;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Сводная статистика по списку совпадений.
 */
@Component
public class MatchStatistics {

    public MatchingStatsDto summarize(List<? extends ScoredMatch> rows, int topSkills) {
        Map<FitEnum, Integer> distribution = new EnumMap<>(FitEnum.class);
        for (FitEnum fit : FitEnum.values()) {
            distribution.put(fit, 0);
        }

        long total = 0;
        // ключ нормализован, имя берём из первого вхождения
        Map<String, String> displayNames = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ScoredMatch row : rows) {
            total += row.getMatch().getScore();
            distribution.merge(row.getMatch().getOverallFit(), 1, Integer::sum);
            for (Skill s : row.getMatch().getMatchingSkills()) {
                String key = SynonymTable.normalize(s.getName());
                displayNames.putIfAbsent(key, s.getName().trim());
                counts.merge(key, 1, Integer::sum);
            }
        }

        MatchingStatsDto dto = new MatchingStatsDto();
        dto.setTotalMatches(rows.size());
        dto.setAverageScore(rows.isEmpty() ? 0.0 : Math.round(10.0 * total / rows.size()) / 10.0);
        dto.setFitDistribution(distribution);
        dto.setTopMatchedSkills(counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .limit(Math.max(0, topSkills))
                .map(e -> new SkillFrequencyDto(displayNames.get(e.getKey()), e.getValue()))
                .toList());
        return dto;
    }
}
