package ru.javaboys.skillmatch.service.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import ru.javaboys.skillmatch.dto.Candidate;
import ru.javaboys.skillmatch.dto.JobRequirement;
import ru.javaboys.skillmatch.dto.Skill;
import ru.javaboys.skillmatch.dto.SkillGapReportDto;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Анализ пробелов кандидата относительно вакансии: чего не хватает, что сильное, над чем работать.
 * Использует те же правила сравнения навыков, что и скорер.
 */
@Component
@RequiredArgsConstructor
public class SkillGapAnalyzer {

    static final int STRENGTH_THRESHOLD = 70;
    private static final int MAX_HIGHLIGHTED = 3;

    private final MatchScorer scorer;

    public SkillGapReportDto analyze(Candidate candidate, JobRequirement job) {
        List<Skill> owned = candidate.getSkills() == null ? List.of() : candidate.getSkills();

        List<Skill> criticalGaps = missing(owned, job.getRequiredSkills());
        List<Skill> minorGaps = missing(owned, job.getPreferredSkills());
        List<Skill> strengths = owned.stream()
                .filter(s -> s != null && s.getName() != null)
                .filter(s -> MatchScorer.normalizedProficiency(s) >= STRENGTH_THRESHOLD)
                .collect(Collectors.toList());

        SkillGapReportDto dto = new SkillGapReportDto();
        dto.setCriticalGaps(criticalGaps);
        dto.setMinorGaps(minorGaps);
        dto.setStrengths(strengths);
        dto.setRecommendations(recommendations(criticalGaps, minorGaps, strengths));
        dto.setSummary(renderSummary(dto));
        return dto;
    }

    private List<Skill> missing(List<Skill> owned, List<Skill> wanted) {
        List<Skill> gaps = new ArrayList<>();
        if (wanted == null) return gaps;
        for (Skill w : wanted) {
            if (w != null && scorer.findMatch(owned, w) == null) {
                gaps.add(w);
            }
        }
        return gaps;
    }

    private List<String> recommendations(List<Skill> criticalGaps, List<Skill> minorGaps, List<Skill> strengths) {
        List<String> out = new ArrayList<>();
        if (!criticalGaps.isEmpty()) {
            out.add("Сфокусироваться на ключевых навыках: " + names(criticalGaps));
        }
        if (!minorGaps.isEmpty() && minorGaps.size() <= MAX_HIGHLIGHTED) {
            out.add("Для преимущества стоит освоить желательные навыки: " + names(minorGaps));
        }
        if (!strengths.isEmpty()) {
            out.add("Подчеркнуть сильные навыки: " + names(strengths.subList(0, Math.min(MAX_HIGHLIGHTED, strengths.size()))));
        }
        if (criticalGaps.isEmpty() && minorGaps.isEmpty()) {
            out.add("Отличное совпадение: кандидат закрывает все требования вакансии.");
        }
        return out;
    }

    private String renderSummary(SkillGapReportDto d) {
        StringBuilder sb = new StringBuilder();
        appendBullets(sb, "Критичные пробелы", names(d.getCriticalGaps(), false));
        appendBullets(sb, "Желательные пробелы", names(d.getMinorGaps(), false));
        appendBullets(sb, "Сильные стороны", names(d.getStrengths(), true));
        appendBullets(sb, "Рекомендации", d.getRecommendations());
        return sb.toString().trim();
    }

    private void appendBullets(StringBuilder sb, String title, List<String> items) {
        if (items == null || items.isEmpty()) return;
        sb.append(title).append(":\n");
        for (String it : items) {
            if (it != null && !it.isBlank()) {
                sb.append(" • ").append(it.trim()).append("\n");
            }
        }
        sb.append("\n");
    }

    private static String names(List<Skill> skills) {
        return skills.stream().map(Skill::getName).collect(Collectors.joining(", "));
    }

    private static List<String> names(List<Skill> skills, boolean withProficiency) {
        return skills.stream()
                .map(s -> withProficiency && s.getProficiency() != null
                        ? s.getName() + " (" + MatchScorer.normalizedProficiency(s) + ")"
                        : s.getName())
                .collect(Collectors.toList());
    }
}
