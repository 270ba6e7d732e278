package ru.javaboys.skillmatch.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.javaboys.skillmatch.config.MatchingProperties;
import ru.javaboys.skillmatch.dto.MatchFilters;
import ru.javaboys.skillmatch.dto.PageRequest;
import ru.javaboys.skillmatch.exception.MatchingException;

/**
 * Отклоняет некорректные фильтры и пагинацию до вызова движка.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MatchRequestValidator {

    private final MatchingProperties properties;

    public void validate(MatchFilters filters, PageRequest page) {
        if (page != null) {
            if (page.getPage() < 1) {
                throw reject("page must be >= 1, got " + page.getPage());
            }
            int maxLimit = properties.getEngine().getMaxLimit();
            if (page.getLimit() < 1 || page.getLimit() > maxLimit) {
                throw reject("limit must be within 1.." + maxLimit + ", got " + page.getLimit());
            }
        }
        if (filters != null) {
            validateMinScore(filters.getMinMatchScore());
            if (filters.getAvailableFrom() != null && filters.getAvailableUntil() != null
                    && filters.getAvailableFrom().isAfter(filters.getAvailableUntil())) {
                throw reject("availability window starts after it ends: "
                        + filters.getAvailableFrom() + " > " + filters.getAvailableUntil());
            }
        }
    }

    public void validateMinScore(Integer minMatchScore) {
        if (minMatchScore != null && (minMatchScore < 0 || minMatchScore > 100)) {
            throw reject("minMatchScore must be within 0..100, got " + minMatchScore);
        }
    }

    private MatchingException reject(String message) {
        log.warn("Invalid matching request: {}", message);
        return MatchingException.invalidFilters(message);
    }
}
