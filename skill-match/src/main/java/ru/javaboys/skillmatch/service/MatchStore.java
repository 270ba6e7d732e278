package ru.javaboys.skillmatch.service;

import ru.javaboys.skillmatch.dto.MatchResult;
import ru.javaboys.skillmatch.dto.StoredMatch;

import java.util.List;
import java.util.Optional;

public interface MatchStore {

    /**
     * Создаёт или обновляет запись пары (вакансия, кандидат).
     */
    StoredMatch storeMatch(String jobId, String candidateId, MatchResult result);

    /**
     * Сохранённые совпадения вакансии, лучшие первыми.
     */
    List<StoredMatch> findByJob(String jobId);

    Optional<StoredMatch> find(String jobId, String candidateId);
}
