package ru.javaboys.skillmatch.service;

import ru.javaboys.skillmatch.dto.CandidateMatch;
import ru.javaboys.skillmatch.dto.JobMatch;

import java.util.List;

/**
 * Read-through кэш полных рейтингов (отсортированных, без фильтров) по id вакансии или кандидата.
 * Все пути записи, меняющие требования вакансии или навыки кандидата, обязаны вызывать invalidate.
 * <p>
 * Запись принимается только если с момента {@link #generation()} не было ни одной инвалидации:
 * рейтинг, посчитанный по устаревшим данным, в кэш не попадает.
 */
public interface MatchCache {

    /**
     * Текущее поколение кэша. Снимается до чтения данных для расчёта рейтинга.
     */
    long generation();

    List<CandidateMatch> getJobMatches(String jobId);

    /**
     * @return {@code false}, если за время расчёта была инвалидация и рейтинг отброшен
     */
    boolean putJobMatches(String jobId, List<CandidateMatch> ranked, long generation);

    List<JobMatch> getCandidateMatches(String candidateId);

    boolean putCandidateMatches(String candidateId, List<JobMatch> ranked, long generation);

    void invalidateJob(String jobId);

    void invalidateCandidate(String candidateId);

    void invalidateAll();
}
