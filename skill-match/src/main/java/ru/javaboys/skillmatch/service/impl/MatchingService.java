package ru.javaboys.skillmatch.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.skillmatch.config.MatchingProperties;
import ru.javaboys.skillmatch.dto.Candidate;
import ru.javaboys.skillmatch.dto.CandidateMatch;
import ru.javaboys.skillmatch.dto.JobMatch;
import ru.javaboys.skillmatch.dto.JobRequirement;
import ru.javaboys.skillmatch.dto.MatchFilters;
import ru.javaboys.skillmatch.dto.MatchResult;
import ru.javaboys.skillmatch.dto.MatchingStatsDto;
import ru.javaboys.skillmatch.dto.PageRequest;
import ru.javaboys.skillmatch.dto.PageResult;
import ru.javaboys.skillmatch.dto.SkillGapReportDto;
import ru.javaboys.skillmatch.dto.StoredMatch;
import ru.javaboys.skillmatch.exception.MatchingException;
import ru.javaboys.skillmatch.service.CandidateProvider;
import ru.javaboys.skillmatch.service.JobRequirementProvider;
import ru.javaboys.skillmatch.service.MatchCache;
import ru.javaboys.skillmatch.service.MatchStore;

import java.util.List;
import java.util.function.Predicate;

/**
 * Точка входа для запросов подбора: проверяет предусловия, загружает данные через провайдеры,
 * отдаёт рейтинги через кэш, остальное делает {@link MatchEngine}.
 * <p>
 * "Ничего не подошло" это пустая страница, "не из чего подбирать" это {@link MatchingException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchingService {

    private final MatchEngine engine;
    private final CandidateProvider candidates;
    private final JobRequirementProvider jobs;
    private final MatchCache cache;
    private final MatchStore store;
    private final MatchRequestValidator validator;
    private final SkillGapAnalyzer gapAnalyzer;
    private final MatchStatistics statistics;
    private final MatchingProperties properties;

    public PageResult<CandidateMatch> findCandidatesForJob(String jobId,
                                                           MatchFilters filters,
                                                           PageRequest page,
                                                           boolean forceRefresh) {
        validator.validate(filters, page);
        JobRequirement job = loadJob(jobId);
        List<CandidateMatch> ranked = rankedCandidates(job, forceRefresh);
        Predicate<Candidate> attributes = MatchFilterPredicates.forCandidates(filters);
        return engine.select(ranked, m -> attributes.test(m.getCandidate()), filters, page);
    }

    public PageResult<JobMatch> findJobsForCandidate(String candidateId,
                                                     MatchFilters filters,
                                                     PageRequest page,
                                                     boolean forceRefresh) {
        validator.validate(filters, page);
        Candidate candidate = loadCandidate(candidateId);
        List<JobMatch> ranked = rankedJobs(candidate, forceRefresh);
        Predicate<JobRequirement> attributes = MatchFilterPredicates.forJobs(filters);
        return engine.select(ranked, m -> attributes.test(m.getJob()), filters, page);
    }

    /**
     * Лучший кандидат с оценкой не ниже порога. Если порог не прошёл никто, возвращается
     * первый кандидат пула.
     */
    public String findTopCandidateIdForJob(String jobId, Integer minMatchScore) {
        validator.validateMinScore(minMatchScore);
        int threshold = minMatchScore != null ? minMatchScore : properties.getEngine().getDefaultMinScore();
        JobRequirement job = loadJob(jobId);
        List<CandidateMatch> ranked = rankedCandidates(job, false);

        return ranked.stream()
                .filter(m -> m.getMatch().getScore() >= threshold)
                .findFirst()
                .map(m -> m.getCandidate().getId())
                .orElseGet(() -> {
                    log.info("No candidate reached {} for job {}, falling back to the first one", threshold, jobId);
                    return candidates.findAllCandidates().stream()
                            .findFirst()
                            .orElseThrow(MatchingService::noCandidates)
                            .getId();
                });
    }

    /**
     * Пересчитывает рейтинг вакансии в кэше и сохраняет каждую строку в хранилище.
     */
    public int refreshJobMatches(String jobId) {
        JobRequirement job = loadJob(jobId);
        List<CandidateMatch> ranked = rankedCandidates(job, true);
        for (CandidateMatch row : ranked) {
            store.storeMatch(job.getId(), row.getCandidate().getId(), row.getMatch());
        }
        log.info("Refreshed matches for job {}: {} candidates", jobId, ranked.size());
        return ranked.size();
    }

    public int precomputeAll() {
        if (candidates.findAllCandidates().isEmpty()) {
            log.info("Precompute skipped: no candidates");
            return 0;
        }
        int rows = 0;
        List<JobRequirement> all = jobs.findAllJobs();
        for (JobRequirement job : all) {
            rows += refreshJobMatches(job.getId());
        }
        log.info("Precomputed matches for {} jobs ({} rows)", all.size(), rows);
        return rows;
    }

    public SkillGapReportDto analyzeSkillGaps(String candidateId, String jobId) {
        Candidate candidate = loadCandidate(candidateId);
        JobRequirement job = loadJob(jobId);
        return gapAnalyzer.analyze(candidate, job);
    }

    public MatchingStatsDto getMatchingStats(String jobId, int topSkills) {
        JobRequirement job = loadJob(jobId);
        return statistics.summarize(rankedCandidates(job, false), topSkills);
    }

    public StoredMatch storeMatch(String jobId, String candidateId, MatchResult result) {
        return store.storeMatch(jobId, candidateId, result);
    }

    public List<StoredMatch> getStoredMatches(String jobId) {
        return store.findByJob(jobId);
    }

    public void invalidateJob(String jobId) {
        cache.invalidateJob(jobId);
    }

    public void invalidateCandidate(String candidateId) {
        cache.invalidateCandidate(candidateId);
    }

    // -------- helpers --------

    private List<CandidateMatch> rankedCandidates(JobRequirement job, boolean forceRefresh) {
        if (!forceRefresh) {
            List<CandidateMatch> cached = cache.getJobMatches(job.getId());
            if (cached != null) {
                log.debug("Candidate matching cache hit for job {}", job.getId());
                return cached;
            }
        }
        // поколение снимаем до чтения данных: инвалидация во время расчёта отбросит результат
        long generation = cache.generation();
        JobRequirement current = loadJob(job.getId());
        List<Candidate> pool = candidates.findAllCandidates();
        if (pool.isEmpty()) {
            throw noCandidates();
        }
        List<CandidateMatch> ranked = engine.rankCandidates(current, pool);
        cache.putJobMatches(job.getId(), ranked, generation);
        log.debug("Ranked {} candidates for job {}", ranked.size(), job.getId());
        return ranked;
    }

    private List<JobMatch> rankedJobs(Candidate candidate, boolean forceRefresh) {
        if (!forceRefresh) {
            List<JobMatch> cached = cache.getCandidateMatches(candidate.getId());
            if (cached != null) {
                log.debug("Job matching cache hit for candidate {}", candidate.getId());
                return cached;
            }
        }
        long generation = cache.generation();
        Candidate current = loadCandidate(candidate.getId());
        List<JobMatch> ranked = engine.rankJobs(current, jobs.findAllJobs());
        cache.putCandidateMatches(candidate.getId(), ranked, generation);
        log.debug("Ranked {} jobs for candidate {}", ranked.size(), candidate.getId());
        return ranked;
    }

    private JobRequirement loadJob(String jobId) {
        return jobs.findJob(jobId).orElseThrow(() -> {
            log.warn("Job not found: {}", jobId);
            return MatchingException.jobNotFound(jobId);
        });
    }

    private Candidate loadCandidate(String candidateId) {
        return candidates.findCandidate(candidateId).orElseThrow(() -> {
            log.warn("Candidate not found: {}", candidateId);
            return MatchingException.candidateNotFound(candidateId);
        });
    }

    private static MatchingException noCandidates() {
        log.warn("No candidates available for matching");
        return MatchingException.noCandidates();
    }
}
