package ru.javaboys.skillmatch.service.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import ru.javaboys.skillmatch.dto.CandidateMatch;
import ru.javaboys.skillmatch.dto.JobMatch;
import ru.javaboys.skillmatch.service.MatchCache;

import java.time.Duration;
import java.util.List;

/**
 * Кэш рейтингов на Caffeine.
 * <p>
 * Рейтинг вакансии содержит всех кандидатов, рейтинг кандидата содержит все вакансии, поэтому
 * изменение вакансии сбрасывает все записи по кандидатам и наоборот. Инвалидация и запись идут
 * под одним замком, запись с устаревшим поколением отбрасывается.
 */
@Slf4j
public class CaffeineMatchCache implements MatchCache {

    private final Cache<String, List<CandidateMatch>> jobMatches;
    private final Cache<String, List<JobMatch>> candidateMatches;

    private final Object lock = new Object();
    private long generation;

    public CaffeineMatchCache(Duration ttl, long maximumSize) {
        this.jobMatches = Caffeine.newBuilder()
                .recordStats()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .build();
        this.candidateMatches = Caffeine.newBuilder()
                .recordStats()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .build();
    }

    @Override
    public long generation() {
        synchronized (lock) {
            return generation;
        }
    }

    @Override
    public List<CandidateMatch> getJobMatches(String jobId) {
        return jobMatches.getIfPresent(jobId);
    }

    @Override
    public boolean putJobMatches(String jobId, List<CandidateMatch> ranked, long expectedGeneration) {
        synchronized (lock) {
            if (expectedGeneration != generation) {
                log.debug("Dropped stale ranking for job {}", jobId);
                return false;
            }
            jobMatches.put(jobId, List.copyOf(ranked));
            return true;
        }
    }

    @Override
    public List<JobMatch> getCandidateMatches(String candidateId) {
        return candidateMatches.getIfPresent(candidateId);
    }

    @Override
    public boolean putCandidateMatches(String candidateId, List<JobMatch> ranked, long expectedGeneration) {
        synchronized (lock) {
            if (expectedGeneration != generation) {
                log.debug("Dropped stale ranking for candidate {}", candidateId);
                return false;
            }
            candidateMatches.put(candidateId, List.copyOf(ranked));
            return true;
        }
    }

    @Override
    public void invalidateJob(String jobId) {
        synchronized (lock) {
            generation++;
            jobMatches.invalidate(jobId);
            candidateMatches.invalidateAll();
        }
        log.debug("Invalidated match cache for job {}", jobId);
    }

    @Override
    public void invalidateCandidate(String candidateId) {
        synchronized (lock) {
            generation++;
            candidateMatches.invalidate(candidateId);
            jobMatches.invalidateAll();
        }
        log.debug("Invalidated match cache for candidate {}", candidateId);
    }

    @Override
    public void invalidateAll() {
        synchronized (lock) {
            generation++;
            jobMatches.invalidateAll();
            candidateMatches.invalidateAll();
        }
        log.info("Invalidated all match caches");
    }

    public CacheStats jobStats() {
        return jobMatches.stats();
    }

    public CacheStats candidateStats() {
        return candidateMatches.stats();
    }
}
