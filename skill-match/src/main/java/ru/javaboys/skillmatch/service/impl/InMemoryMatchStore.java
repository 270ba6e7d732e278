package ru.javaboys.skillmatch.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.javaboys.skillmatch.dto.MatchResult;
import ru.javaboys.skillmatch.dto.StoredMatch;
import ru.javaboys.skillmatch.service.MatchStore;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class InMemoryMatchStore implements MatchStore {

    private final Map<String, StoredMatch> matches = new ConcurrentHashMap<>();

    @Override
    public StoredMatch storeMatch(String jobId, String candidateId, MatchResult result) {
        LocalDateTime now = LocalDateTime.now();
        // одна запись на пару (вакансия, кандидат): обновляем, если уже есть
        StoredMatch stored = matches.compute(key(jobId, candidateId), (k, existing) -> StoredMatch.builder()
                .id(existing != null ? existing.getId() : UUID.randomUUID())
                .jobId(jobId)
                .candidateId(candidateId)
                .result(result)
                .createdAt(existing != null ? existing.getCreatedAt() : now)
                .updatedAt(now)
                .build());
        log.debug("Stored match job={} candidate={} score={}", jobId, candidateId, result.getScore());
        return stored;
    }

    @Override
    public List<StoredMatch> findByJob(String jobId) {
        return matches.values().stream()
                .filter(m -> m.getJobId().equals(jobId))
                .sorted(Comparator.comparingInt((StoredMatch m) -> m.getResult().getScore()).reversed()
                        .thenComparing(StoredMatch::getCandidateId))
                .toList();
    }

    @Override
    public Optional<StoredMatch> find(String jobId, String candidateId) {
        return Optional.ofNullable(matches.get(key(jobId, candidateId)));
    }

    private static String key(String jobId, String candidateId) {
        return jobId + ":" + candidateId;
    }
}
