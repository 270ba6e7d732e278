package ru.javaboys.skillmatch.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.javaboys.skillmatch.dto.Candidate;
import ru.javaboys.skillmatch.dto.JobRequirement;
import ru.javaboys.skillmatch.dto.Skill;
import ru.javaboys.skillmatch.service.CandidateProvider;
import ru.javaboys.skillmatch.service.JobRequirementProvider;
import ru.javaboys.skillmatch.service.MatchCache;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Хранилище кандидатов и вакансий в памяти. Каждая запись сбрасывает соответствующий кэш.
 * Порядок вставки и есть порядок пула для движка.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryTalentDirectory implements CandidateProvider, JobRequirementProvider {

    private final MatchCache matchCache;

    private final Map<String, Candidate> candidates = new LinkedHashMap<>();
    private final Map<String, JobRequirement> jobs = new LinkedHashMap<>();

    @Override
    public synchronized Optional<Candidate> findCandidate(String candidateId) {
        return Optional.ofNullable(candidates.get(candidateId));
    }

    @Override
    public synchronized List<Candidate> findAllCandidates() {
        return new ArrayList<>(candidates.values());
    }

    @Override
    public synchronized Optional<JobRequirement> findJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized List<JobRequirement> findAllJobs() {
        return new ArrayList<>(jobs.values());
    }

    public synchronized void saveCandidate(Candidate candidate) {
        candidates.put(candidate.getId(), candidate);
        matchCache.invalidateCandidate(candidate.getId());
    }

    public synchronized void updateCandidateSkills(String candidateId, List<Skill> skills) {
        Candidate candidate = candidates.get(candidateId);
        if (candidate == null) {
            throw new IllegalArgumentException("Candidate not found: " + candidateId);
        }
        // старый объект могут держать закэшированные строки и идущий расчёт, его не трогаем
        candidates.put(candidateId, candidate.toBuilder().skills(new ArrayList<>(skills)).build());
        matchCache.invalidateCandidate(candidateId);
        log.info("Updated skills of candidate {} ({} skills)", candidateId, skills.size());
    }

    public synchronized void removeCandidate(String candidateId) {
        if (candidates.remove(candidateId) != null) {
            matchCache.invalidateCandidate(candidateId);
        }
    }

    public synchronized void saveJob(JobRequirement job) {
        jobs.put(job.getId(), job);
        matchCache.invalidateJob(job.getId());
    }

    public synchronized void removeJob(String jobId) {
        if (jobs.remove(jobId) != null) {
            matchCache.invalidateJob(jobId);
        }
    }
}
