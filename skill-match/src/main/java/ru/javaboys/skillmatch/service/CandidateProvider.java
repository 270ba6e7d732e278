package ru.javaboys.skillmatch.service;

import ru.javaboys.skillmatch.dto.Candidate;

import java.util.List;
import java.util.Optional;

public interface CandidateProvider {
    Optional<Candidate> findCandidate(String candidateId);
    List<Candidate> findAllCandidates();
}
