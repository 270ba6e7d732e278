package ru.javaboys.skillmatch.exception;

import lombok.Getter;

/**
 * Нарушено предусловие запроса подбора. Сам скоринг это исключение не бросает.
 */
@Getter
public class MatchingException extends RuntimeException {

    private final MatchingErrorCode code;

    public MatchingException(MatchingErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public static MatchingException jobNotFound(String jobId) {
        return new MatchingException(MatchingErrorCode.JOB_NOT_FOUND, "Job not found: " + jobId);
    }

    public static MatchingException candidateNotFound(String candidateId) {
        return new MatchingException(MatchingErrorCode.CANDIDATE_NOT_FOUND, "Candidate not found: " + candidateId);
    }

    public static MatchingException noCandidates() {
        return new MatchingException(MatchingErrorCode.NO_CANDIDATES_AVAILABLE, "No candidates available for matching");
    }

    public static MatchingException invalidFilters(String message) {
        return new MatchingException(MatchingErrorCode.INVALID_FILTER_PARAMETERS, message);
    }
}
