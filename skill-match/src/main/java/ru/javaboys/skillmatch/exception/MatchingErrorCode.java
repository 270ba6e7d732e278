package ru.javaboys.skillmatch.exception;

public enum MatchingErrorCode {
    JOB_NOT_FOUND,
    CANDIDATE_NOT_FOUND,
    NO_CANDIDATES_AVAILABLE,
    INVALID_FILTER_PARAMETERS
}
