package ru.javaboys.skillmatch.service;

import ru.javaboys.skillmatch.dto.JobRequirement;

import java.util.List;
import java.util.Optional;

public interface JobRequirementProvider {
    Optional<JobRequirement> findJob(String jobId);
    List<JobRequirement> findAllJobs();
}
