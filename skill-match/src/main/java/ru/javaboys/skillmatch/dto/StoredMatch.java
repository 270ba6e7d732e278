package ru.javaboys.skillmatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredMatch {
    private UUID id;
    private String jobId;
    private String candidateId;
    private MatchResult result;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
