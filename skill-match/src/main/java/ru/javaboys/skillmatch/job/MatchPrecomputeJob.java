package ru.javaboys.skillmatch.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import ru.javaboys.skillmatch.service.impl.MatchingService;

/**
 * Периодически пересчитывает и сохраняет рейтинги всех вакансий, чтобы чтение попадало в прогретый кэш.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "skillmatch.precompute", name = "enabled", havingValue = "true")
public class MatchPrecomputeJob {

    private final MatchingService matchingService;

    @Scheduled(fixedRateString = "${skillmatch.precompute.interval-ms:900000}",
            initialDelayString = "${skillmatch.precompute.initial-delay-ms:60000}")
    public void precompute() {
        try {
            matchingService.precomputeAll();
        } catch (RuntimeException e) {
            // следующий запуск попробует снова
            log.error("Match precompute failed", e);
        }
    }
}
