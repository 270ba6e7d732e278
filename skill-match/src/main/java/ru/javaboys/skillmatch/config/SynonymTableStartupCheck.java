package ru.javaboys.skillmatch.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.javaboys.skillmatch.service.SynonymTable;

import java.util.List;

/**
 * Проверка таблицы синонимов при старте.
 * Имя в двух группах делает сравнение навыков неоднозначным, в этом случае приложение не стартует.
 */
@Slf4j
@Component
public class SynonymTableStartupCheck {

    private final SynonymTable synonymTable;

    public SynonymTableStartupCheck(SynonymTable synonymTable) {
        this.synonymTable = synonymTable;
    }

    @PostConstruct
    public void verifySynonymTable() {
        List<String> conflicts = synonymTable.conflicts();
        if (!conflicts.isEmpty()) {
            log.error("Synonym table has names in several groups: {}. Failing application startup.", conflicts);
            throw new IllegalStateException("Ambiguous skill synonyms: " + conflicts);
        }
        log.info("Synonym table loaded: {} groups. Startup check passed.", synonymTable.size());
    }
}
