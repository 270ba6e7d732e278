package ru.javaboys.skillmatch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "skillmatch")
public class MatchingProperties {

    @Valid
    private Scoring scoring = new Scoring();

    @Valid
    private Engine engine = new Engine();

    /**
     * Группы синонимов: каноническое имя навыка и его варианты. Пусто: встроенная таблица.
     */
    private Map<String, List<String>> synonyms = new LinkedHashMap<>();

    @Data
    public static class Scoring {
        /** Учитывать уровень владения навыком. Выключено: чистое покрытие. */
        private boolean proficiencyWeighting = true;
    }

    @Data
    public static class Engine {
        /** Пулы такого размера и больше считаются параллельно. */
        @Min(1)
        private int parallelThreshold = 64;

        @Min(1)
        private int defaultLimit = 15;

        @Min(1)
        private int maxLimit = 50;

        /** Порог для поиска лучшего кандидата, если вызывающий его не передал. */
        @Min(0)
        @Max(100)
        private int defaultMinScore = 10;
    }
}
