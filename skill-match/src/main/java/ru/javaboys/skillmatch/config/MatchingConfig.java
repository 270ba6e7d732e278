package ru.javaboys.skillmatch.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.javaboys.skillmatch.service.MatchCache;
import ru.javaboys.skillmatch.service.SkillEquivalence;
import ru.javaboys.skillmatch.service.SynonymTable;
import ru.javaboys.skillmatch.service.impl.CaffeineMatchCache;
import ru.javaboys.skillmatch.service.impl.MatchScorer;
import ru.javaboys.skillmatch.service.impl.RuleBasedSkillEquivalence;

import java.time.Duration;

@Slf4j
@Configuration
@EnableConfigurationProperties(MatchingProperties.class)
public class MatchingConfig {

    @Bean
    public SynonymTable synonymTable(MatchingProperties properties) {
        if (properties.getSynonyms().isEmpty()) {
            return SynonymTable.defaults();
        }
        return SynonymTable.of(properties.getSynonyms());
    }

    @Bean
    public SkillEquivalence skillEquivalence(SynonymTable synonymTable) {
        return new RuleBasedSkillEquivalence(synonymTable);
    }

    @Bean
    public MatchScorer matchScorer(SkillEquivalence skillEquivalence, MatchingProperties properties) {
        boolean weighting = properties.getScoring().isProficiencyWeighting();
        log.info("Match scoring: proficiency weighting {}", weighting ? "enabled" : "disabled");
        return new MatchScorer(skillEquivalence, weighting);
    }

    @Bean
    public MatchCache matchCache(
            @Value("${skillmatch.cache.ttl:PT5M}") Duration ttl,
            @Value("${skillmatch.cache.maximum-size:10000}") long maximumSize
    ) {
        return new CaffeineMatchCache(ttl, maximumSize);
    }
}
