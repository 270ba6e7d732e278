package ru.javaboys.skillmatch.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.skillmatch.config.MatchingProperties;
import ru.javaboys.skillmatch.dto.Candidate;
import ru.javaboys.skillmatch.dto.CandidateMatch;
import ru.javaboys.skillmatch.dto.JobMatch;
import ru.javaboys.skillmatch.dto.JobRequirement;
import ru.javaboys.skillmatch.dto.MatchFilters;
import ru.javaboys.skillmatch.dto.MatchResult;
import ru.javaboys.skillmatch.dto.PageInfo;
import ru.javaboys.skillmatch.dto.PageRequest;
import ru.javaboys.skillmatch.dto.PageResult;
import ru.javaboys.skillmatch.dto.ScoredMatch;
import ru.javaboys.skillmatch.dto.SkillMatch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Оценивает пул относительно одной стороны, фильтрует, сортирует и режет на страницы.
 * <p>
 * Работает в обе стороны (кандидаты для вакансии, вакансии для кандидата) одним скорером.
 * Порядок: по убыванию оценки, при равной оценке сохраняется порядок входного пула.
 * Состояния между вызовами не хранит, на пустом пуле не падает.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchEngine {

    private static final Comparator<ScoredMatch> BY_SCORE_DESC =
            Comparator.comparingInt((ScoredMatch m) -> m.getMatch().getScore()).reversed();

    private final MatchScorer scorer;
    private final FitClassifier fitClassifier;
    private final MatchingProperties properties;

    public MatchResult scoreCandidate(Candidate candidate, JobRequirement job) {
        SkillMatch sm = scorer.score(candidate.getSkills(), job.getRequiredSkills(), job.getPreferredSkills());
        return MatchResult.builder()
                .candidateId(candidate.getId())
                .jobId(job.getId())
                .score(sm.getScore())
                .matchingSkills(sm.getMatchingSkills())
                .skillGaps(sm.getSkillGaps())
                .overallFit(fitClassifier.classify(sm.getScore()))
                .build();
    }

    /**
     * Полный рейтинг кандидатов для вакансии, без фильтров и пагинации.
     */
    public List<CandidateMatch> rankCandidates(JobRequirement job, List<Candidate> candidates) {
        return rank(candidates, c -> new CandidateMatch(c, scoreCandidate(c, job)));
    }

    /**
     * Полный рейтинг вакансий для кандидата, без фильтров и пагинации.
     */
    public List<JobMatch> rankJobs(Candidate candidate, List<JobRequirement> jobs) {
        return rank(jobs, j -> new JobMatch(j, scoreCandidate(candidate, j)));
    }

    public PageResult<CandidateMatch> findMatches(JobRequirement job,
                                                  List<Candidate> candidates,
                                                  MatchFilters filters,
                                                  PageRequest page) {
        List<Candidate> pool = nz(candidates).stream()
                .filter(MatchFilterPredicates.forCandidates(filters))
                .collect(Collectors.toList());
        PageResult<CandidateMatch> result = select(rankCandidates(job, pool), m -> true, filters, page);
        log.debug("Matched job {}: pool={}, afterFilters={}, page={}",
                job.getId(), nz(candidates).size(), result.getPagination().getTotal(), result.getPagination().getPage());
        return result;
    }

    public PageResult<JobMatch> findJobMatches(Candidate candidate,
                                               List<JobRequirement> jobs,
                                               MatchFilters filters,
                                               PageRequest page) {
        List<JobRequirement> pool = nz(jobs).stream()
                .filter(MatchFilterPredicates.forJobs(filters))
                .collect(Collectors.toList());
        PageResult<JobMatch> result = select(rankJobs(candidate, pool), m -> true, filters, page);
        log.debug("Matched candidate {}: pool={}, afterFilters={}, page={}",
                candidate.getId(), nz(jobs).size(), result.getPagination().getTotal(), result.getPagination().getPage());
        return result;
    }

    /**
     * Применяет фильтр по атрибутам, минимальную оценку и пагинацию к готовому рейтингу.
     * {@code total} считается после фильтрации, до пагинации.
     */
    public <T extends ScoredMatch> PageResult<T> select(List<T> ranked,
                                                        Predicate<? super T> attributeFilter,
                                                        MatchFilters filters,
                                                        PageRequest page) {
        Integer minScore = filters == null ? null : filters.getMinMatchScore();
        List<T> filtered = nz(ranked).stream()
                .filter(attributeFilter)
                .filter(m -> minScore == null || m.getMatch().getScore() >= minScore)
                .collect(Collectors.toList());

        PageRequest p = page != null ? page : PageRequest.of(1, properties.getEngine().getDefaultLimit());
        int from = (int) Math.min(Math.max(0L, p.getOffset()), filtered.size());
        int to = (int) Math.min((long) from + Math.max(0, p.getLimit()), filtered.size());
        return new PageResult<>(new ArrayList<>(filtered.subList(from, to)),
                PageInfo.of(p.getPage(), p.getLimit(), filtered.size()));
    }

    private <S, T extends ScoredMatch> List<T> rank(List<S> pool, Function<S, T> scoreOne) {
        List<S> items = nz(pool);
        Stream<S> stream = items.size() >= properties.getEngine().getParallelThreshold()
                ? items.parallelStream()
                : items.stream();
        // collect сохраняет порядок пула и для параллельного стрима, сортировка стабильная
        List<T> rows = stream.filter(Objects::nonNull).map(scoreOne).collect(Collectors.toCollection(ArrayList::new));
        rows.sort(BY_SCORE_DESC);
        return rows;
    }

    private static <E> List<E> nz(List<E> list) {
        return list == null ? List.of() : list;
    }
}
