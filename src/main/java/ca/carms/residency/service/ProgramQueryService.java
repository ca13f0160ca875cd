package ca.carms.residency.service;

import ca.carms.residency.api.DescriptionView;
import ca.carms.residency.api.DisciplineSummary;
import ca.carms.residency.api.ProgramDetail;
import ca.carms.residency.api.ProgramSummary;
import ca.carms.residency.api.RankedSection;
import ca.carms.residency.api.SectionView;
import ca.carms.residency.config.QueryProperties;
import ca.carms.residency.entity.ProgramDescription;
import ca.carms.residency.entity.ProgramDescriptionSection;
import ca.carms.residency.entity.ProgramStream;
import ca.carms.residency.exception.InvalidParameterException;
import ca.carms.residency.exception.NotFoundException;
import ca.carms.residency.repository.DisciplineRepository;
import ca.carms.residency.repository.ProgramDescriptionRepository;
import ca.carms.residency.repository.ProgramDescriptionSectionRepository;
import ca.carms.residency.repository.ProgramFilter;
import ca.carms.residency.repository.ProgramStreamRepository;
import ca.carms.residency.repository.SectionScore;
import ca.carms.residency.repository.SectionTermRepository;
import ca.carms.residency.search.SnippetBuilder;
import ca.carms.residency.search.TextAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only access to the loaded program data: listings, program detail and
 * ranked full-text search over description sections.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ProgramQueryService {

    private static final int MIN_QUERY_LENGTH = 2;

    private final DisciplineRepository disciplineRepository;
    private final ProgramStreamRepository programStreamRepository;
    private final ProgramDescriptionRepository programDescriptionRepository;
    private final ProgramDescriptionSectionRepository sectionRepository;
    private final SectionTermRepository sectionTermRepository;
    private final TextAnalyzer textAnalyzer;
    private final QueryProperties properties;

    public List<DisciplineSummary> listDisciplines() {
        return disciplineRepository.findAll(Sort.by("id")).stream()
            .map(discipline -> DisciplineSummary.builder()
                .disciplineId(discipline.getId())
                .discipline(discipline.getName())
                .build())
            .toList();
    }

    /**
     * @param limit  null for the configured default
     * @param offset null for 0
     * @throws InvalidParameterException when limit is not in 1..max-limit or offset is negative
     */
    public List<ProgramSummary> listPrograms(Integer disciplineId, Integer schoolId, String q, Integer limit, Integer offset) {
        int pageSize = checkLimit(limit, properties.getDefaultLimit(), properties.getMaxLimit());
        int skip = checkOffset(offset);

        ProgramFilter filter = ProgramFilter.builder()
            .disciplineId(disciplineId)
            .schoolId(schoolId)
            .text(q)
            .build();
        return programStreamRepository.findPrograms(filter, pageSize, skip).stream()
            .map(ProgramQueryService::toSummary)
            .toList();
    }

    /**
     * @throws NotFoundException when the stream does not exist or has no description
     */
    public ProgramDetail getProgram(Integer programStreamId) {
        ProgramStream stream = programStreamRepository.findWithReferencesById(programStreamId)
            .orElseThrow(() -> new NotFoundException("program_stream_id " + programStreamId + " not found"));
        ProgramDescription description = programDescriptionRepository.findWithSectionsByProgramStreamId(programStreamId)
            .orElseThrow(() -> new NotFoundException("program_stream_id " + programStreamId + " has no description"));

        List<SectionView> sections = description.getSections().stream()
            .sorted(Comparator.comparing(ProgramDescriptionSection::getSectionName))
            .map(section -> SectionView.builder()
                .sectionId(section.getId())
                .sectionName(section.getSectionName().columnName())
                .sectionText(section.getSectionText())
                .build())
            .toList();

        return ProgramDetail.builder()
            .program(toSummary(stream))
            .description(DescriptionView.builder()
                .programDescriptionId(description.getId())
                .sourceUrl(description.getSourceUrl())
                .documentId(description.getDocumentId())
                .matchIterationId(description.getMatchIterationId())
                .matchIterationName(description.getMatchIterationName())
                .sectionCount(description.getSectionCount())
                .build())
            .sections(sections)
            .build();
    }

    /**
     * Rank sections by summed frequency of the analyzed query terms, highest
     * first, ties by ascending section id.
     *
     * @throws InvalidParameterException for a blank or too short query, or a limit/offset out of range
     */
    public List<RankedSection> search(String query, Integer limit, Integer offset) {
        if (query == null || query.isBlank()) {
            throw new InvalidParameterException("query", "must not be blank");
        }
        if (query.strip().length() < MIN_QUERY_LENGTH) {
            throw new InvalidParameterException("query", "must have at least " + MIN_QUERY_LENGTH + " characters");
        }
        int pageSize = checkLimit(limit, properties.getSearchDefaultLimit(), properties.getSearchMaxLimit());
        int skip = checkOffset(offset);

        Set<String> terms = textAnalyzer.queryTerms(query);
        if (terms.isEmpty()) {
            log.debug("Query '{}' has no searchable terms", query);
            return List.of();
        }

        List<SectionScore> scores = sectionTermRepository.rankSections(terms, pageSize, skip);
        if (scores.isEmpty()) {
            return List.of();
        }
        Map<Long, ProgramDescriptionSection> sections = sectionRepository
            .findAllWithProgramByIdIn(scores.stream().map(SectionScore::getSectionId).toList()).stream()
            .collect(Collectors.toMap(ProgramDescriptionSection::getId, Function.identity()));

        return scores.stream()
            .map(score -> toRankedSection(sections.get(score.getSectionId()), score, terms))
            .toList();
    }

    private RankedSection toRankedSection(ProgramDescriptionSection section, SectionScore score, Set<String> terms) {
        ProgramStream stream = section.getDescription().getProgramStream();
        String text = section.getSectionText();
        return RankedSection.builder()
            .sectionId(section.getId())
            .programStreamId(stream.getId())
            .programDescriptionId(section.getDescription().getId())
            .programName(stream.getProgramName())
            .schoolName(stream.getSchool().getName())
            .disciplineName(stream.getDiscipline().getName())
            .sectionName(section.getSectionName().columnName())
            .rank(score.getScore().doubleValue())
            .snippet(SnippetBuilder.snippet(text, textAnalyzer.tokens(text), terms, properties.getSnippetRadius()))
            .build();
    }

    private static ProgramSummary toSummary(ProgramStream stream) {
        return ProgramSummary.builder()
            .programStreamId(stream.getId())
            .programName(stream.getProgramName())
            .programStreamName(stream.getStreamName())
            .programStream(stream.getStreamLabel())
            .disciplineId(stream.getDiscipline().getId())
            .disciplineName(stream.getDiscipline().getName())
            .schoolId(stream.getSchool().getId())
            .schoolName(stream.getSchool().getName())
            .programSite(stream.getSite())
            .programUrl(stream.getProgramUrl())
            .matchIterationId(stream.getMatchIterationId())
            .build();
    }

    private static int checkLimit(Integer limit, int defaultLimit, int maxLimit) {
        if (limit == null) {
            return defaultLimit;
        }
        if (limit <= 0 || limit > maxLimit) {
            throw new InvalidParameterException("limit", "must be between 1 and " + maxLimit + ", got " + limit);
        }
        return limit;
    }

    private static int checkOffset(Integer offset) {
        if (offset == null) {
            return 0;
        }
        if (offset < 0) {
            throw new InvalidParameterException("offset", "must not be negative, got " + offset);
        }
        return offset;
    }
}
