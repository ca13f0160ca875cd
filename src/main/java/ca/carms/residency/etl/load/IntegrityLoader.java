package ca.carms.residency.etl.load;

import ca.carms.residency.entity.Discipline;
import ca.carms.residency.entity.ProgramDescription;
import ca.carms.residency.entity.ProgramDescriptionSection;
import ca.carms.residency.entity.ProgramStream;
import ca.carms.residency.entity.School;
import ca.carms.residency.entity.SectionName;
import ca.carms.residency.entity.SectionTerm;
import ca.carms.residency.etl.normalize.DisciplineRow;
import ca.carms.residency.etl.normalize.NormalizedBatch;
import ca.carms.residency.etl.normalize.ProgramDescriptionRow;
import ca.carms.residency.etl.normalize.ProgramStreamRow;
import ca.carms.residency.etl.normalize.SchoolRow;
import ca.carms.residency.etl.normalize.SectionRow;
import ca.carms.residency.exception.ConflictingReferenceException;
import ca.carms.residency.exception.DuplicateNaturalKeyException;
import ca.carms.residency.exception.MissingForeignKeyException;
import ca.carms.residency.repository.DisciplineRepository;
import ca.carms.residency.repository.ProgramDescriptionRepository;
import ca.carms.residency.repository.ProgramStreamRepository;
import ca.carms.residency.repository.SchoolRepository;
import ca.carms.residency.search.TextAnalyzer;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Applies a {@link NormalizedBatch} to the store in a single transaction.
 * <p>
 * Rows are upserted by their resolved surrogate ids, so a rerun on unchanged
 * input writes nothing new. Program streams of the same match iteration that
 * are absent from the batch are removed together with their descriptions;
 * sections and index terms follow by cascade. A loaded discipline never
 * changes its name. Any failure rolls the whole run back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntegrityLoader {

    public static final String DISCIPLINES = "disciplines";
    public static final String SCHOOLS = "schools";
    public static final String PROGRAM_STREAMS = "program_streams";
    public static final String PROGRAM_DESCRIPTIONS = "program_descriptions";
    public static final String PROGRAM_DESCRIPTION_SECTIONS = "program_description_sections";
    public static final String SECTION_TERMS = "section_terms";

    private final DisciplineRepository disciplineRepository;
    private final SchoolRepository schoolRepository;
    private final ProgramStreamRepository programStreamRepository;
    private final ProgramDescriptionRepository programDescriptionRepository;
    private final TextAnalyzer textAnalyzer;

    @PersistenceContext
    private EntityManager entityManager;

    @Transactional
    public LoadSummary load(NormalizedBatch batch) {
        Map<String, Integer> written = new LinkedHashMap<>();
        Map<String, Integer> deleted = new LinkedHashMap<>();

        written.put(DISCIPLINES, upsertDisciplines(batch.getDisciplines()));
        written.put(SCHOOLS, upsertSchools(batch.getSchools()));

        deleteStale(batch, deleted);

        written.put(PROGRAM_STREAMS, upsertProgramStreams(batch.getProgramStreams()));

        SectionCounts sectionCounts = upsertDescriptions(batch);
        written.put(PROGRAM_DESCRIPTIONS, batch.getProgramDescriptions().size());
        written.put(PROGRAM_DESCRIPTION_SECTIONS, batch.getSections().size());
        written.put(SECTION_TERMS, sectionCounts.termsWritten);
        deleted.merge(PROGRAM_DESCRIPTION_SECTIONS, sectionCounts.sectionsRemoved, Integer::sum);

        entityManager.flush();
        log.info("Loaded iteration {}: written={} deleted={} sections_reindexed={}",
            batch.getMatchIterationId(), written, deleted, sectionCounts.sectionsReindexed);
        return new LoadSummary(written, deleted);
    }

    private int upsertDisciplines(List<DisciplineRow> rows) {
        Map<Integer, Discipline> existing = disciplineRepository
            .findAllById(rows.stream().map(DisciplineRow::getId).toList()).stream()
            .collect(Collectors.toMap(Discipline::getId, Function.identity()));
        for (DisciplineRow row : rows) {
            Discipline discipline = existing.get(row.getId());
            if (discipline == null) {
                entityManager.persist(Discipline.builder().id(row.getId()).name(row.getName()).build());
            } else if (!discipline.getName().equals(row.getName())) {
                // disciplines are immutable once loaded
                throw new ConflictingReferenceException("discipline", row.getId(), discipline.getName(), row.getName());
            }
        }
        return rows.size();
    }

    private int upsertSchools(List<SchoolRow> rows) {
        Map<Integer, School> existing = schoolRepository
            .findAllById(rows.stream().map(SchoolRow::getId).toList()).stream()
            .collect(Collectors.toMap(School::getId, Function.identity()));
        for (SchoolRow row : rows) {
            School school = existing.get(row.getId());
            if (school == null) {
                entityManager.persist(School.builder().id(row.getId()).name(row.getName()).build());
            } else {
                school.setName(row.getName());
            }
        }
        return rows.size();
    }

    private void deleteStale(NormalizedBatch batch, Map<String, Integer> deleted) {
        Set<String> streamUrls = batch.getProgramStreams().stream()
            .map(ProgramStreamRow::getProgramUrl)
            .collect(Collectors.toSet());
        Set<String> descriptionUrls = batch.getProgramDescriptions().stream()
            .map(ProgramDescriptionRow::getSourceUrl)
            .collect(Collectors.toSet());

        List<ProgramStream> iterationStreams = programStreamRepository.findByMatchIterationId(batch.getMatchIterationId());
        List<ProgramStream> staleStreams = iterationStreams.stream()
            .filter(stream -> !streamUrls.contains(stream.getProgramUrl()))
            .toList();

        List<ProgramDescription> staleDescriptions = programDescriptionRepository
            .findByProgramStreamIdIn(iterationStreams.stream().map(ProgramStream::getId).toList()).stream()
            .filter(description -> !descriptionUrls.contains(description.getSourceUrl()))
            .toList();

        programDescriptionRepository.deleteAll(staleDescriptions);
        programStreamRepository.deleteAll(staleStreams);
        if (!staleDescriptions.isEmpty() || !staleStreams.isEmpty()) {
            entityManager.flush();
            log.info("Removed {} program streams and {} program descriptions no longer in the raw sources",
                staleStreams.size(), staleDescriptions.size());
        }
        deleted.put(PROGRAM_STREAMS, staleStreams.size());
        deleted.put(PROGRAM_DESCRIPTIONS, staleDescriptions.size());
    }

    private int upsertProgramStreams(List<ProgramStreamRow> rows) {
        Set<Integer> disciplineIds = existingIds(disciplineRepository.findAllById(
            rows.stream().map(ProgramStreamRow::getDisciplineId).distinct().toList()), Discipline::getId);
        Set<Integer> schoolIds = existingIds(schoolRepository.findAllById(
            rows.stream().map(ProgramStreamRow::getSchoolId).distinct().toList()), School::getId);

        Map<Integer, ProgramStream> existing = programStreamRepository
            .findAllById(rows.stream().map(ProgramStreamRow::getId).toList()).stream()
            .collect(Collectors.toMap(ProgramStream::getId, Function.identity()));

        for (ProgramStreamRow row : rows) {
            if (!disciplineIds.contains(row.getDisciplineId())) {
                throw new MissingForeignKeyException(PROGRAM_STREAMS, "discipline_id", row.getDisciplineId(), row.getProgramUrl());
            }
            if (!schoolIds.contains(row.getSchoolId())) {
                throw new MissingForeignKeyException(PROGRAM_STREAMS, "school_id", row.getSchoolId(), row.getProgramUrl());
            }

            ProgramStream stream = existing.get(row.getId());
            boolean created = stream == null;
            if (created) {
                stream = ProgramStream.builder().id(row.getId()).build();
            } else if (!stream.getProgramUrl().equals(row.getProgramUrl())) {
                throw new DuplicateNaturalKeyException("program_stream_id", String.valueOf(row.getId()));
            }
            stream.setDiscipline(disciplineRepository.getReferenceById(row.getDisciplineId()));
            stream.setSchool(schoolRepository.getReferenceById(row.getSchoolId()));
            stream.setStreamName(row.getStreamName());
            stream.setSite(row.getSite());
            stream.setStreamLabel(row.getStreamLabel());
            stream.setProgramName(row.getProgramName());
            stream.setProgramUrl(row.getProgramUrl());
            stream.setMatchIterationId(row.getMatchIterationId());
            if (created) {
                entityManager.persist(stream);
            }
        }
        return rows.size();
    }

    private SectionCounts upsertDescriptions(NormalizedBatch batch) {
        List<ProgramDescriptionRow> rows = batch.getProgramDescriptions();
        Set<Integer> streamIds = new HashSet<>();
        batch.getProgramStreams().forEach(stream -> streamIds.add(stream.getId()));

        Map<Integer, List<SectionRow>> sectionsByDescription = batch.getSections().stream()
            .collect(Collectors.groupingBy(SectionRow::getProgramDescriptionId, LinkedHashMap::new, Collectors.toList()));

        Map<Integer, ProgramDescription> existing = programDescriptionRepository
            .findAllWithSectionsByIdIn(rows.stream().map(ProgramDescriptionRow::getId).toList()).stream()
            .collect(Collectors.toMap(ProgramDescription::getId, Function.identity()));

        SectionCounts counts = new SectionCounts();
        Set<Integer> describedStreams = new HashSet<>();
        for (ProgramDescriptionRow row : rows) {
            if (!streamIds.contains(row.getProgramStreamId()) && !programStreamRepository.existsById(row.getProgramStreamId())) {
                throw new MissingForeignKeyException(PROGRAM_DESCRIPTIONS, "program_stream_id",
                    row.getProgramStreamId(), row.getSourceUrl());
            }
            if (!describedStreams.add(row.getProgramStreamId())) {
                throw new DuplicateNaturalKeyException("program_stream_id", String.valueOf(row.getProgramStreamId()));
            }

            ProgramDescription description = existing.get(row.getId());
            boolean created = description == null;
            if (created) {
                description = ProgramDescription.builder().id(row.getId()).build();
            } else if (!description.getSourceUrl().equals(row.getSourceUrl())) {
                throw new DuplicateNaturalKeyException("program_description_id", String.valueOf(row.getId()));
            }
            description.setProgramStream(programStreamRepository.getReferenceById(row.getProgramStreamId()));
            description.setSourceUrl(row.getSourceUrl());
            description.setDocumentId(row.getDocumentId());
            description.setMatchIterationId(row.getMatchIterationId());
            description.setMatchIterationName(row.getMatchIterationName());
            description.setProgramName(row.getProgramName());
            description.setSectionCount(row.getSectionCount());

            reconcileSections(description, sectionsByDescription.getOrDefault(row.getId(), List.of()), counts);
            if (created) {
                entityManager.persist(description);
            }
        }
        return counts;
    }

    /**
     * Update sections in place by name so that unchanged sections keep their ids.
     */
    private void reconcileSections(ProgramDescription description, List<SectionRow> rows, SectionCounts counts) {
        Map<SectionName, String> wanted = new LinkedHashMap<>();
        rows.forEach(row -> wanted.put(row.getSectionName(), row.getSectionText()));

        for (ProgramDescriptionSection section : new ArrayList<>(description.getSections())) {
            if (!wanted.containsKey(section.getSectionName())) {
                description.removeSection(section);
                counts.sectionsRemoved++;
            }
        }

        wanted.forEach((name, text) -> {
            ProgramDescriptionSection section = description.findSection(name).orElse(null);
            if (section == null) {
                section = ProgramDescriptionSection.builder().sectionName(name).build();
                description.addSection(section);
            } else if (Objects.equals(section.getSectionText(), text)) {
                return;
            }
            section.setSectionText(text);
            counts.termsWritten += reindex(section);
            counts.sectionsReindexed++;
        });
    }

    private int reindex(ProgramDescriptionSection section) {
        Map<String, Integer> frequencies = textAnalyzer.termFrequencies(section.getSectionText());
        Map<String, SectionTerm> current = section.getTerms().stream()
            .collect(Collectors.toMap(SectionTerm::getTerm, Function.identity()));

        section.getTerms().removeIf(term -> !frequencies.containsKey(term.getTerm()));
        frequencies.forEach((term, frequency) -> {
            SectionTerm sectionTerm = current.get(term);
            if (sectionTerm != null) {
                sectionTerm.setFrequency(frequency);
            } else {
                section.addTerm(SectionTerm.builder().term(term).frequency(frequency).build());
            }
        });
        return frequencies.size();
    }

    private static <T> Set<Integer> existingIds(List<T> entities, Function<T, Integer> id) {
        return entities.stream().map(id).collect(Collectors.toSet());
    }

    private static class SectionCounts {
        int sectionsReindexed;
        int sectionsRemoved;
        int termsWritten;
    }
}
