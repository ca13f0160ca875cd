package ca.carms.residency.etl.normalize;

import ca.carms.residency.config.EtlProperties;
import ca.carms.residency.entity.SectionName;
import ca.carms.residency.etl.EtlIssue;
import ca.carms.residency.etl.extract.RawRecord;
import ca.carms.residency.etl.extract.RawSourceLoader;
import ca.carms.residency.etl.extract.RawSources;
import ca.carms.residency.etl.extract.RawTable;
import ca.carms.residency.etl.identity.IdentityResolver;
import ca.carms.residency.etl.identity.IdentitySnapshot;
import ca.carms.residency.exception.MissingForeignKeyException;
import ca.carms.residency.exception.RawExtractException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static ca.carms.residency.etl.extract.SourceColumns.*;

/**
 * Joins program_master, x_section and the discipline lookup into the five
 * relational record streams.
 * <p>
 * Pure: reads only its arguments. Lookup conflicts, unresolvable foreign keys
 * and conflicting duplicate natural keys abort with an exception; x_section
 * rows that join no stream are reported and skipped.
 */
@Slf4j
@Component
public class ProgramNormalizer {

    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)\\s*$");

    private final int matchIterationId;

    @Autowired
    public ProgramNormalizer(EtlProperties properties) {
        this(properties.getMatchIterationId());
    }

    ProgramNormalizer(int matchIterationId) {
        this.matchIterationId = matchIterationId;
    }

    public NormalizedBatch normalize(RawSources sources, IdentitySnapshot snapshot) {
        List<EtlIssue> errors = new ArrayList<>();
        List<EtlIssue> warnings = new ArrayList<>();

        // lookups
        ReferenceCollector disciplines = new ReferenceCollector("discipline");
        ReferenceCollector schools = new ReferenceCollector("school");
        for (RawRecord record : sources.getDisciplines().getRecords()) {
            disciplines.add(record.getInteger(DISCIPLINE_ID), record.get(DISCIPLINE));
        }
        for (RawRecord record : sources.getProgramMaster().getRecords()) {
            disciplines.add(record.getInteger(DISCIPLINE_ID), record.get(DISCIPLINE_NAME));
            schools.add(record.getInteger(SCHOOL_ID), record.get(SCHOOL_NAME));
        }

        // program streams
        IdentityResolver streamIds = new IdentityResolver(PROGRAM_URL, snapshot.getProgramStreamIds());
        Map<String, RawRecord> masterByUrl = new TreeMap<>();
        for (RawRecord record : sources.getProgramMaster().getRecords()) {
            String url = IdentityResolver.normalize(record.get(PROGRAM_URL));
            if (url == null) {
                throw new RawExtractException(String.format("%s row %d has no %s",
                    record.getSourceName(), record.getRowNumber(), PROGRAM_URL));
            }
            if (streamIds.register(url, record.getInteger(PROGRAM_STREAM_ID), streamFingerprint(record))) {
                masterByUrl.put(url, record);
            }
        }

        Map<String, ProgramStreamRow> streamsByUrl = new TreeMap<>();
        masterByUrl.forEach((url, record) -> {
            Integer disciplineId = record.getInteger(DISCIPLINE_ID);
            Integer schoolId = record.getInteger(SCHOOL_ID);
            if (!disciplines.contains(disciplineId)) {
                throw new MissingForeignKeyException("program_streams", DISCIPLINE_ID, disciplineId, url);
            }
            if (!schools.contains(schoolId)) {
                throw new MissingForeignKeyException("program_streams", SCHOOL_ID, schoolId, url);
            }
            streamsByUrl.put(url, ProgramStreamRow.builder()
                .id(streamIds.idFor(url))
                .disciplineId(disciplineId)
                .schoolId(schoolId)
                .streamName(record.get(PROGRAM_STREAM_NAME))
                .site(record.get(PROGRAM_SITE))
                .streamLabel(record.get(PROGRAM_STREAM))
                .programName(record.get(PROGRAM_NAME))
                .programUrl(url)
                .matchIterationId(matchIterationId)
                .build());
        });

        // descriptions
        RawTable sectionTable = sources.getSections();
        warnings.addAll(unknownColumns(sectionTable));

        IdentityResolver descriptionIds = new IdentityResolver(SOURCE, snapshot.getProgramDescriptionIds());
        Map<String, RawRecord> sectionsBySource = new TreeMap<>();
        for (RawRecord record : sectionTable.getRecords()) {
            String source = IdentityResolver.normalize(record.get(SOURCE));
            if (source == null || !streamsByUrl.containsKey(source)) {
                errors.add(EtlIssue.builder()
                    .kind(EtlIssue.Kind.UNJOINED_SECTION)
                    .source(record.getSourceName())
                    .key(source == null ? "row " + record.getRowNumber() : source)
                    .message(String.format("row %d (document_id=%s) matches no program stream",
                        record.getRowNumber(), record.get(DOCUMENT_ID)))
                    .build());
                continue;
            }
            if (descriptionIds.register(source, record.getInteger(PROGRAM_DESCRIPTION_ID), record.getValues())) {
                sectionsBySource.put(source, record);
            }
        }

        List<ProgramDescriptionRow> descriptions = new ArrayList<>();
        List<SectionRow> sections = new ArrayList<>();
        sectionsBySource.forEach((source, record) -> {
            ProgramStreamRow stream = streamsByUrl.get(source);
            Integer descriptionId = descriptionIds.idFor(source);

            documentIdMismatch(record, masterByUrl.get(source), source).ifPresent(warnings::add);

            List<SectionRow> pivoted = SectionPivot.pivot(record, descriptionId);
            Integer declaredCount = record.getInteger(N_PROGRAM_DESCRIPTION_SECTIONS);
            Integer iterationId = record.getInteger(MATCH_ITERATION_ID);

            descriptions.add(ProgramDescriptionRow.builder()
                .id(descriptionId)
                .programStreamId(stream.getId())
                .sourceUrl(source)
                .documentId(record.get(DOCUMENT_ID))
                .matchIterationId(iterationId != null ? iterationId : matchIterationId)
                .matchIterationName(record.get(MATCH_ITERATION_NAME))
                .programName(record.get(PROGRAM_NAME))
                .sectionCount(declaredCount != null ? declaredCount : pivoted.size())
                .build());
            sections.addAll(pivoted);
        });

        errors.sort(Comparator.comparing(EtlIssue::getKey));

        NormalizedBatch batch = NormalizedBatch.builder()
            .matchIterationId(matchIterationId)
            .disciplines(disciplines.rows(DisciplineRow::new))
            .schools(schools.rows(SchoolRow::new))
            .programStreams(List.copyOf(streamsByUrl.values()))
            .programDescriptions(List.copyOf(descriptions))
            .sections(List.copyOf(sections))
            .errors(List.copyOf(errors))
            .warnings(List.copyOf(warnings))
            .sourceRows(sourceRows(sources))
            .emptySectionCells(emptySectionCells(sectionTable))
            .build();

        log.info("Prepared: disciplines={} schools={} program_streams={} program_descriptions={} sections={}",
            batch.getDisciplines().size(), batch.getSchools().size(), batch.getProgramStreams().size(),
            batch.getProgramDescriptions().size(), batch.getSections().size());
        return batch;
    }

    private static List<Object> streamFingerprint(RawRecord record) {
        return Arrays.asList(
            record.getInteger(PROGRAM_STREAM_ID),
            record.getInteger(DISCIPLINE_ID),
            record.getInteger(SCHOOL_ID),
            record.get(PROGRAM_STREAM_NAME),
            record.get(PROGRAM_SITE),
            record.get(PROGRAM_STREAM),
            record.get(PROGRAM_NAME));
    }

    private static List<EtlIssue> unknownColumns(RawTable sectionTable) {
        List<EtlIssue> issues = new ArrayList<>();
        for (String column : sectionTable.getColumns()) {
            if (SECTION_METADATA.contains(column) || SectionName.fromColumn(column).isPresent()) {
                continue;
            }
            issues.add(EtlIssue.builder()
                .kind(EtlIssue.Kind.UNKNOWN_COLUMN)
                .source(sectionTable.getSourceName())
                .key(column)
                .message("column '" + column + "' is not a known section and was ignored")
                .build());
        }
        return issues;
    }

    private static Optional<EtlIssue> documentIdMismatch(RawRecord section, RawRecord master, String source) {
        String documentId = section.get(DOCUMENT_ID);
        Integer sourceStreamId = master.getInteger(PROGRAM_STREAM_ID);
        if (documentId == null || sourceStreamId == null) {
            return Optional.empty();
        }
        Matcher matcher = TRAILING_NUMBER.matcher(documentId);
        if (matcher.find() && matcher.group(1).equals(String.valueOf(sourceStreamId))) {
            return Optional.empty();
        }
        return Optional.of(EtlIssue.builder()
            .kind(EtlIssue.Kind.DOCUMENT_ID_MISMATCH)
            .source(section.getSourceName())
            .key(source)
            .message(String.format("document_id '%s' does not end in program_stream_id %d", documentId, sourceStreamId))
            .build());
    }

    private static Map<String, Integer> sourceRows(RawSources sources) {
        Map<String, Integer> rows = new LinkedHashMap<>();
        rows.put(RawSourceLoader.DISCIPLINE_SOURCE, sources.getDisciplines().size());
        rows.put(RawSourceLoader.PROGRAM_MASTER_SOURCE, sources.getProgramMaster().size());
        rows.put(RawSourceLoader.SECTIONS_SOURCE, sources.getSections().size());
        return rows;
    }

    private static Map<String, Integer> emptySectionCells(RawTable sectionTable) {
        Map<String, Integer> empty = new LinkedHashMap<>();
        for (SectionName name : SectionName.values()) {
            if (!sectionTable.getColumns().contains(name.columnName())) {
                continue;
            }
            int count = (int) sectionTable.getRecords().stream()
                .filter(record -> record.get(name.columnName()) == null)
                .count();
            empty.put(name.columnName(), count);
        }
        return empty;
    }
}
