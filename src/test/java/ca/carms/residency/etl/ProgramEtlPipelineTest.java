package ca.carms.residency.etl;

import ca.carms.residency.entity.ProgramDescription;
import ca.carms.residency.entity.ProgramDescriptionSection;
import ca.carms.residency.entity.SectionName;
import ca.carms.residency.entity.SectionTerm;
import ca.carms.residency.etl.extract.RawRecord;
import ca.carms.residency.etl.extract.RawSourceLoader;
import ca.carms.residency.etl.extract.RawSources;
import ca.carms.residency.etl.extract.RawTable;
import ca.carms.residency.etl.load.IntegrityLoader;
import ca.carms.residency.etl.normalize.NormalizedBatch;
import ca.carms.residency.etl.normalize.ProgramStreamRow;
import ca.carms.residency.exception.ConflictingReferenceException;
import ca.carms.residency.exception.DuplicateNaturalKeyException;
import ca.carms.residency.exception.MissingForeignKeyException;
import ca.carms.residency.repository.DisciplineRepository;
import ca.carms.residency.repository.ProgramDescriptionRepository;
import ca.carms.residency.repository.ProgramDescriptionSectionRepository;
import ca.carms.residency.repository.ProgramStreamRepository;
import ca.carms.residency.repository.SchoolRepository;
import ca.carms.residency.repository.SectionTermRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * End-to-end runs of the pipeline against the CSV fixtures in src/test/resources/raw.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("ProgramEtlPipeline Integration Tests")
class ProgramEtlPipelineTest {

    private static final String URL_27447 = "https://www.carms.ca/match/program/27447";
    private static final String URL_27449 = "https://www.carms.ca/match/program/27449";

    @Autowired
    private ProgramEtlPipeline pipeline;

    @Autowired
    private RawSourceLoader rawSourceLoader;

    @SpyBean
    private IntegrityLoader integrityLoader;

    @Autowired
    private DisciplineRepository disciplineRepository;

    @Autowired
    private SchoolRepository schoolRepository;

    @Autowired
    private ProgramStreamRepository programStreamRepository;

    @Autowired
    private ProgramDescriptionRepository programDescriptionRepository;

    @Autowired
    private ProgramDescriptionSectionRepository sectionRepository;

    @Autowired
    private SectionTermRepository sectionTermRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @BeforeEach
    void clearStore() {
        programDescriptionRepository.deleteAll();
        programStreamRepository.deleteAll();
        schoolRepository.deleteAll();
        disciplineRepository.deleteAll();
    }

    @Test
    @DisplayName("Should load the five tables and report unjoined sections")
    void shouldLoadFixtures() {
        // When
        RunResult result = pipeline.run();

        // Then
        assertThat(result.getMatchIterationId()).isEqualTo(1503);
        assertThat(result.getCountsPerTable())
            .containsEntry(IntegrityLoader.DISCIPLINES, 4)
            .containsEntry(IntegrityLoader.SCHOOLS, 3)
            .containsEntry(IntegrityLoader.PROGRAM_STREAMS, 4)
            .containsEntry(IntegrityLoader.PROGRAM_DESCRIPTIONS, 3)
            .containsEntry(IntegrityLoader.PROGRAM_DESCRIPTION_SECTIONS, 7);
        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.getErrors().get(0).getKind()).isEqualTo(EtlIssue.Kind.UNJOINED_SECTION);
        assertThat(result.getErrors().get(0).getKey()).isEqualTo("https://www.carms.ca/match/program/88888");
        assertThat(result.getWarnings()).extracting(EtlIssue::getKind)
            .containsExactlyInAnyOrder(EtlIssue.Kind.UNKNOWN_COLUMN, EtlIssue.Kind.DOCUMENT_ID_MISMATCH);
        assertThat(result.getSourceRows()).containsEntry("program_master", 4).containsEntry("x_section", 4);

        assertThat(disciplineRepository.count()).isEqualTo(4);
        assertThat(programStreamRepository.findAll()).extracting(stream -> stream.getId())
            .containsExactlyInAnyOrder(27447, 27448, 27449, 27450);
        assertThat(programDescriptionRepository.findAll()).extracting(ProgramDescription::getId)
            .containsExactlyInAnyOrder(101, 102, 103);
        assertThat(sectionRepository.count()).isEqualTo(7);
        assertThat(sectionTermRepository.count()).isPositive();
    }

    @Test
    @DisplayName("Should keep every foreign key resolvable after a load")
    void shouldKeepReferentialIntegrity() {
        // When
        pipeline.run();

        // Then
        transactionTemplate.executeWithoutResult(status -> {
            programStreamRepository.findAll().forEach(stream -> {
                assertThat(disciplineRepository.existsById(stream.getDiscipline().getId())).isTrue();
                assertThat(schoolRepository.existsById(stream.getSchool().getId())).isTrue();
            });
            programDescriptionRepository.findAll().forEach(description -> {
                assertThat(programStreamRepository.findById(description.getProgramStream().getId()))
                    .get()
                    .extracting(stream -> stream.getProgramUrl())
                    .isEqualTo(description.getSourceUrl());
            });
        });
        assertThat(programStreamRepository.countByDisciplineId(4)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should be idempotent: a rerun changes no ids and no rows")
    void shouldBeIdempotent() {
        // Given
        pipeline.run();
        Map<Long, String> sectionsBefore = sectionSnapshot();
        long termsBefore = sectionTermRepository.count();

        // When
        RunResult rerun = pipeline.run();

        // Then
        assertThat(rerun.getCountsPerTable()).containsEntry(IntegrityLoader.PROGRAM_STREAMS, 4);
        assertThat(rerun.getDeletedPerTable()).allSatisfy((table, count) -> assertThat(count).isZero());
        assertThat(sectionSnapshot()).isEqualTo(sectionsBefore);
        assertThat(sectionTermRepository.count()).isEqualTo(termsBefore);
        assertThat(programDescriptionRepository.findAll()).extracting(ProgramDescription::getId)
            .containsExactlyInAnyOrder(101, 102, 103);
    }

    @Test
    @DisplayName("Should remove streams and descriptions that left the raw sources")
    void shouldDeleteStaleRows() {
        // Given
        pipeline.run();
        RawSources full = rawSourceLoader.load();
        RawSources reduced = new RawSources(
            full.getDisciplines(),
            filter(full.getProgramMaster(), record -> !URL_27449.equals(record.get("program_url"))),
            filter(full.getSections(), record -> !URL_27449.equals(record.get("source"))));

        // When
        RunResult result = pipeline.run(reduced);

        // Then
        assertThat(result.getDeletedPerTable())
            .containsEntry(IntegrityLoader.PROGRAM_STREAMS, 1)
            .containsEntry(IntegrityLoader.PROGRAM_DESCRIPTIONS, 1);
        assertThat(programStreamRepository.existsById(27449)).isFalse();
        assertThat(programDescriptionRepository.existsById(103)).isFalse();
        assertThat(sectionRepository.count()).isEqualTo(5);
        assertThat(disciplineRepository.existsById(3)).isTrue();
    }

    @Test
    @DisplayName("Should update changed section text in place and reindex its terms")
    void shouldReindexChangedSection() {
        // Given
        pipeline.run();
        Long researchSectionId = researchSectionOf(101);
        RawSources full = rawSourceLoader.load();
        RawSources changed = new RawSources(full.getDisciplines(), full.getProgramMaster(),
            map(full.getSections(), values -> {
                if (URL_27447.equals(values.get("source"))) {
                    values.put("research", "Research, research and more research.");
                }
                return values;
            }));

        // When
        pipeline.run(changed);

        // Then
        assertThat(researchSectionOf(101)).isEqualTo(researchSectionId);
        assertThat(sectionTermRepository.findBySectionId(researchSectionId))
            .filteredOn(term -> term.getTerm().equals("research"))
            .extracting(SectionTerm::getFrequency)
            .containsExactly(3);
        assertThat(sectionTermRepository.findBySectionId(researchSectionId))
            .extracting(SectionTerm::getTerm)
            .doesNotContain("pain");
    }

    @Test
    @DisplayName("Should abort on a conflicting duplicate URL and keep prior state")
    void shouldAbortOnConflictingDuplicate() {
        // Given
        pipeline.run();
        RawSources full = rawSourceLoader.load();
        List<RawRecord> master = new ArrayList<>(full.getProgramMaster().getRecords());
        Map<String, String> clash = new LinkedHashMap<>(master.get(0).getValues());
        clash.put("program_name", "Anesthesiology - Renamed");
        master.add(new RawRecord("program_master", master.size() + 1, clash));
        RawSources conflicting = new RawSources(full.getDisciplines(),
            new RawTable("program_master", full.getProgramMaster().getColumns(), master), full.getSections());

        // When / Then
        assertThatThrownBy(() -> pipeline.run(conflicting))
            .isInstanceOf(DuplicateNaturalKeyException.class)
            .hasMessageContaining(URL_27447);
        assertThat(programStreamRepository.findById(27447)).get()
            .extracting(stream -> stream.getProgramName())
            .isEqualTo("Anesthesiology - Toronto");
    }

    @Test
    @DisplayName("Should roll the whole load back when a foreign key is missing")
    void shouldRollBackOnMissingForeignKey() {
        // Given
        pipeline.run();
        NormalizedBatch broken = NormalizedBatch.builder()
            .matchIterationId(1503)
            .disciplines(List.of())
            .schools(List.of())
            .programStreams(List.of(ProgramStreamRow.builder()
                .id(30000)
                .disciplineId(99)
                .schoolId(10)
                .programName("Orphan")
                .programUrl("https://www.carms.ca/match/program/30000")
                .matchIterationId(1503)
                .build()))
            .programDescriptions(List.of())
            .sections(List.of())
            .errors(List.of())
            .warnings(List.of())
            .sourceRows(Map.of())
            .emptySectionCells(Map.of())
            .build();

        // When / Then
        assertThatThrownBy(() -> integrityLoader.load(broken))
            .isInstanceOf(MissingForeignKeyException.class)
            .hasMessageContaining("discipline_id=99");
        assertThat(programStreamRepository.count()).isEqualTo(4);
        assertThat(programDescriptionRepository.count()).isEqualTo(3);
        assertThat(sectionRepository.count()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should store overlong cell values and skip overlong index terms")
    void shouldLoadOverlongValues() {
        // Given
        String longDocumentId = "1503-" + "x".repeat(70) + "-27447";
        String longSite = "Toronto General ".repeat(60).trim();
        RawSources full = rawSourceLoader.load();
        RawSources overlong = new RawSources(full.getDisciplines(),
            map(full.getProgramMaster(), values -> {
                if (URL_27447.equals(values.get("program_url"))) {
                    values.put("program_site", longSite);
                }
                return values;
            }),
            map(full.getSections(), values -> {
                if (URL_27447.equals(values.get("source"))) {
                    values.put("program_highlights", "Intro " + "a".repeat(300) + " end");
                    values.put("document_id", longDocumentId);
                }
                return values;
            }));

        // When
        RunResult result = pipeline.run(overlong);

        // Then
        assertThat(result.getCountsPerTable())
            .containsEntry(IntegrityLoader.PROGRAM_DESCRIPTIONS, 3)
            .containsEntry(IntegrityLoader.PROGRAM_DESCRIPTION_SECTIONS, 7);
        assertThat(programDescriptionRepository.findById(101)).get()
            .extracting(ProgramDescription::getDocumentId)
            .isEqualTo(longDocumentId);
        assertThat(programStreamRepository.findById(27447)).get()
            .extracting(stream -> stream.getSite())
            .isEqualTo(longSite);
        assertThat(sectionTermRepository.findBySectionId(sectionIdOf(101, SectionName.PROGRAM_HIGHLIGHTS)))
            .extracting(SectionTerm::getTerm)
            .containsExactlyInAnyOrder("intro", "end");
        assertThat(sectionTermRepository.findAll())
            .allSatisfy(term -> assertThat(term.getTerm()).hasSizeLessThanOrEqualTo(SectionTerm.MAX_TERM_LENGTH));
    }

    @Test
    @DisplayName("Should reject a reload that renames a loaded discipline")
    void shouldRejectRenamedDiscipline() {
        // Given
        pipeline.run();
        RawSources full = rawSourceLoader.load();
        UnaryOperator<Map<String, String>> rename = values -> {
            if ("1".equals(values.get("discipline_id"))) {
                values.computeIfPresent("discipline", (column, name) -> "Anaesthesia");
                values.computeIfPresent("discipline_name", (column, name) -> "Anaesthesia");
            }
            return values;
        };
        RawSources renamed = new RawSources(map(full.getDisciplines(), rename),
            map(full.getProgramMaster(), rename), full.getSections());

        // When / Then
        assertThatThrownBy(() -> pipeline.run(renamed))
            .isInstanceOf(ConflictingReferenceException.class)
            .hasMessageContaining("Anesthesiology")
            .hasMessageContaining("Anaesthesia");
        assertThat(disciplineRepository.findById(1)).get()
            .extracting(discipline -> discipline.getName())
            .isEqualTo("Anesthesiology");
    }

    @Test
    @DisplayName("Should serialize concurrent runs so that loads never overlap")
    void shouldSerializeConcurrentRuns() throws Exception {
        // Given
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        CountDownLatch firstLoadStarted = new CountDownLatch(1);
        doAnswer(invocation -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            firstLoadStarted.countDown();
            try {
                // hold the load open long enough for the other run to reach it
                Thread.sleep(300);
                return invocation.callRealMethod();
            } finally {
                inFlight.decrementAndGet();
            }
        }).when(integrityLoader).load(any(NormalizedBatch.class));
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            // When
            Future<RunResult> first = executor.submit(() -> pipeline.run());
            assertThat(firstLoadStarted.await(30, TimeUnit.SECONDS)).isTrue();
            Future<RunResult> second = executor.submit(() -> pipeline.run());
            RunResult firstResult = first.get(60, TimeUnit.SECONDS);
            RunResult secondResult = second.get(60, TimeUnit.SECONDS);

            // Then
            assertThat(maxInFlight).hasValue(1);
            verify(integrityLoader, times(2)).load(any(NormalizedBatch.class));
            assertThat(firstResult.getCountsPerTable()).containsEntry(IntegrityLoader.PROGRAM_STREAMS, 4);
            assertThat(secondResult.getCountsPerTable())
                .containsEntry(IntegrityLoader.PROGRAM_STREAMS, 4)
                .containsEntry(IntegrityLoader.PROGRAM_DESCRIPTIONS, 3)
                .containsEntry(IntegrityLoader.PROGRAM_DESCRIPTION_SECTIONS, 7);
            assertThat(secondResult.getDeletedPerTable()).allSatisfy((table, count) -> assertThat(count).isZero());
            assertThat(programStreamRepository.findAll()).extracting(stream -> stream.getId())
                .containsExactlyInAnyOrder(27447, 27448, 27449, 27450);
            assertThat(programDescriptionRepository.findAll()).extracting(ProgramDescription::getId)
                .containsExactlyInAnyOrder(101, 102, 103);
            assertThat(sectionRepository.count()).isEqualTo(7);
        } finally {
            executor.shutdownNow();
        }
    }

    private Map<Long, String> sectionSnapshot() {
        return sectionRepository.findAll().stream()
            .collect(Collectors.toMap(ProgramDescriptionSection::getId,
                section -> section.getSectionName().columnName() + ":" + section.getSectionText()));
    }

    private Long researchSectionOf(int descriptionId) {
        return sectionIdOf(descriptionId, SectionName.RESEARCH);
    }

    private Long sectionIdOf(int descriptionId, SectionName name) {
        return transactionTemplate.execute(status -> programDescriptionRepository.findById(descriptionId)
            .orElseThrow()
            .findSection(name)
            .orElseThrow()
            .getId());
    }

    private static RawTable filter(RawTable table, Predicate<RawRecord> keep) {
        return new RawTable(table.getSourceName(), table.getColumns(),
            table.getRecords().stream().filter(keep).toList());
    }

    private static RawTable map(RawTable table, UnaryOperator<Map<String, String>> change) {
        List<RawRecord> records = table.getRecords().stream()
            .map(record -> new RawRecord(record.getSourceName(), record.getRowNumber(),
                change.apply(new LinkedHashMap<>(record.getValues()))))
            .toList();
        return new RawTable(table.getSourceName(), table.getColumns(), records);
    }
}
