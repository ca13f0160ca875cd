package ca.carms.residency.etl;

import ca.carms.residency.etl.extract.RawSourceLoader;
import ca.carms.residency.etl.extract.RawSources;
import ca.carms.residency.etl.identity.IdentitySnapshot;
import ca.carms.residency.etl.load.IntegrityLoader;
import ca.carms.residency.etl.load.LoadSummary;
import ca.carms.residency.etl.normalize.NormalizedBatch;
import ca.carms.residency.etl.normalize.ProgramNormalizer;
import ca.carms.residency.exception.EtlException;
import ca.carms.residency.exception.EtlLoadException;
import ca.carms.residency.repository.NaturalKeyIdentity;
import ca.carms.residency.repository.ProgramDescriptionRepository;
import ca.carms.residency.repository.ProgramStreamRepository;
import jakarta.persistence.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs extract, identity resolution, normalization and load for one match
 * iteration.
 * <p>
 * Runs are serialized: a second caller waits until the first has committed or
 * rolled back. Normalization completes before the load transaction opens.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgramEtlPipeline {

    private final RawSourceLoader rawSourceLoader;
    private final ProgramNormalizer normalizer;
    private final IntegrityLoader loader;
    private final ProgramStreamRepository programStreamRepository;
    private final ProgramDescriptionRepository programDescriptionRepository;

    private final ReentrantLock runLock = new ReentrantLock();

    /**
     * Run against the raw files configured under carms.etl.*
     */
    public RunResult run() {
        return runGuarded(rawSourceLoader::load);
    }

    public RunResult run(RawSources sources) {
        return runGuarded(() -> sources);
    }

    private RunResult runGuarded(Supplier<RawSources> extract) {
        runLock.lock();
        try {
            RawSources sources = extract.get();
            NormalizedBatch batch = normalizer.normalize(sources, identitySnapshot());
            batch.getErrors().forEach(issue -> log.warn("{} {}: {}", issue.getKind(), issue.getKey(), issue.getMessage()));
            batch.getWarnings().forEach(issue -> log.warn("{} {}: {}", issue.getKind(), issue.getKey(), issue.getMessage()));

            LoadSummary summary = load(batch);

            RunResult result = RunResult.builder()
                .matchIterationId(batch.getMatchIterationId())
                .countsPerTable(summary.getWritten())
                .deletedPerTable(summary.getDeleted())
                .sourceRows(batch.getSourceRows())
                .emptySectionCells(batch.getEmptySectionCells())
                .errors(batch.getErrors())
                .warnings(batch.getWarnings())
                .build();
            log.info("ETL run finished: counts={} errors={} warnings={}",
                result.getCountsPerTable(), result.getErrors().size(), result.getWarnings().size());
            return result;
        } catch (EtlException e) {
            log.error("ETL run aborted, prior state kept: {}", e.getMessage());
            throw e;
        } finally {
            runLock.unlock();
        }
    }

    private LoadSummary load(NormalizedBatch batch) {
        try {
            return loader.load(batch);
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            throw new EtlLoadException("Load rolled back: " + e.getMessage(), e);
        }
    }

    private IdentitySnapshot identitySnapshot() {
        return new IdentitySnapshot(
            toMap(programStreamRepository.findAllIdentities()),
            toMap(programDescriptionRepository.findAllIdentities()));
    }

    private static Map<String, Integer> toMap(List<NaturalKeyIdentity> identities) {
        Map<String, Integer> map = new LinkedHashMap<>();
        identities.forEach(identity -> map.put(identity.getNaturalKey(), identity.getId()));
        return map;
    }
}
