package ca.carms.residency.etl.extract;

import ca.carms.residency.config.EtlProperties;
import ca.carms.residency.exception.RawExtractException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Extracts the three raw sources on a bounded pool and waits for all of them.
 * Required columns are checked before anything is handed to normalization.
 */
@Slf4j
@Component
public class RawSourceLoader {

    public static final String DISCIPLINE_SOURCE = "discipline";
    public static final String PROGRAM_MASTER_SOURCE = "program_master";
    public static final String SECTIONS_SOURCE = "x_section";

    private final RawExtractReaders readers;
    private final EtlProperties properties;

    public RawSourceLoader(RawExtractReaders readers, EtlProperties properties) {
        this.readers = readers;
        this.properties = properties;
    }

    /**
     * Extract the sources configured under carms.etl.*
     */
    public RawSources load() {
        return load(properties.disciplinePath(), properties.programMasterPath(), properties.sectionsPath());
    }

    public RawSources load(Path disciplinePath, Path programMasterPath, Path sectionsPath) {
        int threads = Math.max(1, Math.min(3, properties.getExtractionThreads()));
        ExecutorService executor = Executors.newFixedThreadPool(threads, namedThreads());
        try {
            Future<RawTable> disciplines = executor.submit(withMdc(() -> readers.read(DISCIPLINE_SOURCE, disciplinePath)));
            Future<RawTable> master = executor.submit(withMdc(() -> readers.read(PROGRAM_MASTER_SOURCE, programMasterPath)));
            Future<RawTable> sections = executor.submit(withMdc(() -> readers.read(SECTIONS_SOURCE, sectionsPath)));

            RawSources sources = new RawSources(await(disciplines), await(master), await(sections));
            sources.getDisciplines().requireColumns(SourceColumns.DISCIPLINE_REQUIRED);
            sources.getProgramMaster().requireColumns(SourceColumns.PROGRAM_MASTER_REQUIRED);
            sources.getSections().requireColumns(SourceColumns.SECTIONS_REQUIRED);

            log.info("Extracted raw sources: discipline={} program_master={} x_section={}",
                sources.getDisciplines().size(), sources.getProgramMaster().size(), sources.getSections().size());
            return sources;
        } finally {
            executor.shutdownNow();
        }
    }

    private static RawTable await(Future<RawTable> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RawExtractException("Interrupted while extracting raw sources", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RawExtractException rawExtractException) {
                throw rawExtractException;
            }
            throw new RawExtractException("Raw extraction failed: " + cause.getMessage(), cause);
        }
    }

    private static <T> Callable<T> withMdc(Callable<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "raw-extract-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
