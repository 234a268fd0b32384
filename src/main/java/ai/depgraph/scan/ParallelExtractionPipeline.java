package ai.depgraph.scan;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.depgraph.model.ImportRecord;

/**
 * Runs an {@link ImportRecordExtractor} over many files on a fixed worker pool.
 * <p>
 * Files are cut into contiguous chunks of {@code max(1, files / (workers * 4))}, one task per
 * chunk. Each task owns its result map; the calling thread merges finished chunks. A file whose
 * extraction throws anything, errors included, gets an empty list; a chunk that does not finish
 * in time gives every one of its files an empty list. Nothing is ever thrown to the caller.
 */
public final class ParallelExtractionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ParallelExtractionPipeline.class);

    public static final int INLINE_THRESHOLD = 3;
    public static final Duration DEFAULT_CHUNK_TIMEOUT = Duration.ofSeconds(30);

    private final int workerCount;
    private final Duration chunkTimeout;
    private final IntFunction<ExecutorService> executorFactory;

    public ParallelExtractionPipeline(int workerCount) {
        this(workerCount, DEFAULT_CHUNK_TIMEOUT);
    }

    public ParallelExtractionPipeline(int workerCount, Duration chunkTimeout) {
        this(workerCount, chunkTimeout, ParallelExtractionPipeline::newWorkerPool);
    }

    public ParallelExtractionPipeline(int workerCount,
                                      Duration chunkTimeout,
                                      IntFunction<ExecutorService> executorFactory) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be > 0: " + workerCount);
        }
        this.workerCount = workerCount;
        this.chunkTimeout = Objects.requireNonNull(chunkTimeout, "chunkTimeout");
        this.executorFactory = Objects.requireNonNull(executorFactory, "executorFactory");
    }

    /**
     * @return one entry per input file, in input order
     */
    public Map<Path, List<ImportRecord>> extractAll(List<Path> files, ImportRecordExtractor extractor) {
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(extractor, "extractor");

        if (files.isEmpty()) {
            return Map.of();
        }
        if (files.size() <= INLINE_THRESHOLD) {
            return processChunk(files, extractor);
        }

        final List<List<Path>> chunks = partition(files, chunkSize(files.size(), workerCount));
        final Map<Path, List<ImportRecord>> merged = new HashMap<>(files.size() * 2);
        final long started = System.nanoTime();

        final ExecutorService executor = executorFactory.apply(workerCount);
        final Map<Future<Map<Path, List<ImportRecord>>>, List<Path>> pending = new HashMap<>();
        try {
            final CompletionService<Map<Path, List<ImportRecord>>> completion =
                    new ExecutorCompletionService<>(executor);
            for (List<Path> chunk : chunks) {
                pending.put(completion.submit(() -> processChunk(chunk, extractor)), chunk);
            }

            while (!pending.isEmpty()) {
                final Future<Map<Path, List<ImportRecord>>> done =
                        completion.poll(chunkTimeout.toNanos(), TimeUnit.NANOSECONDS);
                if (done == null) {
                    log.warn("{} extraction chunk(s) did not finish within {} ms, their files get no imports",
                            pending.size(), chunkTimeout.toMillis());
                    break;
                }
                final List<Path> chunk = pending.remove(done);
                try {
                    merged.putAll(done.get());
                } catch (ExecutionException ex) {
                    log.warn("Extraction chunk of {} file(s) failed: {}", chunk.size(), ex.getCause().toString());
                    degrade(chunk, merged);
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for extraction, {} chunk(s) dropped", pending.size());
        } finally {
            executor.shutdownNow();
        }

        for (var e : pending.entrySet()) {
            e.getKey().cancel(true);
            degrade(e.getValue(), merged);
        }

        log.debug("Extracted {} file(s) in {} chunk(s) on {} worker(s) in {} ms",
                files.size(), chunks.size(), workerCount,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));

        final Map<Path, List<ImportRecord>> ordered = new LinkedHashMap<>(files.size() * 2);
        for (Path file : files) {
            ordered.put(file, merged.getOrDefault(file, List.of()));
        }
        return ordered;
    }

    static int chunkSize(int totalFiles, int workerCount) {
        return Math.max(1, totalFiles / (workerCount * 4));
    }

    static List<List<Path>> partition(List<Path> files, int chunkSize) {
        final List<List<Path>> chunks = new ArrayList<>((files.size() + chunkSize - 1) / chunkSize);
        for (int i = 0; i < files.size(); i += chunkSize) {
            chunks.add(List.copyOf(files.subList(i, Math.min(files.size(), i + chunkSize))));
        }
        return chunks;
    }

    /**
     * Extracts a chunk on the current thread. A failing file never affects its neighbours.
     */
    static Map<Path, List<ImportRecord>> processChunk(List<Path> files, ImportRecordExtractor extractor) {
        final Map<Path, List<ImportRecord>> out = new LinkedHashMap<>(files.size() * 2);
        for (Path file : files) {
            out.put(file, extractOrEmpty(extractor, file));
        }
        return out;
    }

    static List<ImportRecord> extractOrEmpty(ImportRecordExtractor extractor, Path file) {
        try {
            final List<ImportRecord> records = extractor.extract(file);
            return records == null ? List.of() : records;
        } catch (Throwable ex) {
            // errors too: a pathological source can overflow the stack of a parser
            log.debug("Extraction failed for {}: {}", file, ex.toString());
            return List.of();
        }
    }

    private static void degrade(List<Path> chunk, Map<Path, List<ImportRecord>> merged) {
        for (Path file : chunk) {
            merged.put(file, List.of());
        }
    }

    private static ExecutorService newWorkerPool(int workers) {
        final AtomicInteger seq = new AtomicInteger();
        final ThreadFactory factory = r -> {
            final Thread t = new Thread(r, "extract-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(workers, factory);
    }
}
