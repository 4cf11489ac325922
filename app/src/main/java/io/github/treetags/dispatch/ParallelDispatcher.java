package io.github.treetags.dispatch;

import io.github.treetags.engine.EngineException;
import io.github.treetags.engine.ParseQueryEngine;
import io.github.treetags.engine.QueryResult;
import io.github.treetags.files.SourceFile;
import io.github.treetags.normalize.TagNormalizer;
import io.github.treetags.profile.LanguageProfile;
import io.github.treetags.profile.LanguageProfileRegistry;
import io.github.treetags.tags.Tag;
import io.github.treetags.util.ExecutorServiceUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs parse, query and normalize for every file on a fixed pool of worker threads. A file's whole pipeline runs on
 * one worker; failures are caught per file and never stop the batch.
 */
public final class ParallelDispatcher {
    private static final Logger logger = LogManager.getLogger(ParallelDispatcher.class);

    public static final int DEFAULT_WORKERS = 4;

    /** Stack given to every worker, as a multiple of the usual 1 MiB platform default. */
    public static final int STACK_SIZE_MULTIPLIER = 16;

    public static final long PLATFORM_DEFAULT_STACK_SIZE = 1L << 20;
    public static final long WORKER_STACK_SIZE = STACK_SIZE_MULTIPLIER * PLATFORM_DEFAULT_STACK_SIZE;

    private final LanguageProfileRegistry registry;
    private final TagNormalizer normalizer;
    private final int workers;

    public ParallelDispatcher(LanguageProfileRegistry registry, TagNormalizer normalizer, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("worker count must be >= 1, got " + workers);
        }
        this.registry = registry;
        this.normalizer = normalizer;
        this.workers = workers;
    }

    private sealed interface Outcome permits Tagged, Failed, Skipped {}

    private record Tagged(List<Tag> tags) implements Outcome {}

    private record Failed(FileError error) implements Outcome {}

    private record Skipped() implements Outcome {}

    public DispatchResult run(List<SourceFile> files) {
        ExecutorService pool =
                ExecutorServiceUtil.newFixedThreadExecutor(workers, "treetags-worker-", WORKER_STACK_SIZE);
        ThreadLocal<ParseQueryEngine> engines = ThreadLocal.withInitial(ParseQueryEngine::new);
        try {
            var futures = new ArrayList<CompletableFuture<Outcome>>(files.size());
            for (SourceFile file : files) {
                futures.add(CompletableFuture.supplyAsync(() -> process(file, engines.get()), pool)
                        .exceptionally(ex -> new Failed(new FileError(file.absPath(), unwrap(ex)))));
            }
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

            var tags = new ArrayList<Tag>();
            var errors = new ArrayList<FileError>();
            int processed = 0;
            int skipped = 0;
            for (var future : futures) {
                Outcome outcome = future.join();
                if (outcome instanceof Tagged t) {
                    tags.addAll(t.tags());
                    processed++;
                } else if (outcome instanceof Failed f) {
                    errors.add(f.error());
                } else {
                    skipped++;
                }
            }
            logger.info(
                    "File processing summary: {} tagged, {} skipped, {} failed, {} tags",
                    processed,
                    skipped,
                    errors.size(),
                    tags.size());
            return new DispatchResult(List.copyOf(tags), List.copyOf(errors), processed, skipped);
        } finally {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.warn("Worker pool did not terminate within 10 seconds");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private Outcome process(SourceFile file, ParseQueryEngine engine) {
        Optional<LanguageProfile> profile = registry.resolve(file.absPath());
        if (profile.isEmpty()) {
            logger.trace("No language profile for {}", file.tagPath());
            return new Skipped();
        }
        try {
            byte[] bytes = Files.readAllBytes(file.absPath());
            QueryResult result = engine.parseAndQuery(bytes, profile.get());
            return new Tagged(normalizer.normalize(result, profile.get(), file.tagPath()));
        } catch (EngineException | IOException e) {
            logger.warn("Skipping {}: {}", file.tagPath(), e.getMessage());
            return new Failed(new FileError(file.absPath(), e));
        } catch (StackOverflowError e) {
            logger.warn("Skipping {}: nesting too deep for the worker stack", file.tagPath());
            return new Failed(new FileError(file.absPath(), e));
        } catch (RuntimeException e) {
            logger.warn("Unexpected failure processing {}", file.tagPath(), e);
            return new Failed(new FileError(file.absPath(), e));
        }
    }

    private static Throwable unwrap(@Nullable Throwable ex) {
        if (ex instanceof CompletionException && ex.getCause() != null) {
            return ex.getCause();
        }
        return ex == null ? new IllegalStateException("unknown failure") : ex;
    }
}
