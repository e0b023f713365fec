package com.knowledge.crossmodal.api;

import com.knowledge.crossmodal.identity.ResolutionResult;
import com.knowledge.crossmodal.ingest.EvidenceSource;
import com.knowledge.crossmodal.ingest.IngestionBatch;
import com.knowledge.crossmodal.ingest.IngestionGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Runs ingestion over many sources on a bounded thread pool, in three stages: extraction,
 * mention resolution, then claim ingestion. Each stage finishes for every source before the
 * next one starts, so a claim can reference an entity first mentioned in another document.
 *
 * <p>Typed per-item errors end up in the source's {@link IngestionOutcome}; anything else
 * fails the whole run.</p>
 */
public class KnowledgePipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KnowledgePipeline.class);

    private final CrossModalKnowledgeBase knowledgeBase;
    private final IngestionGateway gateway;
    private final ExecutorService executor;

    public KnowledgePipeline(CrossModalKnowledgeBase knowledgeBase, int parallelism) {
        this(knowledgeBase, new IngestionGateway(), parallelism);
    }

    public KnowledgePipeline(CrossModalKnowledgeBase knowledgeBase, IngestionGateway gateway, int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        this.knowledgeBase = knowledgeBase;
        this.gateway = gateway;
        this.executor = Executors.newFixedThreadPool(parallelism);
    }

    /**
     * @return one outcome per source, in the order given
     */
    public List<IngestionOutcome> run(List<? extends EvidenceSource> sources) {
        long start = System.nanoTime();
        List<EvidenceSource> sourceList = List.copyOf(sources);
        List<IngestionBatch> batches = stage(sourceList, (EvidenceSource source) -> gateway.collect(source));
        List<IngestionBatch> accepted = batches.stream().filter(IngestionBatch::isAccepted).toList();

        List<StageResult<ResolutionResult>> mentions =
                stage(accepted, (IngestionBatch batch) -> knowledgeBase.resolveMentions(batch));
        List<StageResult<ClaimResult>> claims =
                stage(accepted, (IngestionBatch batch) -> knowledgeBase.ingestClaims(batch));

        List<IngestionOutcome> outcomes = new ArrayList<>(batches.size());
        int next = 0;
        for (IngestionBatch batch : batches) {
            if (batch.isAccepted()) {
                outcomes.add(IngestionOutcome.of(batch.sourceId(), mentions.get(next), claims.get(next)));
                next++;
            } else {
                outcomes.add(IngestionOutcome.rejected(batch.sourceId(), batch.rejectionReason()));
            }
        }
        long failures = outcomes.stream().mapToLong(o -> o.failures().size()).sum();
        log.info("pipeline.completed sources={} accepted={} itemFailures={} durationMs={}",
                sourceList.size(), accepted.size(), failures, (System.nanoTime() - start) / 1_000_000);
        return outcomes;
    }

    private <I, O> List<O> stage(List<I> inputs, Function<I, O> task) {
        List<CompletableFuture<O>> futures = new ArrayList<>(inputs.size());
        for (I input : inputs) {
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(input), executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
