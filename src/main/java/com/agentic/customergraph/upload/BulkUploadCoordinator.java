package com.agentic.customergraph.upload;

import com.agentic.customergraph.core.Entity;
import com.agentic.customergraph.core.GraphSnapshot;
import com.agentic.customergraph.core.Relationship;
import com.agentic.customergraph.exception.CrossCustomerViolationException;
import com.agentic.customergraph.exception.CustomerGraphException;
import com.agentic.customergraph.exception.GraphDatabaseException;
import com.agentic.customergraph.exception.InvalidSnapshotException;
import com.agentic.customergraph.exception.PartialUploadFailureException;
import com.agentic.customergraph.exception.UploadTimeoutException;
import com.agentic.customergraph.exception.WriteOutcome;
import com.agentic.customergraph.storage.ExtractionStore;
import com.agentic.customergraph.storage.GraphDatabase;
import com.agentic.customergraph.storage.UploadRecordStore;
import com.agentic.customergraph.storage.UploadRecordStore.UploadRecord;
import com.agentic.customergraph.storage.UploadRecordStore.UploadStatus;
import com.agentic.customergraph.utils.LockUtil;
import com.agentic.customergraph.utils.RetryEventLogger;
import com.agentic.customergraph.utils.SensitiveDataSanitizer;
import com.agentic.customergraph.utils.TransientFailurePredicate;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Drives graph snapshots from the {@link ExtractionStore} into the
 * {@link GraphDatabase}, tracking each extraction in the
 * {@link UploadRecordStore}.
 *
 * <p>For one customer, extractions are handled one after another in id order
 * while the customer's lock is held. Different customers run in parallel
 * through {@link #uploadAll}. Every upload writes all vertices before any
 * edge and relies on upserts, so a retry re-sends the whole snapshot.</p>
 *
 * <p>Each extraction moves through {@code PENDING -> IN_PROGRESS -> SUCCEEDED}
 * or {@code ... -> FAILED -> PENDING} for another attempt, each transition
 * appended as an Upload Record. Retryable failures are retried within the run
 * up to {@link UploadSettings#maxAttempts()} with exponential backoff; a
 * record left FAILED is picked up again by the next run.</p>
 */
public class BulkUploadCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(BulkUploadCoordinator.class);

    static final String LOCK_SCOPE = "bulk-upload";
    static final String MDC_CUSTOMER = "customer.id";
    static final String MDC_EXTRACTION = "extraction.id";
    static final String INTERRUPTED_ATTEMPT = "Previous attempt ended without a final state";

    private final ExtractionStore extractionStore;
    private final GraphDatabase graphDatabase;
    private final UploadRecordStore uploadRecords;
    private final UploadSettings settings;
    private final UploadMetricsSink metricsSink;
    private final Sleeper sleeper;
    private final RetryEventLogger retryLogger = new RetryEventLogger();
    private final TransientFailurePredicate transientFailure = new TransientFailurePredicate();

    public BulkUploadCoordinator(
            @NotNull ExtractionStore extractionStore,
            @NotNull GraphDatabase graphDatabase,
            @NotNull UploadRecordStore uploadRecords,
            @NotNull UploadSettings settings,
            @NotNull UploadMetricsSink metricsSink,
            @NotNull Sleeper sleeper) {
        this.extractionStore = Objects.requireNonNull(extractionStore, "extractionStore must not be null");
        this.graphDatabase = Objects.requireNonNull(graphDatabase, "graphDatabase must not be null");
        this.uploadRecords = Objects.requireNonNull(uploadRecords, "uploadRecords must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.metricsSink = Objects.requireNonNull(metricsSink, "metricsSink must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public BulkUploadCoordinator(
            @NotNull ExtractionStore extractionStore,
            @NotNull GraphDatabase graphDatabase,
            @NotNull UploadRecordStore uploadRecords,
            @NotNull UploadSettings settings,
            @NotNull UploadMetricsSink metricsSink) {
        this(extractionStore, graphDatabase, uploadRecords, settings, metricsSink, Sleeper.SYSTEM);
    }

    public BulkUploadResult upload(@NotNull BulkUploadRequest request) {
        return upload(request, CancellationToken.create());
    }

    /**
     * Uploads every eligible extraction of one customer, or only validates
     * them when {@code dry_run} is set.
     *
     * @throws CrossCustomerViolationException if another customer's data is encountered; the batch stops
     * @throws IllegalArgumentException if the customer id is blank
     */
    public BulkUploadResult upload(@NotNull BulkUploadRequest request, @NotNull CancellationToken token) {
        Objects.requireNonNull(request, "request must not be null");
        String customerId = request.customerId();
        if (customerId == null || customerId.isBlank()) {
            throw new IllegalArgumentException("customer_id must not be blank");
        }

        ReentrantLock lock = LockUtil.customerLock(LOCK_SCOPE, customerId);
        lock.lock();
        MDC.put(MDC_CUSTOMER, customerId);
        try {
            return runBatch(customerId, request.dryRun(), token);
        } finally {
            MDC.remove(MDC_CUSTOMER);
            lock.unlock();
        }
    }

    /**
     * Uploads several customers concurrently, at most
     * {@link UploadSettings#parallelism()} at a time. A cross-customer
     * violation cancels the remaining work and is rethrown once every started
     * customer has finished.
     *
     * @return one result per distinct customer, in input order
     */
    public List<BulkUploadResult> uploadAll(@NotNull List<String> customerIds, boolean dryRun,
            @NotNull CancellationToken token) {
        List<String> customers = customerIds.stream().distinct().toList();
        if (customers.isEmpty()) {
            return List.of();
        }

        ExecutorService pool = Executors.newFixedThreadPool(
            Math.min(settings.parallelism(), customers.size()), new UploadThreadFactory());
        try {
            List<CompletableFuture<BulkUploadResult>> futures = new ArrayList<>();
            for (String customerId : customers) {
                futures.add(CompletableFuture
                    .supplyAsync(() -> upload(new BulkUploadRequest(customerId, dryRun), token), pool)
                    .whenComplete((result, failure) -> {
                        if (failure != null && unwrap(failure) instanceof CrossCustomerViolationException) {
                            token.cancel();
                        }
                    }));
            }

            List<BulkUploadResult> results = new ArrayList<>();
            RuntimeException firstFailure = null;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).join());
                } catch (CompletionException e) {
                    Throwable cause = unwrap(e);
                    logger.error("Bulk upload failed for customer {}: {}", customers.get(i),
                        SensitiveDataSanitizer.sanitize(cause.getMessage()));
                    if (firstFailure == null || cause instanceof CrossCustomerViolationException) {
                        firstFailure = cause instanceof RuntimeException runtime
                            ? runtime : new CompletionException(cause);
                    }
                }
            }
            if (firstFailure != null) {
                throw firstFailure;
            }
            return results;
        } finally {
            pool.shutdown();
        }
    }

    private BulkUploadResult runBatch(String customerId, boolean dryRun, CancellationToken token) {
        long started = System.nanoTime();
        List<String> extractionIds = awaitWithRetry(customerId, null, "listExtractions",
            () -> extractionStore.listExtractions(customerId));
        Map<String, UploadRecord> latest = latestRecords(customerId);

        logger.info("Starting {}upload for customer {}: {} extractions discovered",
            dryRun ? "dry-run " : "", customerId, extractionIds.size());

        Tally tally = new Tally();
        boolean cancelled = false;
        for (String extractionId : extractionIds) {
            if (token.isCancellationRequested()) {
                cancelled = true;
                logger.info("Upload for customer {} cancelled after {} extractions", customerId, tally.processed);
                break;
            }
            UploadRecord current = latest.get(extractionId);
            if (current != null && current.status() == UploadStatus.SUCCEEDED) {
                tally.skipped++;
                continue;
            }

            MDC.put(MDC_EXTRACTION, extractionId);
            try {
                tally.add(dryRun
                    ? validateOnly(customerId, extractionId)
                    : uploadExtraction(customerId, extractionId, current));
            } finally {
                MDC.remove(MDC_EXTRACTION);
            }
        }

        double durationSeconds = (System.nanoTime() - started) / 1_000_000_000.0;
        BulkUploadResult result = new BulkUploadResult(customerId, tally.processed, tally.succeeded, tally.failed,
            tally.skipped, tally.nodes, tally.edges, durationSeconds, dryRun, cancelled);
        logger.info("Finished upload for customer {}: processed={} succeeded={} failed={} skipped={} in {}s",
            customerId, result.processed(), result.succeeded(), result.failed(), result.skipped(),
            String.format("%.3f", durationSeconds));
        return result;
    }

    /**
     * Latest record per extraction, after checking every record belongs to the customer.
     */
    private Map<String, UploadRecord> latestRecords(String customerId) {
        List<UploadRecord> records = awaitWithRetry(customerId, null, "latestUploadRecords",
            () -> uploadRecords.latestByCustomer(customerId));
        Map<String, UploadRecord> byExtraction = new HashMap<>();
        for (UploadRecord record : records) {
            SnapshotValidator.requireCustomer(customerId, record.extractionId(), record.customerId());
            byExtraction.put(record.extractionId(), record);
        }
        return byExtraction;
    }

    private ExtractionResult validateOnly(String customerId, String extractionId) {
        long started = System.nanoTime();
        UploadOutcome outcome;
        try {
            GraphSnapshot snapshot = awaitWithRetry(customerId, extractionId, "readSnapshot",
                () -> extractionStore.read(customerId, extractionId));
            List<String> problems = SnapshotValidator.validate(customerId, extractionId, snapshot);
            if (problems.isEmpty()) {
                outcome = UploadOutcome.VALIDATED;
                logger.debug("Dry run: snapshot {} is valid ({} nodes, {} edges)",
                    extractionId, snapshot.nodes().size(), snapshot.edges().size());
            } else {
                outcome = UploadOutcome.INVALID;
                logger.warn("Dry run: snapshot {} would be rejected: {}", extractionId, problems);
            }
        } catch (CrossCustomerViolationException e) {
            throw e;
        } catch (CustomerGraphException e) {
            outcome = UploadOutcome.INVALID;
            logger.warn("Dry run: snapshot {} could not be read: {}", extractionId,
                SensitiveDataSanitizer.sanitize(e.getMessage()));
        }
        metricsSink.record(new UploadMetricEvent(customerId, extractionId, outcome, elapsedSince(started), 0, 0, 0));
        return new ExtractionResult(outcome, 0, 0);
    }

    private ExtractionResult uploadExtraction(String customerId, String extractionId, UploadRecord latest) {
        long started = System.nanoTime();
        String operation = "upload " + customerId + "/" + extractionId;
        UploadRecord current = prepare(customerId, extractionId, latest);

        int attempt = 0;
        while (true) {
            attempt++;
            UploadRecord inProgress = append(current.asInProgress());
            WriteProgress progress = new WriteProgress();
            try {
                writeSnapshot(customerId, extractionId, progress);
                append(inProgress.asSucceeded(progress.nodes, progress.edges));
                retryLogger.logRetrySuccess(operation, attempt);
                metricsSink.record(new UploadMetricEvent(customerId, extractionId, UploadOutcome.SUCCEEDED,
                    elapsedSince(started), progress.nodes, progress.edges, attempt));
                logger.info("Uploaded snapshot {} for customer {}: {} vertices, {} edges",
                    extractionId, customerId, progress.nodes, progress.edges);
                return new ExtractionResult(UploadOutcome.SUCCEEDED, progress.nodes, progress.edges);
            } catch (CrossCustomerViolationException e) {
                append(inProgress.asFailed(SensitiveDataSanitizer.sanitize(e.getMessage()),
                    progress.nodes, progress.edges));
                throw e;
            } catch (RuntimeException e) {
                RuntimeException failure = progress.any()
                    ? new PartialUploadFailureException(customerId, extractionId, progress.nodes, progress.edges, e)
                    : e;
                UploadRecord failed = append(inProgress.asFailed(SensitiveDataSanitizer.sanitize(failure.getMessage()),
                    progress.nodes, progress.edges));

                boolean retryable = isRetryable(e);
                if (retryable && attempt < settings.maxAttempts()) {
                    retryLogger.logRetryAttempt(operation, attempt + 1, settings.maxAttempts(), failure);
                    if (pause(settings.backoffAfter(attempt))) {
                        current = append(failed.asRetryPending());
                        continue;
                    }
                }

                if (retryable) {
                    retryLogger.logRetryExhausted(operation, attempt, failure);
                } else {
                    logger.error("Upload of snapshot {} for customer {} failed permanently: {}",
                        extractionId, customerId, SensitiveDataSanitizer.sanitize(failure.getMessage()));
                }
                UploadOutcome outcome = e instanceof UploadTimeoutException
                    ? UploadOutcome.TIMED_OUT : UploadOutcome.FAILED;
                metricsSink.record(new UploadMetricEvent(customerId, extractionId, outcome,
                    elapsedSince(started), progress.nodes, progress.edges, attempt));
                return new ExtractionResult(outcome, progress.nodes, progress.edges);
            }
        }
    }

    /**
     * Brings the extraction's record to PENDING, appending whatever transitions that takes.
     */
    private UploadRecord prepare(String customerId, String extractionId, UploadRecord latest) {
        if (latest == null) {
            return append(UploadRecord.pending(customerId, extractionId));
        }
        return switch (latest.status()) {
            case PENDING -> latest;
            case FAILED -> append(latest.asRetryPending());
            case IN_PROGRESS -> {
                logger.warn("Snapshot {} was left IN_PROGRESS by an earlier run; marking it failed", extractionId);
                UploadRecord failed = append(latest.asFailed(INTERRUPTED_ATTEMPT,
                    latest.nodesWritten(), latest.edgesWritten()));
                yield append(failed.asRetryPending());
            }
            case SUCCEEDED -> throw new IllegalStateException("Snapshot " + extractionId + " already uploaded");
        };
    }

    private void writeSnapshot(String customerId, String extractionId, WriteProgress progress) {
        GraphSnapshot snapshot = await(customerId, extractionId, "readSnapshot",
            () -> extractionStore.read(customerId, extractionId), WriteOutcome.NOTHING_WRITTEN);
        List<String> problems = SnapshotValidator.validate(customerId, extractionId, snapshot);
        if (!problems.isEmpty()) {
            throw new InvalidSnapshotException(customerId, extractionId, problems);
        }

        for (Entity node : snapshot.nodes()) {
            await(customerId, extractionId, "upsertVertex",
                () -> graphDatabase.upsertVertex(customerId, node.getId(), node.getType().name(),
                    vertexProperties(node)),
                progress.outcome());
            progress.nodes++;
        }
        for (Relationship edge : snapshot.edges()) {
            await(customerId, extractionId, "upsertEdge",
                () -> graphDatabase.upsertEdge(customerId, edge.getId(), edge.getSourceId(), edge.getTargetId(),
                    edge.getType().name(), edgeProperties(edge)),
                progress.outcome());
            progress.edges++;
        }
    }

    static Map<String, Object> vertexProperties(Entity node) {
        Map<String, Object> properties = new LinkedHashMap<>(node.getProperties());
        properties.put("label", node.getLabel());
        properties.put("confidence", node.getConfidence());
        properties.put("sources", node.getSources().stream().map(source -> source.wireName()).toList());
        properties.put("evidence", node.getEvidence());
        properties.put("extraction_id", node.getExtractionId());
        properties.put("created_at", node.getCreatedAt().toString());
        return properties;
    }

    static Map<String, Object> edgeProperties(Relationship edge) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("confidence", edge.getConfidence());
        properties.put("evidence", edge.getEvidence());
        if (!edge.getReasoning().isEmpty()) {
            properties.put("reasoning", edge.getReasoning());
        }
        properties.put("source", edge.getSource().wireName());
        properties.put("extraction_id", edge.getExtractionId());
        return properties;
    }

    private boolean isRetryable(Throwable failure) {
        if (failure instanceof InvalidSnapshotException) {
            return false;
        }
        return transientFailure.test(failure);
    }

    /**
     * @return false if interrupted while waiting, in which case no further attempt is made
     */
    private boolean pause(Duration delay) {
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted during upload backoff; giving up on further attempts");
            return false;
        }
    }

    private UploadRecord append(UploadRecord record) {
        await(record.customerId(), record.extractionId(), "appendUploadRecord",
            () -> uploadRecords.append(record), WriteOutcome.NOTHING_WRITTEN);
        return record;
    }

    /**
     * Runs a discovery or read call, retrying transient failures with backoff.
     */
    private <T> T awaitWithRetry(String customerId, String extractionId, String operation,
            Supplier<CompletableFuture<T>> call) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                T value = await(customerId, extractionId, operation, call, WriteOutcome.NOTHING_WRITTEN);
                retryLogger.logRetrySuccess(operation, attempt);
                return value;
            } catch (RuntimeException e) {
                boolean retryable = isRetryable(e);
                if (retryable && attempt < settings.maxAttempts()) {
                    retryLogger.logRetryAttempt(operation, attempt + 1, settings.maxAttempts(), e);
                    if (pause(settings.backoffAfter(attempt))) {
                        continue;
                    }
                }
                if (retryable) {
                    retryLogger.logRetryExhausted(operation, attempt, e);
                }
                throw e;
            }
        }
    }

    /**
     * Waits for one store or database call, bounded by the call timeout.
     *
     * <p>Cancelling a {@link CompletableFuture} does not stop the work behind
     * it, so an upsert that timed out may still be applied after the FAILED
     * record is appended. Upserts are keyed by id, and the next run rewrites
     * the same vertices and edges.</p>
     */
    private <T> T await(String customerId, String extractionId, String operation,
            Supplier<CompletableFuture<T>> call, WriteOutcome outcomeOnTimeout) {
        CompletableFuture<T> future = call.get();
        try {
            return future.get(settings.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new UploadTimeoutException(customerId, extractionId, operation, settings.callTimeout(),
                outcomeOnTimeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new GraphDatabaseException(operation + " failed: " + cause.getMessage(), customerId,
                transientFailure.test(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GraphDatabaseException(operation + " was interrupted", customerId, false, e);
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private record ExtractionResult(UploadOutcome outcome, int nodes, int edges) {
    }

    private static final class WriteProgress {
        int nodes;
        int edges;

        boolean any() {
            return nodes > 0 || edges > 0;
        }

        WriteOutcome outcome() {
            return any() ? WriteOutcome.PARTIAL_WRITE_RETRY_SAFE : WriteOutcome.NOTHING_WRITTEN;
        }
    }

    private static final class Tally {
        int processed;
        int succeeded;
        int failed;
        int skipped;
        int nodes;
        int edges;

        void add(ExtractionResult result) {
            processed++;
            nodes += result.nodes();
            edges += result.edges();
            switch (result.outcome()) {
                case SUCCEEDED -> succeeded++;
                case FAILED, TIMED_OUT, INVALID -> failed++;
                case VALIDATED -> { }
            }
        }
    }

    private static final class UploadThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(@NotNull Runnable task) {
            Thread thread = new Thread(task, "bulk-upload-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
