package com.archivist.sync.plan;

import com.archivist.sync.core.model.MetadataValidationException;
import com.archivist.sync.core.model.RecordMetadata;
import com.archivist.sync.extract.TextNormalizer;
import com.archivist.sync.logging.LogContext;
import com.archivist.sync.metrics.NoOpSyncMetrics;
import com.archivist.sync.metrics.SyncMetrics;
import com.archivist.sync.remote.DescriptionTooLongException;
import com.archivist.sync.remote.RemoteCampaignService;
import com.archivist.sync.remote.RemoteEntity;
import com.archivist.sync.remote.RemotePayload;
import com.archivist.sync.remote.RemoteServiceException;
import com.archivist.sync.remote.RemoteSession;
import com.archivist.sync.store.LocalRecord;
import com.archivist.sync.store.LocalRecordNotFoundException;
import com.archivist.sync.store.LocalStore;
import com.archivist.sync.store.NewRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a {@link SyncPlan} job by job.
 *
 * <p>Jobs run one at a time in plan order. Every job counts as processed exactly once,
 * whether it succeeds, is skipped or fails; a failure is recorded in the report and the
 * plan carries on. Only one execution may run at a time per executor.</p>
 */
public class SyncPlanExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SyncPlanExecutor.class);

    private final LocalStore store;
    private final RemoteCampaignService remote;
    private final SheetWriter sheets;
    private final SyncMetrics metrics;
    private final AtomicBoolean running = new AtomicBoolean();
    private final ExecutorService asyncRunner;

    public SyncPlanExecutor(LocalStore store, RemoteCampaignService remote) {
        this(store, remote, new NoOpSyncMetrics());
    }

    public SyncPlanExecutor(LocalStore store, RemoteCampaignService remote, SyncMetrics metrics) {
        this.store = store;
        this.remote = remote;
        this.sheets = new SheetWriter(store);
        this.metrics = metrics;
        this.asyncRunner = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "campaign-sync-executor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @throws SyncInProgressException if another execution is running
     * @throws IllegalStateException   if the plan was already executed
     */
    public SyncReport execute(SyncPlan plan, SyncProgressListener listener) {
        if (!running.compareAndSet(false, true)) {
            throw new SyncInProgressException("A sync plan is already executing");
        }
        try (LogContext ctx = LogContext.forSync(plan.getId()).with("campaignId", plan.getCampaignId())) {
            if (!plan.consume()) {
                throw new IllegalStateException("Sync plan " + plan.getId() + " was already executed");
            }
            return run(plan, listener != null ? listener : SyncProgressListener.NOOP);
        } finally {
            running.set(false);
        }
    }

    /**
     * Runs {@link #execute} on the executor's own thread.
     */
    public CompletableFuture<SyncReport> executeAsync(SyncPlan plan, SyncProgressListener listener) {
        return CompletableFuture.supplyAsync(() -> execute(plan, listener), asyncRunner);
    }

    public boolean isRunning() {
        return running.get();
    }

    private SyncReport run(SyncPlan plan, SyncProgressListener listener) {
        Instant start = Instant.now();
        int total = plan.total();
        int processed = 0;
        int done = 0;
        int skipped = 0;
        List<SyncReport.FailedJob> failures = new ArrayList<>();

        log.info("sync.plan.start total={} createLocal={} imports={} recaps={} exports={} links={}",
                total, plan.getCreateLocal().size(), plan.getImports().size(), plan.getRecaps().size(),
                plan.getCreateInRemote().size(), plan.getLink().size());
        listener.onProgress(new SyncProgress(0, total, null, null));

        for (SyncJob job : plan.jobs()) {
            JobOutcome outcome;
            try {
                outcome = runJob(plan, job);
            } catch (DescriptionTooLongException e) {
                outcome = fail(failures, job, SyncReport.FailureKind.DESCRIPTION_TOO_LONG, e);
            } catch (RemoteServiceException e) {
                outcome = fail(failures, job, SyncReport.FailureKind.REMOTE_SERVICE, e);
            } catch (LocalRecordNotFoundException | MetadataValidationException e) {
                outcome = fail(failures, job, SyncReport.FailureKind.LOCAL_STORE, e);
            } catch (RuntimeException e) {
                log.error("sync.job.error type={} name='{}'", job.type(), job.name(), e);
                outcome = fail(failures, job, SyncReport.FailureKind.UNEXPECTED, e);
            }
            if (outcome == JobOutcome.DONE) {
                done++;
            } else if (outcome == JobOutcome.SKIPPED) {
                skipped++;
            }
            processed++;
            metrics.recordJob(job.type(), outcome);
            listener.onProgress(new SyncProgress(processed, total, job.type(), job.name()));
        }

        Duration duration = Duration.between(start, Instant.now());
        metrics.recordPlanDuration(duration, failures.size());
        log.info("sync.plan.done processed={} done={} skipped={} failed={} durationMs={}",
                processed, done, skipped, failures.size(), duration.toMillis());
        return new SyncReport(plan, total, processed, done, skipped, failures, duration);
    }

    private JobOutcome fail(List<SyncReport.FailedJob> failures, SyncJob job, SyncReport.FailureKind kind,
                            RuntimeException e) {
        log.warn("sync.job.failed type={} kind={} name='{}' failure={} error={}",
                job.type(), job.kind().getLabel(), job.name(), kind, e.getMessage());
        failures.add(new SyncReport.FailedJob(job, kind, e.getMessage()));
        return JobOutcome.FAILED;
    }

    private JobOutcome runJob(SyncPlan plan, SyncJob job) {
        return switch (job.type()) {
            case CREATE_LOCAL -> createLocal(plan, job);
            case IMPORT -> importSheet(plan, job);
            case RECAP -> recap(plan, job);
            case LINK -> link(plan, job);
            case EXPORT -> export(plan, job);
        };
    }

    private JobOutcome createLocal(SyncPlan plan, SyncJob job) {
        Optional<RemoteEntity> source = plan.getSource().find(job.kind().getRemoteKind(), job.remoteId());
        if (source.isEmpty()) {
            log.warn("sync.job.skipped type={} name='{}' reason=remote-missing remoteId={}",
                    job.type(), job.name(), job.remoteId());
            return JobOutcome.SKIPPED;
        }
        if (store.findByRemoteId(job.kind().getLocalKind(), job.remoteId()).isPresent()) {
            return JobOutcome.SKIPPED;
        }
        RemoteEntity entity = source.get();
        RecordMetadata.Builder metadata = RecordMetadata.builder()
                .remoteId(entity.id())
                .remoteCampaignId(plan.getCampaignId());
        String id = switch (job.kind()) {
            case PC, NPC -> store.createCharacter(new NewRecord(entity.name(),
                    job.kind() == SyncJobKind.NPC ? "npc" : "character", "", entity.image(),
                    entity.description(), metadata.build()));
            case ITEM -> store.createItem(new NewRecord(entity.name(), "loot", "", entity.image(),
                    entity.description(), metadata.build()));
            case LOCATION -> {
                if (entity.parentId() != null) {
                    metadata.parentLocationId(entity.parentId());
                }
                yield store.createLocation(new NewRecord(entity.name(), "", "", entity.image(),
                        entity.description(), metadata.build()));
            }
            default -> throw new IllegalArgumentException("Cannot create local " + job.kind().getLabel());
        };
        log.debug("sync.local.created kind={} id={} remoteId={}", job.kind().getLabel(), id, entity.id());
        return JobOutcome.DONE;
    }

    private JobOutcome importSheet(SyncPlan plan, SyncJob job) {
        Optional<RemoteEntity> source = plan.getSource().find(job.kind().getRemoteKind(), job.remoteId());
        if (source.isEmpty()) {
            log.warn("sync.job.skipped type={} name='{}' reason=remote-missing remoteId={}",
                    job.type(), job.name(), job.remoteId());
            return JobOutcome.SKIPPED;
        }
        if (store.findByRemoteId(job.kind().getLocalKind(), job.remoteId()).isPresent()) {
            return JobOutcome.SKIPPED;
        }
        SheetWriter.SheetWrite write = sheets.ensureSheet(job.kind().getRemoteKind(), source.get(), plan.getCampaignId());
        return write.change() == SheetWriter.Change.CREATED ? JobOutcome.DONE : JobOutcome.SKIPPED;
    }

    private JobOutcome recap(SyncPlan plan, SyncJob job) {
        Optional<RemoteSession> session = plan.getSource().sessions().stream()
                .filter(s -> s.id().equals(job.remoteId()))
                .findFirst();
        if (session.isEmpty()) {
            log.warn("sync.job.skipped type={} name='{}' reason=session-missing", job.type(), job.name());
            return JobOutcome.SKIPPED;
        }
        SheetWriter.SheetWrite write = sheets.upsertRecap(session.get(), plan.getCampaignId());
        return write.change() == SheetWriter.Change.UNCHANGED ? JobOutcome.SKIPPED : JobOutcome.DONE;
    }

    private JobOutcome link(SyncPlan plan, SyncJob job) {
        if (store.find(job.localId()).isEmpty()) {
            log.warn("sync.job.skipped type={} name='{}' reason=local-missing localId={}",
                    job.type(), job.name(), job.localId());
            return JobOutcome.SKIPPED;
        }
        store.setCrossReference(job.localId(), job.remoteId(), plan.getCampaignId());
        if (job.kind() == SyncJobKind.LOCATION) {
            RemoteEntity location = plan.getSource().find(job.kind().getRemoteKind(), job.remoteId())
                    .orElseGet(() -> RemoteEntity.named(job.remoteId(), job.name()));
            sheets.attachScene(location, job.localId(), plan.getCampaignId());
        }
        return JobOutcome.DONE;
    }

    private JobOutcome export(SyncPlan plan, SyncJob job) {
        Optional<LocalRecord> found = store.find(job.localId());
        if (found.isEmpty()) {
            log.warn("sync.job.skipped type={} name='{}' reason=local-missing localId={}",
                    job.type(), job.name(), job.localId());
            return JobOutcome.SKIPPED;
        }
        LocalRecord record = found.get();
        if (record.getMetadata().isBoundTo(plan.getCampaignId())) {
            return JobOutcome.SKIPPED;
        }
        RemotePayload.Builder payload = RemotePayload.builder()
                .campaignId(plan.getCampaignId())
                .name(record.getName())
                .description(TextNormalizer.toMarkdown(record.getDescription()))
                .image(record.getImage().orElse(null));
        if (job.kind().isCharacter()) {
            payload.type(job.kind().getLabel());
        }
        String remoteId = remote.create(job.kind().getRemoteKind(), payload.build());
        store.setCrossReference(record.getId(), remoteId, plan.getCampaignId());
        log.debug("sync.remote.created kind={} localId={} remoteId={}", job.kind().getLabel(), record.getId(), remoteId);
        return JobOutcome.DONE;
    }

    @Override
    public void close() {
        asyncRunner.shutdown();
    }
}
