package com.archivist.sync.plan;

import com.archivist.sync.reconcile.Category;
import com.archivist.sync.remote.RemoteEntity;
import com.archivist.sync.remote.RemoteSnapshot;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An ordered batch of jobs derived from a confirmed reconciliation.
 *
 * <p>Execution order is fixed: local creations, sheet imports, recaps, then exports and
 * links. The total is known up front. A plan can be executed once; use
 * {@link #retryOf(SyncReport)} to run the failed jobs again.</p>
 */
public final class SyncPlan {

    private final String id;
    private final RemoteSnapshot source;
    private final List<SyncJob> createLocal;
    private final List<SyncJob> imports;
    private final List<SyncJob> recaps;
    private final List<SyncJob> createInRemote;
    private final List<SyncJob> link;
    private final Map<Category, List<RemoteEntity>> importCandidates;
    private final AtomicBoolean consumed = new AtomicBoolean();

    SyncPlan(RemoteSnapshot source,
             List<SyncJob> createLocal,
             List<SyncJob> imports,
             List<SyncJob> recaps,
             List<SyncJob> createInRemote,
             List<SyncJob> link,
             Map<Category, List<RemoteEntity>> importCandidates) {
        this.id = UUID.randomUUID().toString();
        this.source = Objects.requireNonNull(source, "source");
        this.createLocal = List.copyOf(createLocal);
        this.imports = List.copyOf(imports);
        this.recaps = List.copyOf(recaps);
        this.createInRemote = List.copyOf(createInRemote);
        this.link = List.copyOf(link);
        Map<Category, List<RemoteEntity>> candidates = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            candidates.put(category, List.copyOf(importCandidates.getOrDefault(category, List.of())));
        }
        this.importCandidates = candidates;
    }

    /**
     * A new plan holding only the jobs that failed in {@code report}, in their original order.
     */
    public static SyncPlan retryOf(SyncReport report) {
        SyncPlan original = report.plan();
        Set<SyncJob> failed = new HashSet<>();
        report.failedJobs().forEach(f -> failed.add(f.job()));

        Map<Category, List<RemoteEntity>> candidates = new EnumMap<>(Category.class);
        original.importCandidates.forEach((category, entities) -> candidates.put(category, entities.stream()
                .filter(e -> failed.stream().anyMatch(j -> e.id().equals(j.remoteId())
                        && (j.type() == JobType.CREATE_LOCAL || j.type() == JobType.IMPORT)))
                .toList()));

        return new SyncPlan(original.source,
                keep(original.createLocal, failed),
                keep(original.imports, failed),
                keep(original.recaps, failed),
                keep(original.createInRemote, failed),
                keep(original.link, failed),
                candidates);
    }

    private static List<SyncJob> keep(List<SyncJob> jobs, Set<SyncJob> failed) {
        return jobs.stream().filter(failed::contains).toList();
    }

    public String getId() {
        return id;
    }

    public String getCampaignId() {
        return source.campaignId();
    }

    public RemoteSnapshot getSource() {
        return source;
    }

    public List<SyncJob> getCreateLocal() {
        return createLocal;
    }

    public List<SyncJob> getImports() {
        return imports;
    }

    public List<SyncJob> getRecaps() {
        return recaps;
    }

    /**
     * Export jobs: local-only records to create remotely.
     */
    public List<SyncJob> getCreateInRemote() {
        return createInRemote;
    }

    public List<SyncJob> getLink() {
        return link;
    }

    public List<RemoteEntity> getImportCandidates(Category category) {
        return importCandidates.get(category);
    }

    /**
     * All jobs in execution order.
     */
    public List<SyncJob> jobs() {
        List<SyncJob> all = new ArrayList<>(total());
        all.addAll(createLocal);
        all.addAll(imports);
        all.addAll(recaps);
        all.addAll(createInRemote);
        all.addAll(link);
        return all;
    }

    public int total() {
        return createLocal.size() + imports.size() + recaps.size() + createInRemote.size() + link.size();
    }

    public int importCount(Category category) {
        return importCandidates.get(category).size();
    }

    public int exportCount(Category category) {
        return count(createInRemote, category);
    }

    public int linkedCount(Category category) {
        return count(link, category);
    }

    public int factionsCount() {
        return (int) imports.stream().filter(j -> j.kind() == SyncJobKind.FACTION).count();
    }

    public int recapsCount() {
        return recaps.size();
    }

    public boolean isEmpty() {
        return total() == 0;
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    /**
     * @return false if the plan was already consumed
     */
    boolean consume() {
        return consumed.compareAndSet(false, true);
    }

    private static int count(List<SyncJob> jobs, Category category) {
        return (int) jobs.stream().filter(j -> j.kind().getRemoteKind() == category.getRemoteKind()).count();
    }

    @Override
    public String toString() {
        return "SyncPlan{" +
                "id='" + id + '\'' +
                ", campaignId='" + getCampaignId() + '\'' +
                ", createLocal=" + createLocal.size() +
                ", imports=" + imports.size() +
                ", recaps=" + recaps.size() +
                ", createInRemote=" + createInRemote.size() +
                ", link=" + link.size() +
                '}';
    }
}
