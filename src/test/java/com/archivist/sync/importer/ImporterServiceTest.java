package com.archivist.sync.importer;

import com.archivist.sync.api.PageRequest;
import com.archivist.sync.core.model.EntityKind;
import com.archivist.sync.core.model.TargetType;
import com.archivist.sync.mapping.MappingCorrections;
import com.archivist.sync.metrics.NoOpSyncMetrics;
import com.archivist.sync.metrics.SyncMetrics;
import com.archivist.sync.remote.FakeRemoteCampaignService;
import com.archivist.sync.remote.RemoteEntityKind;
import com.archivist.sync.review.ReviewItem;
import com.archivist.sync.review.ReviewStatus;
import com.archivist.sync.store.InMemoryLocalStore;
import com.archivist.sync.store.LocalRecord;
import com.archivist.sync.store.LocalRecordKind;
import com.archivist.sync.store.NewRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ImporterServiceTest {

    private InMemoryLocalStore store;
    private FakeRemoteCampaignService remote;
    private ImporterService importer;

    private String tess;
    private String mira;
    private String rope;
    private String harbor;

    @BeforeEach
    void setUp() {
        store = new InMemoryLocalStore();
        tess = store.createCharacter(new NewRecord("Tess", "character", "", null, "<p>A wandering bard</p>", null));
        mira = store.createCharacter(new NewRecord("Mira", "npc", "", null, "", null));
        store.put(LocalRecord.builder()
                .id("journal-90")
                .kind(LocalRecordKind.NOTE)
                .name("Shopping list")
                .description("bread")
                .build());
        rope = store.createItem(new NewRecord("Rope", "loot", "", null, "", null));
        harbor = store.createLocation(new NewRecord("Harbor", "", "", null, "", null));

        remote = new FakeRemoteCampaignService();
        importer = importer(new NoOpSyncMetrics());
    }

    private ImporterService importer(SyncMetrics metrics) {
        return ImporterService.builder()
                .store(store)
                .upserter(new RemoteUpserter(remote, store))
                .campaignId("c-1")
                .metrics(metrics)
                .build();
    }

    private LocalRecord record(String id) {
        return store.find(id).orElseThrow();
    }

    @Nested
    @DisplayName("Run")
    class Run {

        @Test
        @DisplayName("Scores should route entities to import, review or drop")
        void testRouting() {
            ImportSummary summary = importer.runImport();

            assertEquals(5, summary.total());
            assertTrue(summary.isDone());
            assertEquals(3, summary.autoImported());
            assertEquals(1, summary.queued());
            assertEquals(1, summary.dropped());
            assertEquals(0, summary.errors());
            assertEquals(2, remote.count(RemoteEntityKind.CHARACTER));
            assertEquals(1, remote.count(RemoteEntityKind.LOCATION));
            assertEquals(0, remote.count(RemoteEntityKind.ITEM));
            assertEquals(rope, importer.getReviewQueue().getPending(PageRequest.first(10)).content().get(0).getSourceId());
        }

        @Test
        @DisplayName("Imported records should be bound and fingerprinted")
        void testBinding() {
            importer.runImport();

            LocalRecord bound = record(tess);
            assertTrue(bound.getMetadata().isBoundTo("c-1"));
            assertTrue(bound.getMetadata().getFingerprint().isPresent());
            assertTrue(record(rope).getRemoteId().isEmpty());
        }

        @Test
        @DisplayName("A second run should skip unchanged records")
        void testUnchanged() {
            importer.runImport();
            int created = remote.created().size();

            ImportSummary second = importer.runImport();

            assertEquals(3, second.unchanged());
            assertEquals(0, second.autoImported());
            assertEquals(created, remote.created().size());
            assertEquals(1, importer.getReviewQueue().countPending());
        }

        @Test
        @DisplayName("An edited record should be updated on the next run")
        void testChangedRecordUpdated() {
            importer.runImport();
            store.rename(harbor, "Old Harbor");

            ImportSummary second = importer.runImport();

            assertEquals(1, second.autoImported());
            assertEquals(2, second.unchanged());
            assertEquals(1, remote.updatedIds().size());
        }

        @Test
        @DisplayName("Progress should be reported before and after every entity")
        void testProgress() {
            List<ImportSummary> events = new ArrayList<>();

            importer.runImport(events::add);

            assertEquals(6, events.size());
            assertEquals(0, events.get(0).completed());
            assertEquals(5, events.get(5).completed());
        }

        @Test
        @DisplayName("Remote failures should be counted, not thrown")
        void testFailuresCounted() {
            remote.failWrites(RemoteEntityKind.CHARACTER);

            ImportSummary summary = importer.runImport();

            assertEquals(2, summary.errors());
            assertEquals(1, summary.autoImported());
            assertEquals(5, summary.completed());
            assertTrue(record(tess).getMetadata().getFingerprint().isEmpty());
        }
    }

    @Nested
    @DisplayName("Review")
    class Review {

        @Test
        @DisplayName("Approving a queued proposal should upsert it")
        void testApprove() {
            importer.runImport();
            ReviewItem item = importer.getReviewQueue().findPendingBySource(rope).orElseThrow();

            RemoteUpserter.UpsertResult result = importer.approve(item.getId(), "gm", "fine");

            assertEquals(RemoteUpserter.Outcome.CREATED, result.outcome());
            assertEquals(1, remote.count(RemoteEntityKind.ITEM));
            assertEquals(ReviewStatus.APPROVED, importer.getReviewQueue().get(item.getId()).orElseThrow().getStatus());
            assertEquals(item.getFingerprint(), record(rope).getMetadata().getFingerprint().orElseThrow());
        }

        @Test
        @DisplayName("Rejecting should leave the record untouched")
        void testReject() {
            importer.runImport();
            ReviewItem item = importer.getReviewQueue().findPendingBySource(rope).orElseThrow();

            importer.reject(item.getId(), "gm", "not loot");

            assertEquals(0, importer.getReviewQueue().countPending());
            assertTrue(record(rope).getRemoteId().isEmpty());
            assertThrows(IllegalStateException.class, () -> importer.approve(item.getId(), "gm", null));
        }

        @Test
        @DisplayName("Approving an unknown item should fail")
        void testApproveUnknown() {
            assertThrows(IllegalArgumentException.class, () -> importer.approve("missing", "gm", null));
        }
    }

    @Nested
    @DisplayName("Corrections and filters")
    class Corrections {

        @Test
        @DisplayName("Excluded records should be dropped")
        void testExclude() {
            importer.setCorrections(new MappingCorrections()
                    .putForSource(tess, MappingCorrections.Correction.exclude()));

            ImportSummary summary = importer.runImport();

            assertEquals(2, summary.autoImported());
            assertEquals(2, summary.dropped());
            assertTrue(record(tess).getRemoteId().isEmpty());
        }

        @Test
        @DisplayName("Sample should preview corrected proposals without writing")
        void testSample() {
            importer.setCorrections(new MappingCorrections()
                    .putForSource(mira, MappingCorrections.Correction.retarget(TargetType.FACTION))
                    .putForSource(tess, MappingCorrections.Correction.exclude()));

            List<ImportPreview> previews = importer.sample(2);

            assertEquals(2, previews.size());
            assertFalse(previews.get(0).include());
            assertEquals(TargetType.FACTION, previews.get(1).proposal().targetType());
            assertTrue(remote.created().isEmpty());
            assertEquals(0, importer.getReviewQueue().countPending());
        }

        @Test
        @DisplayName("Filtered push should ignore scores")
        void testPushFiltered() {
            int pushed = importer.pushFiltered(PushFilter.of(TargetType.ITEM));

            assertEquals(1, pushed);
            assertEquals(1, remote.count(RemoteEntityKind.ITEM));
            assertEquals(0, remote.count(RemoteEntityKind.CHARACTER));
        }

        @Test
        @DisplayName("Filtered push should honour entity kinds")
        void testPushByKind() {
            int pushed = importer.pushFiltered(new PushFilter(Set.of(EntityKind.CHARACTER), null, null));

            assertEquals(2, pushed);
            assertEquals(2, remote.count(RemoteEntityKind.CHARACTER));
        }
    }

    @Test
    @DisplayName("Thresholds out of order should be rejected")
    void testThresholdValidation() {
        ImporterService.Builder builder = ImporterService.builder()
                .store(store)
                .upserter(new RemoteUpserter(remote, store))
                .campaignId("c-1")
                .thresholds(0.3, 0.6);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Metrics")
    class Metrics {

        @Mock
        private SyncMetrics metrics;

        @Test
        @DisplayName("Should record every import decision")
        void testDecisionsRecorded() {
            importer(metrics).runImport();

            verify(metrics, times(3)).recordImportDecision(ImportDecision.AUTO_IMPORTED);
            verify(metrics).recordImportDecision(ImportDecision.QUEUED);
            verify(metrics).recordImportDecision(ImportDecision.DROPPED);
        }
    }
}
