/**
 * Canonicalizes a newly discovered source entity
 *
 * Features:
 * - Fetches the entity's metadata through the source gateway and links it to a canonical series
 * - Enqueues metadata enrichment and a first full sync for sources that still need them
 * - Follow-up jobs use deterministic keys, so a retried canonicalization never duplicates them
 */

package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.model.SeriesCandidate;
import com.williamcallahan.chapter_sync_engine.model.SeriesSource;
import com.williamcallahan.chapter_sync_engine.repository.ChapterSyncStore;
import com.williamcallahan.chapter_sync_engine.service.SourceGateway;
import com.williamcallahan.chapter_sync_engine.service.canonical.CanonicalizationResult;
import com.williamcallahan.chapter_sync_engine.service.canonical.CanonicalizationService;
import com.williamcallahan.chapter_sync_engine.types.AttemptOutcome;
import com.williamcallahan.chapter_sync_engine.types.MetadataStatus;
import com.williamcallahan.chapter_sync_engine.types.QueueName;
import com.williamcallahan.chapter_sync_engine.types.SyncPriority;
import com.williamcallahan.chapter_sync_engine.types.SyncType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class CanonicalizeJobHandler implements JobHandler {

    private final SourceGateway sourceGateway;
    private final CanonicalizationService canonicalizationService;
    private final ChapterSyncStore store;
    private final JobQueue jobQueue;

    public CanonicalizeJobHandler(SourceGateway sourceGateway,
                                  CanonicalizationService canonicalizationService,
                                  ChapterSyncStore store,
                                  JobQueue jobQueue) {
        this.sourceGateway = sourceGateway;
        this.canonicalizationService = canonicalizationService;
        this.store = store;
        this.jobQueue = jobQueue;
    }

    @Override
    public QueueName queue() {
        return QueueName.CANONICALIZE;
    }

    @Override
    public AttemptOutcome handle(JobContext context) throws Exception {
        Job job = context.job();
        String sourceName = JobPayloads.require(job, JobPayloads.SOURCE_NAME);
        String sourceId = JobPayloads.require(job, JobPayloads.SOURCE_ID);

        SeriesCandidate candidate = sourceGateway.fetchSeries(sourceName, sourceId).toBuilder()
            .sourceName(sourceName)
            .sourceId(sourceId)
            .build();
        if (candidate.sourceUrl() == null && job.payloadValue(JobPayloads.SOURCE_URL) != null) {
            candidate = candidate.toBuilder().sourceUrl(job.payloadValue(JobPayloads.SOURCE_URL)).build();
        }

        CanonicalizationResult result = canonicalizationService.canonicalize(candidate);
        int followUps = enqueueFollowUps(result.seriesSourceId());
        if (!result.sourceCreated() && followUps == 0) {
            return AttemptOutcome.SKIPPED;
        }
        return AttemptOutcome.SUCCEEDED;
    }

    private int enqueueFollowUps(String seriesSourceId) {
        SeriesSource source = store.findSource(seriesSourceId)
            .orElseThrow(() -> new IllegalStateException("Canonicalized source " + seriesSourceId + " not found"));
        int enqueued = 0;
        if (source.metadataStatus() == MetadataStatus.PENDING
                && jobQueue.enqueue(JobPayloads.enrichMetadata(source.id(), source.sourceName())).enqueued()) {
            enqueued++;
        }
        if (source.lastSuccessAt() == null && source.syncStatus().isSchedulable()) {
            SyncPriority priority = source.syncPriority() != null ? source.syncPriority() : SyncPriority.WARM;
            if (jobQueue.enqueue(JobPayloads.syncSource(source.id(), source.sourceName(), SyncType.FULL, priority))
                    .enqueued()) {
                enqueued++;
            }
        }
        if (enqueued > 0) {
            log.debug("Enqueued {} follow-up job(s) for new source {}", enqueued, source.id());
        }
        return enqueued;
    }
}
