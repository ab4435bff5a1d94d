package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.service.ingestion.ChapterIngestionService;
import com.williamcallahan.chapter_sync_engine.service.ingestion.SyncRequest;
import com.williamcallahan.chapter_sync_engine.service.ingestion.SyncResult;
import com.williamcallahan.chapter_sync_engine.types.AttemptOutcome;
import com.williamcallahan.chapter_sync_engine.types.QueueName;
import com.williamcallahan.chapter_sync_engine.types.SyncType;
import org.springframework.stereotype.Component;

/**
 * Runs a chapter sync for the series source named in the payload.
 */
@Component
public class SyncSourceJobHandler implements JobHandler {

    private final ChapterIngestionService ingestionService;

    public SyncSourceJobHandler(ChapterIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @Override
    public QueueName queue() {
        return QueueName.SYNC_SOURCE;
    }

    @Override
    public AttemptOutcome handle(JobContext context) throws Exception {
        Job job = context.job();
        String seriesSourceId = JobPayloads.require(job, JobPayloads.SERIES_SOURCE_ID);
        SyncType syncType = SyncType.valueOf(JobPayloads.require(job, JobPayloads.SYNC_TYPE));
        SyncResult result = ingestionService.sync(new SyncRequest(seriesSourceId, syncType, context.fence()));
        return result.skipped() ? AttemptOutcome.SKIPPED : AttemptOutcome.SUCCEEDED;
    }
}
