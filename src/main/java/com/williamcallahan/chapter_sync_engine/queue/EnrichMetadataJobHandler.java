package com.williamcallahan.chapter_sync_engine.queue;

import com.williamcallahan.chapter_sync_engine.service.MetadataEnrichmentService;
import com.williamcallahan.chapter_sync_engine.types.AttemptOutcome;
import com.williamcallahan.chapter_sync_engine.types.QueueName;
import org.springframework.stereotype.Component;

/**
 * Enriches the metadata of the series source named in the payload.
 */
@Component
public class EnrichMetadataJobHandler implements JobHandler {

    private final MetadataEnrichmentService enrichmentService;

    public EnrichMetadataJobHandler(MetadataEnrichmentService enrichmentService) {
        this.enrichmentService = enrichmentService;
    }

    @Override
    public QueueName queue() {
        return QueueName.ENRICH_METADATA;
    }

    @Override
    public AttemptOutcome handle(JobContext context) throws Exception {
        String seriesSourceId = JobPayloads.require(context.job(), JobPayloads.SERIES_SOURCE_ID);
        MetadataEnrichmentService.EnrichmentResult result = enrichmentService.enrich(seriesSourceId, context.fence());
        return result.skipped() ? AttemptOutcome.SKIPPED : AttemptOutcome.SUCCEEDED;
    }
}
