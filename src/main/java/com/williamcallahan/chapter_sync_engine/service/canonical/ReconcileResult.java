package com.williamcallahan.chapter_sync_engine.service.canonical;

import com.williamcallahan.chapter_sync_engine.model.ReviewItem;
import com.williamcallahan.chapter_sync_engine.types.ReconcileAction;

public record ReconcileResult(ReconcileAction action, MergeResult merge, ReviewItem reviewItem) {

    static ReconcileResult of(ReconcileAction action) {
        return new ReconcileResult(action, null, null);
    }
}
