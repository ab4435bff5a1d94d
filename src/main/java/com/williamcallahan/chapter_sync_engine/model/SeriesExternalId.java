package com.williamcallahan.chapter_sync_engine.model;

public record SeriesExternalId(String seriesId, String provider, String externalId) {}
