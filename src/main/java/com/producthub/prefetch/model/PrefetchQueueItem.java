package com.producthub.prefetch.model;

public record PrefetchQueueItem(String key, PrefetchCandidate candidate, long scheduledAt) {}
