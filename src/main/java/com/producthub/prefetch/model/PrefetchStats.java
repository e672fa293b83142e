package com.producthub.prefetch.model;

public record PrefetchStats(
    int routeTransitionCount,
    int behaviorPatternCount,
    int componentStatCount,
    int prefetchQueueSize,
    int prefetchInProgressCount,
    long totalObservedAccesses
) {}
