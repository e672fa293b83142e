package com.producthub.prefetch.event;

/**
 * 进程内界面交互事件，payload 为 {type, identifier, prefetchTargets[]} 的 JSON 文本
 */
public record ComponentInteractionEvent(String payload) {}
