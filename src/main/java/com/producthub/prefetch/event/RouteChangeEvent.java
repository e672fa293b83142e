package com.producthub.prefetch.event;

/**
 * 进程内路由跳转事件
 */
public record RouteChangeEvent(String fromRoute, String toRoute, long timeSpentMs) {}
