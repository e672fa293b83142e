package com.producthub.prefetch.event;

import java.util.Map;

/**
 * 进程内数据访问事件，所有希望参与学习的读路径都应发布
 */
public record DataAccessEvent(String category, String identifier, Map<String, Object> params) {}
