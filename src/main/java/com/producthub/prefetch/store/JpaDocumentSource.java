package com.producthub.prefetch.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.producthub.prefetch.entity.ProductHubDocument;
import com.producthub.prefetch.repository.ProductHubDocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * 基于 JPA 的文档数据源
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaDocumentSource implements DocumentSource {
    
    static final String LIMIT_PARAM = "limit";
    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};
    
    private final ProductHubDocumentRepository repository;
    private final ObjectMapper objectMapper;
    
    @Override
    @Transactional(readOnly = true)
    public List<Map<String, Object>> getCollection(String collection, Map<String, Object> params) {
        Map<String, Object> filters = new LinkedHashMap<>(params == null ? Map.of() : params);
        Object limit = filters.remove(LIMIT_PARAM);
        
        Stream<Map<String, Object>> documents = repository.findByCollectionNameOrderByDocumentIdAsc(collection)
            .stream()
            .map(this::toMap)
            .filter(doc -> matches(doc, filters));
        if (limit != null) {
            documents = documents.limit(Long.parseLong(String.valueOf(limit)));
        }
        List<Map<String, Object>> result = documents.toList();
        log.debug("Collection loaded: collection={}, size={}", collection, result.size());
        return result;
    }
    
    @Override
    @Transactional(readOnly = true)
    public Map<String, Object> getDocument(String collection, String documentId) {
        return repository.findByCollectionNameAndDocumentId(collection, documentId)
            .map(this::toMap)
            .orElse(null);
    }
    
    private boolean matches(Map<String, Object> document, Map<String, Object> filters) {
        return filters.entrySet().stream()
            .allMatch(f -> Objects.equals(String.valueOf(document.get(f.getKey())), String.valueOf(f.getValue())));
    }
    
    private Map<String, Object> toMap(ProductHubDocument document) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", document.getDocumentId());
        if (document.getPayload() != null) {
            try {
                result.putAll(objectMapper.readValue(document.getPayload(), PAYLOAD_TYPE));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupt payload for "
                    + document.getCollectionName() + "/" + document.getDocumentId(), e);
            }
        }
        return result;
    }
}
