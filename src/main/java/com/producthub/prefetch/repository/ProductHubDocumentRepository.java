package com.producthub.prefetch.repository;

import com.producthub.prefetch.entity.ProductHubDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * 产品中心文档 Repository
 */
@Repository
public interface ProductHubDocumentRepository extends JpaRepository<ProductHubDocument, Long> {
    
    /**
     * 查询集合内全部文档
     */
    List<ProductHubDocument> findByCollectionNameOrderByDocumentIdAsc(String collectionName);
    
    /**
     * 按集合与文档 ID 查询
     */
    Optional<ProductHubDocument> findByCollectionNameAndDocumentId(String collectionName, String documentId);
}
