package com.producthub.prefetch.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 产品中心文档实体（集合 + 文档 ID + JSON 内容）
 */
@Data
@Entity
@Table(name = "t_product_hub_document",
    uniqueConstraints = @UniqueConstraint(columnNames = {"collection_name", "document_id"}))
public class ProductHubDocument {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    /** 集合名：products / coverages / forms / rules / tasks / steps */
    @Column(name = "collection_name", nullable = false, length = 64)
    private String collectionName;
    
    /** 文档 ID */
    @Column(name = "document_id", nullable = false, length = 128)
    private String documentId;
    
    /** 文档内容 JSON */
    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;
    
    @Column(name = "update_time")
    private LocalDateTime updateTime;
    
    @PrePersist
    @PreUpdate
    protected void touch() {
        updateTime = LocalDateTime.now();
    }
}
