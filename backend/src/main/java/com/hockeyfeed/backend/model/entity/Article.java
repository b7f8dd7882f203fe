package com.hockeyfeed.backend.model.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "articles",
        uniqueConstraints = @UniqueConstraint(name = "uq_articles_origin_url", columnNames = "origin_url"),
        indexes = @Index(name = "idx_articles_scraped_at", columnList = "scraped_at"))
public class Article {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // extraliga / reprezentacia
    @Column(nullable = false, length = 50)
    private String category;

    @Column(name = "origin_url", nullable = false, updatable = false, length = 2048)
    private String originUrl;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(columnDefinition = "TEXT")
    private String metaText;

    @Column(columnDefinition = "TEXT")
    private String imageUrl;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String contentText;

    @Column(name = "scraped_at", nullable = false)
    private LocalDateTime scrapedAt;
}
