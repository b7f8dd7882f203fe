package com.hockeyfeed.backend.model.dto;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthDTO {
    private boolean ok;
    private String app;
    private boolean db;
    private long articlesCount;
    private LocalDateTime lastScrapedAt;
    private String lastOriginUrl;
}
