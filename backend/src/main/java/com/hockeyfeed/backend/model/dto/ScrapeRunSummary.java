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
public class ScrapeRunSummary {
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private double durationSeconds;

    // detail pages fetched (robots-disallowed URLs are not counted)
    private int scanned;
    private int inserted;
    private int updated;
    private int unchanged;
    // pages rejected as non-articles
    private int skipped;
    private int errors;
}
