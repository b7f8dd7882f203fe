package com.hockeyfeed.backend.controller;

import com.hockeyfeed.backend.article.ArticleService;
import com.hockeyfeed.backend.model.dto.HealthDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final ArticleService articleService;

    @GetMapping("/health")
    public ResponseEntity<HealthDTO> health() {
        return ResponseEntity.ok(articleService.health());
    }
}
