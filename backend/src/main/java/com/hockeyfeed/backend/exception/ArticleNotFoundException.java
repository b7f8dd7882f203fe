package com.hockeyfeed.backend.exception;

public class ArticleNotFoundException extends RuntimeException {

    public ArticleNotFoundException(Long articleId) {
        super("Article not found: " + articleId);
    }
}
