package com.trendearly.pipeline.entity;

public enum KeywordType {
    KEYWORD,
    HASHTAG
}
