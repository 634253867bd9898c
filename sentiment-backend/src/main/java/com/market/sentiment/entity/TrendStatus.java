package com.market.sentiment.entity;

public enum TrendStatus {
    HOT,
    TRENDING,
    STABLE,
    EMERGING
}
