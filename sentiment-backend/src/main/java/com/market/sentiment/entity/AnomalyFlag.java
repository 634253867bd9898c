package com.market.sentiment.entity;

public enum AnomalyFlag {
    NORMAL,
    ANOMALY
}
