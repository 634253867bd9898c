package com.market.sentiment.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DailyBrandSentimentId implements Serializable {
    private LocalDate sentimentDate;
    private String brand;
}
