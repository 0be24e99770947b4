package com.tigerwatch.monitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single organic search hit, normalised across providers
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResultItem {
    private String title;
    private String url;
    private String snippet;
    private Integer position;
    private Double score;
    private String publishedDate;
}
