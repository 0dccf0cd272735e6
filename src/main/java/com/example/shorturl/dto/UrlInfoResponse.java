package com.example.shorturl.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class UrlInfoResponse {
    private Long id;
    private String url;
    private String shortCode;
    private String shortUrl;
    private long accessCount;
    private Instant createdAt;
    private Instant updatedAt;
}
