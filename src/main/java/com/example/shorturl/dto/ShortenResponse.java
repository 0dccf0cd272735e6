package com.example.shorturl.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class ShortenResponse {
    private Long id;
    private String url;
    private String shortCode;
    private String shortUrl;
    private Instant createdAt;
    private Instant updatedAt;
}
