package com.example.shorturl.controller;

import com.example.shorturl.dto.CreateUrlRequest;
import com.example.shorturl.dto.HealthResponse;
import com.example.shorturl.dto.ShortenResponse;
import com.example.shorturl.dto.UpdateUrlRequest;
import com.example.shorturl.dto.UrlInfoResponse;
import com.example.shorturl.service.UrlService;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class UrlController {

    private final UrlService urlService;

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("ok"));
    }

    @PostMapping("/api/v1/shorten")
    public ResponseEntity<ShortenResponse> shorten(@Valid @RequestBody CreateUrlRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(urlService.createShortUrl(request));
    }

    @GetMapping("/api/v1/shorten/{shortCode}")
    public ResponseEntity<UrlInfoResponse> getOriginalUrl(@PathVariable String shortCode) {
        return ResponseEntity.ok(urlService.getOriginalUrl(shortCode));
    }

    @PutMapping("/api/v1/shorten/{shortCode}")
    public ResponseEntity<UrlInfoResponse> update(@PathVariable String shortCode,
                                                  @Valid @RequestBody UpdateUrlRequest request) {
        return ResponseEntity.ok(urlService.updateShortUrl(shortCode, request));
    }

    @DeleteMapping("/api/v1/shorten/{shortCode}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String shortCode) {
        urlService.deleteShortUrl(shortCode);
        return ResponseEntity.ok(Map.of("message", "Short URL deleted successfully"));
    }

    @GetMapping("/api/v1/shorten/{shortCode}/stats")
    public ResponseEntity<UrlInfoResponse> stats(@PathVariable String shortCode) {
        return ResponseEntity.ok(urlService.getStatistics(shortCode));
    }

    @GetMapping("/{shortCode}")
    public void redirect(@PathVariable String shortCode, HttpServletResponse response) throws IOException {
        response.sendRedirect(urlService.resolveRedirect(shortCode));
    }
}
