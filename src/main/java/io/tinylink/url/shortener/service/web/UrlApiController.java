package io.tinylink.url.shortener.service.web;

import io.tinylink.url.shortener.service.core.ShortenService;
import io.tinylink.url.shortener.service.core.StatsService;
import io.tinylink.url.shortener.service.model.ShortUrlRecord;
import io.tinylink.url.shortener.service.web.dto.ShortenRequest;
import io.tinylink.url.shortener.service.web.dto.ShortenResponse;
import io.tinylink.url.shortener.service.web.dto.UrlStatsResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class UrlApiController {

    private final ShortenService shortenService;
    private final StatsService statsService;
    private final BaseUrlResolver baseUrlResolver;

    public UrlApiController(ShortenService shortenService, StatsService statsService, BaseUrlResolver baseUrlResolver) {
        this.shortenService = shortenService;
        this.statsService = statsService;
        this.baseUrlResolver = baseUrlResolver;
    }

    @PostMapping("/shorten")
    public ResponseEntity<ShortenResponse> shorten(@Valid @RequestBody ShortenRequest request,
                                                   HttpServletRequest httpRequest) {
        ShortUrlRecord record = shortenService.shorten(request.url());
        String shortUrl = baseUrlResolver.shortUrl(httpRequest, record.getShortCode());
        return ResponseEntity.status(HttpStatus.CREATED).body(ShortenResponse.of(record, shortUrl));
    }

    @GetMapping("/stats/{shortCode}")
    public ResponseEntity<UrlStatsResponse> stats(@PathVariable String shortCode) {
        return ResponseEntity.ok(UrlStatsResponse.of(statsService.stats(shortCode)));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of("status", "ok", "message", "URL Shortener API is running"));
    }
}
