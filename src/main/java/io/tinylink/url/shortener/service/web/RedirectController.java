package io.tinylink.url.shortener.service.web;

import io.tinylink.url.shortener.service.core.RedirectService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RedirectController {

    private final RedirectService service;

    public RedirectController(RedirectService service) {
        this.service = service;
    }

    // 302 and no-store: a cached hop would skip the click count
    @GetMapping("/{shortCode}")
    public ResponseEntity<Void> redirect(@PathVariable String shortCode) {
        String originalUrl = service.resolve(shortCode);

        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.LOCATION, originalUrl);
        headers.add(HttpHeaders.CACHE_CONTROL, "no-store");
        headers.add("X-Robots-Tag", "noindex");
        return new ResponseEntity<>(headers, HttpStatus.FOUND);
    }
}
