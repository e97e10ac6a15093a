package io.tinylink.url.shortener.service.web;

import io.tinylink.url.shortener.service.core.ShortenService;
import io.tinylink.url.shortener.service.exception.UrlStoreException;
import io.tinylink.url.shortener.service.model.ShortUrlRecord;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

@Controller
public class UrlWebController {

    private static final Logger log = LoggerFactory.getLogger(UrlWebController.class);

    private static final String VIEW_INDEX = "index";

    private final ShortenService service;
    private final BaseUrlResolver baseUrlResolver;

    public UrlWebController(ShortenService service, BaseUrlResolver baseUrlResolver) {
        this.service = service;
        this.baseUrlResolver = baseUrlResolver;
    }

    @GetMapping("/")
    public String index() {
        return VIEW_INDEX;
    }

    @PostMapping("/shorten")
    public String shorten(@RequestParam("longUrl") String longUrl,
                          HttpServletRequest request,
                          Model model) {
        ShortUrlRecord record = service.shorten(longUrl);
        model.addAttribute("shortUrl", baseUrlResolver.shortUrl(request, record.getShortCode()));
        model.addAttribute("shortCode", record.getShortCode());
        model.addAttribute("originalUrl", record.getOriginalUrl());
        model.addAttribute("createdAt", record.getCreatedAt());
        return VIEW_INDEX;
    }

    @ExceptionHandler(Exception.class)
    public String handleError(Exception ex, Model model) {
        if (ex instanceof UrlStoreException || ex instanceof DataAccessException) {
            log.error("Shorten form failed: {}", ex.getMessage(), ex);
        } else {
            log.debug("Shorten form rejected: {}", ex.getMessage());
        }
        model.addAttribute("error", ex.getMessage());
        return VIEW_INDEX;
    }
}
