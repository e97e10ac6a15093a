package io.tinylink.url.shortener.service.core;

import io.tinylink.url.shortener.service.exception.InvalidUrlException;
import io.tinylink.url.shortener.service.exception.UrlNotFoundException;
import io.tinylink.url.shortener.service.model.ShortUrlRecord;
import io.tinylink.url.shortener.service.store.InMemoryUrlStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * The three operations wired together over the in-memory store, without Spring.
 */
class ShortenRedirectStatsScenarioTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-10-18T10:15:30Z"), ZoneOffset.UTC);

    private InMemoryUrlStore store;
    private ShortenService shortenService;
    private RedirectService redirectService;
    private StatsService statsService;

    @BeforeEach
    void setUp() {
        store = new InMemoryUrlStore();
        shortenService = new ShortenService(new UrlValidator(), new ShortCodeGenerator(10, new Random(2026L)),
                store, FIXED_CLOCK);
        redirectService = new RedirectService(store);
        statsService = new StatsService(store);
    }

    @Test
    void shortenThenRedirectTwice_shouldReportTwoClicksAndOriginalTimestamp() {
        ShortUrlRecord created = shortenService.shorten("https://example.com/page");
        String code = created.getShortCode();
        assertThat(created.getClickCount()).isZero();

        assertThat(redirectService.resolve(code)).isEqualTo("https://example.com/page");
        assertThat(redirectService.resolve(code)).isEqualTo("https://example.com/page");

        ShortUrlRecord stats = statsService.stats(code);
        assertThat(stats.getShortCode()).isEqualTo(code);
        assertThat(stats.getOriginalUrl()).isEqualTo("https://example.com/page");
        assertThat(stats.getClickCount()).isEqualTo(2L);
        assertThat(stats.getCreatedAt()).isEqualTo(created.getCreatedAt());
    }

    @Test
    void shortenSameUrlTwice_shouldCreateTwoIndependentCodes() {
        ShortUrlRecord first = shortenService.shorten("https://example.com/page");
        ShortUrlRecord second = shortenService.shorten("https://example.com/page");

        assertThat(first.getShortCode()).isNotEqualTo(second.getShortCode());
        assertThat(redirectService.resolve(first.getShortCode())).isEqualTo("https://example.com/page");
        assertThat(redirectService.resolve(second.getShortCode())).isEqualTo("https://example.com/page");
        assertThat(statsService.stats(first.getShortCode()).getClickCount()).isEqualTo(1L);
        assertThat(statsService.stats(second.getShortCode()).getClickCount()).isEqualTo(1L);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void shortenInvalidUrl_shouldLeaveStoreEmpty() {
        assertThatThrownBy(() -> shortenService.shorten("not a url"))
                .isInstanceOf(InvalidUrlException.class);

        assertThat(store.size()).isZero();
    }

    @Test
    void statsForUnissuedCode_shouldThrowNotFound() {
        assertThatThrownBy(() -> statsService.stats("ZZZZZZ"))
                .isInstanceOf(UrlNotFoundException.class);
    }

    @Test
    void concurrentRedirects_shouldNotLoseClicks() throws Exception {
        String code = shortenService.shorten("https://example.com/popular").getShortCode();
        int redirects = 200;
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> results = new ArrayList<>();
        try {
            for (int i = 0; i < redirects; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return redirectService.resolve(code);
                }));
            }
            start.countDown();
            for (Future<String> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo("https://example.com/popular");
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(statsService.stats(code).getClickCount()).isEqualTo(redirects);
    }

    @Test
    void concurrentShortens_shouldIssueDistinctCodes() throws Exception {
        int requests = 100;
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ShortUrlRecord>> results = new ArrayList<>();
        try {
            for (int i = 0; i < requests; i++) {
                String url = "https://www.example" + i + ".com";
                results.add(executor.submit(() -> {
                    start.await();
                    return shortenService.shorten(url);
                }));
            }
            start.countDown();
            List<String> codes = new ArrayList<>();
            for (Future<ShortUrlRecord> result : results) {
                codes.add(result.get(10, TimeUnit.SECONDS).getShortCode());
            }
            assertThat(codes).doesNotHaveDuplicates().allMatch(ShortCodeGenerator::isWellFormed);
        } finally {
            executor.shutdownNow();
        }

        assertThat(store.size()).isEqualTo(requests);
    }
}
