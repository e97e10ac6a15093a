package io.tinylink.url.shortener.service.core;

import io.tinylink.url.shortener.service.util.Base62;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Proposes random short codes. It never consults the store: uniqueness is decided by
 * {@link io.tinylink.url.shortener.service.store.UrlStore#insert}, and the caller asks for another candidate
 * on a collision, at most {@link #maxAttempts()} times per request.
 */
@Component
public class ShortCodeGenerator {

    public static final int CODE_LENGTH = 6;

    private final int maxAttempts;
    private final Random random;

    @Autowired
    public ShortCodeGenerator(@Value("${shortener.code.max-attempts:10}") int maxAttempts) {
        this(maxAttempts, new Random());
    }

    public ShortCodeGenerator(int maxAttempts, Random random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.random = random;
    }

    public String nextCode() {
        char[] code = new char[CODE_LENGTH];
        for (int i = 0; i < CODE_LENGTH; i++) {
            code[i] = Base62.symbol(random.nextInt(Base62.RADIX));
        }
        return new String(code);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public static boolean isWellFormed(String shortCode) {
        return Base62.isCode(shortCode, CODE_LENGTH);
    }
}
