package io.tinylink.url.shortener.service.util;

public final class Base62 {

    public static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    public static final int RADIX = ALPHABET.length();

    private Base62() {
    }

    public static char symbol(int index) {
        return ALPHABET.charAt(index);
    }

    /**
     * True when {@code code} has exactly {@code length} characters, all from {@link #ALPHABET}.
     */
    public static boolean isCode(String code, int length) {
        if (code == null || code.length() != length) return false;
        for (int i = 0; i < code.length(); i++) {
            if (ALPHABET.indexOf(code.charAt(i)) < 0) return false;
        }
        return true;
    }
}
