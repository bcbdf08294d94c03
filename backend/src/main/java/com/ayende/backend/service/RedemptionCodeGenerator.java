package com.ayende.backend.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/** {@code RWD-} followed by six random upper-case letters and digits. */
@Component
public class RedemptionCodeGenerator {

    public static final String PREFIX = "RWD-";
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int LENGTH = 6;

    private final SecureRandom random = new SecureRandom();

    public String next() {
        StringBuilder code = new StringBuilder(PREFIX);
        for (int i = 0; i < LENGTH; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }
}
