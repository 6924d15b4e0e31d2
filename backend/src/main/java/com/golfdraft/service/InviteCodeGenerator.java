package com.golfdraft.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Share-link codes for private competitions. The alphabet leaves out characters that are
 * easy to misread (0/o, 1/l).
 */
@Component
public class InviteCodeGenerator {

    static final String ALPHABET = "abcdefghijkmnpqrstuvwxyz23456789";
    static final int CODE_LENGTH = 8;

    private final Random random;

    @Autowired
    public InviteCodeGenerator() {
        this(new SecureRandom());
    }

    InviteCodeGenerator(Random random) {
        this.random = random;
    }

    public String nextCode() {
        StringBuilder code = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }
}
