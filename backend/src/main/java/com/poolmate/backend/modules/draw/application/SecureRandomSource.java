package com.poolmate.backend.modules.draw.application;

import java.security.SecureRandom;

import org.springframework.stereotype.Component;

@Component
public class SecureRandomSource implements RandomSource {

    private final SecureRandom random = new SecureRandom();

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }
}
