package com.reviewmate.backend.global.common.random;

import java.util.Random;
import java.util.random.RandomGenerator;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Randomness used for reviewer selection. Tests replace it with a seeded or scripted generator.
 */
@Configuration
public class RandomConfig {

    @Bean
    public RandomGenerator reviewerRandom() {
        // java.util.Random is safe for concurrent use across request threads
        return new Random();
    }
}
