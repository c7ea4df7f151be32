package io.github.yok.dbanonymizer.core;

import com.google.common.base.Preconditions;
import java.security.SecureRandom;

/**
 * Produces replacement values: random strings over {@code [a-zA-Z0-9]}.
 *
 * <p>
 * Characters are drawn independently and uniformly from the 62-character alphabet using
 * {@link SecureRandom}, so replacements carry no structure of the values they overwrite.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class RandomValueGenerator {

    static final char[] ALPHABET =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ1234567890".toCharArray();

    private final SecureRandom random;

    /**
     * Creates a generator seeded by the platform's default {@link SecureRandom}.
     */
    public RandomValueGenerator() {
        this(new SecureRandom());
    }

    /**
     * Creates a generator using the given source.
     *
     * @param random random source
     */
    RandomValueGenerator(SecureRandom random) {
        this.random = random;
    }

    /**
     * Generates a random string.
     *
     * @param length number of characters ({@code 0} yields the empty string)
     * @return random string of exactly {@code length} characters
     * @throws IllegalArgumentException if {@code length} is negative
     */
    public String generate(int length) {
        Preconditions.checkArgument(length >= 0, "length must not be negative: %s", length);
        char[] result = new char[length];
        for (int i = 0; i < length; i++) {
            result[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(result);
    }
}
