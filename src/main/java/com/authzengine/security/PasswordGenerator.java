package com.authzengine.security;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;

/**
 * Generates random passwords from up to four character categories.
 *
 * Every enabled category appears at least once, and when more than one
 * category is enabled no category is used three times in a row.
 */
public class PasswordGenerator {

    public static final int DEFAULT_LENGTH = 12;
    public static final int MIN_LENGTH = 6;
    public static final int MAX_LENGTH = 99;

    enum Category {
        UPPER_CASE("ABCDEFGHIJKLMNOPQRSTUVWXYZ"),
        LOWER_CASE("abcdefghijklmnopqrstuvwxyz"),
        DIGIT("1234567890"),
        SPECIAL("!@#$%^&*");

        private final String alphabet;

        Category(String alphabet) {
            this.alphabet = alphabet;
        }

        String getAlphabet() {
            return alphabet;
        }
    }

    private final Random random;

    public PasswordGenerator() {
        this(new SecureRandom());
    }

    public PasswordGenerator(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("Random source cannot be null");
        }
        this.random = random;
    }

    /**
     * Generate a password of {@value #DEFAULT_LENGTH} characters using every category.
     */
    public String generate() {
        return generate(DEFAULT_LENGTH, true, true, true, true);
    }

    /**
     * Generate a password.
     *
     * @param length number of characters, between {@value #MIN_LENGTH} and {@value #MAX_LENGTH}
     * @throws IllegalArgumentException if the length is out of range or no category is enabled
     */
    public String generate(int length, boolean upperCase, boolean lowerCase, boolean digits, boolean special) {
        if (length < MIN_LENGTH || length > MAX_LENGTH) {
            throw new IllegalArgumentException(String.format(
                "Password length must be between %d and %d, was %d", MIN_LENGTH, MAX_LENGTH, length));
        }

        List<Category> categories = new ArrayList<>(4);
        if (upperCase) {
            categories.add(Category.UPPER_CASE);
        }
        if (lowerCase) {
            categories.add(Category.LOWER_CASE);
        }
        if (digits) {
            categories.add(Category.DIGIT);
        }
        if (special) {
            categories.add(Category.SPECIAL);
        }
        if (categories.isEmpty()) {
            throw new IllegalArgumentException("At least one character category must be included");
        }

        List<Category> sequence = categorySequence(length, categories);
        while (!EnumSet.copyOf(sequence).containsAll(categories)) {
            sequence = categorySequence(length, categories);
        }

        StringBuilder password = new StringBuilder(length);
        for (Category category : sequence) {
            String alphabet = category.getAlphabet();
            password.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return password.toString();
    }

    private List<Category> categorySequence(int length, List<Category> categories) {
        List<Category> sequence = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            Category next = categories.get(random.nextInt(categories.size()));
            if (categories.size() > 1 && i >= 2
                && sequence.get(i - 1) == next && sequence.get(i - 2) == next) {
                while (next == sequence.get(i - 1)) {
                    next = categories.get(random.nextInt(categories.size()));
                }
            }
            sequence.add(next);
        }
        return sequence;
    }
}
