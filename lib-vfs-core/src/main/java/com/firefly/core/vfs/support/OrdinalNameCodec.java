/*
 * Copyright 2024 Firefly Software Solutions Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.firefly.core.vfs.support;

import lombok.Value;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes an ordinal into a file name prefix and back, for stores that order siblings by name.
 *
 * <p>The format is {@code NNNN_name}: the ordinal left-padded with zeros to the configured
 * width, an underscore, then the display name. Negative ordinals (quarantined nodes) keep
 * their sign, e.g. {@code -2147483648_name}. Decoding accepts any number of digits so that
 * ordinals wider than the padding and legacy archives with longer prefixes still parse.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
public class OrdinalNameCodec {

    private static final Pattern PREFIXED = Pattern.compile("^(-?)(\\d+)_(.*)$", Pattern.DOTALL);

    private final int width;

    public OrdinalNameCodec(int width) {
        if (width < 1) {
            throw new IllegalArgumentException("Prefix width must be positive: " + width);
        }
        this.width = width;
    }

    public int getWidth() {
        return width;
    }

    /**
     * Builds the stored file name for a node.
     *
     * @param ordinal the node ordinal
     * @param name the display name
     * @return the prefixed name
     */
    public String encode(int ordinal, String name) {
        long value = ordinal;
        String digits = pad(Long.toString(Math.abs(value)));
        return (value < 0 ? "-" : "") + digits + "_" + name;
    }

    /**
     * Splits a stored file name into ordinal and display name.
     *
     * @param fileName the stored name
     * @return the decoded parts, empty when the name has no ordinal prefix
     */
    public Optional<DecodedName> decode(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher matcher = PREFIXED.matcher(fileName);
        if (!matcher.matches() || matcher.group(3).isEmpty()) {
            return Optional.empty();
        }
        try {
            long value = Long.parseLong(matcher.group(2));
            if (!matcher.group(1).isEmpty()) {
                value = -value;
            }
            if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                return Optional.empty();
            }
            return Optional.of(new DecodedName((int) value, matcher.group(3), matcher.group(2).length()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Rewrites a prefixed name so its prefix has the canonical width.
     *
     * <p>Short prefixes are padded ({@code 1_a.md} becomes {@code 0001_a.md}); legacy prefixes
     * with extra leading zeros are trimmed ({@code 00003_a.md} becomes {@code 0003_a.md}).
     * Names without a prefix are returned unchanged.</p>
     *
     * @param fileName the stored name
     * @return the canonical stored name
     */
    public String normalize(String fileName) {
        return decode(fileName)
            .map(decoded -> encode(decoded.getOrdinal(), decoded.getName()))
            .orElse(fileName);
    }

    private String pad(String digits) {
        if (digits.length() >= width) {
            return digits;
        }
        return "0".repeat(width - digits.length()) + digits;
    }

    /**
     * Result of decoding a prefixed file name.
     */
    @Value
    public static class DecodedName {

        /**
         * Ordinal carried by the prefix
         */
        int ordinal;

        /**
         * Display name after the underscore
         */
        String name;

        /**
         * Number of digits in the stored prefix
         */
        int prefixDigits;
    }
}
