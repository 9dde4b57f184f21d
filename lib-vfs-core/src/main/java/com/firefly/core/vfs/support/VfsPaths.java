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

import com.firefly.core.vfs.exception.InvalidOperationException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Path helpers for the virtual filesystem.
 *
 * <p>Paths are absolute, {@code /}-separated and normalized: the root is {@code /}, there is
 * no trailing slash, and {@code .} / {@code ..} segments are resolved. A path that would
 * climb above the root is rejected.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
public final class VfsPaths {

    public static final String ROOT = "/";

    private VfsPaths() {
    }

    /**
     * Normalizes a caller-supplied path.
     *
     * @param path the path, null or blank meaning the root
     * @return the normalized path
     * @throws InvalidOperationException if the path escapes the root
     */
    public static String normalize(String path) {
        if (path == null || path.isBlank()) {
            return ROOT;
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (segments.isEmpty()) {
                    throw new InvalidOperationException("Path escapes the root: " + path, path);
                }
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return segments.isEmpty() ? ROOT : "/" + String.join("/", segments);
    }

    /**
     * Returns the parent of a normalized path, or {@code null} for the root.
     */
    public static String parent(String path) {
        String normalized = normalize(path);
        if (ROOT.equals(normalized)) {
            return null;
        }
        int slash = normalized.lastIndexOf('/');
        return slash == 0 ? ROOT : normalized.substring(0, slash);
    }

    /**
     * Returns the last segment of a path, empty for the root.
     */
    public static String name(String path) {
        String normalized = normalize(path);
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }

    public static String join(String folder, String name) {
        String base = normalize(folder);
        return ROOT.equals(base) ? ROOT + name : base + "/" + name;
    }

    /**
     * Path of the direct child {@code name} of {@code folder}.
     *
     * @throws InvalidOperationException if {@code name} is not a single valid segment
     */
    public static String child(String folder, String name) {
        return join(folder, requireValidName(name));
    }

    /**
     * Checks whether {@code path} equals {@code ancestor} or lies somewhere below it.
     */
    public static boolean isSameOrDescendant(String ancestor, String path) {
        String a = normalize(ancestor);
        String p = normalize(path);
        if (a.equals(p) || ROOT.equals(a)) {
            return true;
        }
        return p.startsWith(a + "/");
    }

    /**
     * Rewrites the {@code fromPrefix} part of {@code path} to {@code toPrefix}.
     */
    public static String rebase(String path, String fromPrefix, String toPrefix) {
        String p = normalize(path);
        String from = normalize(fromPrefix);
        if (p.equals(from)) {
            return normalize(toPrefix);
        }
        if (!isSameOrDescendant(from, p)) {
            throw new IllegalArgumentException(p + " is not below " + from);
        }
        String rest = ROOT.equals(from) ? p.substring(1) : p.substring(from.length() + 1);
        return join(toPrefix, rest);
    }

    /**
     * Validates a single node name.
     *
     * @throws InvalidOperationException if the name is blank or contains a separator
     */
    public static String requireValidName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidOperationException("Name must not be empty");
        }
        String trimmed = name.trim();
        if (trimmed.contains("/") || trimmed.contains("\\") || ".".equals(trimmed) || "..".equals(trimmed)) {
            throw new InvalidOperationException("Invalid node name: " + name, name);
        }
        return trimmed;
    }
}
