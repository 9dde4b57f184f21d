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
package com.firefly.core.vfs.exception;

/**
 * Base type for every failure raised by the VFS ordering engine and its node store adapters.
 *
 * <p>All VFS exceptions are unchecked and are delivered to callers as reactive error
 * signals. Subclasses identify the failure category so that an API layer can map them
 * to user-visible responses (not found, conflict, bad request).</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
public class VfsException extends RuntimeException {

    /** Path or identifier of the node the failure refers to, may be null. */
    private final String subject;

    public VfsException(String message) {
        this(message, null, null);
    }

    public VfsException(String message, String subject) {
        this(message, subject, null);
    }

    public VfsException(String message, String subject, Throwable cause) {
        super(message, cause);
        this.subject = subject;
    }

    /**
     * Returns the path or identifier of the node this failure refers to.
     *
     * @return the subject, or {@code null} when the failure is not tied to one node
     */
    public String getSubject() {
        return subject;
    }
}
