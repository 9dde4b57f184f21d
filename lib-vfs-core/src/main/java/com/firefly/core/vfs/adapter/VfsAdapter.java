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
package com.firefly.core.vfs.adapter;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a bean as a VFS node store adapter so that {@link AdapterRegistry} can discover it.
 *
 * <p>Example:</p>
 * <pre>
 * {@code
 * @VfsAdapter(
 *     type = "memory",
 *     description = "In-memory node store",
 *     supportedFeatures = {AdapterFeature.NODE_CRUD, AdapterFeature.ORDINAL_UPDATES}
 * )
 * public class InMemoryNodeStoreAdapter implements NodeStorePort, NodeContentPort { ... }
 * }
 * </pre>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 * @see AdapterRegistry
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface VfsAdapter {

    /**
     * Adapter type, matched against {@code firefly.vfs.adapter-type}.
     */
    String type();

    /**
     * Priority among adapters of the same type, highest wins.
     */
    int priority() default 0;

    String description() default "";

    String version() default "1.0";

    String vendor() default "Firefly Software Solutions Inc.";

    AdapterFeature[] supportedFeatures() default {};

    /**
     * Disabled adapters are skipped during discovery.
     */
    boolean enabled() default true;
}
