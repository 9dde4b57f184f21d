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

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Picks the adapter that backs a VFS port.
 *
 * <p>The adapter registered under {@code firefly.vfs.adapter-type} wins. If that type is
 * unknown or its bean does not implement the requested port, the highest-priority adapter
 * implementing the port is used instead.</p>
 */
@Slf4j
@Component
public class AdapterSelector {

    private final AdapterRegistry adapterRegistry;

    @Autowired
    public AdapterSelector(AdapterRegistry adapterRegistry) {
        this.adapterRegistry = adapterRegistry;
    }

    /**
     * Selects the adapter for {@code port}.
     *
     * @param adapterType the configured adapter type, may be blank
     * @param port the port interface the adapter must implement
     * @param <T> the port type
     * @return the selected adapter, or empty if no registered adapter implements the port
     */
    public <T> Optional<T> selectAdapter(String adapterType, Class<T> port) {
        if (StringUtils.hasText(adapterType)) {
            Optional<T> configured = configuredAdapter(adapterType.trim(), port);
            if (configured.isPresent()) {
                return configured;
            }
        }

        Optional<T> fallback = adapterRegistry.getAdapter(port);
        if (fallback.isPresent()) {
            log.info("Using fallback {} adapter {}", port.getSimpleName(), fallback.get().getClass().getSimpleName());
        } else {
            log.error("No {} adapter available", port.getSimpleName());
        }
        return fallback;
    }

    private <T> Optional<T> configuredAdapter(String adapterType, Class<T> port) {
        Optional<AdapterInfo> registered = adapterRegistry.getAdapter(adapterType);
        if (registered.isEmpty()) {
            log.warn("No adapter registered for type '{}'", adapterType);
            return Optional.empty();
        }
        AdapterInfo info = registered.get();
        if (!port.isInstance(info.getAdapterBean())) {
            log.warn("Adapter '{}' of type '{}' does not implement {}", info.getBeanName(), adapterType,
                port.getSimpleName());
            return Optional.empty();
        }
        log.info("Selected {} adapter '{}' of type '{}'", port.getSimpleName(), info.getBeanName(), adapterType);
        return Optional.of(port.cast(info.getAdapterBean()));
    }
}
