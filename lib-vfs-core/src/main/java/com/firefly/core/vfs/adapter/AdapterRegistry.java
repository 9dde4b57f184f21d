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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for VFS node store adapters.
 * Discovers {@link VfsAdapter} beans and indexes them by type and by implemented port.
 */
@Slf4j
@Component
public class AdapterRegistry {

    static final String PORT_PACKAGE = "com.firefly.core.vfs.port";

    private final ApplicationContext applicationContext;
    private final Map<String, List<AdapterInfo>> adaptersByType = new ConcurrentHashMap<>();
    private final Map<Class<?>, List<AdapterInfo>> adaptersByInterface = new ConcurrentHashMap<>();

    @Autowired
    public AdapterRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    /**
     * Initialize the registry by discovering all VFS adapters.
     */
    @PostConstruct
    public void initialize() {
        log.info("Initializing VFS Adapter Registry");
        discoverAdapters();
        logRegisteredAdapters();
    }

    private void discoverAdapters() {
        Map<String, Object> adapters = applicationContext.getBeansWithAnnotation(VfsAdapter.class);

        for (Map.Entry<String, Object> entry : adapters.entrySet()) {
            String beanName = entry.getKey();
            VfsAdapter annotation = applicationContext.findAnnotationOnBean(beanName, VfsAdapter.class);

            if (annotation != null && annotation.enabled()) {
                registerAdapter(beanName, entry.getValue(), annotation);
            } else {
                log.debug("Skipping disabled adapter: {}", beanName);
            }
        }
    }

    /**
     * Register an adapter with the registry.
     *
     * @param beanName the bean name
     * @param adapterBean the adapter instance
     * @param annotation the adapter metadata
     */
    public void registerAdapter(String beanName, Object adapterBean, VfsAdapter annotation) {
        AdapterInfo adapterInfo = AdapterInfo.builder()
            .beanName(beanName)
            .adapterBean(adapterBean)
            .type(annotation.type())
            .priority(annotation.priority())
            .description(annotation.description())
            .version(annotation.version())
            .vendor(annotation.vendor())
            .supportedFeatures(Set.of(annotation.supportedFeatures()))
            .build();

        adaptersByType.computeIfAbsent(annotation.type(), k -> new ArrayList<>()).add(adapterInfo);

        // Index by every port the bean implements, including through superclasses
        for (Class<?> interfaceClass : ClassUtils.getAllInterfacesForClassAsSet(adapterBean.getClass())) {
            if (interfaceClass.getPackageName().startsWith(PORT_PACKAGE)) {
                adaptersByInterface.computeIfAbsent(interfaceClass, k -> new ArrayList<>()).add(adapterInfo);
            }
        }

        log.info("Registered VFS adapter: {} (type: {}, priority: {})",
                beanName, annotation.type(), annotation.priority());
    }

    /**
     * Get adapter by type with highest priority.
     */
    public Optional<AdapterInfo> getAdapter(String type) {
        List<AdapterInfo> adapters = adaptersByType.get(type);
        if (adapters == null || adapters.isEmpty()) {
            return Optional.empty();
        }

        return adapters.stream()
            .max(Comparator.comparingInt(AdapterInfo::getPriority));
    }

    /**
     * Get adapter implementing a specific interface with highest priority.
     */
    public <T> Optional<T> getAdapter(Class<T> interfaceClass) {
        List<AdapterInfo> adapters = adaptersByInterface.get(interfaceClass);
        if (adapters == null || adapters.isEmpty()) {
            return Optional.empty();
        }

        return adapters.stream()
            .max(Comparator.comparingInt(AdapterInfo::getPriority))
            .map(info -> interfaceClass.cast(info.getAdapterBean()));
    }

    private void logRegisteredAdapters() {
        if (adaptersByType.isEmpty()) {
            log.warn("No VFS adapters found! Node store operations will fall back to no-op adapters.");
            return;
        }

        log.info("Registered VFS adapters by type:");
        for (Map.Entry<String, List<AdapterInfo>> entry : adaptersByType.entrySet()) {
            log.info("  Type '{}': {} adapter(s)", entry.getKey(), entry.getValue().size());

            for (AdapterInfo adapter : entry.getValue()) {
                log.info("    - {} (priority: {}, version: {}): {} {}", adapter.getBeanName(), adapter.getPriority(),
                        adapter.getVersion(), adapter.getDescription(), adapter.getSupportedFeatures());
            }
        }
    }
}
