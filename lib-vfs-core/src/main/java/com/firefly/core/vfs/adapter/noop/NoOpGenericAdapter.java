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
package com.firefly.core.vfs.adapter.noop;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.Set;

/**
 * Dynamic-proxy no-op implementation of any VFS port interface.
 *
 * <p>Methods whose name starts with a query verb ({@code get}, {@code read}, {@code exists})
 * complete empty, or with {@code false} for boolean checks. All other reactive methods
 * signal {@link UnsupportedOperationException}.</p>
 *
 * @param <T> the port interface
 */
public class NoOpGenericAdapter<T> extends NoOpAdapterBase implements InvocationHandler {

    private static final Set<String> QUERY_PREFIXES = Set.of("get", "read", "exists", "list");

    private final Class<T> portType;

    public NoOpGenericAdapter(String portName, Class<T> portType) {
        super(portName);
        this.portType = portType;
    }

    /**
     * Creates the proxy implementing the port.
     *
     * @return the no-op port
     */
    public T getProxy() {
        return portType.cast(Proxy.newProxyInstance(
            portType.getClassLoader(), new Class<?>[]{portType}, this));
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) {
        String name = method.getName();
        switch (name) {
            case "toString":
                return getAdapterName();
            case "hashCode":
                return System.identityHashCode(proxy);
            case "equals":
                return args != null && args.length == 1 && proxy == args[0];
            case "getAdapterName":
                return getAdapterName();
            default:
                break;
        }

        Class<?> returnType = method.getReturnType();
        boolean query = isQuery(name);
        if (Flux.class.isAssignableFrom(returnType)) {
            return query ? emptyListing(name) : Flux.from(unsupported(name));
        }
        if (Mono.class.isAssignableFrom(returnType)) {
            if (query && name.startsWith("exists")) {
                logQuery(name);
                return Mono.just(false);
            }
            return query ? emptyQuery(name) : unsupported(name);
        }
        logUnsupported(name);
        throw new UnsupportedOperationException(name + " requires a " + getPortName() + " adapter");
    }

    private static boolean isQuery(String methodName) {
        return QUERY_PREFIXES.stream().anyMatch(methodName::startsWith);
    }
}
