/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vsphere;

import io.capv.operator.common.InvalidConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.function.Supplier;

/**
 * Discovers the {@link VSphereBackend} implementations available on the class path
 */
public class VSphereBackends {
    private static final Logger LOGGER = LogManager.getLogger(VSphereBackends.class);

    private final Supplier<Iterable<VSphereBackend>> loader;

    /**
     * Creates the lookup using the {@link ServiceLoader}
     */
    public VSphereBackends() {
        this(() -> ServiceLoader.load(VSphereBackend.class));
    }

    /*test*/ VSphereBackends(Supplier<Iterable<VSphereBackend>> loader) {
        this.loader = loader;
    }

    /**
     * Finds the backend by its name. The name can be the name reported by the backend, its class name or the simple
     * name of its class. When no name is configured, the only available backend is used.
     *
     * @param name  Name of the backend or null
     *
     * @return  The backend
     *
     * @throws InvalidConfigurationException when no backend or more than one matching backend is found
     */
    public VSphereBackend find(String name) {
        List<VSphereBackend> available = new ArrayList<>();
        loader.get().forEach(available::add);

        if (name == null || name.isEmpty()) {
            if (available.size() == 1) {
                LOGGER.info("Using the only available vSphere backend {}", available.get(0).name());
                return available.get(0);
            }

            throw new InvalidConfigurationException("Expected exactly one vSphere backend on the class path but found " + names(available));
        }

        for (VSphereBackend backend : available) {
            if (matches(name, backend)) {
                LOGGER.info("Using vSphere backend {}", backend.name());
                return backend;
            }
        }

        throw new InvalidConfigurationException("vSphere backend '" + name + "' not found. Available backends: " + names(available));
    }

    private static boolean matches(String name, VSphereBackend backend) {
        Class<?> type = backend.getClass();

        return name.equals(backend.name())
                || name.equals(type.getName())
                || (!type.isMemberClass() && !type.isAnonymousClass() && name.equals(type.getSimpleName()));
    }

    private static List<String> names(List<VSphereBackend> backends) {
        return backends.stream().map(VSphereBackend::name).toList();
    }
}
