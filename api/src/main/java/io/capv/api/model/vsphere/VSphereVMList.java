/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.vsphere;

import io.fabric8.kubernetes.api.model.DefaultKubernetesResourceList;

/**
 * List of {@link VSphereVM} resources
 */
public class VSphereVMList extends DefaultKubernetesResourceList<VSphereVM> {
    private static final long serialVersionUID = 1L;
}
