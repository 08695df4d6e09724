/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vsphere;

import io.capv.api.model.vsphere.VSphereVM;
import io.capv.operator.common.Reconciliation;

/**
 * Everything the virtualization backend needs to converge one VM
 *
 * @param reconciliation    Reconciliation marker used for logging
 * @param session           Session of the vCenter hosting the VM
 * @param vm                The VSphereVM resource
 * @param bootstrapData     Bootstrap data (cloud-init) passed to the guest or null when none is needed
 */
public record VirtualMachineContext(Reconciliation reconciliation, Session session, VSphereVM vm, String bootstrapData) {
}
