/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vsphere;

/**
 * Driver converging the virtual machines on vSphere. Both operations are expected to return quickly; long running
 * vCenter tasks are reported as {@link VirtualMachineState#PENDING} and checked again on the next reconciliation.
 */
public interface VirtualMachineService {
    /**
     * Clones the VM when it does not exist, powers it on and reports its network.
     *
     * @param context   VM context
     *
     * @return  Observed state of the VM
     */
    VirtualMachine reconcileVM(VirtualMachineContext context);

    /**
     * Powers the VM off and destroys it.
     *
     * @param context   VM context
     *
     * @return  Observed state of the VM. {@link VirtualMachineState#NOT_FOUND} once the VM is gone.
     */
    VirtualMachine destroyVM(VirtualMachineContext context);
}
