/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.capv.api.Crds;
import io.capv.api.model.vsphere.VSphereVM;
import io.capv.api.model.vsphere.VSphereVMSpec;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Creates and updates the VSphereVM resources owned by the machines and the load balancers
 */
public class VSphereVMs {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(VSphereVMs.class);
    private static final ObjectMapper DIFF_MAPPER = new ObjectMapper().setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private final KubernetesClient client;

    /**
     * @param client    Kubernetes client of the management cluster
     */
    public VSphereVMs(KubernetesClient client) {
        this.client = client;
    }

    /**
     * @param namespace     Namespace
     * @param name          Name
     *
     * @return  The VSphereVM or null when it does not exist
     */
    public VSphereVM get(String namespace, String name) {
        return Crds.vsphereVmOperation(client).inNamespace(namespace).withName(name).get();
    }

    /**
     * Creates the VSphereVM when it does not exist or updates it when the mutator changed its labels, owner
     * references or spec. The mutator is applied to the existing VM or to an empty one.
     *
     * @param reconciliation    Reconciliation marker
     * @param namespace         Namespace
     * @param name              Name of the VM
     * @param mutator           Sets the desired state
     *
     * @return  The VSphereVM as stored in the API server
     */
    public VSphereVM createOrUpdate(Reconciliation reconciliation, String namespace, String name, Consumer<VSphereVM> mutator) {
        VSphereVM current = get(namespace, name);

        if (current == null) {
            VSphereVM vm = new VSphereVM();
            vm.setMetadata(new ObjectMetaBuilder().withNamespace(namespace).withName(name).build());
            vm.setSpec(new VSphereVMSpec());
            mutator.accept(vm);

            LOGGER.infoCr(reconciliation, "Creating VSphereVM {}", name);
            return Crds.vsphereVmOperation(client).inNamespace(namespace).resource(vm).create();
        }

        if (current.getSpec() == null) {
            current.setSpec(new VSphereVMSpec());
        }

        JsonNode before = desiredState(current);
        mutator.accept(current);

        if (Objects.equals(before, desiredState(current))) {
            LOGGER.debugCr(reconciliation, "VSphereVM {} is unchanged", name);
            return current;
        }

        LOGGER.infoCr(reconciliation, "Updating VSphereVM {}", name);
        return Crds.vsphereVmOperation(client).inNamespace(namespace).resource(current).update();
    }

    private static JsonNode desiredState(VSphereVM vm) {
        ObjectNode node = DIFF_MAPPER.createObjectNode();
        node.set("labels", DIFF_MAPPER.valueToTree(vm.getMetadata().getLabels()));
        node.set("ownerReferences", DIFF_MAPPER.valueToTree(vm.getMetadata().getOwnerReferences()));
        node.set("spec", DIFF_MAPPER.valueToTree(vm.getSpec()));
        return node;
    }

    /**
     * Marks the VSphereVM for deletion unless it is already being deleted
     *
     * @param reconciliation    Reconciliation marker
     * @param vm                The VM
     */
    public void delete(Reconciliation reconciliation, VSphereVM vm) {
        if (vm.getMetadata().getDeletionTimestamp() == null) {
            LOGGER.infoCr(reconciliation, "Deleting VSphereVM {}", vm.getMetadata().getName());
            Crds.vsphereVmOperation(client).inNamespace(vm.getMetadata().getNamespace()).withName(vm.getMetadata().getName()).delete();
        }
    }
}
