/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.loadbalancer;

import io.capv.api.Crds;
import io.capv.api.model.common.Constants;
import io.capv.api.model.loadbalancer.LoadBalancerStatus;
import io.capv.api.model.loadbalancer.NSXTLoadBalancer;
import io.capv.api.model.loadbalancer.NSXTLoadBalancerList;
import io.capv.operator.cluster.loadbalancer.appliance.ApplianceClient;
import io.capv.operator.cluster.loadbalancer.appliance.ApplianceConfiguration;
import io.capv.operator.cluster.loadbalancer.appliance.ApplianceConfiguration.Pool;
import io.capv.operator.cluster.loadbalancer.appliance.ApplianceConfiguration.PoolMember;
import io.capv.operator.cluster.loadbalancer.appliance.ApplianceConfiguration.VirtualServer;
import io.capv.operator.cluster.loadbalancer.appliance.IpAction;
import io.capv.operator.common.Reconciliation;
import io.capv.operator.common.ReconciliationLogger;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Load balancers provided by the load balancer appliance. Each load balancer gets a virtual IP from an IP pool, a
 * virtual server listening on it and a pool with the backend members. The appliance configuration is only written
 * when the entries of the load balancer changed.
 */
public class NSXTLoadBalancerService implements LoadBalancerService<NSXTLoadBalancer> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(NSXTLoadBalancerService.class);

    /**
     * Balancing algorithm of the pools
     */
    public static final String ALGORITHM = "ROUND_ROBIN";

    private final KubernetesClient client;
    private final ApplianceClient appliance;

    /**
     * @param client        Kubernetes client
     * @param appliance     Appliance client
     */
    public NSXTLoadBalancerService(KubernetesClient client, ApplianceClient appliance) {
        this.client = client;
        this.appliance = appliance;
    }

    @Override
    public String kind() {
        return NSXTLoadBalancer.RESOURCE_KIND;
    }

    @Override
    public MixedOperation<NSXTLoadBalancer, NSXTLoadBalancerList, Resource<NSXTLoadBalancer>> operation() {
        return Crds.nsxtLoadBalancerOperation(client);
    }

    @Override
    public int port(NSXTLoadBalancer loadBalancer) {
        int port = loadBalancer.getSpec() != null ? loadBalancer.getSpec().getPort() : 0;
        return port > 0 ? port : Constants.DEFAULT_API_SERVER_PORT;
    }

    /**
     * @param loadBalancer  Load balancer
     *
     * @return  Name used for the appliance entries of the load balancer
     */
    /* test */ static String applianceName(NSXTLoadBalancer loadBalancer) {
        return loadBalancer.getMetadata().getNamespace() + "-" + loadBalancer.getMetadata().getName();
    }

    /* test */ static String virtualServerName(NSXTLoadBalancer loadBalancer, int port) {
        return applianceName(loadBalancer) + "-" + port;
    }

    /* test */ static String poolName(NSXTLoadBalancer loadBalancer) {
        return applianceName(loadBalancer) + "-pool";
    }

    @Override
    public LoadBalancerStatus reconcile(Reconciliation reconciliation, NSXTLoadBalancer loadBalancer, List<LoadBalancerMember> members) {
        String ipPool = loadBalancer.getSpec().getIpPoolName();
        String address = loadBalancer.getStatus() != null ? loadBalancer.getStatus().getAddress() : null;
        boolean allocated = false;

        if (address == null || address.isEmpty()) {
            address = appliance.allocateOrReleaseIp(ipPool, null, IpAction.ALLOCATE);
            allocated = true;
            LOGGER.infoCr(reconciliation, "Allocated virtual IP {} from pool {}", address, ipPool);
        }

        try {
            String transaction = appliance.startTransaction();
            ApplianceConfiguration current = appliance.getConfiguration(transaction);
            ApplianceConfiguration desired = desiredConfiguration(current, loadBalancer, address, members);

            if (sameEntries(current, desired, loadBalancer)) {
                LOGGER.debugCr(reconciliation, "Appliance configuration is unchanged");
            } else {
                LOGGER.infoCr(reconciliation, "Updating appliance configuration version {}", current.version());
                appliance.postConfiguration(transaction, desired, current.version());
                appliance.commit(transaction);
            }
        } catch (RuntimeException e) {
            if (allocated) {
                releaseAfterFailure(reconciliation, ipPool, address, e);
            }

            throw e;
        }

        LoadBalancerStatus status = new LoadBalancerStatus();
        status.setReady(true);
        status.setAddress(address);
        return status;
    }

    private void releaseAfterFailure(Reconciliation reconciliation, String ipPool, String address, RuntimeException original) {
        try {
            appliance.allocateOrReleaseIp(ipPool, address, IpAction.RELEASE);
            LOGGER.infoCr(reconciliation, "Released virtual IP {} after a failed reconciliation", address);
        } catch (RuntimeException releaseFailure) {
            LOGGER.warnCr(reconciliation, "Failed to release virtual IP {}", address, releaseFailure);
            original.addSuppressed(releaseFailure);
        }
    }

    /* test */ ApplianceConfiguration desiredConfiguration(ApplianceConfiguration current, NSXTLoadBalancer loadBalancer,
                                                          String address, List<LoadBalancerMember> members) {
        int port = port(loadBalancer);
        String virtualServerName = virtualServerName(loadBalancer, port);
        String poolName = poolName(loadBalancer);

        List<PoolMember> poolMembers = members.stream()
                .sorted(Comparator.comparing(LoadBalancerMember::name))
                .map(member -> new PoolMember(member.name(), member.address(), port))
                .collect(Collectors.toList());

        List<VirtualServer> virtualServers = withoutEntriesOf(current.virtualServers(), loadBalancer, VirtualServer::name);
        virtualServers.add(new VirtualServer(virtualServerName, loadBalancer.getSpec().getLoadBalancerServiceId(), address, port, poolName));

        List<Pool> pools = withoutEntriesOf(current.pools(), loadBalancer, Pool::name);
        pools.add(new Pool(poolName, ALGORITHM, 1, poolMembers));

        return new ApplianceConfiguration(current.version(), virtualServers, pools);
    }

    private static <E> List<E> withoutEntriesOf(List<E> entries, NSXTLoadBalancer loadBalancer, Function<E, String> name) {
        String prefix = applianceName(loadBalancer) + "-";

        return entries.stream()
                .filter(entry -> !isEntryOf(name.apply(entry), prefix))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static boolean isEntryOf(String name, String prefix) {
        if (name == null || !name.startsWith(prefix)) {
            return false;
        }

        String suffix = name.substring(prefix.length());
        return "pool".equals(suffix) || suffix.chars().allMatch(Character::isDigit);
    }

    /* test */ static boolean sameEntries(ApplianceConfiguration current, ApplianceConfiguration desired, NSXTLoadBalancer loadBalancer) {
        String prefix = applianceName(loadBalancer) + "-";

        return Objects.equals(entriesOf(current.virtualServers(), prefix, VirtualServer::name), entriesOf(desired.virtualServers(), prefix, VirtualServer::name))
                && Objects.equals(sortedPools(entriesOf(current.pools(), prefix, Pool::name)), sortedPools(entriesOf(desired.pools(), prefix, Pool::name)));
    }

    private static <E> List<E> entriesOf(List<E> entries, String prefix, Function<E, String> name) {
        return entries.stream()
                .filter(entry -> isEntryOf(name.apply(entry), prefix))
                .sorted(Comparator.comparing(name))
                .collect(Collectors.toList());
    }

    private static List<Pool> sortedPools(List<Pool> pools) {
        return pools.stream()
                .map(pool -> new Pool(pool.name(), pool.algorithm(), pool.minActiveMembers(),
                        pool.members().stream().sorted(Comparator.comparing(PoolMember::name)).collect(Collectors.toList())))
                .collect(Collectors.toList());
    }

    @Override
    public boolean delete(Reconciliation reconciliation, NSXTLoadBalancer loadBalancer) {
        String transaction = appliance.startTransaction();
        ApplianceConfiguration current = appliance.getConfiguration(transaction);
        String prefix = applianceName(loadBalancer) + "-";

        if (!entriesOf(current.virtualServers(), prefix, VirtualServer::name).isEmpty()
                || !entriesOf(current.pools(), prefix, Pool::name).isEmpty()) {
            LOGGER.infoCr(reconciliation, "Removing the load balancer from the appliance configuration");

            ApplianceConfiguration desired = new ApplianceConfiguration(current.version(),
                    withoutEntriesOf(current.virtualServers(), loadBalancer, VirtualServer::name),
                    withoutEntriesOf(current.pools(), loadBalancer, Pool::name));
            appliance.postConfiguration(transaction, desired, current.version());
            appliance.commit(transaction);
        }

        String address = loadBalancer.getStatus() != null ? loadBalancer.getStatus().getAddress() : null;
        if (address != null && !address.isEmpty() && loadBalancer.getSpec() != null) {
            appliance.allocateOrReleaseIp(loadBalancer.getSpec().getIpPoolName(), address, IpAction.RELEASE);
            LOGGER.infoCr(reconciliation, "Released virtual IP {}", address);
            loadBalancer.getStatus().setAddress(null);
        }

        return true;
    }
}
