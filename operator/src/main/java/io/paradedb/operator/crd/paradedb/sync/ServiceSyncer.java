package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.ServicePortBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator.core.EventRecorder;
import org.jspecify.annotations.NullMarked;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Services compare type, selector and the declared part of each port. clusterIP and assigned node ports
 * are owned by the API server and kept on update.
 */
@NullMarked
public abstract class ServiceSyncer extends SubResourceSyncer<Service> {
    protected ServiceSyncer() {
    }

    protected ServiceSyncer(
            KubernetesClient kubernetesClient,
            EventRecorder eventRecorder
    ) {
        super(kubernetesClient, eventRecorder);
    }

    @Override
    protected Class<Service> resourceType() {
        return Service.class;
    }

    @Override
    protected boolean isUpToDate(
            Service actual,
            Service desired
    ) {
        var actualSpec = actual.getSpec();
        var desiredSpec = desired.getSpec();

        return Objects.equals(typeOrDefault(actualSpec.getType()), typeOrDefault(desiredSpec.getType()))
                && Objects.equals(actualSpec.getSelector(), desiredSpec.getSelector())
                && Objects.equals(declaredPorts(actualSpec.getPorts()), declaredPorts(desiredSpec.getPorts()))
                && hasLabels(actual, desired);
    }

    @Override
    protected void applyMutableFields(
            Service actual,
            Service desired
    ) {
        var actualSpec = actual.getSpec();
        var desiredSpec = desired.getSpec();

        var ports = new ArrayList<ServicePort>();
        for (var port : desiredSpec.getPorts()) {
            var updated = new ServicePortBuilder(port).build();

            // keep the node port the API server assigned
            if (!"ClusterIP".equals(desiredSpec.getType())) {
                actualSpec.getPorts().stream()
                        .filter(existing -> Objects.equals(existing.getName(), port.getName()))
                        .findFirst()
                        .ifPresent(existing -> updated.setNodePort(existing.getNodePort()));
            }

            ports.add(updated);
        }

        actualSpec.setType(desiredSpec.getType());
        actualSpec.setSelector(desiredSpec.getSelector());
        actualSpec.setPorts(ports);

        mergeLabels(actual, desired);
    }

    protected static ServicePort port(
            String name,
            int port
    ) {
        return new ServicePortBuilder()
                .withName(name)
                .withPort(port)
                .withTargetPort(new IntOrString(port))
                .withProtocol("TCP")
                .build();
    }

    private static String typeOrDefault(String type) {
        //noinspection ConstantConditions
        return type == null ? "ClusterIP" : type;
    }

    private static List<String> declaredPorts(List<ServicePort> ports) {
        //noinspection ConstantConditions
        if (ports == null) {
            return List.of();
        }

        return ports.stream()
                .map(port -> "%s/%s/%s/%s".formatted(
                        port.getName(),
                        port.getPort(),
                        port.getProtocol() == null ? "TCP" : port.getProtocol(),
                        port.getTargetPort() == null ? port.getPort() : port.getTargetPort().getValue()
                ))
                .toList();
    }
}
