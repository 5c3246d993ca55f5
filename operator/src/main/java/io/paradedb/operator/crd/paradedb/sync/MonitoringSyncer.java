package io.paradedb.operator.crd.paradedb.sync;

import io.paradedb.operator.crd.paradedb.ParadeDB;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.NullMarked;

@NullMarked
@ApplicationScoped
@RequiredArgsConstructor
public class MonitoringSyncer {
    private final MetricsServiceSyncer metricsServiceSyncer;
    private final ServiceMonitorSyncer serviceMonitorSyncer;

    public void sync(ParadeDB paradeDB) {
        metricsServiceSyncer.sync(paradeDB);

        var serviceMonitor = paradeDB.getSpec().getMonitoringOrDefault().getServiceMonitor();
        if (serviceMonitor != null && serviceMonitor.isEnabled()) {
            serviceMonitorSyncer.sync(paradeDB);
        }
    }
}
