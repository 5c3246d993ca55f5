package io.paradedb.operator.core;

import io.fabric8.kubernetes.client.CustomResource;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NullMarked;

@NullMarked
@Slf4j
public abstract class BaseReconciler<CR extends CustomResource<?, S>, S extends CRStatus> {
    protected abstract S newStatus();

    protected abstract EventRecorder eventRecorder();

    protected abstract OperatorConfig operatorConfig();

    public S initializeStatus(CR resource) {
        S status = resource.getStatus();

        //noinspection ConstantConditions
        if (status == null) {
            status = newStatus();
            resource.setStatus(status);
        }

        return status;
    }

    /**
     * Mark the resource as failed and schedule a retry.
     *
     * @param step human-readable name of the step that failed, used as the message prefix
     */
    public <E extends Exception> UpdateControl<CR> handleError(
            CR resource,
            S status,
            String step,
            E exception
    ) {
        var metadata = resource.getMetadata();
        var message = "%s: %s".formatted(step, exception.getMessage());

        log.error(
                "Failed to reconcile resource [resource={}/{}, step={}]",
                metadata.getNamespace(),
                metadata.getName(),
                step,
                exception
        );

        status.setPhase(CRPhase.FAILED)
                .setMessage(message);

        Conditions.set(
                status.getConditions(),
                Conditions.TYPE_DEGRADED,
                true,
                EventRecorder.REASON_RECONCILIATION_FAILED,
                message,
                metadata.getGeneration() == null ? 0 : metadata.getGeneration()
        );

        eventRecorder().warning(
                resource,
                EventRecorder.REASON_RECONCILIATION_FAILED,
                message
        );

        return UpdateControl.patchStatus(resource)
                .rescheduleAfter(operatorConfig().requeue().error());
    }
}
