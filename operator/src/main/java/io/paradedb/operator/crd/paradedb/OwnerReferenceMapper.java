package io.paradedb.operator.crd.paradedb;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import io.javaoperatorsdk.operator.processing.event.source.SecondaryToPrimaryMapper;
import org.jspecify.annotations.NullMarked;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Maps an owned object back to the {@link ParadeDB} that controls it.
 */
@NullMarked
public class OwnerReferenceMapper<R extends HasMetadata> implements SecondaryToPrimaryMapper<R> {
    private static final String KIND = HasMetadata.getKind(ParadeDB.class);
    private static final String GROUP = HasMetadata.getGroup(ParadeDB.class);

    @Override
    public Set<ResourceID> toPrimaryResourceIDs(R resource) {
        var ownerReferences = resource.getMetadata().getOwnerReferences();
        var result = new HashSet<ResourceID>();

        //noinspection ConstantConditions
        if (ownerReferences == null) {
            return result;
        }

        for (var ownerReference : ownerReferences) {
            if (!KIND.equals(ownerReference.getKind())
                    || ownerReference.getApiVersion() == null
                    || !ownerReference.getApiVersion().startsWith(GROUP + "/")
                    || !Objects.equals(ownerReference.getController(), Boolean.TRUE)
            ) {
                continue;
            }

            result.add(new ResourceID(
                    ownerReference.getName(),
                    resource.getMetadata().getNamespace()
            ));
        }

        return result;
    }
}
