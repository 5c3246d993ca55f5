package io.paradedb.operator.crd.paradedb;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.ShortNames;
import io.fabric8.kubernetes.model.annotation.Singular;
import io.fabric8.kubernetes.model.annotation.Version;
import org.jspecify.annotations.NullMarked;

@NullMarked
@Version("v1alpha1")
@Group("database.paradedb.io")
@Singular("paradedb")
@Plural("paradedbs")
@ShortNames("pdb")
public class ParadeDB
        extends CustomResource<ParadeDBSpec, ParadeDBStatus>
        implements Namespaced {
    @Override
    protected ParadeDBSpec initSpec() {
        return new ParadeDBSpec();
    }
}
