package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.utils.KubernetesSerialization;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * Drift detection for objects whose live form is enriched with server-side defaults.
 * <p>
 * The SHA-256 of the desired mutable section is stored as an annotation on the object. An object is up to
 * date when the stored hash equals the hash of the freshly built desired state.
 */
@NullMarked
public final class DesiredStateHash {
    public static final String ANNOTATION = "paradedb.io/desired-hash";

    private static final KubernetesSerialization SERIALIZATION = new KubernetesSerialization();

    public static String of(Object state) {
        try {
            var digest = MessageDigest.getInstance("SHA-256")
                    .digest(SERIALIZATION.asJson(state).getBytes(StandardCharsets.UTF_8));

            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public static void stamp(
            HasMetadata resource,
            Object state
    ) {
        var metadata = resource.getMetadata();

        if (metadata.getAnnotations() == null) {
            metadata.setAnnotations(new LinkedHashMap<>());
        }

        metadata.getAnnotations().put(ANNOTATION, of(state));
    }

    @Nullable
    public static String read(HasMetadata resource) {
        var annotations = resource.getMetadata().getAnnotations();

        return annotations == null ? null : annotations.get(ANNOTATION);
    }

    public static boolean matches(
            HasMetadata actual,
            HasMetadata desired
    ) {
        var expected = read(desired);

        return expected != null && Objects.equals(read(actual), expected);
    }

    /**
     * Copy the desired hash onto the live object, keeping its other annotations.
     */
    public static void copy(
            HasMetadata desired,
            HasMetadata actual
    ) {
        var hash = read(desired);

        if (hash != null) {
            var metadata = actual.getMetadata();

            if (metadata.getAnnotations() == null) {
                metadata.setAnnotations(new LinkedHashMap<>());
            }

            metadata.getAnnotations().put(ANNOTATION, hash);
        }
    }

    private DesiredStateHash() {
    }
}
