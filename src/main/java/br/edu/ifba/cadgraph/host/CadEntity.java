package br.edu.ifba.cadgraph.host;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Read-only handle to an entity of the host CAD object model.
 *
 * <p>Handles are only valid on the thread that obtained them from the host.
 * Any accessor may throw {@link HostUnavailableException} once the owning
 * document has been closed.</p>
 */
public interface CadEntity {

    /**
     * Host type discriminator, e.g. {@code adsk::fusion::SketchLine}.
     *
     * @return the fully qualified host object type
     */
    @NotNull
    String objectType();

    /**
     * Persistent token identifying the underlying entity for the lifetime of the document.
     *
     * @return the token, or null for transient/virtual entities that have none
     */
    @Nullable
    String entityToken();

    /**
     * Short type name, the last {@code ::} segment of {@link #objectType()}.
     *
     * @return the simple type name used as graph node label
     */
    default String typeName() {
        return simpleTypeName(objectType());
    }

    static String simpleTypeName(@NotNull String objectType) {
        int separator = objectType.lastIndexOf("::");
        return separator >= 0 ? objectType.substring(separator + 2) : objectType;
    }
}
