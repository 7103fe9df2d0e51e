package br.edu.ifba.cadgraph.extract;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.cadgraph.core.EntityIdentityService;
import br.edu.ifba.cadgraph.core.IdentityUnavailableException;
import br.edu.ifba.cadgraph.host.CadEntity;

/**
 * Per-run state handed to extractors.
 */
public final class ExtractionContext {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionContext.class);

    private final EntityIdentityService identityService;
    private long unresolvedReferences;

    public ExtractionContext(@NotNull EntityIdentityService identityService) {
        this.identityService = identityService;
    }

    /**
     * Stable id of an entity that must be identifiable.
     */
    @NotNull
    public String idOf(@NotNull CadEntity entity) throws IdentityUnavailableException {
        return identityService.identityOf(entity);
    }

    /**
     * Stable id of a referenced entity, or null if it is absent or has no identity.
     * References to such entities are dropped.
     */
    @Nullable
    public String referenceIdOf(@Nullable CadEntity entity) {
        if (entity == null) {
            return null;
        }
        try {
            return identityService.identityOf(entity);
        } catch (IdentityUnavailableException e) {
            unresolvedReferences++;
            logger.debug("Dropping reference to {}: {}", entity.objectType(), e.getMessage());
            return null;
        }
    }

    public RelationshipCollector relationships() {
        return new RelationshipCollector(this);
    }

    /**
     * Number of references dropped because their target had no identity.
     */
    public long unresolvedReferences() {
        return unresolvedReferences;
    }
}
