package br.edu.ifba.cadgraph.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.concurrent.ConcurrentHashMap;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.cadgraph.host.CadEntity;
import br.edu.ifba.cadgraph.host.HostUnavailableException;

/**
 * Assigns stable identifiers to CAD entities.
 *
 * <p>The stable id is the first 128 bits of the SHA-256 digest of the entity's
 * persistent token, hex encoded. It depends on nothing but the token, so the same
 * entity reached through different reference paths, in different runs or in
 * different processes maps to the same id.</p>
 *
 * <p>Results are cached per instance; create one service per pipeline run.</p>
 */
public class EntityIdentityService {

    private static final Logger logger = LoggerFactory.getLogger(EntityIdentityService.class);

    private static final int ID_BYTES = 16;
    private static final HexFormat HEX = HexFormat.of();

    // token -> stable id
    private final ConcurrentHashMap<String, String> cache = new ConcurrentHashMap<>();

    /**
     * Returns the stable id of an entity.
     *
     * @param entity host entity handle
     * @return 32 character hex id
     * @throws IdentityUnavailableException if the host has no persistent token for the entity
     * @throws HostUnavailableException if the document is no longer accessible
     */
    @NotNull
    public String identityOf(@NotNull CadEntity entity) throws IdentityUnavailableException {
        final String token;
        try {
            token = entity.entityToken();
        } catch (HostUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IdentityUnavailableException(entity.objectType(), "Host failed to supply an entity token", e);
        }

        if (token == null || token.isBlank()) {
            throw new IdentityUnavailableException(entity.objectType(), "Entity has no persistent token");
        }
        return cache.computeIfAbsent(token, EntityIdentityService::stableIdFor);
    }

    /**
     * Pure token to id mapping used by {@link #identityOf(CadEntity)}.
     *
     * @param token persistent entity token
     * @return 32 character lowercase hex id
     */
    @NotNull
    public static String stableIdFor(@NotNull String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            return HEX.formatHex(hash, 0, ID_BYTES);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public int cachedCount() {
        return cache.size();
    }

    public void clear() {
        logger.debug("Clearing {} cached identities", cache.size());
        cache.clear();
    }
}
