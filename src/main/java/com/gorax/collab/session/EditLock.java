package com.gorax.collab.session;

import java.time.Instant;

/**
 * Exclusive edit right of one user over one graph element.
 */
public record EditLock(
    String elementId,
    ElementType elementType,
    String ownerUserId,
    String ownerUserName,
    Instant acquiredAt
) {
    public boolean isOwnedBy(String userId) {
        return ownerUserId.equals(userId);
    }
}
