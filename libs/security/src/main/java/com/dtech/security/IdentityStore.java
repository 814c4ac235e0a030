package com.dtech.security;

import java.util.Optional;

/**
 * Read access to identities. Implementations must be safe for concurrent use.
 */
public interface IdentityStore {

    Optional<Identity> findById(String id);

    Optional<Identity> findByEmail(String email);
}
