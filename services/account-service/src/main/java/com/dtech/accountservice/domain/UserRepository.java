package com.dtech.accountservice.domain;

import com.dtech.security.Identity;
import com.dtech.security.IdentityStore;
import com.dtech.security.Role;
import java.util.List;

/**
 * Identity persistence. Lookups come from {@link IdentityStore}; e-mails are stored lower-case.
 */
public interface UserRepository extends IdentityStore {

    Identity save(Identity identity);

    void delete(String id);

    /** Identities with the given role ordered by e-mail. */
    List<Identity> findAllByRole(Role role);
}
