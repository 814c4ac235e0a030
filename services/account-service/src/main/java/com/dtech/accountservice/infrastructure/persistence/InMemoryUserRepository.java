package com.dtech.accountservice.infrastructure.persistence;

import com.dtech.accountservice.domain.UserRepository;
import com.dtech.security.Identity;
import com.dtech.security.Role;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * Process-local identity store keyed by id, with a secondary e-mail index.
 */
@Repository
public class InMemoryUserRepository implements UserRepository {

    private final Map<String, Identity> byId = new ConcurrentHashMap<>();
    private final Map<String, String> idByEmail = new ConcurrentHashMap<>();

    @Override
    public synchronized Identity save(Identity identity) {
        String ownerOfEmail = idByEmail.get(identity.email());
        if (ownerOfEmail != null && !ownerOfEmail.equals(identity.id())) {
            throw new IllegalStateException("e-mail already belongs to another identity");
        }
        Identity previous = byId.put(identity.id(), identity);
        if (previous != null && !previous.email().equals(identity.email())) {
            idByEmail.remove(previous.email());
        }
        idByEmail.put(identity.email(), identity.id());
        return identity;
    }

    @Override
    public synchronized void delete(String id) {
        Identity removed = byId.remove(id);
        if (removed != null) {
            idByEmail.remove(removed.email());
        }
    }

    @Override
    public Optional<Identity> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    @Override
    public Optional<Identity> findByEmail(String email) {
        return email == null ? Optional.empty() : Optional.ofNullable(idByEmail.get(email)).flatMap(this::findById);
    }

    @Override
    public List<Identity> findAllByRole(Role role) {
        return byId.values().stream()
                .filter(identity -> identity.role() == role)
                .sorted(Comparator.comparing(Identity::email))
                .toList();
    }
}
