package com.dtech.accountservice.infrastructure.persistence;

import com.dtech.accountservice.domain.MembershipRepository;
import com.dtech.security.TenantMembership;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * Memberships keyed by their (tenant, user) pair.
 */
@Repository
public class InMemoryMembershipRepository implements MembershipRepository {

    private final Map<Key, TenantMembership> memberships = new ConcurrentHashMap<>();

    @Override
    public TenantMembership save(TenantMembership membership) {
        memberships.put(new Key(membership.tenantId(), membership.userId()), membership);
        return membership;
    }

    @Override
    public void remove(String tenantId, String userId) {
        memberships.remove(new Key(tenantId, userId));
    }

    @Override
    public void removeAllForUser(String userId) {
        memberships.keySet().removeIf(key -> key.userId().equals(userId));
    }

    @Override
    public List<TenantMembership> listByUser(String userId) {
        return memberships.values().stream()
                .filter(membership -> membership.userId().equals(userId))
                .sorted(Comparator.comparing(TenantMembership::tenantId))
                .toList();
    }

    @Override
    public Optional<TenantMembership> find(String tenantId, String userId) {
        if (tenantId == null || userId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(memberships.get(new Key(tenantId, userId)));
    }

    @Override
    public List<TenantMembership> listByTenant(String tenantId) {
        return memberships.values().stream()
                .filter(membership -> membership.tenantId().equals(tenantId))
                .toList();
    }

    @Override
    public int countByTenant(String tenantId) {
        return (int) memberships.keySet().stream().filter(key -> key.tenantId().equals(tenantId)).count();
    }

    private record Key(String tenantId, String userId) {}
}
