package com.dtech.accountservice.infrastructure.persistence;

import com.dtech.accountservice.domain.Vendor;
import com.dtech.accountservice.domain.VendorRepository;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryVendorRepository implements VendorRepository {

    private final Map<String, Vendor> vendors = new ConcurrentHashMap<>();

    @Override
    public Vendor save(Vendor vendor) {
        vendors.put(vendor.id(), vendor);
        return vendor;
    }

    @Override
    public Optional<Vendor> findVendor(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(vendors.get(id));
    }

    /** Names compare case-insensitively. */
    @Override
    public Optional<Vendor> findByName(String name) {
        return vendors.values().stream()
                .filter(vendor -> vendor.name().equalsIgnoreCase(name))
                .findFirst();
    }

    @Override
    public List<Vendor> findAll() {
        return vendors.values().stream()
                .sorted(Comparator.comparing(Vendor::name, String.CASE_INSENSITIVE_ORDER).thenComparing(Vendor::id))
                .toList();
    }
}
