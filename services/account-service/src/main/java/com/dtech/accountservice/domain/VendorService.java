package com.dtech.accountservice.domain;

import com.dtech.security.TenantMembership;
import com.dtech.security.TenantType;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class VendorService {

    private static final Logger log = LoggerFactory.getLogger(VendorService.class);

    private final VendorRepository vendors;

    public VendorService(VendorRepository vendors) {
        this.vendors = vendors;
    }

    /**
     * Creates an INTERNAL vendor, which starts in the NORMAL state.
     *
     * @throws ResourceConflictException when another vendor already has the name
     */
    public Vendor create(String name, int userLimit) {
        String trimmed = name.strip();
        if (vendors.findByName(trimmed).isPresent()) {
            throw new ResourceConflictException("Vendor with this name already exist");
        }
        Vendor vendor = vendors.save(Vendor.create(UUID.randomUUID().toString(), trimmed, TenantType.INTERNAL, userLimit));
        log.info("Created vendor {} with user limit {}", vendor.id(), userLimit);
        return vendor;
    }

    public Page<Vendor> listAll(int offset, int limit) {
        return Page.slice(vendors.findAll(), offset, limit);
    }

    /**
     * Vendors of the given memberships, ordered by vendor name. Memberships of vendors that no longer
     * exist are skipped.
     */
    public Page<MemberVendor> listForMember(
            List<TenantMembership> memberships, InvitationFilter filter, int offset, int limit) {
        List<MemberVendor> all = memberships.stream()
                .filter(filter::matches)
                .flatMap(membership -> vendors.findVendor(membership.tenantId())
                        .map(vendor -> new MemberVendor(vendor, membership))
                        .stream())
                .sorted(Comparator.comparing((MemberVendor entry) -> entry.vendor().name(), String.CASE_INSENSITIVE_ORDER))
                .toList();
        return Page.slice(all, offset, limit);
    }

    public Vendor find(String vendorId) {
        return vendors.findVendor(vendorId)
                .orElseThrow(() -> new ResourceNotFoundException("Vendor with this id does not exist"));
    }
}
