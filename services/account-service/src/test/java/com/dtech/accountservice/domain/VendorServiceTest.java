package com.dtech.accountservice.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dtech.security.TenantMembership;
import com.dtech.security.TenantRole;
import com.dtech.security.TenantState;
import com.dtech.security.TenantType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VendorService")
class VendorServiceTest {

    private final VendorService vendors = new AccountFixture().vendors;

    @Test
    @DisplayName("creates INTERNAL vendors in NORMAL state")
    void create() {
        Vendor vendor = vendors.create("  Acme ", 5);

        assertThat(vendor.name()).isEqualTo("Acme");
        assertThat(vendor.type()).isEqualTo(TenantType.INTERNAL);
        assertThat(vendor.state()).isEqualTo(TenantState.NORMAL);
        assertThat(vendors.find(vendor.id())).isEqualTo(vendor);
    }

    @Test
    @DisplayName("names are unique regardless of case")
    void uniqueName() {
        vendors.create("Acme", 5);

        assertThatThrownBy(() -> vendors.create("ACME", 1)).isInstanceOf(ResourceConflictException.class);
    }

    @Test
    @DisplayName("lists every vendor by name")
    void listAll() {
        vendors.create("Zeta", 1);
        vendors.create("alpha", 1);
        vendors.create("Beta", 1);

        Page<Vendor> page = vendors.listAll(1, 1);

        assertThat(page.total()).isEqualTo(3);
        assertThat(page.items()).extracting(Vendor::name).containsExactly("Beta");
    }

    @Test
    @DisplayName("lists a member's vendors filtered by invitation state, skipping vanished vendors")
    void listForMember() {
        Vendor acme = vendors.create("Acme", 5);
        Vendor bolt = vendors.create("Bolt", 5);
        List<TenantMembership> memberships = List.of(
                new TenantMembership(bolt.id(), "u1", TenantRole.ANALYST, false),
                new TenantMembership(acme.id(), "u1", TenantRole.ADMIN, true),
                new TenantMembership("gone", "u1", TenantRole.VETTER, true));

        assertThat(vendors.listForMember(memberships, InvitationFilter.ALL, 0, 10).items())
                .extracting(entry -> entry.vendor().name())
                .containsExactly("Acme", "Bolt");
        assertThat(vendors.listForMember(memberships, InvitationFilter.ACCEPTED, 0, 10).items())
                .singleElement()
                .satisfies(entry -> assertThat(entry.membership().role()).isEqualTo(TenantRole.ADMIN));
        assertThat(vendors.listForMember(memberships, InvitationFilter.PENDING, 0, 10).items())
                .extracting(entry -> entry.vendor().id())
                .containsExactly(bolt.id());
    }

    @Test
    @DisplayName("asking for both or neither invitation state selects everything")
    void invitationFilter() {
        assertThat(InvitationFilter.of(false, false)).isEqualTo(InvitationFilter.ALL);
        assertThat(InvitationFilter.of(true, true)).isEqualTo(InvitationFilter.ALL);
        assertThat(InvitationFilter.of(true, false)).isEqualTo(InvitationFilter.ACCEPTED);
        assertThat(InvitationFilter.of(false, true)).isEqualTo(InvitationFilter.PENDING);
    }

    @Test
    @DisplayName("a user limit below one is rejected")
    void userLimit() {
        assertThatThrownBy(() -> vendors.create("Tiny", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
