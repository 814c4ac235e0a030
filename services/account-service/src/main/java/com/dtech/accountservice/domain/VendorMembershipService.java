package com.dtech.accountservice.domain;

import com.dtech.security.Identity;
import com.dtech.security.InvitationTokenCodec;
import com.dtech.security.Role;
import com.dtech.security.TenantMembership;
import com.dtech.security.TenantRole;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Membership of VENDOR identities in vendors: invitations, acceptance, role changes and removal.
 */
public class VendorMembershipService {

    private static final Logger log = LoggerFactory.getLogger(VendorMembershipService.class);

    static final String ACCOUNT_NOT_ACCEPTED = "User has not accepted the account invitation yet";

    private final VendorService vendors;
    private final UserAccountService accounts;
    private final MembershipRepository memberships;
    private final InvitationTokenCodec invitationTokens;
    private final AccountNotifier notifier;
    private final AccountLinks links;

    public VendorMembershipService(
            VendorService vendors,
            UserAccountService accounts,
            MembershipRepository memberships,
            InvitationTokenCodec invitationTokens,
            AccountNotifier notifier,
            AccountLinks links) {
        this.vendors = vendors;
        this.accounts = accounts;
        this.memberships = memberships;
        this.invitationTokens = invitationTokens;
        this.notifier = notifier;
        this.links = links;
    }

    /** Members ordered by e-mail. */
    public Page<VendorMember> listMembers(String vendorId, int offset, int limit) {
        vendors.find(vendorId);
        List<VendorMember> all = memberships.listByTenant(vendorId).stream()
                .map(membership -> new VendorMember(accounts.findById(membership.userId()), membership))
                .sorted(Comparator.comparing(member -> member.identity().email()))
                .toList();
        return Page.slice(all, offset, limit);
    }

    /**
     * Adds the identity with {@code email} to the vendor as a pending member, creating a pending VENDOR
     * identity first when the e-mail is unknown, and sends the invitation.
     *
     * @throws PaymentRequiredException  when the vendor's user limit is reached
     * @throws ResourceConflictException when the identity is an ADMIN or already a member
     */
    public VendorMember invite(String vendorId, String email, TenantRole role, Identity invitedBy) {
        Vendor vendor = vendors.find(vendorId);
        if (memberships.countByTenant(vendorId) >= vendor.userLimit()) {
            throw new PaymentRequiredException("You cannot add more users because your limit has been reached");
        }
        Identity user = accounts.lookupByEmail(email).orElseGet(() -> accounts.createIdentity(email, Role.VENDOR));
        if (user.role() != Role.VENDOR) {
            throw new ResourceConflictException("Only vendor users can be added to a vendor");
        }
        if (memberships.find(vendorId, user.id()).isPresent()) {
            throw new ResourceConflictException("User already exist in the vendor");
        }
        TenantMembership membership = memberships.save(TenantMembership.pending(vendorId, user.id(), role));
        log.info("Added user {} to vendor {} as {}", user.id(), vendorId, role);
        notifyInvitation(vendor, user, membership, invitedBy);
        return new VendorMember(user, membership);
    }

    public void resendInvitation(String vendorId, String userId, Identity invitedBy) {
        Vendor vendor = vendors.find(vendorId);
        Identity user = accounts.findById(userId);
        TenantMembership membership = findMembership(vendorId, userId);
        if (membership.invitationAccepted()) {
            throw new ResourceConflictException("User has already accepted the invitation");
        }
        notifyInvitation(vendor, user, membership, invitedBy);
    }

    /**
     * @throws ResourceConflictException when the membership is already accepted, or the identity has
     *                                   not accepted its own invitation yet
     */
    public void acceptInvitation(String vendorId, String userId) {
        TenantMembership membership = findMembership(vendorId, userId);
        if (membership.invitationAccepted()) {
            throw new ResourceConflictException("User has already accepted the invitation");
        }
        if (!accounts.findById(userId).invitationAccepted()) {
            throw new ResourceConflictException(ACCOUNT_NOT_ACCEPTED);
        }
        memberships.save(membership.accepted());
        log.info("User {} accepted the invitation to vendor {}", userId, vendorId);
    }

    /**
     * @throws ResourceConflictException while the member has not accepted the invitation
     */
    public VendorMember changeRole(String vendorId, String userId, TenantRole role) {
        Identity user = accounts.findById(userId);
        TenantMembership membership = findMembership(vendorId, userId);
        if (!membership.invitationAccepted()) {
            throw new ResourceConflictException("Not allowed to change role until user accepts the invitation");
        }
        return new VendorMember(user, memberships.save(membership.withRole(role)));
    }

    public void remove(String vendorId, String userId) {
        findMembership(vendorId, userId);
        memberships.remove(vendorId, userId);
        log.info("Removed user {} from vendor {}", userId, vendorId);
    }

    private TenantMembership findMembership(String vendorId, String userId) {
        return memberships.find(vendorId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("User does not exist in the vendor"));
    }

    // Identities that already accepted a previous invitation log in and accept from the vendor page.
    private void notifyInvitation(Vendor vendor, Identity user, TenantMembership membership, Identity invitedBy) {
        String link = user.invitationAccepted()
                ? links.vendor(vendor.id())
                : links.acceptInvitation(invitationTokens.issue(user));
        notifier.vendorUserInvited(user, membership.role(), vendor, invitedBy, link);
    }
}
