package com.dtech.security;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Claims bound by an invitation token digest. Serialized with a fixed property order.
 *
 * @param type   always {@link ClaimType#INVITATION}
 * @param userId invited identity id
 * @param role   invited identity role
 */
@JsonPropertyOrder({"type", "userId", "role"})
public record InvitationClaims(
        @JsonProperty("type") String type,
        @JsonProperty("userId") String userId,
        @JsonProperty("role") String role
) {

    /** Claims describing the current state of {@code identity}. */
    public static InvitationClaims of(Identity identity) {
        return new InvitationClaims(ClaimType.INVITATION.value(), identity.id(), identity.role().value());
    }
}
