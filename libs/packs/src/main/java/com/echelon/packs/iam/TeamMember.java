package com.echelon.packs.iam;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * A person invited to, or active in, a tenant.
 *
 * @param memberId  opaque identifier
 * @param tenantId  owning tenant
 * @param email     normalized (lower-case) address
 * @param role      one of {@link IamPack#ROLES}
 * @param status    {@code invited} until the invitation is accepted
 * @param invitedAt invitation time
 * @param invitedBy credential that sent the invitation
 */
public record TeamMember(
        @JsonProperty("member_id") String memberId,
        @JsonProperty("tenant_id") String tenantId,
        String email,
        String role,
        String status,
        @JsonProperty("invited_at") Instant invitedAt,
        @JsonProperty("invited_by") String invitedBy) {

    public static final String STATUS_INVITED = "invited";
}
