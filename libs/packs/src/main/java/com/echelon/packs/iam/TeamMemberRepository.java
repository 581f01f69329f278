package com.echelon.packs.iam;

import java.util.List;
import java.util.Optional;

/**
 * Storage port for team members.
 */
public interface TeamMemberRepository {

    List<TeamMember> listByTenant(String tenantId);

    Optional<TeamMember> findByEmail(String tenantId, String email);

    /**
     * Stores the member unless the tenant already has one with the same email.
     *
     * @return true if stored
     */
    boolean saveIfAbsent(TeamMember member);
}
