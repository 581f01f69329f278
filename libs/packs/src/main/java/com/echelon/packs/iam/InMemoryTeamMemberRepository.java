package com.echelon.packs.iam;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TeamMemberRepository} keyed by tenant and email.
 */
public class InMemoryTeamMemberRepository implements TeamMemberRepository {

    private final Map<String, TeamMember> members = new ConcurrentHashMap<>();

    @Override
    public List<TeamMember> listByTenant(String tenantId) {
        return members.values().stream()
                .filter(m -> m.tenantId().equals(tenantId))
                .sorted(Comparator.comparing(TeamMember::invitedAt))
                .toList();
    }

    @Override
    public Optional<TeamMember> findByEmail(String tenantId, String email) {
        return Optional.ofNullable(members.get(key(tenantId, email)));
    }

    @Override
    public boolean saveIfAbsent(TeamMember member) {
        return members.putIfAbsent(key(member.tenantId(), member.email()), member) == null;
    }

    private static String key(String tenantId, String email) {
        return tenantId + "/" + email;
    }
}
