package com.echelon.packs.iam;

import com.echelon.kernel.error.ErrorCodes;
import com.echelon.kernel.error.ErrorKind;
import com.echelon.kernel.error.KernelException;
import com.echelon.kernel.registry.Action;
import com.echelon.kernel.registry.ActionContext;
import com.echelon.kernel.registry.ActionDefinition;
import com.echelon.kernel.registry.ActionResult;
import com.echelon.kernel.registry.FieldSchema;
import com.echelon.kernel.registry.Impact;
import com.echelon.kernel.registry.Pack;
import com.echelon.packs.PackInputs;
import com.echelon.security.ApiKeys;
import com.echelon.security.Credential;
import com.echelon.security.CredentialRepository;
import com.echelon.security.IssuedApiKey;
import com.echelon.security.Scopes;
import com.echelon.security.SecretHasher;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Identity and access management for a tenant: its API keys and team members.
 * <p>
 * A key can only be granted scopes the calling key currently holds, so an unverified
 * tenant cannot mint a key that becomes more powerful than its creator after verification.
 * Keys belonging to other tenants are never visible or modifiable.
 */
public class IamPack implements Pack {

    private static final Logger log = LoggerFactory.getLogger(IamPack.class);

    public static final String NAMESPACE = "iam";
    public static final List<String> ROLES = List.of("admin", "member", "viewer");

    private static final String API_KEY = "api_key";
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final CredentialRepository credentials;
    private final TeamMemberRepository team;
    private final SecretHasher hasher;

    public IamPack(CredentialRepository credentials, TeamMemberRepository team, SecretHasher hasher) {
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.team = Objects.requireNonNull(team, "team");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
    }

    @Override
    public String namespace() {
        return NAMESPACE;
    }

    @Override
    public String description() {
        return "API keys and team members";
    }

    @Override
    public List<Action> actions() {
        FieldSchema scopes = FieldSchema.array(FieldSchema.string().oneOf(Scopes.ALL.toArray(String[]::new)));
        FieldSchema keyList = FieldSchema.object(Map.of(
                "keys", FieldSchema.array(FieldSchema.object()),
                "total", FieldSchema.integer()));
        FieldSchema keyOut = FieldSchema.object(Map.of(
                "key_id", FieldSchema.string(),
                "prefix", FieldSchema.string(),
                "scopes", FieldSchema.array(FieldSchema.string())));

        return List.of(
                new Action(ActionDefinition.read("iam.keys.list", Scopes.READ,
                        "List all API keys for the tenant", FieldSchema.object(), keyList),
                        this::listKeys),
                new Action(ActionDefinition.mutation("iam.keys.create", Scopes.IAM,
                        "Create a new API key; the raw key is returned once",
                        FieldSchema.object(Map.of(
                                "name", FieldSchema.string(),
                                "scopes", scopes,
                                "expires_at", FieldSchema.string().describedAs("ISO-8601 timestamp")),
                                "scopes"),
                        keyOut),
                        this::createKey),
                new Action(ActionDefinition.mutation("iam.keys.update", Scopes.IAM,
                        "Update the name, scopes or expiry of an API key",
                        FieldSchema.object(Map.of(
                                "key_id", FieldSchema.string(),
                                "name", FieldSchema.string(),
                                "scopes", scopes,
                                "expires_at", FieldSchema.string().describedAs("ISO-8601 timestamp")),
                                "key_id"),
                        keyOut),
                        this::updateKey),
                new Action(ActionDefinition.mutation("iam.keys.revoke", Scopes.IAM,
                        "Revoke an API key",
                        FieldSchema.object(Map.of("key_id", FieldSchema.string()), "key_id"),
                        FieldSchema.object(Map.of(
                                "key_id", FieldSchema.string(),
                                "revoked", FieldSchema.bool()))),
                        this::revokeKey),
                new Action(ActionDefinition.read("iam.team.list", Scopes.READ,
                        "List all team members for the tenant", FieldSchema.object(),
                        FieldSchema.object(Map.of(
                                "members", FieldSchema.array(FieldSchema.object()),
                                "total", FieldSchema.integer()))),
                        this::listTeam),
                new Action(ActionDefinition.mutation("iam.team.invite", Scopes.IAM,
                        "Invite a team member",
                        FieldSchema.object(Map.of(
                                "email", FieldSchema.string(),
                                "role", FieldSchema.string().oneOf(ROLES.toArray(String[]::new))),
                                "email", "role"),
                        FieldSchema.object(Map.of(
                                "member_id", FieldSchema.string(),
                                "status", FieldSchema.string()))),
                        this::inviteMember));
    }

    private ActionResult listKeys(ActionContext ctx, JsonNode input) {
        Instant now = ctx.clock().instant();
        List<ApiKeyView> keys = credentials.listByTenant(ctx.tenantId()).stream()
                .map(c -> ApiKeyView.of(c, now))
                .toList();
        return ActionResult.of(Map.of("keys", keys, "total", keys.size()));
    }

    private ActionResult createKey(ActionContext ctx, JsonNode input) {
        Instant now = ctx.clock().instant();
        String name = PackInputs.text(input, "name");
        Set<String> scopes = PackInputs.textSet(input, "scopes");
        Instant expiresAt = PackInputs.instant(input, "expires_at");
        requireGrantable(ctx, scopes);
        requireFuture(expiresAt, now);

        if (ctx.dryRun()) {
            Impact impact = Impact.creates(API_KEY + ":" + (name == null ? "unnamed" : name), Impact.RISK_LOW);
            if (scopes.contains(Scopes.IAM)) {
                impact = impact.withWarning("The new key can create and revoke other keys");
            }
            return ActionResult.dryRun(impact);
        }

        IssuedApiKey issued = ApiKeys.generate(hasher);
        Credential credential = new Credential("key_" + UUID.randomUUID().toString().replace("-", ""),
                ctx.tenantId(), issued.prefix(), issued.hash(), name, scopes, now, expiresAt, null, null);
        credentials.save(credential);
        log.info("API key created: tenant={} keyId={} prefix={} by={}",
                ctx.tenantId(), credential.credentialId(), credential.keyPrefix(), ctx.credentialId());
        return ActionResult.of(ApiKeyView.withKey(credential, issued.rawKey(), now));
    }

    private ActionResult updateKey(ActionContext ctx, JsonNode input) {
        Instant now = ctx.clock().instant();
        Credential existing = ownedKey(ctx, PackInputs.text(input, "key_id"));
        if (existing.isRevoked()) {
            throw KernelException.invalidInput("API key is revoked: " + existing.credentialId());
        }
        String name = PackInputs.has(input, "name") ? PackInputs.text(input, "name") : existing.name();
        Set<String> scopes = PackInputs.has(input, "scopes") ? PackInputs.textSet(input, "scopes") : existing.scopes();
        Instant expiresAt = PackInputs.has(input, "expires_at")
                ? PackInputs.instant(input, "expires_at") : existing.expiresAt();
        if (PackInputs.has(input, "scopes")) {
            requireGrantable(ctx, scopes);
        }
        requireFuture(PackInputs.has(input, "expires_at") ? expiresAt : null, now);

        if (ctx.dryRun()) {
            List<String> changed = new ArrayList<>();
            if (!Objects.equals(name, existing.name())) {
                changed.add(API_KEY + ":" + existing.credentialId() + ".name");
            }
            if (!scopes.equals(existing.scopes())) {
                changed.add(API_KEY + ":" + existing.credentialId() + ".scopes");
            }
            if (!Objects.equals(expiresAt, existing.expiresAt())) {
                changed.add(API_KEY + ":" + existing.credentialId() + ".expires_at");
            }
            List<String> warnings = changed.isEmpty() ? List.of("No fields changed") : List.of();
            return ActionResult.dryRun(new Impact(null, changed, null, null, Impact.RISK_LOW, warnings));
        }

        Credential updated = existing.withDetails(name, scopes, expiresAt);
        credentials.save(updated);
        return ActionResult.of(ApiKeyView.of(updated, now));
    }

    private ActionResult revokeKey(ActionContext ctx, JsonNode input) {
        Credential existing = ownedKey(ctx, PackInputs.text(input, "key_id"));

        if (ctx.dryRun()) {
            Impact impact = Impact.deletes(API_KEY + ":" + existing.credentialId(), Impact.RISK_MEDIUM)
                    .withWarning("This will immediately invalidate the API key");
            if (existing.credentialId().equals(ctx.credentialId())) {
                impact = impact.withWarning("This is the key making the request");
            }
            return ActionResult.dryRun(impact);
        }

        Credential revoked = credentials.revoke(existing.credentialId(), ctx.clock().instant())
                .orElseThrow(() -> KernelException.resourceNotFound("API key", existing.credentialId()));
        log.info("API key revoked: tenant={} keyId={} by={}",
                ctx.tenantId(), revoked.credentialId(), ctx.credentialId());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("key_id", revoked.credentialId());
        data.put("revoked", true);
        data.put("revoked_at", revoked.revokedAt());
        return ActionResult.of(data);
    }

    private ActionResult listTeam(ActionContext ctx, JsonNode input) {
        List<TeamMember> members = team.listByTenant(ctx.tenantId());
        return ActionResult.of(Map.of("members", members, "total", members.size()));
    }

    private ActionResult inviteMember(ActionContext ctx, JsonNode input) {
        String email = PackInputs.text(input, "email").trim().toLowerCase(Locale.ROOT);
        String role = PackInputs.text(input, "role");
        if (!EMAIL.matcher(email).matches()) {
            throw KernelException.invalidInput("email must be a valid email address");
        }
        if (team.findByEmail(ctx.tenantId(), email).isPresent()) {
            throw KernelException.invalidInput("A team member with this email already exists");
        }

        if (ctx.dryRun()) {
            return ActionResult.dryRun(Impact.creates("team_member:" + email, Impact.RISK_LOW)
                    .withSideEffect("email:" + email));
        }

        TeamMember member = new TeamMember("mem_" + UUID.randomUUID().toString().replace("-", ""),
                ctx.tenantId(), email, role, TeamMember.STATUS_INVITED, ctx.clock().instant(), ctx.credentialId());
        if (!team.saveIfAbsent(member)) {
            throw KernelException.invalidInput("A team member with this email already exists");
        }
        return ActionResult.of(member);
    }

    private Credential ownedKey(ActionContext ctx, String keyId) {
        Credential credential = credentials.findById(keyId)
                .orElseThrow(() -> KernelException.resourceNotFound("API key", keyId));
        ctx.requireOwned(credential.tenantId(), "API key", keyId);
        return credential;
    }

    private static void requireGrantable(ActionContext ctx, Set<String> scopes) {
        for (String scope : scopes) {
            if (!ctx.hasScope(scope)) {
                throw new KernelException(ErrorKind.FORBIDDEN, ErrorCodes.SCOPE_DENIED,
                        "Cannot grant a scope the calling key does not hold: " + scope,
                        Map.of("scope", scope));
            }
        }
    }

    private static void requireFuture(Instant expiresAt, Instant now) {
        if (expiresAt != null && !expiresAt.isAfter(now)) {
            throw KernelException.invalidInput("expires_at must be in the future");
        }
    }
}
