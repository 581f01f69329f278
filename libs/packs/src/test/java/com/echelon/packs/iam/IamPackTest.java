package com.echelon.packs.iam;

import static org.assertj.core.api.Assertions.assertThat;

import com.echelon.kernel.error.ErrorCodes;
import com.echelon.kernel.error.ErrorKind;
import com.echelon.kernel.json.Json;
import com.echelon.kernel.router.ActionRequest;
import com.echelon.kernel.router.ActionResponse;
import com.echelon.kernel.testing.TestKernel;
import com.echelon.security.Scopes;
import com.echelon.security.testing.TestIdentities;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("IamPack")
class IamPackTest {

    private final InMemoryTeamMemberRepository team = new InMemoryTeamMemberRepository();
    private TestKernel kernel;
    private String adminKey;

    @BeforeEach
    void setUp() {
        kernel = TestKernel.create(k -> List.of(new IamPack(k.credentials, team, k.hasher)));
        adminKey = kernel.signup(TestIdentities.verifiedTenant("t-1"),
                Set.of(Scopes.READ, Scopes.DISCOVER, Scopes.IAM)).rawKey();
    }

    @AfterEach
    void tearDown() {
        kernel.close();
    }

    private ActionResponse call(String key, String action, String payload) {
        return kernel.router.route(ActionRequest.of(key, action, Json.read(payload, JsonNode.class)));
    }

    @Nested
    @DisplayName("iam.keys.create")
    class CreateKey {

        @Test
        @DisplayName("returns a working raw key once and stores only its hash")
        void createsUsableKey() {
            var response = call(adminKey, "iam.keys.create", "{\"name\":\"ci\",\"scopes\":[\"manage.read\"]}");

            assertThat(response.code()).isEqualTo(ErrorCodes.OK);
            String raw = response.data().get("key").asText();
            assertThat(raw).startsWith("ock_");
            assertThat(response.data().get("scopes")).hasSize(1);

            var listed = call(raw, "iam.keys.list", "{}");
            assertThat(listed.ok()).isTrue();
            assertThat(listed.data().get("total").asInt()).isEqualTo(2);
            assertThat(listed.data().toString()).doesNotContain(raw).doesNotContain("hash");
        }

        @Test
        @DisplayName("cannot grant a scope the caller does not hold")
        void noEscalation() {
            var response = call(adminKey, "iam.keys.create", "{\"scopes\":[\"manage.read\",\"manage.settings\"]}");

            assertThat(response.errorKind()).isEqualTo(ErrorKind.FORBIDDEN);
            assertThat(response.code()).isEqualTo(ErrorCodes.SCOPE_DENIED);
            assertThat(kernel.credentials.listByTenant("t-1")).hasSize(1);
        }

        @Test
        @DisplayName("is unavailable to an unverified tenant")
        void unverified() {
            String key = kernel.signup(TestIdentities.unverifiedTenant("t-new"), Set.of(Scopes.READ, Scopes.IAM))
                    .rawKey();

            var response = call(key, "iam.keys.create", "{\"scopes\":[\"manage.read\"]}");

            assertThat(response.errorKind()).isEqualTo(ErrorKind.FORBIDDEN);
        }

        @Test
        @DisplayName("dry run describes the key without creating it")
        void dryRun() {
            var response = kernel.router.route(ActionRequest.of(adminKey, "iam.keys.create",
                    Json.read("{\"name\":\"ci\",\"scopes\":[\"manage.iam\"]}", JsonNode.class)).asDryRun());

            assertThat(response.code()).isEqualTo(ErrorCodes.DRY_RUN);
            assertThat(response.data().get("impact").get("creates").get(0).asText()).isEqualTo("api_key:ci");
            assertThat(response.data().get("impact").get("warnings")).hasSize(1);
            assertThat(kernel.credentials.listByTenant("t-1")).hasSize(1);
        }

        @Test
        @DisplayName("rejects unknown scopes and past expiry")
        void invalid() {
            assertThat(call(adminKey, "iam.keys.create", "{\"scopes\":[\"root\"]}").code())
                    .isEqualTo(ErrorCodes.VALIDATION_ERROR);
            assertThat(call(adminKey, "iam.keys.create",
                    "{\"scopes\":[\"manage.read\"],\"expires_at\":\"2020-01-01T00:00:00Z\"}").code())
                    .isEqualTo(ErrorCodes.VALIDATION_ERROR);
            assertThat(call(adminKey, "iam.keys.create",
                    "{\"scopes\":[\"manage.read\"],\"expires_at\":\"tomorrow\"}").code())
                    .isEqualTo(ErrorCodes.VALIDATION_ERROR);
        }

        @Test
        @DisplayName("an expiring key stops resolving after its expiry")
        void expiry() {
            var response = call(adminKey, "iam.keys.create",
                    "{\"scopes\":[\"manage.read\"],\"expires_at\":\"2026-01-02T00:00:00Z\"}");
            String raw = response.data().get("key").asText();

            assertThat(call(raw, "iam.keys.list", "{}").ok()).isTrue();
            kernel.clock.advance(Duration.ofDays(2));
            assertThat(call(raw, "iam.keys.list", "{}").errorKind()).isEqualTo(ErrorKind.UNAUTHENTICATED);
        }
    }

    @Nested
    @DisplayName("iam.keys.update and iam.keys.revoke")
    class UpdateAndRevoke {

        @Test
        @DisplayName("revoked key is rejected on its next use")
        void revoke() {
            var created = call(adminKey, "iam.keys.create", "{\"scopes\":[\"manage.read\"]}");
            String keyId = created.data().get("key_id").asText();
            String raw = created.data().get("key").asText();

            var revoked = call(adminKey, "iam.keys.revoke", "{\"key_id\":\"" + keyId + "\"}");

            assertThat(revoked.data().get("revoked").asBoolean()).isTrue();
            assertThat(call(raw, "iam.keys.list", "{}").errorKind()).isEqualTo(ErrorKind.UNAUTHENTICATED);
        }

        @Test
        @DisplayName("keys of another tenant look exactly like missing keys")
        void tenantIsolation() {
            var other = kernel.signup(TestIdentities.verifiedTenant("t-2"), Set.of(Scopes.READ));

            var foreign = call(adminKey, "iam.keys.revoke", "{\"key_id\":\"" + other.credentialId() + "\"}");
            var missing = call(adminKey, "iam.keys.revoke", "{\"key_id\":\"key_missing\"}");

            assertThat(foreign.code()).isEqualTo(ErrorCodes.NOT_FOUND);
            assertThat(foreign.status()).isEqualTo(missing.status());
            assertThat(foreign.errorKind()).isEqualTo(missing.errorKind());
            assertThat(foreign.error().message()).isEqualTo("API key not found: " + other.credentialId());
            assertThat(call(other.rawKey(), "iam.keys.list", "{}").ok()).isTrue();
        }

        @Test
        @DisplayName("keys of another tenant cannot be updated")
        void foreignUpdate() {
            var other = kernel.signup(TestIdentities.verifiedTenant("t-2"), Set.of(Scopes.READ));

            var response = call(adminKey, "iam.keys.update",
                    "{\"key_id\":\"" + other.credentialId() + "\",\"name\":\"taken\"}");

            assertThat(response.code()).isEqualTo(ErrorCodes.NOT_FOUND);
            assertThat(kernel.credentials.findById(other.credentialId()).orElseThrow().name()).isNotEqualTo("taken");
        }

        @Test
        @DisplayName("unknown key is reported as NOT_FOUND")
        void unknownKey() {
            var response = call(adminKey, "iam.keys.update", "{\"key_id\":\"key_missing\",\"name\":\"x\"}");
            assertThat(response.code()).isEqualTo(ErrorCodes.NOT_FOUND);
        }

        @Test
        @DisplayName("update changes name and narrows scopes")
        void update() {
            var created = call(adminKey, "iam.keys.create",
                    "{\"name\":\"old\",\"scopes\":[\"manage.read\",\"manage.discover\"]}");
            String keyId = created.data().get("key_id").asText();

            var preview = kernel.router.route(ActionRequest.of(adminKey, "iam.keys.update",
                    Json.read("{\"key_id\":\"" + keyId + "\",\"name\":\"new\"}", JsonNode.class)).asDryRun());
            assertThat(preview.data().get("impact").get("updates").get(0).asText()).endsWith(".name");

            var updated = call(adminKey, "iam.keys.update",
                    "{\"key_id\":\"" + keyId + "\",\"name\":\"new\",\"scopes\":[\"manage.read\"]}");

            assertThat(updated.data().get("name").asText()).isEqualTo("new");
            assertThat(kernel.credentials.findById(keyId).orElseThrow().scopes()).containsExactly(Scopes.READ);
        }
    }

    @Nested
    @DisplayName("iam.team")
    class Team {

        @Test
        @DisplayName("invites a member once per email")
        void invite() {
            var first = call(adminKey, "iam.team.invite", "{\"email\":\"Ada@Example.com\",\"role\":\"admin\"}");
            var second = call(adminKey, "iam.team.invite", "{\"email\":\"ada@example.com\",\"role\":\"viewer\"}");

            assertThat(first.data().get("status").asText()).isEqualTo(TeamMember.STATUS_INVITED);
            assertThat(first.data().get("email").asText()).isEqualTo("ada@example.com");
            assertThat(second.code()).isEqualTo(ErrorCodes.VALIDATION_ERROR);
            assertThat(call(adminKey, "iam.team.list", "{}").data().get("total").asInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("dry run lists the invitation email as a side effect")
        void dryRun() {
            var response = kernel.router.route(ActionRequest.of(adminKey, "iam.team.invite",
                    Json.read("{\"email\":\"bob@example.com\",\"role\":\"member\"}", JsonNode.class)).asDryRun());

            assertThat(response.data().get("impact").get("sideEffects").get(0).asText())
                    .isEqualTo("email:bob@example.com");
            assertThat(team.listByTenant("t-1")).isEmpty();
        }

        @Test
        @DisplayName("rejects unknown roles and malformed emails")
        void invalid() {
            assertThat(call(adminKey, "iam.team.invite", "{\"email\":\"a@b.io\",\"role\":\"owner\"}").code())
                    .isEqualTo(ErrorCodes.VALIDATION_ERROR);
            assertThat(call(adminKey, "iam.team.invite", "{\"email\":\"not-an-email\",\"role\":\"member\"}").code())
                    .isEqualTo(ErrorCodes.VALIDATION_ERROR);
        }
    }
}
