package com.echelon.kernel.router;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.echelon.kernel.audit.AuditEntry;
import com.echelon.kernel.ceiling.CeilingPolicy;
import com.echelon.kernel.config.KernelSettings;
import com.echelon.kernel.error.ErrorCodes;
import com.echelon.kernel.error.ErrorKind;
import com.echelon.kernel.error.ResponseStatus;
import com.echelon.kernel.support.Payloads;
import com.echelon.kernel.support.SamplePack;
import com.echelon.kernel.testing.TestKernel;
import com.echelon.security.Scopes;
import com.echelon.security.TenantTier;
import com.echelon.security.VerificationState;
import com.echelon.security.testing.TestIdentities;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * End-to-end flows through a fully wired in-memory kernel.
 */
@DisplayName("Kernel scenarios")
class KernelScenariosTest {

    private static final Set<String> ALL_SCOPES = Set.of(
            Scopes.READ, Scopes.DISCOVER, Scopes.IAM, Scopes.WEBHOOKS, Scopes.SETTINGS);

    private final SamplePack pack = new SamplePack();
    private TestKernel kernel;

    @AfterEach
    void tearDown() {
        if (kernel != null) {
            kernel.close();
        }
    }

    @Test
    @DisplayName("signup, forbidden mutation, verification, then the same mutation succeeds")
    void signupToVerifiedMutation() {
        kernel = TestKernel.create(List.of(pack));
        String key = kernel.signup(TestIdentities.unverifiedTenant("t-new"), ALL_SCOPES).rawKey();
        var create = ActionRequest.of(key, "sample.things.create", Payloads.json("{\"name\":\"first\"}"));

        assertThat(kernel.router.route(ActionRequest.of(key, "sample.echo", null)).ok()).isTrue();
        var denied = kernel.router.route(create);
        assertThat(denied.errorKind()).isEqualTo(ErrorKind.FORBIDDEN);

        String token = kernel.verification.issueToken("t-new");
        assertThat(kernel.verification.redeem("t-new", token, "10.0.0.1").ok()).isTrue();

        var allowed = kernel.router.route(create);
        assertThat(allowed.code()).isEqualTo(ErrorCodes.OK);
        assertThat(pack.creates).hasValue(1);

        kernel.flushAudit();
        assertThat(kernel.auditSink.entriesFor("t-new"))
                .extracting(AuditEntry::action, AuditEntry::code)
                .containsExactly(
                        tuple("sample.echo", ErrorCodes.OK),
                        tuple("sample.things.create", ErrorCodes.SCOPE_DENIED),
                        tuple("tenant.verify", ErrorCodes.OK),
                        tuple("sample.things.create", ErrorCodes.OK));
    }

    @Test
    @DisplayName("verification is monotone: a second token cannot be redeemed into a different state")
    void verificationIsMonotone() {
        kernel = TestKernel.create(List.of(pack));
        kernel.signup(TestIdentities.unverifiedTenant("t-mono"), ALL_SCOPES);

        String token = kernel.verification.issueToken("t-mono");
        assertThat(kernel.verification.redeem("t-mono", token, null).ok()).isTrue();
        assertThat(kernel.verification.redeem("t-mono", token, null).code())
                .isEqualTo(ErrorCodes.INVALID_VERIFICATION_TOKEN);

        assertThat(kernel.tenants.findById("t-mono").orElseThrow().verificationState())
                .isEqualTo(VerificationState.VERIFIED);
    }

    @Test
    @DisplayName("concurrent duplicates with one idempotency key execute the handler once")
    void concurrentDuplicates() throws Exception {
        kernel = TestKernel.create(List.of(pack));
        String key = kernel.signup(TestIdentities.verifiedTenant("t-dup"), ALL_SCOPES).rawKey();
        pack.createGate = new CountDownLatch(1);
        var request = ActionRequest.of(key, "sample.things.create", Payloads.json("{\"name\":\"once\"}"))
                .withIdempotencyKey("dup-1");

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<ActionResponse> first = callers.submit(() -> kernel.router.route(request));
            Future<ActionResponse> second = callers.submit(() -> kernel.router.route(request));
            Thread.sleep(200);
            pack.createGate.countDown();

            var responses = List.of(first.get(), second.get());
            assertThat(responses).extracting(ActionResponse::code)
                    .containsExactlyInAnyOrder(ErrorCodes.OK, ErrorCodes.IDEMPOTENT_REPLAY);
            assertThat(responses.get(0).data()).isEqualTo(responses.get(1).data());
            assertThat(pack.creates).hasValue(1);
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    @DisplayName("the per-second ceiling binds an enterprise tenant whose rate limits are far higher")
    void ceilingBeatsTier() {
        kernel = TestKernel.create(List.of(pack),
                KernelSettings.defaults().withCeilings(new CeilingPolicy(500, Map.of())));
        String key = kernel.signup(TestIdentities.verifiedTenant("t-big").withTier(TenantTier.ENTERPRISE),
                ALL_SCOPES).rawKey();
        assertThat(kernel.ceilings.tenantActionsPerSecond()).isEqualTo(50);

        for (int i = 0; i < 50; i++) {
            assertThat(kernel.router.route(ActionRequest.of(key, "sample.echo", null)).ok()).isTrue();
        }
        var rejected = kernel.router.route(ActionRequest.of(key, "sample.echo", null));

        assertThat(rejected.status()).isEqualTo(ResponseStatus.DENIED);
        assertThat(rejected.code()).isEqualTo(ErrorCodes.CEILING_EXCEEDED);

        kernel.clock.advance(Duration.ofSeconds(1));
        assertThat(kernel.router.route(ActionRequest.of(key, "sample.echo", null)).ok()).isTrue();
    }

    @Test
    @DisplayName("daily ceiling holds across replays without counting them")
    void replayDoesNotConsumeCeiling() {
        kernel = TestKernel.create(List.of(pack),
                KernelSettings.defaults().withCeilings(new CeilingPolicy(50, Map.of("sample.things.create", 1L))));
        String key = kernel.signup(TestIdentities.verifiedTenant("t-day"), ALL_SCOPES).rawKey();
        var keyed = ActionRequest.of(key, "sample.things.create", Payloads.json("{\"name\":\"a\"}"))
                .withIdempotencyKey("day-1");

        assertThat(kernel.router.route(keyed).code()).isEqualTo(ErrorCodes.OK);
        assertThat(kernel.router.route(keyed).code()).isEqualTo(ErrorCodes.IDEMPOTENT_REPLAY);

        var fresh = kernel.router.route(keyed.withIdempotencyKey("day-2"));
        assertThat(fresh.code()).isEqualTo(ErrorCodes.CEILING_EXCEEDED);

        kernel.clock.advance(Duration.ofDays(1));
        assertThat(kernel.router.route(keyed.withIdempotencyKey("day-2")).code()).isEqualTo(ErrorCodes.OK);
    }

    @Test
    @DisplayName("a tenant hint for another tenant is refused")
    void tenantHintMismatch() {
        kernel = TestKernel.create(List.of(pack));
        String key = kernel.signup(TestIdentities.verifiedTenant("t-a"), ALL_SCOPES).rawKey();

        var response = kernel.router.route(ActionRequest.of(key, "sample.echo", null).withTenantHint("t-b"));

        assertThat(response.errorKind()).isEqualTo(ErrorKind.FORBIDDEN);
        assertThat(response.code()).isEqualTo(ErrorCodes.TENANT_MISMATCH);
        assertThat(pack.echoes).hasValue(0);
    }
}
