package com.echelon.controlplane.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.echelon.kernel.error.ErrorCodes;
import com.echelon.kernel.error.KernelException;
import com.echelon.kernel.json.Json;
import com.echelon.kernel.router.ActionResponse;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

@DisplayName("ActionHttpStatus")
class ActionHttpStatusTest {

    private static ActionResponse failure(KernelException e) {
        return ActionResponse.failure("req_1", e, false);
    }

    @Test
    @DisplayName("success and dry run are 200")
    void success() {
        assertThat(ActionHttpStatus.of(ActionResponse.success(ErrorCodes.OK, "req_1", Json.object(), false, List.of())))
                .isEqualTo(HttpStatus.OK);
        assertThat(ActionHttpStatus.of(ActionResponse.success(ErrorCodes.DRY_RUN, "req_1", Json.object(), true, List.of())))
                .isEqualTo(HttpStatus.OK);
    }

    @Test
    @DisplayName("maps each error kind to its status")
    void errorKinds() {
        assertThat(ActionHttpStatus.of(failure(KernelException.unauthenticated()))).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(ActionHttpStatus.of(failure(KernelException.forbidden("manage.iam")))).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(ActionHttpStatus.of(failure(KernelException.unknownAction("x.y")))).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(ActionHttpStatus.of(failure(KernelException.invalidInput("bad")))).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ActionHttpStatus.of(failure(KernelException.idempotencyConflict("k")))).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ActionHttpStatus.of(failure(KernelException.ceilingExceeded("tenant_actions_per_second", 50))))
                .isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(ActionHttpStatus.of(failure(KernelException.invalidVerificationToken())))
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ActionHttpStatus.of(failure(KernelException.timeout(Duration.ofSeconds(1)))))
                .isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        assertThat(ActionHttpStatus.of(failure(KernelException.internal("boom", null))))
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    @DisplayName("a missing resource is 404 although its kind is invalid input")
    void resourceNotFound() {
        assertThat(ActionHttpStatus.of(failure(KernelException.resourceNotFound("Webhook", "wh_1"))))
                .isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    @DisplayName("rate-limited responses carry Retry-After")
    void retryAfter() {
        var response = failure(KernelException.rateLimited("api_key", "5m", 1000, 42));

        var entity = ManageController.toEntity(response);

        assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(entity.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("42");
    }

    @Test
    @DisplayName("other failures carry no Retry-After")
    void noRetryAfter() {
        var entity = ManageController.toEntity(failure(KernelException.forbidden("manage.iam")));

        assertThat(entity.getHeaders().containsKey(HttpHeaders.RETRY_AFTER)).isFalse();
    }
}
