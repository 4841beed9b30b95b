package com.ryuqq.connector.application.metrics;

import com.ryuqq.connector.core.model.ProviderId;
import com.ryuqq.connector.core.model.UserId;
import com.ryuqq.connector.core.spi.MetricsSink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * GuardedMetricsSink 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
@DisplayName("GuardedMetricsSink 테스트")
class GuardedMetricsSinkTest {

    private static final ProviderId GITHUB = ProviderId.of("github");
    private static final UserId USER = UserId.of("user-1");

    @Test
    @DisplayName("위임 싱크의 예외를 삼키고 호출자에게 전파하지 않는다")
    void delegateFailure_isSwallowed() {
        // Given
        MetricsSink failing = mock(MetricsSink.class);
        RuntimeException boom = new IllegalStateException("statsd unreachable");
        doThrow(boom).when(failing).trackApiCall(any(), any(), any(), anyString(), anyLong(), anyBoolean());
        doThrow(boom).when(failing).trackWebhookEvent(any(), any(), any(), anyString(), anyLong());
        doThrow(boom).when(failing).trackRateLimit(any(), anyString());
        doThrow(boom).when(failing).trackSyncOperation(any(), any(), any(), anyInt(), anyInt(), anyInt(), anyLong());
        MetricsSink guarded = GuardedMetricsSink.wrap(failing);

        // When & Then
        assertThatCode(() -> {
            guarded.trackApiCall(USER, "github-main", GITHUB, "issues.list", 12, true);
            guarded.trackWebhookEvent(USER, "github-main", GITHUB, "issues", 3);
            guarded.trackRateLimit(GITHUB, "issues.list");
            guarded.trackSyncOperation(USER, "github-main", GITHUB, 1, 2, 0, 40);
        }).doesNotThrowAnyException();
        verify(failing).trackRateLimit(GITHUB, "issues.list");
    }

    @Test
    @DisplayName("null은 no-op 싱크로, 이미 감싼 싱크는 그대로 반환한다")
    void wrap_isIdempotent() {
        MetricsSink guarded = GuardedMetricsSink.wrap(mock(MetricsSink.class));

        assertThat(GuardedMetricsSink.wrap(null)).isSameAs(MetricsSink.noop());
        assertThat(GuardedMetricsSink.wrap(guarded)).isSameAs(guarded);
    }
}
