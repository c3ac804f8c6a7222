package com.divelog.proximity.service.location;

import com.divelog.proximity.model.AuthorizationStatus;
import com.divelog.proximity.model.PerformancePolicy;
import com.divelog.proximity.model.Position;
import com.divelog.proximity.model.PositionFailure;
import com.divelog.proximity.model.SamplingMode;
import com.divelog.proximity.model.SamplingProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.divelog.proximity.support.TestSites.T0;
import static com.divelog.proximity.support.TestSites.positionAt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class DeviceStreamLocationPlatformTest {

    private SimpMessagingTemplate messagingTemplate;
    private DeviceStreamLocationPlatform platform;
    private List<Position> accepted;
    private List<AuthorizationStatus> authorizations;
    private List<PositionFailure> failures;

    @BeforeEach
    void setUp() {
        messagingTemplate = mock(SimpMessagingTemplate.class);
        platform = new DeviceStreamLocationPlatform(messagingTemplate);
        accepted = new ArrayList<>();
        authorizations = new ArrayList<>();
        failures = new ArrayList<>();
        platform.setListener(new LocationPlatform.Listener() {
            @Override
            public void onPosition(Position position) {
                accepted.add(position);
            }

            @Override
            public void onPositionFailure(PositionFailure failure) {
                failures.add(failure);
            }

            @Override
            public void onAuthorizationChanged(AuthorizationStatus status) {
                authorizations.add(status);
            }
        });
    }

    @Test
    void shouldIgnoreReadingsWhileSamplingIsOff() {
        assertThat(platform.ingest(positionAt(0))).isFalse();
        assertThat(accepted).isEmpty();
    }

    @Test
    void shouldApplyDistanceFilterOfActiveProfile() {
        platform.startStandardUpdates(SamplingProfile.forPolicy(PerformancePolicy.STANDARD));

        assertThat(platform.ingest(positionAt(0))).isTrue();
        assertThat(platform.ingest(positionAt(0.03))).isFalse();
        assertThat(platform.ingest(positionAt(0.06))).isTrue();

        platform.startStandardUpdates(SamplingProfile.forPolicy(PerformancePolicy.BOAT_MODE));
        assertThat(platform.ingest(positionAt(0.4))).isFalse();
        assertThat(platform.ingest(positionAt(0.6))).isTrue();

        assertThat(accepted).hasSize(3);
    }

    @Test
    void shouldUseCoarseFilterInSignificantChangeMode() {
        platform.startSignificantChangeUpdates();

        assertThat(platform.ingest(positionAt(0))).isTrue();
        assertThat(platform.ingest(positionAt(0.3))).isFalse();
        assertThat(platform.ingest(positionAt(0.55))).isTrue();
        assertThat(platform.mode()).isEqualTo(SamplingMode.SIGNIFICANT_CHANGE);
    }

    @Test
    void shouldForgetLastReadingWhenStopped() {
        platform.startStandardUpdates(SamplingProfile.forPolicy(PerformancePolicy.STANDARD));
        platform.ingest(positionAt(0));
        platform.stopUpdates();
        platform.startStandardUpdates(SamplingProfile.forPolicy(PerformancePolicy.STANDARD));

        assertThat(platform.ingest(positionAt(0.01))).isTrue();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSendSamplingDirectiveToDevice() {
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);

        platform.startStandardUpdates(SamplingProfile.forPolicy(PerformancePolicy.CRITICAL));

        verify(messagingTemplate).convertAndSend(eq(DeviceStreamLocationPlatform.SAMPLING_TOPIC), payload.capture());
        Map<String, Object> directive = (Map<String, Object>) payload.getValue();
        assertThat(directive)
            .containsEntry("mode", "STANDARD")
            .containsEntry("desiredAccuracyMeters", 100.0)
            .containsEntry("distanceFilterMeters", 1000.0);
    }

    @Test
    void shouldPromptDeviceForConsent() {
        platform.requestAuthorization();

        verify(messagingTemplate).convertAndSend(eq(DeviceStreamLocationPlatform.CONSENT_TOPIC), any(Object.class));
    }

    @Test
    void shouldRecordReportedAuthorization() {
        assertThat(platform.authorizationStatus()).isEqualTo(AuthorizationStatus.NOT_DETERMINED);

        platform.reportAuthorization(AuthorizationStatus.AUTHORIZED_WHEN_IN_USE);

        assertThat(platform.authorizationStatus()).isEqualTo(AuthorizationStatus.AUTHORIZED_WHEN_IN_USE);
        assertThat(authorizations).containsExactly(AuthorizationStatus.AUTHORIZED_WHEN_IN_USE);
    }

    @Test
    void shouldForwardFailures() {
        PositionFailure failure = new PositionFailure(PositionFailure.Kind.PLATFORM_ERROR, "gps off", T0);

        platform.reportFailure(failure);

        assertThat(failures).containsExactly(failure);
    }

    @Test
    void shouldSurviveBrokerFailures() {
        doThrow(new MessagingException("broker down"))
            .when(messagingTemplate).convertAndSend(anyString(), any(Object.class));

        assertThatCode(() -> platform.requestAuthorization()).doesNotThrowAnyException();
        assertThatCode(() -> platform.stopUpdates()).doesNotThrowAnyException();
    }
}
