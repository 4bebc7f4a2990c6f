package com.segs.alert.service;

import com.segs.alert.cache.ConditionStateCache;
import com.segs.alert.config.properties.AlertProperties;
import com.segs.alert.entity.Alert;
import com.segs.alert.entity.AlertStatus;
import com.segs.alert.entity.AlertTypes;
import com.segs.alert.entity.ConditionKey;
import com.segs.alert.entity.Severity;
import com.segs.alert.exception.AlertNotFoundException;
import com.segs.alert.exception.AlertPersistenceException;
import com.segs.alert.exception.AlertValidationException;
import com.segs.alert.exception.ConnectivityException;
import com.segs.alert.exception.DuplicateAlertSuppressedException;
import com.segs.alert.kafka.AlertEventPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit Tests for AlertLifecycleManager
 *
 * Covers deduplication, idempotent acknowledge/resolve and the marker and
 * publication side effects of every lifecycle transition.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AlertLifecycleManager Unit Tests")
class AlertLifecycleManagerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private AlertStore alertStore;

    @Mock
    private ConditionStateCache conditionStateCache;

    @Mock
    private AlertEventPublisher eventPublisher;

    @Captor
    private ArgumentCaptor<AlertUpdate> updateCaptor;

    @Captor
    private ArgumentCaptor<AlertFilter> filterCaptor;

    private SimpleMeterRegistry meterRegistry;
    private AlertLifecycleManager lifecycleManager;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        lifecycleManager = new AlertLifecycleManager(alertStore, conditionStateCache, eventPublisher,
                new AlertProperties(), meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
        lifecycleManager.initMetrics();
    }

    @Nested
    @DisplayName("createAlert")
    class CreateAlert {

        private final NewAlert data = NewAlert.builder()
                .type(AlertTypes.METER_OUTAGE)
                .severity(Severity.MEDIUM)
                .region("north")
                .meterId("meter-1")
                .message("Meter outage detected: No data received for 31 seconds")
                .build();

        @Test
        @DisplayName("Should store and publish the alert when the dedup marker is free")
        void shouldCreateWhenMarkerFree() {
            // Given
            Alert stored = alert(AlertStatus.ACTIVE, false);
            when(conditionStateCache.trySetDedupMarker(data.conditionKey(), Duration.ofMinutes(5))).thenReturn(true);
            when(alertStore.create(data)).thenReturn(stored);

            // When
            Alert created = lifecycleManager.createAlert(data);

            // Then
            assertThat(created).isSameAs(stored);
            verify(eventPublisher).publishProcessedAlert(stored);
            assertThat(meterRegistry.counter("segs.alerts.created",
                    "type", AlertTypes.METER_OUTAGE, "severity", "medium").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should suppress a second creation within the dedup TTL")
        void shouldSuppressDuplicate() {
            // Given
            when(conditionStateCache.trySetDedupMarker(any(), any())).thenReturn(false);

            // When / Then
            assertThatThrownBy(() -> lifecycleManager.createAlert(data))
                    .isInstanceOf(DuplicateAlertSuppressedException.class)
                    .extracting("errorCode").isEqualTo("DUPLICATE_SUPPRESSED");
            verifyNoInteractions(alertStore, eventPublisher);
            assertThat(meterRegistry.counter("segs.alerts.suppressed", "type", AlertTypes.METER_OUTAGE).count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should release the dedup marker when the store write fails")
        void shouldReleaseMarkerOnStoreFailure() {
            // Given
            when(conditionStateCache.trySetDedupMarker(any(), any())).thenReturn(true);
            when(alertStore.create(data)).thenThrow(new AlertPersistenceException("down", new RuntimeException()));

            // When / Then
            assertThatThrownBy(() -> lifecycleManager.createAlert(data))
                    .isInstanceOf(AlertPersistenceException.class);
            verify(conditionStateCache).releaseDedupMarker(data.conditionKey());
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("Should release the dedup marker when the database is unreachable")
        void shouldReleaseMarkerWhenDatabaseUnreachable() {
            when(conditionStateCache.trySetDedupMarker(any(), any())).thenReturn(true);
            when(alertStore.create(data)).thenThrow(new ConnectivityException("postgres", new RuntimeException()));

            assertThatThrownBy(() -> lifecycleManager.createAlert(data))
                    .isInstanceOf(ConnectivityException.class);
            verify(conditionStateCache).releaseDedupMarker(data.conditionKey());
        }

        @Test
        @DisplayName("Should reject an alert without severity before touching the cache")
        void shouldRejectMissingSeverity() {
            NewAlert invalid = NewAlert.builder().type("anomaly").message("spike").build();

            assertThatThrownBy(() -> lifecycleManager.createAlert(invalid))
                    .isInstanceOf(AlertValidationException.class)
                    .hasMessageContaining("severity");
            verifyNoInteractions(conditionStateCache, alertStore);
        }
    }

    @Nested
    @DisplayName("acknowledge")
    class Acknowledge {

        @Test
        @DisplayName("Should set acknowledgement, clear the active marker and publish a status update")
        void shouldAcknowledgeActiveAlert() {
            // Given
            Alert alert = alert(AlertStatus.ACTIVE, false);
            Alert acknowledged = copy(alert);
            acknowledged.acknowledge("operator-7", NOW);
            when(alertStore.get(alert.getId())).thenReturn(Optional.of(alert));
            when(alertStore.update(eq(alert.getId()), any())).thenReturn(Optional.of(acknowledged));

            // When
            Alert result = lifecycleManager.acknowledge(alert.getId(), "operator-7", "on it");

            // Then
            verify(alertStore).update(eq(alert.getId()), updateCaptor.capture());
            AlertUpdate update = updateCaptor.getValue();
            assertThat(update.getAcknowledged()).isTrue();
            assertThat(update.getAcknowledgedBy()).isEqualTo("operator-7");
            assertThat(update.getAcknowledgedAt()).isEqualTo(NOW);
            assertThat(update.getStatus()).isNull();
            assertThat(update.getExpectedVersion()).isEqualTo(3L);
            assertThat(update.getMetadata())
                    .containsEntry("acknowledgment_note", "on it")
                    .containsEntry("acknowledgment_timestamp", NOW.toString());

            assertThat(result).isSameAs(acknowledged);
            verify(conditionStateCache).clearActiveCondition(
                    new ConditionKey(AlertTypes.METER_OUTAGE, "north", "meter-1"), alert.getId());
            verify(eventPublisher).publishStatusUpdate(acknowledged);
        }

        @Test
        @DisplayName("Should return an already acknowledged alert unchanged")
        void shouldBeIdempotent() {
            Alert alert = alert(AlertStatus.ACTIVE, true);
            when(alertStore.get(alert.getId())).thenReturn(Optional.of(alert));

            Alert result = lifecycleManager.acknowledge(alert.getId(), "operator-7", null);

            assertThat(result).isSameAs(alert);
            verify(alertStore, never()).update(any(), any());
            verifyNoInteractions(conditionStateCache, eventPublisher);
        }

        @Test
        @DisplayName("Should reject a missing acknowledged_by")
        void shouldRequireActor() {
            assertThatThrownBy(() -> lifecycleManager.acknowledge(UUID.randomUUID(), " ", null))
                    .isInstanceOf(AlertValidationException.class)
                    .hasMessageContaining("acknowledged_by");
            verifyNoInteractions(alertStore);
        }

        @Test
        @DisplayName("Should fail with not found for an unknown id")
        void shouldFailForUnknownAlert() {
            UUID id = UUID.randomUUID();
            when(alertStore.get(id)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> lifecycleManager.acknowledge(id, "operator-7", null))
                    .isInstanceOf(AlertNotFoundException.class);
        }

        @Test
        @DisplayName("Should return the current record without publishing when a concurrent update wins")
        void shouldReturnCurrentStateOnConcurrentUpdate() {
            // Given
            Alert alert = alert(AlertStatus.ACTIVE, false);
            Alert current = copy(alert);
            current.acknowledge("operator-2", NOW.minusSeconds(1));
            when(alertStore.get(alert.getId())).thenReturn(Optional.of(alert), Optional.of(current));
            when(alertStore.update(eq(alert.getId()), any()))
                    .thenThrow(new ObjectOptimisticLockingFailureException(Alert.class, alert.getId()));

            // When
            Alert result = lifecycleManager.acknowledge(alert.getId(), "operator-7", null);

            // Then
            assertThat(result.getAcknowledgedBy()).isEqualTo("operator-2");
            verifyNoInteractions(eventPublisher);
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("Should resolve, clear the marker and publish once")
        void shouldResolveActiveAlert() {
            // Given
            Alert alert = alert(AlertStatus.ACTIVE, true);
            Alert resolved = copy(alert);
            resolved.resolve(NOW);
            when(alertStore.get(alert.getId())).thenReturn(Optional.of(alert));
            when(alertStore.update(eq(alert.getId()), any())).thenReturn(Optional.of(resolved));

            // When
            Alert result = lifecycleManager.resolve(alert.getId(), "operator-7", "breaker reset");

            // Then
            verify(alertStore).update(eq(alert.getId()), updateCaptor.capture());
            assertThat(updateCaptor.getValue().getStatus()).isEqualTo(AlertStatus.RESOLVED);
            assertThat(updateCaptor.getValue().getResolvedAt()).isEqualTo(NOW);
            assertThat(updateCaptor.getValue().getMetadata())
                    .containsEntry("resolved_by", "operator-7")
                    .containsEntry("resolution_note", "breaker reset")
                    .containsEntry("resolution_timestamp", NOW.toString());
            assertThat(result.isResolved()).isTrue();
            verify(conditionStateCache).clearActiveCondition(alert.conditionKey(), alert.getId());
            verify(eventPublisher).publishStatusUpdate(resolved);
        }

        @Test
        @DisplayName("Should retry against the fresh version when a concurrent acknowledge wins the race")
        void shouldRetryAfterLosingToAcknowledge() {
            // Given
            Alert alert = alert(AlertStatus.ACTIVE, false);
            Alert acknowledged = copy(alert);
            acknowledged.acknowledge("operator-2", NOW.minusSeconds(1));
            acknowledged.setVersion(4L);
            Alert resolved = copy(acknowledged);
            resolved.resolve(NOW);
            resolved.setVersion(5L);
            when(alertStore.get(alert.getId())).thenReturn(Optional.of(alert), Optional.of(acknowledged));
            when(alertStore.update(eq(alert.getId()), any()))
                    .thenThrow(new ObjectOptimisticLockingFailureException(Alert.class, alert.getId()))
                    .thenReturn(Optional.of(resolved));

            // When
            Alert result = lifecycleManager.resolve(alert.getId(), "operator-7", null);

            // Then
            assertThat(result.getStatus()).isEqualTo(AlertStatus.RESOLVED);
            verify(alertStore, times(2)).update(eq(alert.getId()), updateCaptor.capture());
            assertThat(updateCaptor.getAllValues()).extracting(AlertUpdate::getExpectedVersion)
                    .containsExactly(3L, 4L);
            verify(conditionStateCache).clearActiveCondition(alert.conditionKey(), alert.getId());
            verify(eventPublisher).publishStatusUpdate(resolved);
        }

        @Test
        @DisplayName("Should give up with the conflict once every attempt loses")
        void shouldGiveUpAfterRepeatedConflicts() {
            // Given
            Alert alert = alert(AlertStatus.ACTIVE, false);
            when(alertStore.get(alert.getId())).thenReturn(Optional.of(alert));
            when(alertStore.update(eq(alert.getId()), any()))
                    .thenThrow(new ObjectOptimisticLockingFailureException(Alert.class, alert.getId()));

            // When / Then
            assertThatThrownBy(() -> lifecycleManager.resolve(alert.getId(), "operator-7", null))
                    .isInstanceOf(ObjectOptimisticLockingFailureException.class);
            verify(alertStore, times(AlertLifecycleManager.MAX_UPDATE_ATTEMPTS)).update(eq(alert.getId()), any());
            verifyNoInteractions(conditionStateCache, eventPublisher);
        }

        @Test
        @DisplayName("Should return a resolved alert unchanged without a second status update")
        void shouldNotRepublishResolvedAlert() {
            Alert alert = alert(AlertStatus.RESOLVED, false);
            alert.setResolvedAt(NOW.minusSeconds(600));
            when(alertStore.get(alert.getId())).thenReturn(Optional.of(alert));

            Alert result = lifecycleManager.resolve(alert.getId(), "operator-7", null);

            assertThat(result).isSameAs(alert);
            verify(alertStore, never()).update(any(), any());
            verifyNoInteractions(eventPublisher, conditionStateCache);
        }
    }

    @Nested
    @DisplayName("bulk and auto resolution")
    class BulkResolution {

        @Test
        @DisplayName("Should clear markers and publish only for the alerts actually resolved")
        void shouldSideEffectOnlyResolvedAlerts() {
            // Given
            Alert a = alert(AlertStatus.RESOLVED, false);
            Alert c = alert(AlertStatus.RESOLVED, false);
            c.setMeterId("meter-3");
            UUID b = UUID.randomUUID();
            when(alertStore.bulkResolve(anyCollection(), eq("operator-7"), eq(NOW), eq("storm over")))
                    .thenReturn(List.of(a, c));

            // When
            List<Alert> result = lifecycleManager.bulkResolve(List.of(a.getId(), b, c.getId()), "operator-7", "storm over");

            // Then
            assertThat(result).containsExactly(a, c);
            verify(conditionStateCache).clearActiveCondition(a.conditionKey(), a.getId());
            verify(conditionStateCache).clearActiveCondition(c.conditionKey(), c.getId());
            verify(eventPublisher).publishStatusUpdate(a);
            verify(eventPublisher).publishStatusUpdate(c);
            assertThat(meterRegistry.counter("segs.alerts.resolved", "mode", "bulk").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should reject an empty id list")
        void shouldRejectEmptyIds() {
            assertThatThrownBy(() -> lifecycleManager.bulkResolve(List.of(), "operator-7", null))
                    .isInstanceOf(AlertValidationException.class)
                    .hasMessageContaining("alert_ids");
            verifyNoInteractions(alertStore);
        }

        @Test
        @DisplayName("Should auto-resolve with a cutoff of now minus max age and return the count")
        void shouldAutoResolveOldAlerts() {
            // Given
            Alert first = alert(AlertStatus.RESOLVED, false);
            Alert second = alert(AlertStatus.RESOLVED, false);
            second.setMeterId("meter-2");
            when(alertStore.autoResolveOlderThan(NOW.minus(Duration.ofHours(48)), NOW))
                    .thenReturn(List.of(first, second));

            // When
            int count = lifecycleManager.autoResolveOldAlerts(48);

            // Then
            assertThat(count).isEqualTo(2);
            verify(eventPublisher).publishStatusUpdate(first);
            verify(eventPublisher).publishStatusUpdate(second);
            verify(conditionStateCache).clearActiveCondition(first.conditionKey(), first.getId());
            verify(conditionStateCache).clearActiveCondition(second.conditionKey(), second.getId());
            assertThat(meterRegistry.counter("segs.alerts.resolved", "mode", "auto").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should reject a non-positive max age")
        void shouldRejectNonPositiveAge() {
            assertThatThrownBy(() -> lifecycleManager.autoResolveOldAlerts(0))
                    .isInstanceOf(AlertValidationException.class);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("History should default to resolved alerts of the last 24 hours")
        void historyDefaults() {
            when(alertStore.query(any())).thenReturn(AlertPage.empty());

            lifecycleManager.getAlertHistory("north", null, Severity.HIGH, null);

            verify(alertStore).query(filterCaptor.capture());
            AlertFilter filter = filterCaptor.getValue();
            assertThat(filter.getStatus()).isEqualTo(AlertStatus.RESOLVED);
            assertThat(filter.getRegion()).isEqualTo("north");
            assertThat(filter.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(filter.getFrom()).isEqualTo(NOW.minus(Duration.ofHours(24)));
            assertThat(filter.getLimit()).isEqualTo(50);
        }

        @Test
        @DisplayName("Listing should clamp the page size to the configured maximum")
        void clampsPageSize() {
            when(alertStore.query(any())).thenReturn(AlertPage.empty());

            AlertPage page = lifecycleManager.getAlerts(AlertFilter.builder().limit(10_000).offset(-5).build());

            verify(alertStore).query(filterCaptor.capture());
            assertThat(filterCaptor.getValue().getLimit()).isEqualTo(500);
            assertThat(filterCaptor.getValue().getOffset()).isZero();
            assertThat(page.total()).isZero();
        }

        @Test
        @DisplayName("Active listing should filter on active status")
        void activeListing() {
            when(alertStore.query(any())).thenReturn(AlertPage.empty());

            lifecycleManager.getActiveAlerts("south", 20, 40L);

            verify(alertStore).query(filterCaptor.capture());
            assertThat(filterCaptor.getValue().getStatus()).isEqualTo(AlertStatus.ACTIVE);
            assertThat(filterCaptor.getValue().getRegion()).isEqualTo("south");
            assertThat(filterCaptor.getValue().getOffset()).isEqualTo(40L);
        }

        @Test
        @DisplayName("Statistics should pass the region through")
        void statistics() {
            AlertStatistics stats = AlertStatistics.builder().total(3).build();
            when(alertStore.statistics(anyString())).thenReturn(stats);

            assertThat(lifecycleManager.getStatistics("north")).isSameAs(stats);
        }
    }

    private static Alert alert(AlertStatus status, boolean acknowledged) {
        Alert alert = Alert.builder()
                .id(UUID.randomUUID())
                .type(AlertTypes.METER_OUTAGE)
                .severity(Severity.MEDIUM)
                .region("north")
                .meterId("meter-1")
                .message("Meter outage detected: No data received for 31 seconds")
                .status(status)
                .metadata(new HashMap<>(Map.of("last_seen", NOW.minusSeconds(91).toString())))
                .createdAt(NOW.minusSeconds(60))
                .updatedAt(NOW.minusSeconds(60))
                .version(3L)
                .build();
        if (acknowledged) {
            alert.acknowledge("operator-1", NOW.minusSeconds(30));
        }
        return alert;
    }

    private static Alert copy(Alert alert) {
        return alert.toBuilder().metadata(new HashMap<>(alert.getMetadata())).build();
    }
}
