package com.frenchtoast.alert.jetstream.bootstrap;

import com.frenchtoast.alert.jetstream.config.TriggerQueueProperties;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TriggerStreamBootstrapperTest {

    @Test
    void streamIsAWorkQueueOnTheCheckSubject() {
        TriggerQueueProperties props = new TriggerQueueProperties();
        props.setMaxAge(Duration.ofMinutes(30));
        props.setStorageType("memory");

        StreamConfiguration sc = TriggerStreamBootstrapper.toStreamConfig(props);

        assertThat(sc.getName()).isEqualTo("FRENCH_TOAST_CHECKS");
        assertThat(sc.getSubjects()).containsExactly("frenchtoast.status.check");
        assertThat(sc.getRetentionPolicy()).isEqualTo(RetentionPolicy.WorkQueue);
        assertThat(sc.getStorageType()).isEqualTo(StorageType.Memory);
        assertThat(sc.getMaxAge()).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    void rejectsUnknownStorageType() {
        TriggerQueueProperties props = new TriggerQueueProperties();
        props.setStorageType("tape");

        assertThatThrownBy(() -> TriggerStreamBootstrapper.toStreamConfig(props))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createsMissingStreamAndSignalsReady() throws Exception {
        JetStreamManagement jsm = mock(JetStreamManagement.class);
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        JetStreamApiException notFound = mock(JetStreamApiException.class);
        when(notFound.getApiErrorCode()).thenReturn(10059);
        when(jsm.getStreamInfo("FRENCH_TOAST_CHECKS")).thenThrow(notFound);

        new TriggerStreamBootstrapper(jsm, new TriggerQueueProperties(), publisher).run(null);

        verify(jsm).addStream(any(StreamConfiguration.class));
        verify(publisher).publishEvent(new TriggerStreamReadyEvent("FRENCH_TOAST_CHECKS"));
    }

    @Test
    void skipsWhenBootstrapDisabled() throws Exception {
        JetStreamManagement jsm = mock(JetStreamManagement.class);
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        TriggerQueueProperties props = new TriggerQueueProperties();
        props.setBootstrap(false);

        new TriggerStreamBootstrapper(jsm, props, publisher).run(null);

        verify(jsm, never()).addStream(any(StreamConfiguration.class));
        verify(publisher, never()).publishEvent(any(Object.class));
    }
}
