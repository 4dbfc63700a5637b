package com.inventory.anomaly.service;

import com.inventory.anomaly.alert.AlertChannel;
import com.inventory.anomaly.alert.AlertDispatcher;
import com.inventory.anomaly.alert.AlertMessageFormatter;
import com.inventory.anomaly.config.AlertChannelConfig;
import com.inventory.anomaly.config.SeverityThresholdConfig;
import com.inventory.anomaly.model.AlertMessage;
import com.inventory.anomaly.model.AnomalyRecord;
import com.inventory.anomaly.model.ChannelKind;
import com.inventory.anomaly.model.DispatchOutcome;
import com.inventory.anomaly.model.RunOptions;
import com.inventory.anomaly.model.Severity;
import com.inventory.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

class AnomalyAlertServiceTest {

    private AlertChannel discord;
    private AlertChannel teams;
    private AlertChannel email;
    private AlertDispatcher dispatcher;
    private AnomalyAlertService service;

    private final RunOptions defaults = RunOptions.builder()
            .inputSource("data/inventory.csv")
            .enableAlerts(true)
            .enableReport(true)
            .build();

    @BeforeEach
    void setUp() {
        discord = channel(ChannelKind.DISCORD, true);
        teams = channel(ChannelKind.TEAMS, false);
        email = channel(ChannelKind.EMAIL, true);
        dispatcher = mock(AlertDispatcher.class);
        when(dispatcher.dispatch(any(), anyCollection())).thenAnswer(inv -> {
            Collection<AlertChannel> targets = inv.getArgument(1);
            Map<ChannelKind, DispatchOutcome> outcomes = new EnumMap<>(ChannelKind.class);
            targets.forEach(c -> outcomes.put(c.kind(), DispatchOutcome.success(c.kind())));
            return outcomes;
        });

        service = new AnomalyAlertService(List.of(discord, teams, email),
                new AlertMessageFormatter(new AlertChannelConfig()), dispatcher,
                new SeverityClassifier(new SeverityThresholdConfig()));
    }

    @Test
    void sendAlerts_onlyFlaggedRecordsAtOrAboveMinAlertable() {
        List<AnomalyRecord> records = List.of(
                TestDataFactory.anomaly("P1", 0.91, Severity.CRITICAL),
                TestDataFactory.anomaly("P2", 0.70, Severity.HIGH),
                TestDataFactory.anomaly("P3", 0.65, Severity.NONE),
                TestDataFactory.normal("P4", 0.95));

        Map<ChannelKind, DispatchOutcome> outcomes = service.sendAlerts(records, defaults);

        ArgumentCaptor<AlertMessage> message = ArgumentCaptor.forClass(AlertMessage.class);
        verify(dispatcher).dispatch(message.capture(), anyCollection());
        assertThat(message.getValue().getText())
                .contains("ALERT: 2 ANOMALY(IES) DETECTED")
                .contains("Product: P1")
                .contains("Product: P2")
                .doesNotContain("Product: P3")
                .doesNotContain("Product: P4");
        assertThat(outcomes).containsOnlyKeys(ChannelKind.DISCORD);
    }

    @Test
    void sendAlerts_emailOptIn_addsConfiguredEmailChannel() {
        Map<ChannelKind, DispatchOutcome> outcomes = service.sendAlerts(
                List.of(TestDataFactory.anomaly("P1", 0.9, Severity.CRITICAL)),
                defaults.toBuilder().enableEmailChannel(true).build());

        assertThat(outcomes).containsOnlyKeys(ChannelKind.DISCORD, ChannelKind.EMAIL);
        verify(teams, never()).send(any());
    }

    @Test
    void sendAlerts_nothingAlertWorthy_noDispatch() {
        Map<ChannelKind, DispatchOutcome> outcomes = service.sendAlerts(
                List.of(TestDataFactory.normal("P1", 0.2), TestDataFactory.anomaly("P2", 0.5, Severity.NONE)),
                defaults);

        assertThat(outcomes).isEmpty();
        verifyNoInteractions(dispatcher);
    }

    @Test
    void sendAlerts_noConfiguredChannel_noDispatch() {
        when(discord.isConfigured()).thenReturn(false);

        Map<ChannelKind, DispatchOutcome> outcomes = service.sendAlerts(
                List.of(TestDataFactory.anomaly("P1", 0.9, Severity.CRITICAL)), defaults);

        assertThat(outcomes).isEmpty();
        verifyNoInteractions(dispatcher);
    }

    @Test
    void channelStatus_reportsEveryKind() {
        Map<ChannelKind, Boolean> status = service.channelStatus();

        assertThat(status).containsExactly(
                Map.entry(ChannelKind.DISCORD, true),
                Map.entry(ChannelKind.TEAMS, false),
                Map.entry(ChannelKind.EMAIL, true));
    }

    private static AlertChannel channel(ChannelKind kind, boolean configured) {
        AlertChannel channel = mock(AlertChannel.class);
        when(channel.kind()).thenReturn(kind);
        when(channel.isConfigured()).thenReturn(configured);
        return channel;
    }
}
