package com.inventory.anomaly.alert;

import com.inventory.anomaly.config.AlertChannelConfig;
import com.inventory.anomaly.model.AlertMessage;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class EmailAlertChannelTest {

    private JavaMailSender sender;
    private ObjectProvider<JavaMailSender> provider;
    private AlertChannelConfig config;
    private EmailAlertChannel channel;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        sender = mock(JavaMailSender.class);
        provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(sender);
        when(sender.createMimeMessage()).thenAnswer(inv -> new MimeMessage(Session.getInstance(new Properties())));

        config = new AlertChannelConfig();
        config.getEmail().setFrom("alerts@example.com");
        config.getEmail().setTo(List.of("ops@example.com", "planner@example.com"));
        channel = new EmailAlertChannel(provider, config);
    }

    @Test
    void send_buildsMultipartMessageToAllRecipients() throws Exception {
        AlertMessage message = AlertMessage.builder()
                .title("Inventory Anomaly Alert")
                .text("ALERT: 1 ANOMALY(IES) DETECTED")
                .html("<p>1 anomaly</p>")
                .build();

        assertThat(channel.send(message).isSuccess()).isTrue();

        MimeMessage sent = captureSent();
        assertThat(sent.getSubject()).isEqualTo("Anomaly Alert - Inventory Anomaly Detector");
        assertThat(sent.getAllRecipients()).hasSize(2);
        assertThat(sent.getFrom()[0].toString()).isEqualTo("alerts@example.com");
    }

    @Test
    void send_smtpFailure_throwsChannelSendException() {
        doThrow(new MailSendException("connection refused")).when(sender).send(any(MimeMessage.class));

        assertThatThrownBy(() -> channel.send(AlertMessage.builder().title("t").text("x").build()))
                .isInstanceOf(ChannelSendException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    void isConfigured_requiresRecipientsAndSender() {
        assertThat(channel.isConfigured()).isTrue();

        config.getEmail().setTo(List.of());
        assertThat(channel.isConfigured()).isFalse();

        config.getEmail().setTo(List.of("ops@example.com"));
        when(provider.getIfAvailable()).thenReturn(null);
        assertThat(channel.isConfigured()).isFalse();
        assertThatThrownBy(() -> channel.send(AlertMessage.builder().title("t").text("x").build()))
                .isInstanceOf(ChannelSendException.class);
    }

    private MimeMessage captureSent() {
        ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
        verify(sender).send(captor.capture());
        return captor.getValue();
    }

    @Test
    void isConfigured_blankSmtpHost_isNotConfigured() {
        JavaMailSenderImpl blankHost = new JavaMailSenderImpl();
        blankHost.setHost("");
        when(provider.getIfAvailable()).thenReturn(blankHost);

        assertThat(channel.isConfigured()).isFalse();
        assertThatThrownBy(() -> channel.send(AlertMessage.builder().title("t").text("x").build()))
                .isInstanceOf(ChannelSendException.class)
                .hasMessageContaining("not configured");

        JavaMailSenderImpl withHost = new JavaMailSenderImpl();
        withHost.setHost("smtp.example.com");
        when(provider.getIfAvailable()).thenReturn(withHost);

        assertThat(channel.isConfigured()).isTrue();
    }
}
