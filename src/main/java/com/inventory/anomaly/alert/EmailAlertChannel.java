package com.inventory.anomaly.alert;

import com.inventory.anomaly.config.AlertChannelConfig;
import com.inventory.anomaly.model.AlertMessage;
import com.inventory.anomaly.model.ChannelKind;
import com.inventory.anomaly.model.DispatchOutcome;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * SMTP delivery as a multipart/alternative message (plain text + HTML).
 * Transport settings come from {@code spring.mail.*}. The channel reports itself
 * unconfigured when no {@link JavaMailSender} exists or its SMTP host is blank.
 */
@Component
public class EmailAlertChannel implements AlertChannel {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final AlertChannelConfig config;

    public EmailAlertChannel(ObjectProvider<JavaMailSender> mailSender, AlertChannelConfig config) {
        this.mailSender = mailSender;
        this.config = config;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.EMAIL;
    }

    @Override
    public boolean isConfigured() {
        return config.getEmail().isConfigured() && hasTransport(mailSender.getIfAvailable());
    }

    @Override
    public DispatchOutcome send(AlertMessage message) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (!hasTransport(sender) || !config.getEmail().isConfigured()) {
            throw new ChannelSendException(kind(), "email channel is not configured", null);
        }

        AlertChannelConfig.Email email = config.getEmail();
        try {
            MimeMessage mime = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, true, "UTF-8");
            helper.setFrom(email.getFrom());
            helper.setTo(email.getTo().toArray(new String[0]));
            helper.setSubject(email.getSubject());
            if (message.getHtml() != null) {
                helper.setText(message.getText(), message.getHtml());
            } else {
                helper.setText(message.getText());
            }
            sender.send(mime);
            return DispatchOutcome.success(kind());
        } catch (MessagingException | MailException e) {
            throw new ChannelSendException(kind(), "email delivery failed: " + e.getMessage(), e);
        }
    }

    // Boot still creates a sender for an empty spring.mail.host
    private static boolean hasTransport(JavaMailSender sender) {
        if (sender == null) return false;
        if (sender instanceof JavaMailSenderImpl impl) {
            return StringUtils.hasText(impl.getHost());
        }
        return true;
    }
}
