package com.carelink.backend.global.mail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Sends transactional account emails.
 * Without a configured SMTP host the message is written to the log instead, which keeps
 * local and test environments working.
 */
@Component
public class MailNotifier {

    private static final Logger log = LoggerFactory.getLogger(MailNotifier.class);

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final String fromAddress;
    private final String frontendBaseUrl;

    public MailNotifier(
            ObjectProvider<JavaMailSender> mailSenderProvider,
            @Value("${app.mail.from:no-reply@carelink.local}") String fromAddress,
            @Value("${app.frontend-base-url:http://localhost:3000}") String frontendBaseUrl
    ) {
        this.mailSenderProvider = mailSenderProvider;
        this.fromAddress = fromAddress;
        this.frontendBaseUrl = frontendBaseUrl;
    }

    public boolean sendPasswordResetLink(String email, String firstName, String token) {
        String link = buildLink("/reset-password", "token", token);
        String greeting = firstName != null && !firstName.isBlank() ? firstName : "there";
        String body = """
                Hi %s,

                We received a request to reset your CareLink password.
                Use the link below within the next hour to choose a new one:

                %s

                If you did not ask for this, you can ignore this email.
                """.formatted(greeting, link);
        return send(email, "Reset your CareLink password", body, "PASSWORD_RESET");
    }

    public boolean sendEmailVerification(String email, String token) {
        String link = UriComponentsBuilder.fromHttpUrl(frontendBaseUrl)
                .path("/verify-email")
                .queryParam("email", email)
                .queryParam("token", token)
                .build()
                .encode()
                .toUriString();
        String body = """
                Welcome to CareLink.

                Please confirm your email address by opening the link below:

                %s

                The link expires in 24 hours.
                """.formatted(link);
        return send(email, "Confirm your CareLink email", body, "EMAIL_VERIFICATION");
    }

    boolean send(String to, String subject, String body, String kind) {
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            log.info("[MAIL][{}] no mail sender configured, to={} subject=\"{}\"\n{}", kind, to, subject, body);
            return true;
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromAddress);
        message.setTo(to);
        message.setSubject(subject);
        message.setText(body);
        try {
            mailSender.send(message);
            log.info("[MAIL][{}] sent to={}", kind, to);
            return true;
        } catch (MailException ex) {
            log.warn("[MAIL][{}] delivery failed to={} detail={}", kind, to, ex.getMessage(), ex);
            return false;
        }
    }

    private String buildLink(String path, String param, String value) {
        return UriComponentsBuilder.fromHttpUrl(frontendBaseUrl)
                .path(path)
                .queryParam(param, value)
                .build()
                .encode()
                .toUriString();
    }
}
