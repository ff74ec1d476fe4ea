package io.seatwatch.notify;

import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;
import java.util.List;
import java.util.Properties;

public final class MailNotifier implements Notifier {
    private static final Logger LOG = LoggerFactory.getLogger(MailNotifier.class);
    static final String SUBJECT = "Course Opening Alert!";
    static final String SENDER_NAME = "SeatWatch Monitor";

    private final Session session;
    private final String senderAddress;
    private final List<String> recipients;

    public MailNotifier(Session session, String senderAddress, List<String> recipients) {
        this.session = session;
        this.senderAddress = senderAddress.trim();
        this.recipients = List.copyOf(recipients);
    }

    public static Session smtpSession(String host, int port, Duration timeout, String username, String password) {
        Properties props = new Properties();
        props.put("mail.smtp.host", host);
        props.put("mail.smtp.port", String.valueOf(port));
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.connectiontimeout", String.valueOf(timeout.toMillis()));
        props.put("mail.smtp.timeout", String.valueOf(timeout.toMillis()));
        props.put("mail.smtp.writetimeout", String.valueOf(timeout.toMillis()));
        if (password == null || password.isBlank()) {
            return Session.getInstance(props);
        }
        props.put("mail.smtp.auth", "true");
        return Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(username, password);
            }
        });
    }

    @Override
    public void notify(String message) {
        for (String recipient : recipients) {
            try {
                Transport.send(buildMessage(recipient, message));
                LOG.info("Email sent to {}", recipient);
            } catch (MessagingException e) {
                LOG.error("Could not send email to {}: {}", recipient, e.getMessage());
            }
        }
    }

    MimeMessage buildMessage(String recipient, String content) throws MessagingException {
        MimeMessage mail = new MimeMessage(session);
        mail.setFrom(new InternetAddress(SENDER_NAME + " <" + senderAddress + ">"));
        mail.setRecipient(Message.RecipientType.TO, new InternetAddress(recipient.trim()));
        mail.setSubject(SUBJECT, StandardCharsets.UTF_8.name());
        mail.setSentDate(new Date());
        mail.setText(content, StandardCharsets.UTF_8.name());
        return mail;
    }
}
