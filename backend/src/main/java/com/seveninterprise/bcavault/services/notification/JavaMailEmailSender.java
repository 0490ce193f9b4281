package com.seveninterprise.bcavault.services.notification;

import com.seveninterprise.bcavault.dto.EmailMessage;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * Envio via JavaMailSender. Sem spring.mail.host configurado, apenas registra
 * a mensagem no log e informa que não houve envio.
 */
@Component
public class JavaMailEmailSender implements EmailSender {

    private static final Logger log = LoggerFactory.getLogger(JavaMailEmailSender.class);

    private final ObjectProvider<JavaMailSender> mailSenderProvider;

    @Value("${bcavault.backup.notification.from:backups@bcavault.local}")
    private String from;

    public JavaMailEmailSender(ObjectProvider<JavaMailSender> mailSenderProvider) {
        this.mailSenderProvider = mailSenderProvider;
    }

    @Override
    public boolean sendEmail(EmailMessage message) {
        if (message.getTo() == null || message.getTo().isEmpty()) {
            log.warn("Nenhum destinatário configurado para '{}'", message.getSubject());
            return false;
        }

        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            log.info("Servidor de e-mail não configurado; notificação '{}' não enviada", message.getSubject());
            return false;
        }

        try {
            MimeMessage mime = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, true, "UTF-8");
            helper.setFrom(from);
            helper.setTo(message.getTo().toArray(new String[0]));
            helper.setSubject(message.getSubject());
            if (message.getHtml() != null) {
                helper.setText(message.getText(), message.getHtml());
            } else {
                helper.setText(message.getText());
            }
            mailSender.send(mime);
            return true;
        } catch (MessagingException | MailException e) {
            log.error("Erro ao enviar e-mail '{}': {}", message.getSubject(), e.getMessage());
            return false;
        }
    }
}
