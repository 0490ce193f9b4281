package com.seveninterprise.bcavault.services.notification;

import com.seveninterprise.bcavault.dto.EmailMessage;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JavaMailEmailSenderTest {

    @Mock
    private ObjectProvider<JavaMailSender> mailSenderProvider;

    @Mock
    private JavaMailSender mailSender;

    @Test
    void testSendEmail_WithoutMailServerOnlyLogs() {
        when(mailSenderProvider.getIfAvailable()).thenReturn(null);
        JavaMailEmailSender sender = new JavaMailEmailSender(mailSenderProvider);

        boolean sent = sender.sendEmail(new EmailMessage(List.of("ops@example.com"), "Assunto", "texto", null));

        assertFalse(sent);
    }

    @Test
    void testSendEmail_WithoutRecipients() {
        JavaMailEmailSender sender = new JavaMailEmailSender(mailSenderProvider);

        assertFalse(sender.sendEmail(new EmailMessage(List.of(), "Assunto", "texto", null)));
        verifyNoInteractions(mailSenderProvider);
    }

    @Test
    void testSendEmail_UsesJavaMailSender() {
        when(mailSenderProvider.getIfAvailable()).thenReturn(mailSender);
        when(mailSender.createMimeMessage()).thenReturn(new MimeMessage(Session.getInstance(new Properties())));
        JavaMailEmailSender sender = new JavaMailEmailSender(mailSenderProvider);
        ReflectionTestUtils.setField(sender, "from", "backups@example.com");

        boolean sent = sender.sendEmail(new EmailMessage(List.of("ops@example.com"), "Assunto", "texto", "<p>html</p>"));

        assertTrue(sent);
        verify(mailSender).send(any(MimeMessage.class));
    }
}
