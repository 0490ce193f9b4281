package com.seveninterprise.bcavault.services.notification;

import com.seveninterprise.bcavault.dto.BackupFailureDetails;
import com.seveninterprise.bcavault.dto.BackupSuccessDetails;
import com.seveninterprise.bcavault.dto.EmailMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class BackupNotificationService implements IBackupNotificationService {

    private static final Logger log = LoggerFactory.getLogger(BackupNotificationService.class);

    private final EmailSender emailSender;
    private final List<String> recipients;

    public BackupNotificationService(EmailSender emailSender,
                                     @Value("${bcavault.backup.notification.recipients:}") String recipients) {
        this.emailSender = emailSender;
        this.recipients = Arrays.stream(recipients.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }

    @Override
    public boolean notifySuccess(BackupSuccessDetails details) {
        String subject = "✅ Backup concluído: " + details.getScheduleName();
        String text = String.join("\n",
            "O backup agendado foi concluído com sucesso.",
            "",
            "Agendamento: " + details.getScheduleName(),
            "Arquivo: " + details.getBackupName(),
            "ID do backup: " + details.getBackupId(),
            "Tamanho: " + details.getFileSize(),
            "Duração: " + details.getDuration(),
            "Data: " + details.getTimestamp());
        String html = "<h2>Backup concluído</h2><ul>"
            + item("Agendamento", details.getScheduleName())
            + item("Arquivo", details.getBackupName())
            + item("ID do backup", details.getBackupId())
            + item("Tamanho", details.getFileSize())
            + item("Duração", details.getDuration())
            + item("Data", details.getTimestamp())
            + "</ul>";
        return send(new EmailMessage(recipients, subject, text, html));
    }

    @Override
    public boolean notifyFailure(BackupFailureDetails details) {
        String subject = "❌ Falha no backup: " + details.getScheduleName();
        String text = String.join("\n",
            "O backup agendado falhou.",
            "",
            "Agendamento: " + details.getScheduleName(),
            "Erro: " + details.getError(),
            "Data: " + details.getTimestamp(),
            "",
            "A próxima tentativa ocorrerá no horário agendado.");
        String html = "<h2>Falha no backup</h2><ul>"
            + item("Agendamento", details.getScheduleName())
            + item("Erro", details.getError())
            + item("Data", details.getTimestamp())
            + "</ul>";
        return send(new EmailMessage(recipients, subject, text, html));
    }

    private boolean send(EmailMessage message) {
        try {
            boolean sent = emailSender.sendEmail(message);
            if (!sent) {
                log.warn("Notificação '{}' não foi enviada", message.getSubject());
            }
            return sent;
        } catch (Exception e) {
            log.warn("Falha ao enviar notificação '{}': {}", message.getSubject(), e.getMessage(), e);
            return false;
        }
    }

    private static String item(String label, String value) {
        return "<li><strong>" + label + ":</strong> " + HtmlUtils.htmlEscape(value != null ? value : "") + "</li>";
    }
}
