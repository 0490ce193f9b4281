package com.seveninterprise.bcavault.services.notification;

import com.seveninterprise.bcavault.dto.EmailMessage;

/**
 * Canal de envio de e-mail
 */
public interface EmailSender {

    /**
     * @return true se a mensagem foi aceita para entrega
     */
    boolean sendEmail(EmailMessage message);
}
