package com.seveninterprise.bcavault.services.notification;

import com.seveninterprise.bcavault.dto.BackupFailureDetails;
import com.seveninterprise.bcavault.dto.BackupSuccessDetails;

/**
 * Notificações de resultado de backup aos administradores
 *
 * Melhor esforço: falhas de envio são registradas em log e nunca alteram
 * o resultado do backup notificado.
 */
public interface IBackupNotificationService {

    boolean notifySuccess(BackupSuccessDetails details);

    boolean notifyFailure(BackupFailureDetails details);
}
