package io.stockflow.backend.notification;

import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class NotificationService {

  private final NotificationRepository notificationRepository;

  public NotificationService(NotificationRepository notificationRepository) {
    this.notificationRepository = notificationRepository;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Notification createNotification(
      UUID tenantId, UUID recipientUserId, String type, String title, String body) {
    return notificationRepository.save(
        new Notification(tenantId, recipientUserId, type, title, body));
  }
}
