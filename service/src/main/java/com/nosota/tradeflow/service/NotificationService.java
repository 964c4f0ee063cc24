package com.nosota.tradeflow.service;

import com.nosota.tradeflow.error.EntityNotFoundException;
import com.nosota.tradeflow.model.Notification;
import com.nosota.tradeflow.repository.NotificationRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Stores notifications and exposes them to their owner.
 *
 * <p>Clients poll {@link #list} and {@link #unreadCount}; there is no push channel for
 * notifications.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final NotificationRepository notificationRepository;

    @Value("${notification.max-page-size:50}")
    private int maxPageSize;

    /**
     * Writes a notification in its own transaction. Called after the business transaction
     * committed, when no transaction is left to join.
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public Notification create(NotificationRequestedEvent event) {
        Notification notification = new Notification();
        notification.setUserId(event.userId());
        notification.setType(event.type());
        notification.setTitle(event.title());
        notification.setMessage(event.message());
        notification.setLink(event.link());
        notification.setRead(false);
        notification.setCreatedAt(LocalDateTime.now());

        Notification saved = notificationRepository.save(notification);
        log.info("Notification {} ({}) written for user {}", saved.getId(), saved.getType(), saved.getUserId());
        return saved;
    }

    /**
     * Notifications of a user, most recent first. The page size is capped at
     * {@code notification.max-page-size}.
     */
    public Page<Notification> list(Long userId, int page, int size) {
        int pageSize = Math.min(Math.max(size, 1), maxPageSize);
        return notificationRepository.findByUserIdOrderByCreatedAtDesc(userId,
                PageRequest.of(Math.max(page, 0), pageSize));
    }

    public long unreadCount(Long userId) {
        return notificationRepository.countByUserIdAndReadFalse(userId);
    }

    /**
     * Marks one notification read. Marking an already read notification keeps its original
     * read time. Another user's notification is reported as not found.
     */
    @Transactional
    public Notification markRead(UUID notificationId, Long userId) {
        Notification notification = notificationRepository.findById(notificationId)
                .filter(n -> n.getUserId().equals(userId))
                .orElseThrow(() -> new EntityNotFoundException("NOTIFICATION", notificationId));

        if (!notification.isRead()) {
            notification.setRead(true);
            notification.setReadAt(LocalDateTime.now());
            notification = notificationRepository.save(notification);
        }
        return notification;
    }

    /**
     * @return unread count after the call, always 0
     */
    @Transactional
    public long markAllRead(Long userId) {
        int changed = notificationRepository.markAllRead(userId, LocalDateTime.now());
        log.debug("Marked {} notifications read for user {}", changed, userId);
        return notificationRepository.countByUserIdAndReadFalse(userId);
    }
}
