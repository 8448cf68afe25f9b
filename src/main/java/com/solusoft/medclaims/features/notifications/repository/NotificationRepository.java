package com.solusoft.medclaims.features.notifications.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.ListCrudRepository;
import org.springframework.data.repository.query.Param;

import com.solusoft.medclaims.features.notifications.model.Notification;

public interface NotificationRepository extends ListCrudRepository<Notification, Long> {

    Optional<Notification> findByIdAndUserId(Long id, Long userId);

    @Query("""
        SELECT * FROM notifications
        WHERE user_id = :userId
          AND (:unreadOnly = false OR is_read = false)
        ORDER BY created_at DESC, id DESC
        LIMIT :limit OFFSET :offset
    """)
    List<Notification> findInbox(@Param("userId") Long userId,
                                 @Param("unreadOnly") boolean unreadOnly,
                                 @Param("limit") int limit,
                                 @Param("offset") long offset);

    @Query("SELECT COUNT(*) FROM notifications WHERE user_id = :userId AND is_read = false")
    long countUnread(@Param("userId") Long userId);
}
