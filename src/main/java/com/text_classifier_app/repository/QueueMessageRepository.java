package com.text_classifier_app.repository;

import com.text_classifier_app.entity.QueueMessage;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface QueueMessageRepository extends JpaRepository<QueueMessage, String> {

    // lock timeout -2 is Hibernate's SKIP LOCKED: concurrent receivers never lease the same row
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("SELECT m FROM QueueMessage m WHERE m.visibleAt <= :now ORDER BY m.enqueuedAt ASC")
    List<QueueMessage> findVisibleForUpdate(@Param("now") Instant now, Pageable pageable);

    @Modifying
    @Query("DELETE FROM QueueMessage m WHERE m.id = :id AND m.leaseToken = :leaseToken")
    int deleteLeased(@Param("id") String id, @Param("leaseToken") String leaseToken);

    @Modifying
    @Query("UPDATE QueueMessage m SET m.visibleAt = :visibleAt WHERE m.id = :id AND m.leaseToken = :leaseToken")
    int extendLease(@Param("id") String id, @Param("leaseToken") String leaseToken, @Param("visibleAt") Instant visibleAt);
}
