package com.panwatch.repository.jpa;

import com.panwatch.entity.NotifyChannelEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface NotifyChannelJpaRepository extends JpaRepository<NotifyChannelEntity, Long> {

    Optional<NotifyChannelEntity> findFirstByDefaultChannelTrueOrderByIdAsc();

    /**
     * Flags {@code id} as the default and clears every other row in one statement. Concurrent
     * callers serialize on the row locks, so the last commit leaves exactly one default.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE NotifyChannelEntity c SET c.defaultChannel = CASE WHEN c.id = :id THEN true ELSE false END")
    int makeDefault(@Param("id") Long id);
}
