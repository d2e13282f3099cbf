package com.panwatch.repository.jpa;

import com.panwatch.entity.AiModelEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface AiModelJpaRepository extends JpaRepository<AiModelEntity, Long> {

    /** Same single-statement swap as {@link NotifyChannelJpaRepository#makeDefault(Long)}. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AiModelEntity m SET m.defaultModel = CASE WHEN m.id = :id THEN true ELSE false END")
    int makeDefault(@Param("id") Long id);
}
