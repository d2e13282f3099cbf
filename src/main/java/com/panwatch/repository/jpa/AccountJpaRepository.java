package com.panwatch.repository.jpa;

import com.panwatch.entity.AccountEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AccountJpaRepository extends JpaRepository<AccountEntity, Long> {

    List<AccountEntity> findAllByOrderByIdAsc();

    List<AccountEntity> findByEnabledTrueOrderByIdAsc();
}
