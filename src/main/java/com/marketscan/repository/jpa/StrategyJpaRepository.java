package com.marketscan.repository.jpa;

import com.marketscan.entity.StrategyEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StrategyJpaRepository extends JpaRepository<StrategyEntity, String> {

    List<StrategyEntity> findByActiveTrueOrderByCreatedAtAsc();
}
