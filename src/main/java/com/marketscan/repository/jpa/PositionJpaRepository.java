package com.marketscan.repository.jpa;

import com.marketscan.entity.PositionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, String> {}
