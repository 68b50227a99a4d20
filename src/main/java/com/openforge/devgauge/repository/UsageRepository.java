package com.openforge.devgauge.repository;

import com.openforge.devgauge.domain.UsageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UsageRepository extends JpaRepository<UsageRecord, Long> {

    Optional<UsageRecord> findByUserId(String userId);
}
