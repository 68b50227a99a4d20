package com.openforge.devgauge.repository;

import com.openforge.devgauge.domain.AgentStateRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AgentStateRepository extends JpaRepository<AgentStateRecord, Long> {

    Optional<AgentStateRecord> findByUserId(String userId);
}
