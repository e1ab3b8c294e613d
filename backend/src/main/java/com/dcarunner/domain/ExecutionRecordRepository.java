package com.dcarunner.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for execution_records. Inserts go through ExecutionRecordStore (unique txHash handling).
 */
public interface ExecutionRecordRepository extends MongoRepository<ExecutionRecord, String> {

    Optional<ExecutionRecord> findByTxHash(String txHash);

    List<ExecutionRecord> findByScheduleIdOrderByCreatedAtDesc(String scheduleId);

    List<ExecutionRecord> findByOwnerAddressOrderByCreatedAtDesc(String ownerAddress);
}
