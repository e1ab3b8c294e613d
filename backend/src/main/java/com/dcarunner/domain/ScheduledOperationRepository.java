package com.dcarunner.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for scheduled_operations. Scheduling-state mutations go through the job store's targeted updates.
 */
public interface ScheduledOperationRepository extends MongoRepository<ScheduledOperation, String> {

    List<ScheduledOperation> findByOwnerAddressOrderByCreatedAtDesc(String ownerAddress);

    Optional<ScheduledOperation> findByIdAndOwnerAddress(String id, String ownerAddress);
}
