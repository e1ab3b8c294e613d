package com.dcarunner.records;

import com.dcarunner.domain.ExecutionRecord;
import com.dcarunner.domain.ExecutionRecordRepository;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ReceiptStatus;
import com.dcarunner.failure.PersistenceFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Append-only store of execution records, keyed by txHash (unique index).
 * Inserting a record whose txHash is already stored returns the stored record unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionRecordStore {

    private final ExecutionRecordRepository repository;
    private final MongoTemplate mongoTemplate;

    /**
     * @return the inserted record, or the record already stored for the same txHash
     * @throws PersistenceFailureException when the write fails for any other reason
     */
    public ExecutionRecord insert(ExecutionRecord record) {
        try {
            return repository.insert(record);
        } catch (DuplicateKeyException e) {
            log.info("Execution record for {} already stored; keeping existing", record.getTxHash());
            return existing(record, e);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException(record.getKind(), record.getTxHash(), e);
        }
    }

    /**
     * Records the observed receipt state. Only the status field is touched.
     *
     * @throws PersistenceFailureException when the update fails
     */
    public void markReceiptStatus(OperationKind kind, String txHash, ReceiptStatus status) {
        Query query = Query.query(Criteria.where("txHash").is(txHash));
        try {
            mongoTemplate.updateFirst(query, new Update().set("receiptStatus", status), ExecutionRecord.class);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException(kind, txHash, e);
        }
    }

    private ExecutionRecord existing(ExecutionRecord record, DuplicateKeyException duplicate) {
        try {
            return repository.findByTxHash(record.getTxHash())
                    .orElseThrow(() -> new PersistenceFailureException(record.getKind(), record.getTxHash(),
                            duplicate));
        } catch (DataAccessException e) {
            e.addSuppressed(duplicate);
            throw new PersistenceFailureException(record.getKind(), record.getTxHash(), e);
        }
    }

    /** Newest first. */
    public List<ExecutionRecord> findBySchedule(String scheduleId) {
        return repository.findByScheduleIdOrderByCreatedAtDesc(scheduleId);
    }

    /** Newest first. */
    public List<ExecutionRecord> findByOwner(String ownerAddress) {
        return repository.findByOwnerAddressOrderByCreatedAtDesc(ownerAddress);
    }
}
