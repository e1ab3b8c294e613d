package com.dcarunner.records;

import com.dcarunner.domain.ExecutionRecord;
import com.dcarunner.domain.ExecutionRecordRepository;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ReceiptStatus;
import com.dcarunner.failure.PersistenceFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutionRecordStoreTest {

    @Mock private ExecutionRecordRepository repository;
    @Mock private MongoTemplate mongoTemplate;

    private ExecutionRecordStore store;
    private ExecutionRecord record;

    @BeforeEach
    void setUp() {
        store = new ExecutionRecordStore(repository, mongoTemplate);
        record = new ExecutionRecord();
        record.setTxHash("0xabc");
        record.setKind(OperationKind.DCA_SWAP);
    }

    @Test
    @DisplayName("duplicate txHash returns the stored record")
    void duplicateReturnsExisting() {
        ExecutionRecord stored = new ExecutionRecord();
        when(repository.insert(record)).thenThrow(new DuplicateKeyException("E11000"));
        when(repository.findByTxHash("0xabc")).thenReturn(Optional.of(stored));

        assertThat(store.insert(record)).isSameAs(stored);
    }

    @Test
    @DisplayName("failed lookup after a duplicate key is a persistence failure")
    void duplicateLookupFailure() {
        when(repository.insert(record)).thenThrow(new DuplicateKeyException("E11000"));
        when(repository.findByTxHash("0xabc")).thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThatThrownBy(() -> store.insert(record))
                .isInstanceOf(PersistenceFailureException.class)
                .hasRootCauseMessage("mongo down")
                .satisfies(e -> assertThat(((PersistenceFailureException) e).getKind())
                        .isEqualTo(OperationKind.DCA_SWAP));
    }

    @Test
    @DisplayName("failed receipt status update is a persistence failure")
    void receiptStatusFailure() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(ExecutionRecord.class)))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThatThrownBy(() -> store.markReceiptStatus(OperationKind.DCA_SWAP, "0xabc", ReceiptStatus.CONFIRMED))
                .isInstanceOf(PersistenceFailureException.class)
                .hasMessageContaining("0xabc");
    }
}
