package com.dcarunner.store;

import com.dcarunner.domain.AppReference;
import com.dcarunner.domain.OperationKind;
import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.domain.ScheduledOperationRepository;
import com.dcarunner.domain.TransferParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers
class MongoJobStoreIntegrationTest {

    private static final Instant T0 = Instant.parse("2026-10-01T12:00:00Z");

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    JobStore jobStore;
    @Autowired
    ScheduledOperationRepository repository;

    @BeforeEach
    void clean() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("listDue returns enabled jobs at or before now, oldest first, up to the limit")
    void listDueOrdering() {
        ScheduledOperation late = jobStore.save(job(T0.minusSeconds(10), true));
        ScheduledOperation early = jobStore.save(job(T0.minusSeconds(600), true));
        ScheduledOperation exact = jobStore.save(job(T0, true));
        jobStore.save(job(T0.minusSeconds(900), false));
        jobStore.save(job(T0.plusSeconds(1), true));

        List<ScheduledOperation> due = jobStore.listDue(T0, 10);
        assertThat(due).extracting(ScheduledOperation::getId)
                .containsExactly(early.getId(), late.getId(), exact.getId());

        assertThat(jobStore.listDue(T0, 1)).extracting(ScheduledOperation::getId).containsExactly(early.getId());
    }

    @Test
    @DisplayName("app version only moves upward")
    void advanceAppVersionOnlyRaises() {
        ScheduledOperation job = jobStore.save(job(T0, true));

        assertThat(jobStore.advanceAppVersion(job.getId(), 5)).isTrue();
        assertThat(jobStore.advanceAppVersion(job.getId(), 4)).isFalse();
        assertThat(jobStore.advanceAppVersion(job.getId(), 5)).isFalse();

        assertThat(jobStore.load(job.getId()).orElseThrow().getApp().getVersion()).isEqualTo(5);
    }

    @Test
    @DisplayName("disable keeps the reason; enable clears it and sets the next fire")
    void disableAndEnable() {
        ScheduledOperation job = jobStore.save(job(T0, true));

        assertThat(jobStore.disable(job.getId(), "insufficient balance")).isTrue();
        ScheduledOperation disabled = jobStore.load(job.getId()).orElseThrow();
        assertThat(disabled.isEnabled()).isFalse();
        assertThat(disabled.getDisabledReason()).isEqualTo("insufficient balance");
        assertThat(jobStore.listDue(T0, 10)).isEmpty();

        Instant resumeAt = T0.plusSeconds(60);
        assertThat(jobStore.enable(job.getId(), resumeAt)).isTrue();
        ScheduledOperation enabled = jobStore.load(job.getId()).orElseThrow();
        assertThat(enabled.isEnabled()).isTrue();
        assertThat(enabled.getDisabledReason()).isNull();
        assertThat(enabled.getNextRunAt()).isEqualTo(resumeAt);
    }

    @Test
    @DisplayName("fire bookkeeping touches only scheduling fields")
    void recordFireFields() {
        ScheduledOperation job = jobStore.save(job(T0, true));

        jobStore.markStarted(job.getId(), T0);
        jobStore.recordFailure(job.getId(), T0.plusSeconds(5), "nonce too low", T0.plusSeconds(3_600));
        ScheduledOperation stored = jobStore.load(job.getId()).orElseThrow();

        assertThat(stored.getLastRunAt()).isEqualTo(T0);
        assertThat(stored.getFailedAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(stored.getFailReason()).isEqualTo("nonce too low");
        assertThat(stored.getNextRunAt()).isEqualTo(T0.plusSeconds(3_600));
        assertThat(stored.isEnabled()).isTrue();
        assertThat(stored.getTransfer().getAmount()).isEqualTo("1.5");
    }

    @Test
    @DisplayName("updates against a removed job report no match and never recreate it")
    void removedJobNotRecreated() {
        ScheduledOperation job = jobStore.save(job(T0, true));
        assertThat(jobStore.remove(job.getId())).isTrue();

        assertThat(jobStore.recordSuccess(job.getId(), T0, T0.plusSeconds(60))).isFalse();
        assertThat(jobStore.disable(job.getId(), "late failure")).isFalse();
        assertThat(jobStore.markStarted(job.getId(), T0)).isFalse();
        assertThat(jobStore.remove(job.getId())).isFalse();
        assertThat(jobStore.load(job.getId())).isEmpty();
    }

    private static ScheduledOperation job(Instant nextRunAt, boolean enabled) {
        ScheduledOperation job = new ScheduledOperation();
        job.setKind(OperationKind.TRANSFER);
        job.setOwnerAddress("0x1111111111111111111111111111111111111111");
        job.setApp(new AppReference("dca-app", 2));
        job.setTransfer(new TransferParams(null, "0x2222222222222222222222222222222222222222", "1.5"));
        job.setEnabled(enabled);
        job.setIntervalSeconds(3_600);
        job.setNextRunAt(nextRunAt);
        job.setCreatedAt(T0);
        return job;
    }
}
