package com.dcarunner.store;

import com.dcarunner.domain.ScheduledOperation;
import com.dcarunner.domain.ScheduledOperationRepository;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link JobStore} over scheduled_operations using MongoTemplate updateFirst (no upsert).
 */
@Component
@RequiredArgsConstructor
public class MongoJobStore implements JobStore {

    private final ScheduledOperationRepository repository;
    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<ScheduledOperation> load(String jobId) {
        return repository.findById(jobId);
    }

    @Override
    public ScheduledOperation save(ScheduledOperation job) {
        job.setUpdatedAt(Instant.now());
        return repository.save(job);
    }

    @Override
    public boolean disable(String jobId, String reason) {
        return update(jobId, new Update()
                .set("enabled", false)
                .set("disabledReason", reason));
    }

    @Override
    public boolean enable(String jobId, Instant nextRunAt) {
        return update(jobId, new Update()
                .set("enabled", true)
                .unset("disabledReason")
                .set("nextRunAt", nextRunAt));
    }

    @Override
    public boolean remove(String jobId) {
        return mongoTemplate.remove(byId(jobId), ScheduledOperation.class).getDeletedCount() > 0;
    }

    @Override
    public List<ScheduledOperation> listDue(Instant now, int limit) {
        Query query = Query.query(Criteria.where("enabled").is(true).and("nextRunAt").lte(now))
                .with(Sort.by(Sort.Direction.ASC, "nextRunAt"))
                .limit(limit);
        return mongoTemplate.find(query, ScheduledOperation.class);
    }

    @Override
    public boolean advanceAppVersion(String jobId, int version) {
        Query query = Query.query(Criteria.where("_id").is(jobId).and("app.version").lt(version));
        UpdateResult result = mongoTemplate.updateFirst(query,
                new Update().set("app.version", version).set("updatedAt", Instant.now()),
                ScheduledOperation.class);
        return result.getModifiedCount() > 0;
    }

    @Override
    public boolean markStarted(String jobId, Instant startedAt) {
        return update(jobId, new Update().set("lastRunAt", startedAt));
    }

    @Override
    public boolean recordSuccess(String jobId, Instant finishedAt, Instant nextRunAt) {
        return update(jobId, new Update()
                .set("lastFinishedAt", finishedAt)
                .set("nextRunAt", nextRunAt));
    }

    @Override
    public boolean recordFailure(String jobId, Instant failedAt, String reason, Instant nextRunAt) {
        return update(jobId, new Update()
                .set("failedAt", failedAt)
                .set("failReason", reason)
                .set("nextRunAt", nextRunAt));
    }

    private boolean update(String jobId, Update update) {
        UpdateResult result = mongoTemplate.updateFirst(byId(jobId), update.set("updatedAt", Instant.now()),
                ScheduledOperation.class);
        return result.getMatchedCount() > 0;
    }

    private static Query byId(String jobId) {
        return Query.query(Criteria.where("_id").is(jobId));
    }
}
