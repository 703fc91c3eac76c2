package io.coachflow.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.coachflow.core.Job;
import io.coachflow.core.JobRequest;
import io.coachflow.core.JobStatus;
import io.coachflow.core.ScheduleSpec;
import io.coachflow.exception.InvariantViolationException;
import io.coachflow.exception.TransientDependencyException;
import io.coachflow.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>The one-pending-job-per-dedupe-key rule is enforced twice: {@link #enqueue} cancels the previous
 * holder before inserting, and a unique partial index on {@code dedupeKey} (status {@code PENDING})
 * rejects the loser of a concurrent enqueue, which then supersedes and retries once.
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public Job enqueue(JobRequest request, Instant now) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(now, "now must not be null");

        return execute("enqueue", () -> {
            try {
                return supersedeAndInsert(request, now);
            } catch (DuplicateKeyException first) {
                log.debug("enqueue raced on dedupeKey={}; retrying once", request.dedupeKey());
                try {
                    return supersedeAndInsert(request, now);
                } catch (DuplicateKeyException second) {
                    throw new InvariantViolationException("more than one pending job for dedupeKey " + request.dedupeKey());
                }
            }
        });
    }

    private Job supersedeAndInsert(JobRequest request, Instant now) {
        if (request.dedupeKey() != null) {
            Query q = new Query(
                    Criteria.where("dedupeKey").is(request.dedupeKey())
                            .orOperator(
                                    Criteria.where("status").is(JobStatus.PENDING),
                                    Criteria.where("status").is(JobStatus.RUNNING).and("lockUntil").lte(now)
                            )
            );
            UpdateResult r = mongoTemplate.updateMulti(q, finishUpdate(JobStatus.CANCELLED, now).set("lastError", "superseded"), JobDocument.class);
            if (r.getModifiedCount() > 0) {
                log.debug("jobs superseded dedupeKey={} count={}", request.dedupeKey(), r.getModifiedCount());
            }
        }
        return toJob(mongoTemplate.insert(toDocument(request, now)));
    }

    /**
     * Atomically claims at most {@code limit} due jobs.
     *
     * <p>A job is due when {@code runAt <= now} and it is either {@code PENDING} or {@code RUNNING} with an
     * expired lock. Each claim is a {@code findAndModify}, so concurrent workers never share a job.
     */
    @Override
    public List<Job> claimDue(Instant now, int limit, Duration lockLifetime, String workerId) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (limit <= 0) {
            return List.of();
        }
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Query baseQuery = new Query(
                Criteria.where("runAt").lte(now)
                        .orOperator(
                                Criteria.where("status").is(JobStatus.PENDING),
                                Criteria.where("status").is(JobStatus.RUNNING).and("lockUntil").lte(now)
                        )
        );
        baseQuery.with(Sort.by(Sort.Order.asc("runAt")));

        Update lockUpdate = new Update()
                .set("status", JobStatus.RUNNING)
                .set("lockedBy", workerId)
                .set("lockUntil", now.plus(lockLifetime))
                .inc("attempts", 1);

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        return execute("claimDue", () -> {
            List<Job> claimed = new ArrayList<>(Math.min(limit, 64));
            for (int i = 0; i < limit; i++) {
                JobDocument doc = mongoTemplate.findAndModify(baseQuery, lockUpdate, options, JobDocument.class);
                if (doc == null) {
                    break;
                }
                claimed.add(toJob(doc));
            }
            return claimed;
        });
    }

    @Override
    public boolean markDone(String jobId, String workerId, Instant finishedAt) {
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        return release(jobId, workerId, finishUpdate(JobStatus.DONE, finishedAt));
    }

    @Override
    public boolean markFailed(String jobId, String workerId, Instant failedAt, String error) {
        Objects.requireNonNull(failedAt, "failedAt must not be null");
        return release(jobId, workerId, finishUpdate(JobStatus.FAILED, failedAt).set("lastError", error));
    }

    private boolean release(String jobId, String workerId, Update update) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");

        Query q = new Query(
                Criteria.where("_id").is(jobId)
                        // Prevent stale write-back if the job was cancelled or re-claimed meanwhile.
                        .and("lockedBy").is(workerId)
                        .and("status").is(JobStatus.RUNNING)
        );
        return execute("release", () -> mongoTemplate.updateFirst(q, update, JobDocument.class).getModifiedCount() == 1);
    }

    @Override
    public boolean cancel(String jobId, Instant now) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Query q = new Query(Criteria.where("_id").is(jobId).and("status").in(JobStatus.PENDING, JobStatus.RUNNING));
        return execute("cancel", () -> mongoTemplate.updateFirst(q, finishUpdate(JobStatus.CANCELLED, now), JobDocument.class)
                .getModifiedCount() == 1);
    }

    @Override
    public long cancelByDedupeKey(String dedupeKey, Instant now) {
        if (dedupeKey == null || dedupeKey.isBlank()) {
            return 0;
        }
        Query q = new Query(Criteria.where("dedupeKey").is(dedupeKey).and("status").in(JobStatus.PENDING, JobStatus.RUNNING));
        return execute("cancelByDedupeKey", () -> mongoTemplate.updateMulti(q, finishUpdate(JobStatus.CANCELLED, now), JobDocument.class)
                .getModifiedCount());
    }

    @Override
    public Optional<Job> findById(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return execute("findById", () -> Optional.ofNullable(mongoTemplate.findById(jobId, JobDocument.class)).map(this::toJob));
    }

    @Override
    public Optional<Job> findPendingByDedupeKey(String dedupeKey) {
        Query q = new Query(Criteria.where("dedupeKey").is(dedupeKey).and("status").is(JobStatus.PENDING));
        return execute("findPendingByDedupeKey", () -> Optional.ofNullable(mongoTemplate.findOne(q, JobDocument.class)).map(this::toJob));
    }

    private static Update finishUpdate(JobStatus status, Instant at) {
        return new Update()
                .set("status", status)
                .set("finishedAt", at)
                .unset("lockedBy")
                .unset("lockUntil");
    }

    private JobDocument toDocument(JobRequest request, Instant now) {
        JobDocument doc = new JobDocument();
        doc.setKind(request.kind());
        doc.setDedupeKey(request.dedupeKey());
        doc.setRunAt(request.runAt());
        doc.setStatus(JobStatus.PENDING);
        doc.setAttempts(0);
        doc.setCreatedAt(now);
        doc.setPayload(new LinkedHashMap<>(request.payload()));
        if (request.schedule() != null) {
            doc.setSchedule(objectMapper.convertValue(request.schedule(), MAP_TYPE));
        }
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(JobRequest, Instant)}.
     */
    Job toJob(JobDocument doc) {
        ScheduleSpec schedule = doc.getSchedule() == null ? null : objectMapper.convertValue(doc.getSchedule(), ScheduleSpec.class);
        return new Job(
                doc.getId(),
                doc.getKind(),
                doc.getDedupeKey(),
                doc.getRunAt(),
                schedule,
                doc.getStatus(),
                doc.getLockedBy(),
                doc.getLockUntil(),
                doc.getAttempts(),
                doc.getCreatedAt(),
                doc.getFinishedAt(),
                doc.getLastError(),
                doc.getPayload() == null ? Map.of() : doc.getPayload()
        );
    }

    private static <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new TransientDependencyException("job store " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
