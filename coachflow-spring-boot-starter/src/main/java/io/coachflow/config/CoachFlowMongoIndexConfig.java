package io.coachflow.config;

import io.coachflow.internal.mongo.FlowStateDocument;
import io.coachflow.internal.mongo.JobDocument;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;

/**
 * MongoDB index definitions for CoachFlow.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code coachflow.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Jobs (collection: {@code coachflow_jobs})</h3>
 * <ul>
 *   <li><b>idx_due_claim</b>: { status: 1, runAt: 1, lockUntil: 1 }
 *       <br/>Used by claiming due jobs and reclaiming expired locks.</li>
 *   <li><b>idx_dedupe_key</b>: { dedupeKey: 1 }
 *       <br/>Used by supersede and cancel-by-key.</li>
 *   <li><b>ux_pending_dedupe_key</b> (unique + partial): { dedupeKey: 1 } with
 *       partialFilterExpression { status: "PENDING", dedupeKey: { $exists: true } }
 *       <br/>At most one pending job per dedupe key, even across processes.</li>
 * </ul>
 *
 * <h3>Flow states (collection: {@code coachflow_flow_states})</h3>
 * <ul>
 *   <li><b>idx_participant</b>: { participantId: 1 }
 *       <br/>Used by per-participant lookup, withdrawal and the recovery scan.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.coachflow_jobs.createIndex({ status: 1, runAt: 1, lockUntil: 1 }, { name: "idx_due_claim" });
 * db.coachflow_jobs.createIndex({ dedupeKey: 1 }, { name: "idx_dedupe_key" });
 * db.coachflow_jobs.createIndex(
 *   { dedupeKey: 1 },
 *   { name: "ux_pending_dedupe_key", unique: true,
 *     partialFilterExpression: { status: "PENDING", dedupeKey: { $exists: true } } }
 * );
 * db.coachflow_flow_states.createIndex({ participantId: 1 }, { name: "idx_participant" });
 * </pre>
 */
public class CoachFlowMongoIndexConfig {

    public static final String IDX_DUE_CLAIM = "idx_due_claim";
    public static final String IDX_DEDUPE_KEY = "idx_dedupe_key";
    public static final String UX_PENDING_DEDUPE_KEY = "ux_pending_dedupe_key";
    public static final String IDX_PARTICIPANT = "idx_participant";

    private final MongoTemplate mongoTemplate;

    public CoachFlowMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create every index above. Idempotent for unchanged definitions.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(dueClaimIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(dedupeKeyIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(pendingDedupeKeyUniqueIndex());
        mongoTemplate.indexOps(FlowStateDocument.class).ensureIndex(participantIndex());
    }

    public static Index dueClaimIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("runAt", Sort.Direction.ASC)
                .on("lockUntil", Sort.Direction.ASC)
                .named(IDX_DUE_CLAIM);
    }

    public static Index dedupeKeyIndex() {
        return new Index()
                .on("dedupeKey", Sort.Direction.ASC)
                .named(IDX_DEDUPE_KEY);
    }

    public static Index pendingDedupeKeyUniqueIndex() {
        Document filter = new Document("status", "PENDING")
                .append("dedupeKey", new Document("$exists", true));
        return new Index()
                .on("dedupeKey", Sort.Direction.ASC)
                .unique()
                .partial(PartialIndexFilter.of(filter))
                .named(UX_PENDING_DEDUPE_KEY);
    }

    public static Index participantIndex() {
        return new Index()
                .on("participantId", Sort.Direction.ASC)
                .named(IDX_PARTICIPANT);
    }
}
