package com.surveillance.baseline.session;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Txn;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unit of work against the baseline sets.
 *
 * A transactional session wraps an Aerospike multi-record transaction: every policy it
 * hands out is bound to that transaction, and nothing becomes visible to other sessions
 * until {@link #commit()}. A direct session has no transaction; each call stands alone
 * and commit / rollback are no-ops.
 *
 * Closing a session that was neither committed nor rolled back aborts it.
 */
public class BaselineSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BaselineSession.class);

    private final AerospikeClient client;
    private final Txn txn;
    private final Policy readPolicy;
    private final WritePolicy writePolicy;
    private final BatchPolicy batchPolicy;
    private boolean completed;

    BaselineSession(AerospikeClient client, Txn txn,
                    Policy readPolicy, WritePolicy writePolicy, BatchPolicy batchPolicy) {
        this.client = client;
        this.txn = txn;
        this.readPolicy = readPolicy;
        this.writePolicy = writePolicy;
        this.batchPolicy = batchPolicy;
    }

    public AerospikeClient client() {
        return client;
    }

    public boolean isTransactional() {
        return txn != null;
    }

    public boolean isCompleted() {
        return completed;
    }

    /** Fresh read policy bound to this session; callers may adjust it freely. */
    public Policy readPolicy() {
        Policy policy = new Policy(readPolicy);
        policy.txn = txn;
        return policy;
    }

    /** Fresh write policy bound to this session; callers may adjust it freely. */
    public WritePolicy writePolicy() {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.txn = txn;
        return policy;
    }

    public BatchPolicy batchPolicy() {
        BatchPolicy policy = new BatchPolicy(batchPolicy);
        policy.txn = txn;
        return policy;
    }

    public void commit() {
        if (completed) {
            throw new IllegalStateException("Session already completed");
        }
        if (txn != null) {
            client.commit(txn);
            log.debug("Committed baseline transaction {}", txn.getId());
        }
        completed = true;
    }

    public void rollback() {
        if (completed) {
            return;
        }
        completed = true;
        if (txn != null) {
            client.abort(txn);
            log.debug("Rolled back baseline transaction {}", txn.getId());
        }
    }

    @Override
    public void close() {
        if (!completed) {
            rollback();
        }
    }
}
