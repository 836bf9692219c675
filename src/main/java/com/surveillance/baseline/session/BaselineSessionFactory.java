package com.surveillance.baseline.session;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Txn;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.function.Function;

@Component
public class BaselineSessionFactory {

    private final AerospikeClient client;
    private final Policy readPolicy;
    private final WritePolicy writePolicy;
    private final BatchPolicy batchPolicy;

    public BaselineSessionFactory(AerospikeClient client,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultBatchPolicy") BatchPolicy batchPolicy) {
        this.client = client;
        this.readPolicy = readPolicy;
        this.writePolicy = writePolicy;
        this.batchPolicy = batchPolicy;
    }

    /** Starts a multi-record transaction. The caller must commit, roll back or close it. */
    public BaselineSession open() {
        return new BaselineSession(client, new Txn(), readPolicy, writePolicy, batchPolicy);
    }

    /** Session without a transaction, for standalone reads. */
    public BaselineSession direct() {
        return new BaselineSession(client, null, readPolicy, writePolicy, batchPolicy);
    }

    /**
     * Runs a write under the given ownership mode. Self-managed work is committed on
     * success and rolled back when {@code work} throws; the exception propagates unchanged.
     */
    public <T> T write(TransactionMode mode, Function<BaselineSession, T> work) {
        if (mode instanceof TransactionMode.CallerManaged callerManaged) {
            return work.apply(callerManaged.session());
        }
        try (BaselineSession session = open()) {
            T result = work.apply(session);
            session.commit();
            return result;
        }
    }

    /** Runs a read under the given ownership mode. Never commits. */
    public <T> T read(TransactionMode mode, Function<BaselineSession, T> work) {
        if (mode instanceof TransactionMode.CallerManaged callerManaged) {
            return work.apply(callerManaged.session());
        }
        try (BaselineSession session = direct()) {
            return work.apply(session);
        }
    }
}
