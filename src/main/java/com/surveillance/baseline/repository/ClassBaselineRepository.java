package com.surveillance.baseline.repository;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.Value;
import com.aerospike.client.cdt.ListOperation;
import com.aerospike.client.cdt.ListOrder;
import com.aerospike.client.cdt.ListPolicy;
import com.aerospike.client.cdt.ListWriteFlags;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.surveillance.baseline.config.AerospikeConfig;
import com.surveillance.baseline.model.ClassBaseline;
import com.surveillance.baseline.session.BaselineSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.surveillance.baseline.repository.BaselineKeys.HOURS_PER_DAY;

/**
 * Class baselines plus a per-(camera, hour) index of the classes seen there.
 *
 * Detection classes are free text, so the rows of one hour cannot be enumerated from
 * the key alone. The index record holds an ordered unique list of class names and is
 * appended to in the same session that creates a class row.
 */
@Repository
public class ClassBaselineRepository {

    private static final Logger log = LoggerFactory.getLogger(ClassBaselineRepository.class);

    static final String INDEX_BIN = "classes";

    private static final ListPolicy INDEX_POLICY =
            new ListPolicy(ListOrder.ORDERED, ListWriteFlags.ADD_UNIQUE | ListWriteFlags.NO_FAIL);

    private final String namespace;

    public ClassBaselineRepository(@Qualifier("aerospikeNamespace") String namespace) {
        this.namespace = namespace;
    }

    public ClassBaseline find(BaselineSession session, String cameraId, String detectionClass, int hour) {
        Record record = session.client().get(session.readPolicy(), key(cameraId, hour, detectionClass));
        if (record == null) {
            return null;
        }
        return mapRecord(record);
    }

    /**
     * Every class row at one hour of a camera, ordered by class name.
     */
    public List<ClassBaseline> findByCameraAndHour(BaselineSession session, String cameraId, int hour) {
        List<String> classes = indexedClasses(session.client().get(session.readPolicy(), indexKey(cameraId, hour)));
        if (classes.isEmpty()) {
            return new ArrayList<>();
        }
        Key[] keys = new Key[classes.size()];
        for (int i = 0; i < keys.length; i++) {
            keys[i] = key(cameraId, hour, classes.get(i));
        }
        return batchGet(session, keys);
    }

    /**
     * Every class row of a camera, ordered by (hour, class name).
     */
    public List<ClassBaseline> findByCamera(BaselineSession session, String cameraId) {
        Record[] indexRecords = session.client().get(session.batchPolicy(), indexKeys(cameraId));
        List<Key> keys = new ArrayList<>();
        if (indexRecords != null) {
            for (int hour = 0; hour < indexRecords.length; hour++) {
                for (String detectionClass : indexedClasses(indexRecords[hour])) {
                    keys.add(key(cameraId, hour, detectionClass));
                }
            }
        }
        if (keys.isEmpty()) {
            return new ArrayList<>();
        }
        return batchGet(session, keys.toArray(new Key[0]));
    }

    /**
     * Creates the row and registers its class in the hour index.
     * Returns false when another writer created the row first.
     */
    public boolean insert(BaselineSession session, ClassBaseline baseline) {
        WritePolicy policy = session.writePolicy();
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        try {
            session.client().put(policy, key(baseline.getCameraId(), baseline.getHour(), baseline.getDetectionClass()),
                    bins(baseline));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
        session.client().operate(session.writePolicy(), indexKey(baseline.getCameraId(), baseline.getHour()),
                ListOperation.append(INDEX_POLICY, INDEX_BIN, Value.get(baseline.getDetectionClass())));
        return true;
    }

    /**
     * Overwrites the row only if it is still at {@code expectedGeneration}.
     */
    public boolean update(BaselineSession session, ClassBaseline baseline, int expectedGeneration) {
        WritePolicy policy = session.writePolicy();
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = expectedGeneration;
        try {
            session.client().put(policy, key(baseline.getCameraId(), baseline.getHour(), baseline.getDetectionClass()),
                    bins(baseline));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR
                    || e.getResultCode() == ResultCode.KEY_NOT_FOUND_ERROR) {
                return false;
            }
            throw e;
        }
    }

    public int deleteByCamera(BaselineSession session, String cameraId) {
        int deleted = 0;
        for (ClassBaseline baseline : findByCamera(session, cameraId)) {
            if (session.client().delete(session.writePolicy(),
                    key(cameraId, baseline.getHour(), baseline.getDetectionClass()))) {
                deleted++;
            }
        }
        for (Key indexKey : indexKeys(cameraId)) {
            session.client().delete(session.writePolicy(), indexKey);
        }
        return deleted;
    }

    private List<ClassBaseline> batchGet(BaselineSession session, Key[] keys) {
        Record[] records = session.client().get(session.batchPolicy(), keys);
        List<ClassBaseline> results = new ArrayList<>();
        if (records == null) {
            return results;
        }
        for (int i = 0; i < records.length; i++) {
            if (records[i] != null) {
                results.add(mapRecord(records[i]));
            } else {
                log.debug("Class index points at missing row {}", keys[i].userKey);
            }
        }
        return results;
    }

    private List<String> indexedClasses(Record indexRecord) {
        if (indexRecord == null) {
            return Collections.emptyList();
        }
        List<?> raw = indexRecord.getList(INDEX_BIN);
        if (raw == null) {
            return Collections.emptyList();
        }
        List<String> classes = new ArrayList<>(raw.size());
        for (Object value : raw) {
            classes.add(String.valueOf(value));
        }
        return classes;
    }

    private Key[] indexKeys(String cameraId) {
        Key[] keys = new Key[HOURS_PER_DAY];
        for (int hour = 0; hour < HOURS_PER_DAY; hour++) {
            keys[hour] = indexKey(cameraId, hour);
        }
        return keys;
    }

    private Key key(String cameraId, int hour, String detectionClass) {
        return new Key(namespace, AerospikeConfig.SET_CLASS_BASELINES,
                BaselineKeys.classKey(cameraId, hour, detectionClass));
    }

    private Key indexKey(String cameraId, int hour) {
        return new Key(namespace, AerospikeConfig.SET_CLASS_BASELINE_INDEX,
                BaselineKeys.classIndexKey(cameraId, hour));
    }

    private Bin[] bins(ClassBaseline baseline) {
        return new Bin[] {
                new Bin("cameraId", baseline.getCameraId()),
                new Bin("detClass", baseline.getDetectionClass()),
                new Bin("hour", baseline.getHour()),
                new Bin("frequency", baseline.getFrequency()),
                new Bin("sampleCount", baseline.getSampleCount()),
                new Bin("lastUpdated", baseline.getLastUpdated().toEpochMilli())
        };
    }

    private ClassBaseline mapRecord(Record record) {
        return ClassBaseline.builder()
                .cameraId(record.getString("cameraId"))
                .detectionClass(record.getString("detClass"))
                .hour(record.getInt("hour"))
                .frequency(record.getDouble("frequency"))
                .sampleCount(record.getLong("sampleCount"))
                .lastUpdated(Instant.ofEpochMilli(record.getLong("lastUpdated")))
                .generation(record.generation)
                .build();
    }
}
