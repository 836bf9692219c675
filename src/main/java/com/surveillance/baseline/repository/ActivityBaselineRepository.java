package com.surveillance.baseline.repository;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.surveillance.baseline.config.AerospikeConfig;
import com.surveillance.baseline.model.ActivityBaseline;
import com.surveillance.baseline.session.BaselineSession;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.surveillance.baseline.repository.BaselineKeys.DAYS_PER_WEEK;
import static com.surveillance.baseline.repository.BaselineKeys.HOURS_PER_DAY;

@Repository
public class ActivityBaselineRepository {

    private final String namespace;

    public ActivityBaselineRepository(@Qualifier("aerospikeNamespace") String namespace) {
        this.namespace = namespace;
    }

    public ActivityBaseline find(BaselineSession session, String cameraId, int hour, int dayOfWeek) {
        Record record = session.client().get(session.readPolicy(), key(cameraId, hour, dayOfWeek));
        if (record == null) {
            return null;
        }
        return mapRecord(record);
    }

    /**
     * All day-of-week rows for one hour, ordered by day.
     */
    public List<ActivityBaseline> findByCameraAndHour(BaselineSession session, String cameraId, int hour) {
        Key[] keys = new Key[DAYS_PER_WEEK];
        for (int day = 0; day < DAYS_PER_WEEK; day++) {
            keys[day] = key(cameraId, hour, day);
        }
        return batchGet(session, keys);
    }

    /**
     * Every row of a camera, ordered by (dayOfWeek, hour).
     */
    public List<ActivityBaseline> findByCamera(BaselineSession session, String cameraId) {
        return batchGet(session, allKeys(cameraId));
    }

    /**
     * Creates the row. Returns false when another writer created it first.
     */
    public boolean insert(BaselineSession session, ActivityBaseline baseline) {
        WritePolicy policy = session.writePolicy();
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        try {
            session.client().put(policy, key(baseline.getCameraId(), baseline.getHour(), baseline.getDayOfWeek()),
                    bins(baseline));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Overwrites the row only if it is still at {@code expectedGeneration}.
     * Returns false when the row changed or disappeared since it was read.
     */
    public boolean update(BaselineSession session, ActivityBaseline baseline, int expectedGeneration) {
        WritePolicy policy = session.writePolicy();
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = expectedGeneration;
        try {
            session.client().put(policy, key(baseline.getCameraId(), baseline.getHour(), baseline.getDayOfWeek()),
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
        for (Key key : allKeys(cameraId)) {
            if (session.client().delete(session.writePolicy(), key)) {
                deleted++;
            }
        }
        return deleted;
    }

    private List<ActivityBaseline> batchGet(BaselineSession session, Key[] keys) {
        Record[] records = session.client().get(session.batchPolicy(), keys);
        List<ActivityBaseline> results = new ArrayList<>();
        if (records == null) {
            return results;
        }
        for (Record record : records) {
            if (record != null) {
                results.add(mapRecord(record));
            }
        }
        return results;
    }

    private Key[] allKeys(String cameraId) {
        Key[] keys = new Key[DAYS_PER_WEEK * HOURS_PER_DAY];
        int i = 0;
        for (int day = 0; day < DAYS_PER_WEEK; day++) {
            for (int hour = 0; hour < HOURS_PER_DAY; hour++) {
                keys[i++] = key(cameraId, hour, day);
            }
        }
        return keys;
    }

    private Key key(String cameraId, int hour, int dayOfWeek) {
        return new Key(namespace, AerospikeConfig.SET_ACTIVITY_BASELINES,
                BaselineKeys.activityKey(cameraId, hour, dayOfWeek));
    }

    private Bin[] bins(ActivityBaseline baseline) {
        return new Bin[] {
                new Bin("cameraId", baseline.getCameraId()),
                new Bin("hour", baseline.getHour()),
                new Bin("dayOfWeek", baseline.getDayOfWeek()),
                new Bin("avgCount", baseline.getAvgCount()),
                new Bin("sampleCount", baseline.getSampleCount()),
                new Bin("lastUpdated", baseline.getLastUpdated().toEpochMilli())
        };
    }

    private ActivityBaseline mapRecord(Record record) {
        return ActivityBaseline.builder()
                .cameraId(record.getString("cameraId"))
                .hour(record.getInt("hour"))
                .dayOfWeek(record.getInt("dayOfWeek"))
                .avgCount(record.getDouble("avgCount"))
                .sampleCount(record.getLong("sampleCount"))
                .lastUpdated(Instant.ofEpochMilli(record.getLong("lastUpdated")))
                .generation(record.generation)
                .build();
    }
}
