package com.surveillance.baseline.service;

import com.surveillance.baseline.model.ActivityBaseline;
import com.surveillance.baseline.model.CameraBaselineSummary;
import com.surveillance.baseline.model.ClassBaseline;
import com.surveillance.baseline.model.CurrentDeviation;
import com.surveillance.baseline.model.DailyPattern;
import com.surveillance.baseline.model.DeviationInterpretation;
import com.surveillance.baseline.model.HourlyPattern;
import com.surveillance.baseline.model.ObjectBaseline;
import com.surveillance.baseline.repository.ActivityBaselineRepository;
import com.surveillance.baseline.repository.BaselineKeys;
import com.surveillance.baseline.repository.ClassBaselineRepository;
import com.surveillance.baseline.session.BaselineSessionFactory;
import com.surveillance.baseline.session.TransactionMode;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read-only diagnostics over the learned baselines. Nothing here feeds anomaly decisions.
 *
 * Aggregates work on raw stored values (not decayed), in repository key order, with
 * explicit tie-breaks so rankings are deterministic.
 */
@Service
public class BaselineReportService {

    static final int TOP_N = 5;

    private static final String[] DAY_NAMES =
            {"monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday"};

    // Single-row hours have no spread; assume 10% of the mean
    private static final double SINGLE_ROW_STD_FRACTION = 0.1;
    private static final double ELEVATED_Z_SCORE = 1.5;
    // A class is elevated when its frequency is this multiple of the hour's mean class frequency
    private static final double ELEVATED_CLASS_RATIO = 2.0;

    private final ActivityBaselineRepository activityRepository;
    private final ClassBaselineRepository classRepository;
    private final BaselineSessionFactory sessionFactory;
    private final BaselineService baselineService;
    private final Clock clock;

    public BaselineReportService(ActivityBaselineRepository activityRepository,
                                 ClassBaselineRepository classRepository,
                                 BaselineSessionFactory sessionFactory,
                                 BaselineService baselineService,
                                 Clock clock) {
        this.activityRepository = activityRepository;
        this.classRepository = classRepository;
        this.sessionFactory = sessionFactory;
        this.baselineService = baselineService;
        this.clock = clock;
    }

    public CameraBaselineSummary getCameraBaselineSummary(String cameraId) {
        return getCameraBaselineSummary(cameraId, TransactionMode.selfManaged());
    }

    /**
     * Row counts plus the top 5 classes by summed frequency and the top 5 hours by summed
     * activity. Ties rank the lower class name / hour first.
     */
    @Observed(name = "baseline.summary", contextualName = "camera-baseline-summary")
    public CameraBaselineSummary getCameraBaselineSummary(String cameraId, TransactionMode mode) {
        BaselineKeys.requireId(cameraId, "cameraId");
        CameraRows rows = readCameraRows(cameraId, mode);
        List<ActivityBaseline> activity = rows.activity();
        List<ClassBaseline> classes = rows.classes();

        Map<String, Double> classTotals = new TreeMap<>();
        for (ClassBaseline baseline : classes) {
            classTotals.merge(baseline.getDetectionClass(), baseline.getFrequency(), Double::sum);
        }

        Map<Integer, Double> hourTotals = new TreeMap<>();
        for (ActivityBaseline baseline : activity) {
            hourTotals.merge(baseline.getHour(), baseline.getAvgCount(), Double::sum);
        }

        List<CameraBaselineSummary.ClassTotal> topClasses = classTotals.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Double>comparingByKey()))
                .limit(TOP_N)
                .map(e -> new CameraBaselineSummary.ClassTotal(e.getKey(), e.getValue()))
                .collect(Collectors.toList());

        List<CameraBaselineSummary.HourActivity> peakHours = hourTotals.entrySet().stream()
                .sorted(Map.Entry.<Integer, Double>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<Integer, Double>comparingByKey()))
                .limit(TOP_N)
                .map(e -> new CameraBaselineSummary.HourActivity(e.getKey(), e.getValue()))
                .collect(Collectors.toList());

        return CameraBaselineSummary.builder()
                .cameraId(cameraId)
                .activityBaselineCount(activity.size())
                .classBaselineCount(classes.size())
                .uniqueClasses(classTotals.size())
                .topClasses(topClasses)
                .peakHours(peakHours)
                .build();
    }

    public Map<Integer, HourlyPattern> getHourlyPatterns(String cameraId) {
        return getHourlyPatterns(cameraId, TransactionMode.selfManaged());
    }

    /**
     * Per hour, the mean and population std-dev of the stored averages across days.
     */
    public Map<Integer, HourlyPattern> getHourlyPatterns(String cameraId, TransactionMode mode) {
        BaselineKeys.requireId(cameraId, "cameraId");
        List<ActivityBaseline> baselines = sessionFactory.read(mode,
                session -> activityRepository.findByCamera(session, cameraId));

        Map<Integer, List<ActivityBaseline>> byHour = baselines.stream()
                .collect(Collectors.groupingBy(ActivityBaseline::getHour, TreeMap::new, Collectors.toList()));

        Map<Integer, HourlyPattern> patterns = new LinkedHashMap<>();
        byHour.forEach((hour, rows) -> {
            double[] counts = rows.stream().mapToDouble(ActivityBaseline::getAvgCount).toArray();
            double mean = mean(counts);
            double stdDev = counts.length > 1 ? populationStdDev(counts, mean) : 0.0;
            long samples = rows.stream().mapToLong(ActivityBaseline::getSampleCount).sum();
            patterns.put(hour, HourlyPattern.builder()
                    .avgDetections(round2(mean))
                    .stdDev(round2(stdDev))
                    .sampleCount(samples)
                    .build());
        });
        return patterns;
    }

    public Map<String, DailyPattern> getDailyPatterns(String cameraId) {
        return getDailyPatterns(cameraId, TransactionMode.selfManaged());
    }

    /**
     * Per day name, the summed stored activity, the busiest hour and the summed samples.
     */
    public Map<String, DailyPattern> getDailyPatterns(String cameraId, TransactionMode mode) {
        BaselineKeys.requireId(cameraId, "cameraId");
        List<ActivityBaseline> baselines = sessionFactory.read(mode,
                session -> activityRepository.findByCamera(session, cameraId));

        Map<Integer, List<ActivityBaseline>> byDay = baselines.stream()
                .collect(Collectors.groupingBy(ActivityBaseline::getDayOfWeek, TreeMap::new, Collectors.toList()));

        Map<String, DailyPattern> patterns = new LinkedHashMap<>();
        byDay.forEach((day, rows) -> {
            double total = rows.stream().mapToDouble(ActivityBaseline::getAvgCount).sum();
            long samples = rows.stream().mapToLong(ActivityBaseline::getSampleCount).sum();
            int peakHour = rows.stream()
                    .max(Comparator.comparingDouble(ActivityBaseline::getAvgCount)
                            .thenComparing(ActivityBaseline::getHour, Comparator.reverseOrder()))
                    .map(ActivityBaseline::getHour)
                    .orElse(12);
            patterns.put(DAY_NAMES[day], DailyPattern.builder()
                    .avgDetections(round2(total))
                    .peakHour(peakHour)
                    .totalSamples(samples)
                    .build());
        });
        return patterns;
    }

    public Map<String, ObjectBaseline> getObjectBaselines(String cameraId) {
        return getObjectBaselines(cameraId, TransactionMode.selfManaged());
    }

    /**
     * Per detection class, the mean stored frequency over the hours it was seen, its peak
     * hour and the total detections folded in.
     */
    public Map<String, ObjectBaseline> getObjectBaselines(String cameraId, TransactionMode mode) {
        BaselineKeys.requireId(cameraId, "cameraId");
        List<ClassBaseline> baselines = sessionFactory.read(mode,
                session -> classRepository.findByCamera(session, cameraId));

        Map<String, List<ClassBaseline>> byClass = baselines.stream()
                .collect(Collectors.groupingBy(ClassBaseline::getDetectionClass, TreeMap::new, Collectors.toList()));

        Map<String, ObjectBaseline> result = new LinkedHashMap<>();
        byClass.forEach((detectionClass, rows) -> {
            double totalFrequency = rows.stream().mapToDouble(ClassBaseline::getFrequency).sum();
            int peakHour = rows.stream()
                    .max(Comparator.comparingDouble(ClassBaseline::getFrequency)
                            .thenComparing(ClassBaseline::getHour, Comparator.reverseOrder()))
                    .map(ClassBaseline::getHour)
                    .orElse(12);
            long detections = rows.stream().mapToLong(ClassBaseline::getSampleCount).sum();
            result.put(detectionClass, ObjectBaseline.builder()
                    .avgHourly(round2(totalFrequency / rows.size()))
                    .peakHour(peakHour)
                    .totalDetections(detections)
                    .build());
        });
        return result;
    }

    public Optional<CurrentDeviation> getCurrentDeviation(String cameraId) {
        return getCurrentDeviation(cameraId, TransactionMode.selfManaged());
    }

    /**
     * How the current slot's stored activity compares with the same hour on other days,
     * as a z-score. Empty when the slot has no row or fewer than {@code minSamples} samples.
     */
    public Optional<CurrentDeviation> getCurrentDeviation(String cameraId, TransactionMode mode) {
        BaselineKeys.requireId(cameraId, "cameraId");
        ZonedDateTime now = clock.instant().atZone(baselineService.getSettings().getZone());
        int hour = now.getHour();
        int dayOfWeek = now.getDayOfWeek().getValue() - 1;
        int minSamples = baselineService.getSettings().getMinSamples();

        return sessionFactory.read(mode, session -> {
            ActivityBaseline current = activityRepository.find(session, cameraId, hour, dayOfWeek);
            if (current == null || current.getSampleCount() < minSamples) {
                return Optional.<CurrentDeviation>empty();
            }

            List<ActivityBaseline> sameHour = activityRepository.findByCameraAndHour(session, cameraId, hour);
            if (sameHour.isEmpty()) {
                return Optional.<CurrentDeviation>empty();
            }

            double[] counts = sameHour.stream().mapToDouble(ActivityBaseline::getAvgCount).toArray();
            double mean = mean(counts);
            double stdDev = counts.length > 1 ? populationStdDev(counts, mean) : mean * SINGLE_ROW_STD_FRACTION;
            double zScore = stdDev > 0 ? (current.getAvgCount() - mean) / stdDev : 0.0;

            List<String> factors = new ArrayList<>();
            if (zScore > ELEVATED_Z_SCORE) {
                List<ClassBaseline> hourClasses = classRepository.findByCameraAndHour(session, cameraId, hour);
                double meanFrequency = mean(hourClasses.stream().mapToDouble(ClassBaseline::getFrequency).toArray());
                for (ClassBaseline baseline : hourClasses) {
                    if (baseline.getFrequency() > meanFrequency * ELEVATED_CLASS_RATIO) {
                        factors.add(baseline.getDetectionClass() + "_count_elevated");
                    }
                }
            }
            if (Math.abs(zScore) > 1.0 && factors.isEmpty()) {
                factors.add("overall_activity_deviation");
            }

            return Optional.of(CurrentDeviation.builder()
                    .score(round2(zScore))
                    .interpretation(DeviationInterpretation.fromZScore(zScore))
                    .contributingFactors(factors)
                    .build());
        });
    }

    public Optional<Instant> getBaselineEstablishedDate(String cameraId) {
        return getBaselineEstablishedDate(cameraId, TransactionMode.selfManaged());
    }

    /**
     * Earliest {@code lastUpdated} across both stores of a camera.
     */
    public Optional<Instant> getBaselineEstablishedDate(String cameraId, TransactionMode mode) {
        BaselineKeys.requireId(cameraId, "cameraId");
        CameraRows rows = readCameraRows(cameraId, mode);
        List<ActivityBaseline> activity = rows.activity();
        List<ClassBaseline> classes = rows.classes();

        Optional<Instant> activityMin = activity.stream().map(ActivityBaseline::getLastUpdated).min(Comparator.naturalOrder());
        Optional<Instant> classMin = classes.stream().map(ClassBaseline::getLastUpdated).min(Comparator.naturalOrder());
        if (activityMin.isEmpty()) {
            return classMin;
        }
        if (classMin.isEmpty()) {
            return activityMin;
        }
        return Optional.of(activityMin.get().isBefore(classMin.get()) ? activityMin.get() : classMin.get());
    }

    public List<ActivityBaseline> getActivityBaselinesRaw(String cameraId) {
        return getActivityBaselinesRaw(cameraId, TransactionMode.selfManaged());
    }

    /** Up to 168 rows, ordered by (dayOfWeek, hour). */
    public List<ActivityBaseline> getActivityBaselinesRaw(String cameraId, TransactionMode mode) {
        BaselineKeys.requireId(cameraId, "cameraId");
        return sessionFactory.read(mode, session -> activityRepository.findByCamera(session, cameraId));
    }

    public List<ClassBaseline> getClassBaselinesRaw(String cameraId) {
        return getClassBaselinesRaw(cameraId, TransactionMode.selfManaged());
    }

    /** Ordered by (detectionClass, hour). */
    public List<ClassBaseline> getClassBaselinesRaw(String cameraId, TransactionMode mode) {
        BaselineKeys.requireId(cameraId, "cameraId");
        List<ClassBaseline> rows = new ArrayList<>(sessionFactory.read(mode,
                session -> classRepository.findByCamera(session, cameraId)));
        rows.sort(Comparator.comparing(ClassBaseline::getDetectionClass).thenComparingInt(ClassBaseline::getHour));
        return rows;
    }

    public Map<String, ClassBaseline> getClassBaselinesByCameraHour(String cameraId, int hour) {
        return getClassBaselinesByCameraHour(cameraId, hour, TransactionMode.selfManaged());
    }

    /**
     * Class rows at one hour keyed {@code cameraId:hour:detectionClass}, for context builders
     * that look rows up by that composite key.
     */
    public Map<String, ClassBaseline> getClassBaselinesByCameraHour(String cameraId, int hour, TransactionMode mode) {
        BaselineKeys.requireId(cameraId, "cameraId");
        BaselineKeys.requireHour(hour);
        List<ClassBaseline> rows = sessionFactory.read(mode,
                session -> classRepository.findByCameraAndHour(session, cameraId, hour));
        Map<String, ClassBaseline> byKey = new LinkedHashMap<>();
        for (ClassBaseline baseline : rows) {
            byKey.put(baseline.getCameraId() + ":" + baseline.getHour() + ":" + baseline.getDetectionClass(), baseline);
        }
        return byKey;
    }

    // Both stores of one camera, read through the same session
    private CameraRows readCameraRows(String cameraId, TransactionMode mode) {
        return sessionFactory.read(mode, session -> new CameraRows(
                activityRepository.findByCamera(session, cameraId),
                classRepository.findByCamera(session, cameraId)));
    }

    private record CameraRows(List<ActivityBaseline> activity, List<ClassBaseline> classes) {
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return values.length > 0 ? sum / values.length : 0.0;
    }

    private static double populationStdDev(double[] values, double mean) {
        double sumSquares = 0.0;
        for (double v : values) {
            sumSquares += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSquares / values.length);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
