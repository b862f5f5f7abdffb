package com.spectralsentinel.core.detection;

import com.spectralsentinel.core.boundary.BoundaryCalculator;
import com.spectralsentinel.core.config.DetectorConfig;
import com.spectralsentinel.core.math.AnomalyInterpolator;
import com.spectralsentinel.core.math.MovingAverageFilter;
import com.spectralsentinel.core.model.AnomalyRecord;
import com.spectralsentinel.core.model.AnomalyReport;
import com.spectralsentinel.core.model.DetectMode;
import com.spectralsentinel.core.model.MarginAnomalyRecord;
import com.spectralsentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Spectral Residual anomaly detector for one univariate series.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   values
 *     → SeriesExtender (flat predicted tail)
 *     → SpectralTransformer (saliency map, truncated to the input length)
 *     → ScoreGenerator (score in [0, 1]; flagged when score &gt;= threshold)
 *     → [margin mode] ExpectedValueEstimator + BoundaryCalculator
 *     → AnomalyReport
 * </pre>
 *
 * <p>
 * In {@link DetectMode#ANOMALY_AND_MARGIN} mode the scores are replaced by the
 * boundary calculator's rescaled scores, every point gets
 * {@code expected ∓ margin} as its boundaries, and a point stays flagged only
 * if its value also lies within those boundaries. The margin stage can
 * therefore only remove anomalies, never add them.
 * </p>
 *
 * <h3>Batching</h3>
 * <p>
 * With a positive batch size the series is split into consecutive batches of
 * {@code min(size, max(}{@value #MIN_BATCH_SIZE}{@code , batchSize))} points,
 * each detected on its own. A trailing remainder shorter than
 * {@value #MIN_BATCH_SIZE} points is detected together with the points before
 * it, and only its own records are kept. Ids are renumbered afterwards.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The report is computed on the first {@link #detect()} call and published
 * through a lock-guarded, once-only initialization; concurrent callers block
 * until it is available and all receive the same instance.
 * </p>
 *
 * @since 1.0.0
 */
public class SpectralResidualDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SpectralResidualDetector.class);

    /** Smallest series the extrapolation step can work with. */
    public static final int MIN_SERIES_SIZE = 3;

    /** Smallest batch detected on its own. */
    public static final int MIN_BATCH_SIZE = 12;

    /**
     * Largest accepted absolute value. Transform sums and squared magnitudes
     * of larger values overflow to infinity.
     */
    public static final double MAX_ABS_VALUE = 1e100;

    private final TimeSeries series;
    private final double threshold;
    private final double sensitivity;
    private final DetectMode detectMode;
    private final int batchSize;

    private final SpectralTransformer transformer;
    private final ScoreGenerator scoreGenerator;
    private final ExpectedValueEstimator estimator;
    private final BoundaryCalculator boundaryCalculator;

    private final Object lock = new Object();
    private volatile AnomalyReport report;

    /**
     * @param series             the series to analyse; at least
     *                           {@value #MIN_SERIES_SIZE} points
     * @param config             detection parameters; validated here
     * @param averageFilter      moving-average filter for both smoothing steps
     * @param interpolator       anomaly remover used before expected-value
     *                           reconstruction
     * @param boundaryCalculator unit / margin / score calculator
     * @throws NullPointerException     if any argument is {@code null}
     * @throws IllegalArgumentException if the series is too short or holds a
     *                                  value beyond {@link #MAX_ABS_VALUE}
     * @throws IllegalStateException    if the configuration is invalid
     */
    public SpectralResidualDetector(TimeSeries series,
            DetectorConfig config,
            MovingAverageFilter averageFilter,
            AnomalyInterpolator interpolator,
            BoundaryCalculator boundaryCalculator) {
        this.series = Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(averageFilter, "averageFilter must not be null");
        config.validate();

        if (series.size() < MIN_SERIES_SIZE) {
            throw new IllegalArgumentException("Series must contain at least " + MIN_SERIES_SIZE
                    + " points, got: " + series.size());
        }
        for (int i = 0; i < series.size(); i++) {
            double value = series.get(i).getValue();
            if (Math.abs(value) > MAX_ABS_VALUE) {
                throw new IllegalArgumentException("Value at index " + i + " (" + value
                        + ") exceeds the supported magnitude " + MAX_ABS_VALUE);
            }
        }

        this.threshold = config.getThreshold();
        this.sensitivity = config.getSensitivity();
        this.detectMode = config.resolveDetectMode();
        this.batchSize = effectiveBatchSize(config.getBatchSize(), series.size());

        this.transformer = new SpectralTransformer(averageFilter, config.getMagWindow());
        this.scoreGenerator = new ScoreGenerator(averageFilter, config.getScoreWindow());
        this.estimator = new ExpectedValueEstimator(interpolator);
        this.boundaryCalculator = Objects.requireNonNull(boundaryCalculator,
                "boundaryCalculator must not be null");
    }

    @Override
    public AnomalyReport detect() {
        AnomalyReport result = report;
        if (result == null) {
            synchronized (lock) {
                result = report;
                if (result == null) {
                    result = computeReport();
                    report = result;
                }
            }
        }
        return result;
    }

    /**
     * @return {@code true} once the report has been computed
     */
    public boolean isComputed() {
        return report != null;
    }

    @Override
    public DetectMode getDetectMode() {
        return detectMode;
    }

    int getBatchSize() {
        return batchSize;
    }

    // ---------------------------------------------------------------
    // Orchestration
    // ---------------------------------------------------------------

    private AnomalyReport computeReport() {
        int n = series.size();
        List<AnomalyRecord> records = new ArrayList<>(n);

        for (int start = 0; start < n; start += batchSize) {
            int end = Math.min(start + batchSize, n);
            if (end - start >= MIN_BATCH_SIZE) {
                LOG.debug("Detecting batch [{}, {})", start, end);
                records.addAll(detectBatch(series.slice(start, end)));
            } else {
                int extendedStart = Math.max(0, end - batchSize);
                LOG.debug("Detecting short tail [{}, {}) within [{}, {})", start, end, extendedStart, end);
                List<AnomalyRecord> extended = detectBatch(series.slice(extendedStart, end));
                records.addAll(extended.subList(start - extendedStart, extended.size()));
            }
        }

        List<AnomalyRecord> renumbered = new ArrayList<>(n);
        for (int i = 0; i < records.size(); i++) {
            AnomalyRecord record = records.get(i);
            renumbered.add(record.getId() == i ? record : record.withId(i));
        }

        AnomalyReport result = new AnomalyReport(detectMode, renumbered);
        LOG.info("Detected {} anomalies in {} points (mode={}, batchSize={})",
                result.getAnomalyCount(), n, detectMode.getValue(), batchSize);
        return result;
    }

    private List<AnomalyRecord> detectBatch(TimeSeries batch) {
        double[] values = batch.values();
        int n = values.length;

        double[] extended = SeriesExtender.extendSeries(values);
        double[] mags = Arrays.copyOf(transformer.transform(extended), n);
        double[] scores = scoreGenerator.score(mags);

        boolean[] isAnomaly = new boolean[n];
        int flagged = 0;
        for (int i = 0; i < n; i++) {
            isAnomaly[i] = scores[i] >= threshold;
            if (isAnomaly[i]) {
                flagged++;
            }
        }

        List<AnomalyRecord> records = new ArrayList<>(n);
        if (detectMode == DetectMode.ANOMALY_ONLY) {
            for (int i = 0; i < n; i++) {
                records.add(baseRecord(batch, i, mags[i], scores[i], isAnomaly[i]));
            }
            return records;
        }

        int[] anomalyIndices = new int[flagged];
        for (int i = 0, j = 0; i < n; i++) {
            if (isAnomaly[i]) {
                anomalyIndices[j++] = i;
            }
        }

        double[] expected = estimator.estimate(values, anomalyIndices);
        double[] units = boundaryCalculator.boundaryUnits(values, isAnomaly);
        double[] marginScores = boundaryCalculator.anomalyScores(values, expected, units, isAnomaly);

        for (int i = 0; i < n; i++) {
            double margin = boundaryCalculator.margin(units[i], sensitivity);
            double lower = expected[i] - margin;
            double upper = expected[i] + margin;
            boolean anomaly = isAnomaly[i] && lower <= values[i] && values[i] <= upper;
            AnomalyRecord base = baseRecord(batch, i, mags[i], marginScores[i], anomaly);
            records.add(MarginAnomalyRecord.of(base, expected[i], lower, upper));
        }
        return records;
    }

    private static AnomalyRecord baseRecord(TimeSeries batch, int i, double mag, double score,
            boolean anomaly) {
        return AnomalyRecord.builder()
                .id(i)
                .timestamp(batch.get(i).getTimestamp())
                .value(batch.get(i).getValue())
                .mag(mag)
                .score(score)
                .anomaly(anomaly)
                .build();
    }

    static int effectiveBatchSize(int configured, int seriesSize) {
        if (configured <= 0) {
            return seriesSize;
        }
        return Math.min(seriesSize, Math.max(MIN_BATCH_SIZE, configured));
    }
}
