package com.tony.sportsFeatures.service;

import com.tony.sportsFeatures.exception.InsufficientDataException;
import com.tony.sportsFeatures.model.BootstrapSummary;
import com.tony.sportsFeatures.model.CalibrationReport;
import com.tony.sportsFeatures.model.ErrorInterval;
import com.tony.sportsFeatures.model.ErrorMetric;
import com.tony.sportsFeatures.model.FeatureImportanceReport;
import com.tony.sportsFeatures.model.GameRecord;
import com.tony.sportsFeatures.model.LearningCurvePoint;
import com.tony.sportsFeatures.model.OverfittingReport;
import com.tony.sportsFeatures.model.RowTable;
import com.tony.sportsFeatures.util.FeatureMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Diagnostics d'un modèle entraîné ailleurs : on ne reçoit que ses prédictions, les valeurs observées
 * ou ses métriques. Aucun modèle n'est entraîné ici.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValidationMetricsService {

    public static final double DEFAULT_OVERFIT_THRESHOLD = 0.1;
    public static final List<Double> DEFAULT_TRAIN_FRACTIONS = List.of(0.1, 0.25, 0.5, 0.75, 1.0);

    private final TemporalGrouper grouper;

    /**
     * Erreurs absolues triées ; la borne est l'erreur au rang floor(n * confiance).
     */
    public ErrorInterval confidenceInterval(List<Double> predictions, List<Double> actuals, double confidence) {
        if (!(confidence > 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Le niveau de confiance doit être dans ]0, 1] : " + confidence);
        }
        requirePairs(predictions, actuals, 1);
        log.info("📏 Intervalle de confiance à {}% sur {} prédiction(s)", Math.round(confidence * 100), predictions.size());

        DescriptiveStatistics errors = new DescriptiveStatistics();
        for (int i = 0; i < predictions.size(); i++) {
            errors.addValue(Math.abs(predictions.get(i) - actuals.get(i)));
        }
        double[] sorted = errors.getSortedValues();

        return ErrorInterval.builder()
                .confidenceLevel(confidence)
                .ciBound(FeatureMath.round(sorted[rank(sorted.length, confidence)], 4))
                .meanError(FeatureMath.round(errors.getMean(), 4))
                .medianError(FeatureMath.round(sorted[sorted.length / 2], 4))
                .sampleSize(sorted.length)
                .build();
    }

    /**
     * Signal de sur-apprentissage pour chaque métrique dont l'écart relatif train/test dépasse le seuil.
     * Métrique d'entraînement nulle : signal dès que le test s'en écarte (écart relatif non défini).
     */
    public OverfittingReport detectOverfitting(Map<String, Double> trainMetrics, Map<String, Double> testMetrics,
                                               double threshold) {
        if (threshold < 0.0) {
            throw new IllegalArgumentException("Le seuil doit être positif : " + threshold);
        }
        log.info("🔍 Recherche de sur-apprentissage (seuil {}%)", FeatureMath.round(threshold * 100, 1));

        List<OverfittingReport.Signal> signals = new ArrayList<>();
        trainMetrics.forEach((metric, train) -> {
            Double test = testMetrics.get(metric);
            if (train == null || test == null) return;

            double diff = Math.abs(train - test);
            if (train == 0.0) {
                if (diff > 0.0) signals.add(new OverfittingReport.Signal(metric, train, test, FeatureMath.round(diff, 4), null));
                return;
            }
            double pctDiff = diff / Math.abs(train);
            if (pctDiff > threshold) {
                signals.add(new OverfittingReport.Signal(metric, train, test, FeatureMath.round(diff, 4), FeatureMath.round(pctDiff, 4)));
            }
        });

        if (signals.isEmpty()) {
            log.info("✅ Aucun signe de sur-apprentissage");
        } else {
            log.warn("⚠️ Sur-apprentissage probable : {} métrique(s) dégradée(s)", signals.size());
            signals.forEach(s -> log.warn("  {} : train={} test={} ({})", s.getMetric(), s.getTrain(), s.getTest(),
                    s.getPctDiff() == null ? "écart relatif non défini" : FeatureMath.round(s.getPctDiff() * 100, 1) + "%"));
        }

        return OverfittingReport.builder()
                .overfit(!signals.isEmpty())
                .threshold(threshold)
                .signals(List.copyOf(signals))
                .build();
    }

    /**
     * Bootstrap (tirage avec remise, graine fixée) d'une métrique d'erreur.
     * Un échantillon dont le R2 n'est pas défini (valeurs observées constantes) est écarté.
     */
    public BootstrapSummary bootstrap(List<Double> predictions, List<Double> actuals, ErrorMetric metric,
                                      int iterations, long seed) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("Le nombre d'itérations doit être positif : " + iterations);
        }
        requirePairs(predictions, actuals, 1);
        log.info("🎲 Bootstrap de {} ({} itérations, graine {})", metric, iterations, seed);

        int n = predictions.size();
        Random random = new Random(seed);
        DescriptiveStatistics scores = new DescriptiveStatistics();
        int[] indices = new int[n];

        for (int it = 0; it < iterations; it++) {
            for (int k = 0; k < n; k++) {
                indices[k] = random.nextInt(n);
            }
            double score = score(metric, predictions, actuals, indices);
            if (Double.isFinite(score)) scores.addValue(score);
        }

        if (scores.getN() == 0) {
            throw new InsufficientDataException("Aucun échantillon bootstrap exploitable pour " + metric, 1, 0);
        }
        if (scores.getN() < iterations) {
            log.warn("⚠️ {} échantillon(s) bootstrap écarté(s) : {} non défini", iterations - scores.getN(), metric);
        }

        double[] sorted = scores.getSortedValues();
        return BootstrapSummary.builder()
                .metric(metric)
                .iterations(sorted.length)
                .mean(FeatureMath.round(scores.getMean(), 4))
                .median(FeatureMath.round(sorted[sorted.length / 2], 4))
                .ci95Lower(FeatureMath.round(sorted[rank(sorted.length, 0.025)], 4))
                .ci95Upper(FeatureMath.round(sorted[rank(sorted.length, 0.975)], 4))
                .stdDev(FeatureMath.round(Math.sqrt(scores.getPopulationVariance()), 4))
                .build();
    }

    /**
     * Sous-ensembles d'entraînement croissants. Ce sont les premières lignes dans l'ordre chronologique
     * (jamais un tirage aléatoire qui mélangerait passé et futur) ; taille = floor(n * fraction).
     */
    public List<LearningCurvePoint> learningCurve(RowTable table, String timestampColumn, List<Double> fractions) {
        if (fractions == null || fractions.isEmpty()) {
            throw new IllegalArgumentException("Au moins une fraction d'entraînement est requise");
        }
        for (Double fraction : fractions) {
            if (fraction == null || !(fraction > 0.0 && fraction <= 1.0)) {
                throw new IllegalArgumentException("Fraction d'entraînement hors de ]0, 1] : " + fraction);
            }
        }
        table.requireColumn(timestampColumn, "courbe d'apprentissage");
        log.info("📚 Courbe d'apprentissage sur {} point(s)", fractions.size());

        RowTable copy = table.copy();
        List<GameRecord> timeline = grouper.group(copy, null, timestampColumn, null).group(TemporalGrouper.WHOLE_TABLE);

        List<LearningCurvePoint> curve = new ArrayList<>();
        for (double fraction : fractions) {
            int size = (int) Math.floor(timeline.size() * fraction);
            curve.add(LearningCurvePoint.builder()
                    .trainFraction(fraction)
                    .trainSize(size)
                    .train(List.copyOf(timeline.subList(0, size)))
                    .build());
        }
        return curve;
    }

    /**
     * Les {@code topN} features les plus importantes et leur part cumulée de l'importance totale.
     */
    public FeatureImportanceReport featureImportance(Map<String, Double> importances, int topN) {
        if (topN <= 0) {
            throw new IllegalArgumentException("topN doit être positif : " + topN);
        }
        log.info("🏅 Validation des {} features principales", topN);

        double total = importances.values().stream().mapToDouble(FeatureMath::valueOrZero).sum();
        Map<String, Double> top = new LinkedHashMap<>();
        importances.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()))
                .limit(topN)
                .forEach(e -> top.put(e.getKey(), e.getValue()));

        double cumulative = 0.0;
        for (Map.Entry<String, Double> entry : top.entrySet()) {
            cumulative += entry.getValue();
            if (total != 0.0) {
                log.info("  {} : {} ({}%, cumulé {}%)", entry.getKey(), FeatureMath.round(entry.getValue(), 4),
                        FeatureMath.round(entry.getValue() / total * 100, 2), FeatureMath.round(cumulative / total * 100, 2));
            }
        }

        return FeatureImportanceReport.builder()
                .topFeatures(top)
                .cumulativeImportance(total != 0.0 ? FeatureMath.round(cumulative / total, 4) : null)
                .build();
    }

    /**
     * Prédictions triées puis coupées en {@code bins} tranches de floor(n / bins) ; la dernière prend le reste.
     */
    public CalibrationReport calibration(List<Double> predictions, List<Double> actuals, int bins) {
        if (bins <= 0) {
            throw new IllegalArgumentException("Le nombre de tranches doit être positif : " + bins);
        }
        requirePairs(predictions, actuals, bins);
        log.info("🎚️ Contrôle de calibration ({} tranches)", bins);

        List<double[]> pairs = new ArrayList<>();
        for (int i = 0; i < predictions.size(); i++) {
            pairs.add(new double[]{predictions.get(i), actuals.get(i)});
        }
        pairs.sort(Comparator.comparingDouble(p -> p[0]));

        int binSize = pairs.size() / bins;
        List<CalibrationReport.Bin> result = new ArrayList<>();
        SummaryStatistics errors = new SummaryStatistics();

        for (int b = 0; b < bins; b++) {
            int from = b * binSize;
            int to = b == bins - 1 ? pairs.size() : (b + 1) * binSize;
            SummaryStatistics predicted = new SummaryStatistics();
            SummaryStatistics observed = new SummaryStatistics();
            for (double[] pair : pairs.subList(from, to)) {
                predicted.addValue(pair[0]);
                observed.addValue(pair[1]);
            }
            double error = FeatureMath.round(Math.abs(predicted.getMean() - observed.getMean()), 3);
            errors.addValue(error);
            result.add(new CalibrationReport.Bin(b + 1, to - from,
                    FeatureMath.round(predicted.getMean(), 3), FeatureMath.round(observed.getMean(), 3), error));
        }

        double meanError = FeatureMath.round(errors.getMean(), 4);
        log.info("Erreur de calibration moyenne : {}", meanError);
        return CalibrationReport.builder()
                .bins(List.copyOf(result))
                .meanCalibrationError(meanError)
                .build();
    }

    // =========================================================================================
    // Outils internes
    // =========================================================================================

    private static double score(ErrorMetric metric, List<Double> predictions, List<Double> actuals, int[] indices) {
        int n = indices.length;
        return switch (metric) {
            case RMSE -> {
                double sum = 0.0;
                for (int i : indices) sum += Math.pow(predictions.get(i) - actuals.get(i), 2);
                yield Math.sqrt(sum / n);
            }
            case MAE -> {
                double sum = 0.0;
                for (int i : indices) sum += Math.abs(predictions.get(i) - actuals.get(i));
                yield sum / n;
            }
            case R2 -> {
                SummaryStatistics observed = new SummaryStatistics();
                double ssRes = 0.0;
                for (int i : indices) {
                    observed.addValue(actuals.get(i));
                    ssRes += Math.pow(actuals.get(i) - predictions.get(i), 2);
                }
                // Somme des carrés totale = variance de population * n
                double ssTot = observed.getPopulationVariance() * n;
                yield ssTot == 0.0 ? Double.NaN : 1.0 - ssRes / ssTot;
            }
        };
    }

    /** Rang floor(n * q), borné au dernier élément. */
    private static int rank(int size, double quantile) {
        return Math.min((int) Math.floor(size * quantile), size - 1);
    }

    private static void requirePairs(List<Double> predictions, List<Double> actuals, int minimum) {
        if (predictions == null || actuals == null) {
            throw new IllegalArgumentException("Prédictions et valeurs observées sont requises");
        }
        if (predictions.size() != actuals.size()) {
            throw new IllegalArgumentException("Tailles différentes : " + predictions.size() + " prédiction(s) pour "
                    + actuals.size() + " valeur(s) observée(s)");
        }
        if (predictions.stream().anyMatch(Objects::isNull) || actuals.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Les prédictions et valeurs observées ne peuvent pas être nulles");
        }
        if (predictions.size() < minimum) {
            throw new InsufficientDataException("Pas assez de prédictions", minimum, predictions.size());
        }
    }
}
