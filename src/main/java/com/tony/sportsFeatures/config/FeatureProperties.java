package com.tony.sportsFeatures.config;

import com.tony.sportsFeatures.service.DerivedFeatureService;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "features")
@Data
public class FeatureProperties {
    // --- Colonnes d'identité / de temps ---
    private String groupColumn = "Team";
    private String dateColumn = "date";
    private String sequenceColumn = "game_number"; // Utilisée si pas de date

    // --- Fenêtres glissantes et lissage ---
    private int windowSize = 5;
    private double ewmaSpan = 10.0;
    private Double ewmaAlpha; // Prioritaire sur le span si renseigné
    private List<Integer> lagPeriods = new ArrayList<>(List.of(1, 3, 5));
    private int defaultRestDays = 3; // Premier match d'une équipe

    // --- Normalisation des scores (PTS / GF / GA) avant le calcul des features ---
    private boolean normalizeScores = false;
    private DerivedFeatureService.NormalizationMethod normalizationMethod = DerivedFeatureService.NormalizationMethod.MIN_MAX;

    // --- Découpage train / test ---
    private int splits = 5;
    private double testFraction = 0.2;
    private String targetColumn = "playoff_status";
    private long randomSeed = 42L;
    private int minRowsForSplit = 100;

    // --- Noms de colonnes du pipeline standard ---
    private Columns columns = new Columns();

    @Data
    public static class Columns {
        private String wins = "W";
        private String losses = "L";
        private String gamesPlayed = "GP";
        private String points = "PTS";
        private String goalsFor = "GF";
        private String goalsAgainst = "GA";
        private String goalDiff = "DIFF";
        private String result = "result";
        private String homeRecord = "HOME"; // Bilan "V-D-N" à domicile
        private String awayRecord = "AWAY";
    }

    /**
     * Alpha effectif de l'EWMA : alpha explicite, sinon dérivé du span (2 / (span + 1)).
     */
    public double effectiveEwmaAlpha() {
        return ewmaAlpha != null ? ewmaAlpha : 2.0 / (ewmaSpan + 1.0);
    }
}
