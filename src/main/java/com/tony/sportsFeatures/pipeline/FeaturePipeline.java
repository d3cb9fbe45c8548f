package com.tony.sportsFeatures.pipeline;

import com.tony.sportsFeatures.exception.UnknownColumnException;
import com.tony.sportsFeatures.model.RowTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Suite ordonnée d'étapes. La configuration est vérifiée en entier avant de toucher une seule ligne.
 */
@Slf4j
public class FeaturePipeline {

    private final List<FeatureStep> steps = new ArrayList<>();

    public FeaturePipeline add(FeatureStep step) {
        steps.add(step);
        return this;
    }

    public List<FeatureStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    /**
     * Parcourt les étapes dans l'ordre en suivant les colonnes disponibles.
     *
     * @throws UnknownColumnException à la première colonne requise absente (nom de l'étape dans le message)
     */
    public void validate(Collection<String> inputColumns) {
        Set<String> available = new LinkedHashSet<>(inputColumns);
        for (FeatureStep step : steps) {
            for (String column : step.requiredColumns()) {
                if (!available.contains(column)) {
                    throw new UnknownColumnException(column, "étape " + step.name());
                }
            }
            available.addAll(step.producedColumns());
        }
    }

    public RowTable run(RowTable table) {
        if (!table.isEmpty()) {
            validate(table.getColumns());
        }
        log.info("🚀 Lancement du pipeline : {} étape(s) sur {} ligne(s)", steps.size(), table.size());

        RowTable current = table;
        for (FeatureStep step : steps) {
            log.debug("▶️ Étape {}", step.name());
            current = step.apply(current);
        }

        log.info("✅ Pipeline terminé : {} colonne(s)", current.getColumns().size());
        return current;
    }
}
