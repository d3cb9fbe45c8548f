package com.tony.sportsFeatures.pipeline;

import com.tony.sportsFeatures.model.Fold;
import com.tony.sportsFeatures.model.RowTable;
import com.tony.sportsFeatures.model.StratifiedSplit;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PipelineResult {
    RowTable table;
    List<String> steps;
    @Builder.Default
    List<Fold> folds = List.of(); // Vide si la table est trop petite ou sans date
    StratifiedSplit stratifiedSplit; // null sauf découpage stratifié
}
