package com.tony.sportsFeatures.model.dto;

import com.tony.sportsFeatures.model.RowTable;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class FeatureResponse {
    int rowCount;
    List<String> columns;
    List<Map<String, Object>> rows;
    List<String> steps; // Renseigné par le pipeline uniquement
    List<FoldResponse> folds;
    StratifiedSplitResponse split;

    public static FeatureResponse of(RowTable table) {
        return FeatureResponse.builder()
                .rowCount(table.size())
                .columns(table.getColumns())
                .rows(table.toMaps())
                .build();
    }
}
