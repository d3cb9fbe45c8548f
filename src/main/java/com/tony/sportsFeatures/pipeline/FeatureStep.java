package com.tony.sportsFeatures.pipeline;

import com.tony.sportsFeatures.model.RowTable;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Une étape du pipeline : colonnes lues, colonnes produites, transformation.
 */
public interface FeatureStep {

    String name();

    List<String> requiredColumns();

    List<String> producedColumns();

    RowTable apply(RowTable table);

    static FeatureStep of(String name, List<String> required, List<String> produced, UnaryOperator<RowTable> transform) {
        return new FeatureStep() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<String> requiredColumns() {
                return List.copyOf(required);
            }

            @Override
            public List<String> producedColumns() {
                return List.copyOf(produced);
            }

            @Override
            public RowTable apply(RowTable table) {
                return transform.apply(table);
            }

            @Override
            public String toString() {
                return "FeatureStep[" + name + "]";
            }
        };
    }
}
