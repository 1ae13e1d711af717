package com.quarry.query.processor;

import com.quarry.query.ComparisonExpression;
import com.quarry.query.Query;
import com.quarry.query.RequestSettings;

import java.util.List;

/**
 * Appends the conditions a table requires on every read, e.g. {@code deleted = 0}.
 * A condition already present is not added twice.
 */
public class MandatoryConditionsProcessor implements QueryProcessor {

    private final List<ComparisonExpression> mandatoryConditions;

    public MandatoryConditionsProcessor(List<ComparisonExpression> mandatoryConditions) {
        this.mandatoryConditions = List.copyOf(mandatoryConditions);
    }

    @Override
    public void processQuery(Query query, RequestSettings settings) {
        for (ComparisonExpression condition : mandatoryConditions) {
            if (!query.getConditions().contains(condition)) {
                query.addCondition(condition);
            }
        }
    }
}
