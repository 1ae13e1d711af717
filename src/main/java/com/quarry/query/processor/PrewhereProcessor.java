package com.quarry.query.processor;

import com.quarry.config.RuntimeConfig;
import com.quarry.query.ComparisonExpression;
import com.quarry.query.Expression;
import com.quarry.query.Query;
import com.quarry.query.RequestSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Moves the most selective top-level conditions into PREWHERE so ClickHouse filters
 * on them before reading the remaining columns.
 *
 * Candidates are ranked by their position in the schema's candidate list. At most
 * {@code max_prewhere_conditions} conditions are moved.
 */
public class PrewhereProcessor implements QueryProcessor {

    private static final Logger log = LoggerFactory.getLogger(PrewhereProcessor.class);

    public static final String MAX_PREWHERE_CONDITIONS = "max_prewhere_conditions";

    private static final Set<String> PREWHERE_OPERATORS =
        Set.of(ComparisonExpression.EQ, ComparisonExpression.IN, ComparisonExpression.LIKE);

    private final List<String> candidates;
    private final RuntimeConfig config;

    public PrewhereProcessor(List<String> candidates, RuntimeConfig config) {
        this.candidates = List.copyOf(candidates);
        this.config = config;
    }

    @Override
    public void processQuery(Query query, RequestSettings settings) {
        int maxConditions = config.getInt(MAX_PREWHERE_CONDITIONS, 1);
        if (maxConditions <= 0 || !query.getPrewhere().isEmpty()) {
            return;
        }

        List<ComparisonExpression> eligible = new ArrayList<>();
        for (Expression condition : query.getConditions()) {
            if (condition instanceof ComparisonExpression) {
                ComparisonExpression comparison = (ComparisonExpression) condition;
                if (candidates.contains(comparison.getField())
                        && PREWHERE_OPERATORS.contains(comparison.getOperator())) {
                    eligible.add(comparison);
                }
            }
        }
        if (eligible.isEmpty()) {
            return;
        }

        // stable sort keeps query order between conditions on the same column
        eligible.sort(Comparator.comparingInt(c -> candidates.indexOf(c.getField())));
        List<ComparisonExpression> moved = eligible.subList(0, Math.min(maxConditions, eligible.size()));

        List<Expression> remaining = new ArrayList<>(query.getConditions());
        remaining.removeAll(moved);
        query.setConditions(remaining);
        query.setPrewhere(moved);
        log.debug("Moved {} to PREWHERE", moved);
    }
}
