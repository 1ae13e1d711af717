package com.quarry.query.extension;

import com.quarry.query.ComparisonExpression;
import com.quarry.query.Query;
import com.quarry.query.Request;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Applies the {@code project} extension as {@code project_column IN (...)}.
 * Requests without the namespace are left alone.
 */
public class ProjectExtensionProcessor implements ExtensionProcessor {

    private final String projectColumn;

    public ProjectExtensionProcessor(String projectColumn) {
        this.projectColumn = projectColumn;
    }

    @Override
    public void process(Request request) {
        if (!request.hasExtension(Request.PROJECT)) {
            return;
        }
        Map<String, Object> extension = request.getExtension(Request.PROJECT);
        List<Object> projects = toList(extension.get(Request.PROJECT));
        if (projects.isEmpty()) {
            throw new IllegalArgumentException("project extension requires at least one project");
        }
        extension.put(Request.PROJECT, projects);

        Query query = request.getQuery();
        if (query.replaceCondition(projectColumn, ComparisonExpression.IN, projects) == 0) {
            query.addCondition(new ComparisonExpression(projectColumn, ComparisonExpression.IN, projects));
        }
    }

    private static List<Object> toList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection) {
            return new ArrayList<>((Collection<?>) value);
        }
        List<Object> single = new ArrayList<>();
        single.add(value);
        return single;
    }
}
