package com.quarry.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One API call: the query, its side-channel extensions and settings.
 *
 * Extensions are namespaced maps, e.g. {@code timeseries.from_date} or
 * {@code project.project}. A query runner may mutate the request it is given,
 * so anything that must survive a runner call works on {@link #copy()}.
 */
public class Request {

    public static final String TIMESERIES = "timeseries";
    public static final String FROM_DATE = "from_date";
    public static final String TO_DATE = "to_date";
    public static final String PROJECT = "project";

    private final Query query;
    private final Map<String, Map<String, Object>> extensions;
    private final RequestSettings settings;

    public Request(Query query, Map<String, Map<String, Object>> extensions, RequestSettings settings) {
        this.query = Objects.requireNonNull(query, "query");
        this.extensions = copyExtensions(extensions != null ? extensions : Map.of());
        this.settings = settings != null ? settings : RequestSettings.defaults();
    }

    public Request(Query query) {
        this(query, null, null);
    }

    public Query getQuery() {
        return query;
    }

    public Map<String, Map<String, Object>> getExtensions() {
        return extensions;
    }

    public RequestSettings getSettings() {
        return settings;
    }

    public boolean hasExtension(String namespace) {
        return extensions.containsKey(namespace);
    }

    /**
     * Mutable view of one extension namespace, created on first use
     */
    public Map<String, Object> getExtension(String namespace) {
        return extensions.computeIfAbsent(namespace, k -> new LinkedHashMap<>());
    }

    /**
     * Set an extension value only when the namespace is in use for this request
     */
    public void updateExtension(String namespace, String key, Object value) {
        Map<String, Object> extension = extensions.get(namespace);
        if (extension != null) {
            extension.put(key, value);
        }
    }

    /**
     * Deep copy: the query, every extension map and any nested list or map values
     */
    public Request copy() {
        return new Request(query.copy(), extensions, settings);
    }

    private static Map<String, Map<String, Object>> copyExtensions(Map<String, Map<String, Object>> source) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : source.entrySet()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (Map.Entry<String, Object> value : entry.getValue().entrySet()) {
                values.put(value.getKey(), copyValue(value.getValue()));
            }
            copy.put(entry.getKey(), values);
        }
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Collection) {
            List<Object> list = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                list.add(copyValue(item));
            }
            return list;
        }
        if (value instanceof Map) {
            Map<Object, Object> map = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                map.put(entry.getKey(), copyValue(entry.getValue()));
            }
            return map;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Request)) {
            return false;
        }
        Request that = (Request) o;
        return query.equals(that.query) && extensions.equals(that.extensions) && settings == that.settings;
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, extensions);
    }

    @Override
    public String toString() {
        return "Request{query=" + query + ", extensions=" + extensions + ", settings=" + settings + "}";
    }
}
