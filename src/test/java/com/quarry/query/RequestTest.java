package com.quarry.query;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RequestTest {

    private static Request sample() {
        Map<String, Object> project = new LinkedHashMap<>();
        project.put(Request.PROJECT, new ArrayList<>(List.of(1L, 2L)));
        Map<String, Map<String, Object>> extensions = new LinkedHashMap<>();
        extensions.put(Request.PROJECT, project);
        return new Request(new Query(), extensions, RequestSettings.defaults());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCopyIsDeep() {
        Request original = sample();
        Request copy = original.copy();

        ((List<Object>) copy.getExtension(Request.PROJECT).get(Request.PROJECT)).add(3L);
        copy.getQuery().setLimit(5);

        assertThat(original).isEqualTo(sample());
        assertThat(copy.getSettings()).isSameAs(original.getSettings());
    }

    @Test
    void testUpdateExtensionOnlyWhenNamespaceExists() {
        Request request = sample();

        request.updateExtension(Request.TIMESERIES, Request.FROM_DATE, "2020-01-01T00:00:00");
        request.updateExtension(Request.PROJECT, Request.PROJECT, List.of(9L));

        assertThat(request.hasExtension(Request.TIMESERIES)).isFalse();
        assertThat(request.getExtension(Request.PROJECT).get(Request.PROJECT)).isEqualTo(List.of(9L));
    }

    @Test
    void testConstructorCopiesCallerMaps() {
        Map<String, Object> project = new LinkedHashMap<>();
        project.put(Request.PROJECT, 1L);
        Map<String, Map<String, Object>> extensions = new LinkedHashMap<>();
        extensions.put(Request.PROJECT, project);

        Request request = new Request(new Query(), extensions, null);
        project.put(Request.PROJECT, 2L);

        assertThat(request.getExtension(Request.PROJECT).get(Request.PROJECT)).isEqualTo(1L);
        assertThat(request.getSettings()).isSameAs(RequestSettings.defaults());
    }
}
