// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import sh.sift.core.error.FilterConfigurationException;

/**
 * JSON codec for {@link FilterRequest}.
 *
 * <pre>{@code
 * FilterRequest request = FilterRequestJson.parse(body);
 * BlockTransform transform = request.toTransform(store, IndexConfig.defaults());
 * }</pre>
 */
public final class FilterRequestJson {
    private static final ObjectMapper MAPPER = createMapper();

    private FilterRequestJson() {}

    /**
     * @param json request document
     * @return the parsed request
     * @throws FilterConfigurationException if the document is not valid JSON or has the wrong shape
     */
    public static FilterRequest parse(String json) {
        if (json == null || json.isBlank()) {
            throw new FilterConfigurationException("Empty filter request");
        }
        try {
            return MAPPER.readValue(json, FilterRequest.class);
        } catch (JsonProcessingException e) {
            throw new FilterConfigurationException("Invalid filter request JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static String toJson(FilterRequest request) {
        try {
            return MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("FilterRequest serialization failed", e);
        }
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
