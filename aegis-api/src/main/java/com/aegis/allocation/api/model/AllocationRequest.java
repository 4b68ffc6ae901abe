package com.aegis.allocation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Wire form of an allocation request, before the selection has been
 * validated.
 *
 * <p>The selection is kept as a raw map so that malformed payloads reach the
 * boundary parser and are rejected with a field-level message instead of a
 * generic deserialization error.
 *
 * @param requestId      caller correlation id; generated when null
 * @param selection      raw classification flags
 * @param templateFields Fast-Track template values (optional)
 */
public record AllocationRequest(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("selection") Map<String, Object> selection,
    @JsonProperty("template_fields") Map<String, String> templateFields
) {
}
