package io.github.chirino.tracker.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * JSON error body.
 *
 * @param error human readable summary
 * @param code stable machine readable code, e.g. {@code not_found}
 * @param details optional context such as the sender id
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String code, Map<String, Object> details) {}
