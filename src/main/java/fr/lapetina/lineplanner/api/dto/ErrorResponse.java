package fr.lapetina.lineplanner.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.lineplanner.domain.model.LayoutErrorType;

/**
 * Error body returned by every endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        @JsonProperty("error_type") String errorType
) {
    public static ErrorResponse of(String message) {
        return new ErrorResponse(message, null);
    }

    public static ErrorResponse of(LayoutErrorType type, String message) {
        return new ErrorResponse(message, type.name());
    }
}
