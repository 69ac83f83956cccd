package uk.gegc.aegis.features.screening.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aegis.features.screening.domain.model.ScreeningPath;

@Schema(name = "StartSessionRequest", description = "Options for a new screening session")
public record StartSessionRequest(
        @Schema(description = "How answers will be provided. Defaults to MANUAL.", example = "MANUAL")
        ScreeningPath path
) {
    public StartSessionRequest {
        if (path == null) {
            path = ScreeningPath.MANUAL;
        }
    }
}
