package uk.gegc.aegis.features.verification.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import uk.gegc.aegis.features.verification.domain.model.CodeType;

@Schema(name = "IssueCodeRequest")
public record IssueCodeRequest(
        @Schema(description = "Defaults to pos_barcode", example = "pos_barcode")
        CodeType codeType,

        @Schema(description = "Hours until the code expires. Defaults to 72.", example = "72")
        @Min(value = 0, message = "expiresInHours must not be negative")
        @Max(value = 720, message = "expiresInHours must be at most 720")
        Integer expiresInHours
) {
    public IssueCodeRequest {
        if (codeType == null) {
            codeType = CodeType.POS_BARCODE;
        }
    }
}
