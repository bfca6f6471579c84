package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Future;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Create market request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Create market request")
public class CreateMarketRequest {

    @NotBlank(message = "Title cannot be blank")
    @Size(min = 5, max = 255, message = "Title must be between 5 and 255 characters")
    @Schema(description = "Question being predicted", example = "Will it rain in Paris tomorrow?")
    private String title;

    @NotBlank(message = "Description cannot be blank")
    @Size(min = 10, max = 2000, message = "Description must be between 10 and 2000 characters")
    private String description;

    @NotBlank(message = "Category cannot be blank")
    @Schema(description = "Category", example = "Weather")
    private String category;

    @NotNull(message = "End date cannot be null")
    @Future(message = "End date must be in the future")
    private LocalDateTime endDate;

    @NotNull(message = "Outcomes cannot be null")
    @Size(min = 2, message = "A market needs at least 2 outcomes")
    @Valid
    private List<OutcomeSpec> outcomes;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Outcome definition")
    public static class OutcomeSpec {

        @NotBlank(message = "Outcome title cannot be blank")
        @Schema(description = "Outcome title", example = "Yes")
        private String title;

        private String description;
    }
}
