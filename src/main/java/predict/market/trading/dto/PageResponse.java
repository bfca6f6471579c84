package predict.market.trading.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a listing
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Paginated result")
public class PageResponse<T> {

    private List<T> items;

    @Schema(description = "1-based page number", example = "1")
    private Integer page;

    @Schema(description = "Page size", example = "20")
    private Integer limit;

    @Schema(description = "Total matching items", example = "42")
    private Long total;

    @Schema(description = "Total pages", example = "3")
    private Integer totalPages;

    public static <T> PageResponse<T> of(List<T> items, int page, int limit, long total) {
        return PageResponse.<T>builder()
                .items(items)
                .page(page)
                .limit(limit)
                .total(total)
                .totalPages((int) ((total + limit - 1) / limit))
                .build();
    }

    public <R> PageResponse<R> map(Function<T, R> mapper) {
        return PageResponse.of(items.stream().map(mapper).toList(), page, limit, total);
    }
}
