package predict.market.trading.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for every REST response, success or error.
 * {@code code} repeats the HTTP status so clients reading only the body still see it.
 * @param <T> payload type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {

    private Integer code;

    private String message;

    private T data;

    @Builder.Default
    private Long timestamp = System.currentTimeMillis();

    public static <T> ApiResponse<T> success(T data) {
        return success("Success", data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return of(200, message, data);
    }

    /**
     * For endpoints that answer 201
     */
    public static <T> ApiResponse<T> created(String message, T data) {
        return of(201, message, data);
    }

    public static <T> ApiResponse<T> error(Integer code, String message) {
        return of(code, message, null);
    }

    /**
     * Error with details, e.g. the failing field of each validation error
     */
    public static <T> ApiResponse<T> error(Integer code, String message, T details) {
        return of(code, message, details);
    }

    private static <T> ApiResponse<T> of(Integer code, String message, T data) {
        return ApiResponse.<T>builder()
                .code(code)
                .message(message)
                .data(data)
                .build();
    }
}
