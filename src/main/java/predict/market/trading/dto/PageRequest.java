package predict.market.trading.dto;

import predict.market.trading.exception.InvalidRequestException;

/**
 * Validated page/limit pair
 *
 * @param page 1-based page number
 * @param limit page size
 */
public record PageRequest(int page, int limit) {

    public static PageRequest of(Integer page, Integer limit, int maxLimit) {
        int p = page == null ? 1 : page;
        int l = limit == null ? Math.min(20, maxLimit) : limit;
        if (p < 1) {
            throw new InvalidRequestException("page must be >= 1");
        }
        if (l < 1 || l > maxLimit) {
            throw new InvalidRequestException("limit must be between 1 and " + maxLimit);
        }
        return new PageRequest(p, l);
    }

    public int offset() {
        return (page - 1) * limit;
    }
}
