package com.payment.wire.domain;

import com.payment.wire.scalar.NonNegInt;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * One page of a list endpoint. {@code data} keeps the server's order.
 *
 * @param <T> element type
 */
@Value
@Builder(toBuilder = true)
public class PaginatedList<T> {

    public static final String OBJECT = "list";

    @NonNull List<T> data;
    boolean hasMore;
    @NonNull String url;
    NonNegInt totalCount;

    public static <T> PaginatedList<T> of(String url, List<T> data) {
        return PaginatedList.<T>builder().url(url).data(List.copyOf(data)).hasMore(false).build();
    }
}
