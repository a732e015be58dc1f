package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.PaginatedList;

/**
 * {@code {"object": "list", "data": [...], "has_more": ..., "url": ..., "total_count": ...}} over any
 * element codec. A single bad element fails the whole page; there is no partial result.
 */
public final class ListCodec<T> implements Decoder<PaginatedList<T>>, Encoder<PaginatedList<T>> {

    private final Decoder<T> elementDecoder;
    private final Encoder<T> elementEncoder;

    public ListCodec(Decoder<T> elementDecoder, Encoder<T> elementEncoder) {
        this.elementDecoder = elementDecoder;
        this.elementEncoder = elementEncoder;
    }

    @Override
    public PaginatedList<T> decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.tagged(node, ctx, PaginatedList.OBJECT);
        return PaginatedList.<T>builder()
                .data(r.required("data", (data, dataCtx) -> FieldReader.decodeArray(data, dataCtx, elementDecoder)))
                .hasMore(r.bool("has_more"))
                .url(r.string("url"))
                .totalCount(r.optNonNegInt("total_count"))
                .build();
    }

    @Override
    public JsonNode encode(PaginatedList<T> value, EncodeStyle style) {
        return WireObject.tagged(PaginatedList.OBJECT, style)
                .putList("data", value.getData(), elementEncoder)
                .put("has_more", value.isHasMore())
                .put("url", value.getUrl())
                .put("total_count", value.getTotalCount())
                .build();
    }
}
