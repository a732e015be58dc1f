package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.DeletedObject;

public final class DeletedObjectCodec implements Decoder<DeletedObject>, Encoder<DeletedObject> {

    public static final DeletedObjectCodec INSTANCE = new DeletedObjectCodec();

    private DeletedObjectCodec() {}

    @Override
    public DeletedObject decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.of(node, ctx);
        return DeletedObject.builder()
                .id(r.string("id"))
                .deleted(r.bool("deleted"))
                .objectType(r.optString("object"))
                .build();
    }

    @Override
    public JsonNode encode(DeletedObject deleted, EncodeStyle style) {
        return WireObject.create(style)
                .put("id", deleted.getId())
                .put("deleted", deleted.isDeleted())
                .put("object", deleted.getObjectType())
                .build();
    }
}
