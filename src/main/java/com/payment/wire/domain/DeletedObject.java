package com.payment.wire.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Reply to a delete call: {@code {"id": ..., "deleted": true}}.
 */
@Value
@Builder(toBuilder = true)
public class DeletedObject {
    @NonNull String id;
    boolean deleted;
    /** Wire name {@code object}; only some API versions send it. */
    String objectType;
}
