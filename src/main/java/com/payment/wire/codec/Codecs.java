package com.payment.wire.codec;

import com.payment.wire.domain.ApiError;
import com.payment.wire.domain.Card;
import com.payment.wire.domain.Charge;
import com.payment.wire.domain.Coupon;
import com.payment.wire.domain.Customer;
import com.payment.wire.domain.DeletedObject;
import com.payment.wire.domain.Discount;
import com.payment.wire.domain.Event;
import com.payment.wire.domain.EventProbe;
import com.payment.wire.domain.Invoice;
import com.payment.wire.domain.InvoiceItem;
import com.payment.wire.domain.InvoiceLineItem;
import com.payment.wire.domain.PaginatedList;
import com.payment.wire.domain.Period;
import com.payment.wire.domain.Plan;
import com.payment.wire.domain.Refund;
import com.payment.wire.domain.Subscription;
import com.payment.wire.scalar.Metadata;
import com.payment.wire.scalar.NonNegInt;
import com.payment.wire.scalar.PosInt;

/**
 * Entry points: one {@link Codec} per entity the API returns or accepts.
 * <pre>{@code
 * Customer customer = Codecs.customer().decode(json);
 * JsonNode body = Codecs.customer().encodeRequest(customer);
 * PaginatedList<Charge> page = Codecs.list(Codecs.charge()).decode(json);
 * }</pre>
 * Error paths start at the codec's root name, e.g. {@code customer.sources.data[2].exp_year}.
 */
public final class Codecs {

    private static final Codec<Customer> CUSTOMER =
            Codec.of(Customer.OBJECT, CustomerCodec.EXPANDABLE_SOURCE, CustomerCodec.EXPANDABLE_SOURCE);
    private static final Codec<Card> CARD =
            Codec.of(Card.OBJECT, CardCodec.EXPANDABLE_OWNER, CardCodec.EXPANDABLE_OWNER);
    private static final Codec<Charge> CHARGE = Codec.of(Charge.OBJECT, ChargeCodec.INSTANCE, ChargeCodec.INSTANCE);
    private static final Codec<Refund> REFUND = Codec.of(Refund.OBJECT, RefundCodec.INSTANCE, RefundCodec.INSTANCE);
    private static final Codec<Invoice> INVOICE = Codec.of(Invoice.OBJECT, InvoiceCodec.INSTANCE, InvoiceCodec.INSTANCE);
    private static final Codec<InvoiceLineItem> INVOICE_LINE_ITEM =
            Codec.of(InvoiceLineItem.OBJECT, InvoiceLineItemCodec.INSTANCE, InvoiceLineItemCodec.INSTANCE);
    private static final Codec<InvoiceItem> INVOICE_ITEM =
            Codec.of(InvoiceItem.OBJECT, InvoiceItemCodec.INSTANCE, InvoiceItemCodec.INSTANCE);
    private static final Codec<Coupon> COUPON = Codec.of(Coupon.OBJECT, CouponCodec.INSTANCE, CouponCodec.INSTANCE);
    private static final Codec<Subscription> SUBSCRIPTION =
            Codec.of(Subscription.OBJECT, SubscriptionCodec.INSTANCE, SubscriptionCodec.INSTANCE);
    private static final Codec<Plan> PLAN = Codec.of(Plan.OBJECT, PlanCodec.INSTANCE, PlanCodec.INSTANCE);
    private static final Codec<Discount> DISCOUNT =
            Codec.of(Discount.OBJECT, DiscountCodec.INSTANCE, DiscountCodec.INSTANCE);
    private static final Codec<Period> PERIOD = Codec.of("period", PeriodCodec.INSTANCE, PeriodCodec.INSTANCE);
    private static final Codec<DeletedObject> DELETED_OBJECT =
            Codec.of("deleted", DeletedObjectCodec.INSTANCE, DeletedObjectCodec.INSTANCE);
    private static final Codec<EventProbe> EVENT_PROBE =
            Codec.of(Event.OBJECT, EventProbeCodec.INSTANCE, EventProbeCodec.INSTANCE);
    private static final Codec<ApiError> API_ERROR =
            Codec.withoutUpstreamDetection("error", ApiErrorCodec.INSTANCE, ApiErrorCodec.INSTANCE);

    private static final Codec<PosInt> POS_INT =
            Codec.withoutUpstreamDetection("value", ScalarCodecs.POS_INT, ScalarCodecs.POS_INT_ENCODER);
    private static final Codec<NonNegInt> NON_NEG_INT =
            Codec.withoutUpstreamDetection("value", ScalarCodecs.NON_NEG_INT, ScalarCodecs.NON_NEG_INT_ENCODER);
    private static final Codec<Metadata> METADATA =
            Codec.withoutUpstreamDetection("metadata", ScalarCodecs.METADATA, ScalarCodecs.METADATA_ENCODER);

    private Codecs() {}

    /** Customer whose {@code default_source} may be an id or an embedded card. */
    public static Codec<Customer> customer() {
        return CUSTOMER;
    }

    /** Card whose {@code customer} may be an id or an embedded customer. */
    public static Codec<Card> card() {
        return CARD;
    }

    public static Codec<Charge> charge() {
        return CHARGE;
    }

    public static Codec<Refund> refund() {
        return REFUND;
    }

    public static Codec<Invoice> invoice() {
        return INVOICE;
    }

    public static Codec<InvoiceLineItem> invoiceLineItem() {
        return INVOICE_LINE_ITEM;
    }

    public static Codec<InvoiceItem> invoiceItem() {
        return INVOICE_ITEM;
    }

    public static Codec<Coupon> coupon() {
        return COUPON;
    }

    public static Codec<Subscription> subscription() {
        return SUBSCRIPTION;
    }

    public static Codec<Plan> plan() {
        return PLAN;
    }

    public static Codec<Discount> discount() {
        return DISCOUNT;
    }

    public static Codec<Period> period() {
        return PERIOD;
    }

    public static Codec<DeletedObject> deletedObject() {
        return DELETED_OBJECT;
    }

    /** Decodes {@code {"error": {...}}} as a value rather than raising it. */
    public static Codec<ApiError> apiError() {
        return API_ERROR;
    }

    /** Type-only pre-decode of an event. */
    public static Codec<EventProbe> eventProbe() {
        return EVENT_PROBE;
    }

    public static <T> Codec<PaginatedList<T>> list(Codec<T> element) {
        ListCodec<T> codec = new ListCodec<>(element, element);
        return Codec.of(PaginatedList.OBJECT, codec, codec);
    }

    public static <T> Codec<Event<T>> event(Codec<T> payload) {
        EventCodec<T> codec = new EventCodec<>(payload, payload);
        return Codec.of(Event.OBJECT, codec, codec);
    }

    public static Codec<PosInt> posInt() {
        return POS_INT;
    }

    public static Codec<NonNegInt> nonNegInt() {
        return NON_NEG_INT;
    }

    public static Codec<Metadata> metadata() {
        return METADATA;
    }
}
