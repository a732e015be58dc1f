package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Card;
import com.payment.wire.domain.Customer;
import com.payment.wire.domain.PaginatedList;
import com.payment.wire.domain.Reference;
import com.payment.wire.error.DecodeException;

/**
 * A customer fetched on its own may carry an embedded {@code default_source} card
 * ({@link #EXPANDABLE_SOURCE}); a customer embedded in a card carries the default source as an id
 * only ({@link #SOURCE_ID}). Cards in {@code sources}/{@code cards} always reference the customer by id.
 */
public final class CustomerCodec implements Decoder<Customer>, Encoder<Customer> {

    public static final CustomerCodec EXPANDABLE_SOURCE = new CustomerCodec(true);
    public static final CustomerCodec SOURCE_ID = new CustomerCodec(false);

    private final boolean expandSource;

    private CustomerCodec(boolean expandSource) {
        this.expandSource = expandSource;
    }

    private ReferenceCodec<Card> sourceCodec() {
        if (expandSource) {
            return ReferenceCodec.expandable(CardCodec.OWNER_ID, CardCodec.OWNER_ID, Card::getId);
        }
        return ReferenceCodec.idOnly();
    }

    private static ListCodec<Card> cardList() {
        return new ListCodec<>(CardCodec.OWNER_ID, CardCodec.OWNER_ID);
    }

    @Override
    public Customer decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.tagged(node, ctx, Customer.OBJECT);
        Reference<Card> defaultSource = r.optional("default_source", sourceCodec());
        PaginatedList<Card> sources = r.optional("sources", cardList());
        PaginatedList<Card> cards = r.optional("cards", cardList());
        if (ctx.getOptions().isStrictExclusivity() && sources != null && cards != null) {
            throw DecodeException.validationFailed(ctx.field("cards").getPath(),
                    "sources and cards must not both be present");
        }
        return Customer.builder()
                .id(r.string("id"))
                .created(r.timestamp("created"))
                .livemode(r.bool("livemode", false))
                .balance(r.longValue("account_balance", 0))
                .currency(r.nullable("currency", ScalarCodecs.STRING))
                .defaultSource(defaultSource)
                .delinquent(r.bool("delinquent", false))
                .description(r.optString("description"))
                .email(r.optString("email"))
                .discount(r.optional("discount", DiscountCodec.INSTANCE))
                .sources(sources)
                .cards(cards)
                .subscriptions(r.optional("subscriptions", SubscriptionCodec.LIST))
                .metadata(r.metadata())
                .build();
    }

    @Override
    public JsonNode encode(Customer customer, EncodeStyle style) {
        return WireObject.tagged(Customer.OBJECT, style)
                .put("id", customer.getId())
                .put("created", customer.getCreated())
                .put("livemode", customer.isLivemode())
                .put("account_balance", customer.getBalance())
                .put("currency", customer.getCurrency(), ScalarCodecs.STRING_ENCODER)
                .put("default_source", customer.getDefaultSource(), sourceCodec())
                .put("delinquent", customer.isDelinquent())
                .put("description", customer.getDescription())
                .put("email", customer.getEmail())
                .put("discount", customer.getDiscount(), DiscountCodec.INSTANCE)
                .put("sources", customer.getSources(), cardList())
                .put("cards", customer.getCards(), cardList())
                .put("subscriptions", customer.getSubscriptions(), SubscriptionCodec.LIST)
                .putMetadata(customer.getMetadata())
                .build();
    }
}
