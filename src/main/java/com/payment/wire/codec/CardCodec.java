package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Card;
import com.payment.wire.domain.Customer;
import com.payment.wire.domain.Reference;

/**
 * Cards come in two shapes. A card fetched on its own may have its {@code customer} expanded
 * ({@link #EXPANDABLE_OWNER}); a card nested in a customer or a charge only ever names its owner by id
 * ({@link #OWNER_ID}), and an object in that position is a TYPE_MISMATCH.
 */
public final class CardCodec implements Decoder<Card>, Encoder<Card> {

    public static final CardCodec EXPANDABLE_OWNER = new CardCodec(true);
    public static final CardCodec OWNER_ID = new CardCodec(false);

    private final boolean expandOwner;

    private CardCodec(boolean expandOwner) {
        this.expandOwner = expandOwner;
    }

    // Resolved per call: CustomerCodec and CardCodec refer to each other.
    private ReferenceCodec<Customer> ownerCodec() {
        if (expandOwner) {
            return ReferenceCodec.expandable(CustomerCodec.SOURCE_ID, CustomerCodec.SOURCE_ID, Customer::getId);
        }
        return ReferenceCodec.idOnly();
    }

    @Override
    public Card decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.tagged(node, ctx, Card.OBJECT);
        Reference<Customer> customer = r.optional("customer", ownerCodec());
        return Card.builder()
                .id(r.string("id"))
                .brand(r.string("brand"))
                .last4(r.string("last4"))
                .expMonth(r.posInt("exp_month"))
                .expYear(r.posInt("exp_year"))
                .fingerprint(r.optString("fingerprint"))
                .funding(r.optString("funding"))
                .country(r.optString("country"))
                .name(r.optString("name"))
                .addressLine1(r.optString("address_line1"))
                .addressLine2(r.optString("address_line2"))
                .addressCity(r.optString("address_city"))
                .addressState(r.optString("address_state"))
                .addressZip(r.optString("address_zip"))
                .addressCountry(r.optString("address_country"))
                .cvcCheck(r.optString("cvc_check"))
                .addressLine1Check(r.optString("address_line1_check"))
                .addressZipCheck(r.optString("address_zip_check"))
                .customer(customer)
                .metadata(r.metadata())
                .build();
    }

    @Override
    public JsonNode encode(Card card, EncodeStyle style) {
        return WireObject.tagged(Card.OBJECT, style)
                .put("id", card.getId())
                .put("brand", card.getBrand())
                .put("last4", card.getLast4())
                .put("exp_month", card.getExpMonth())
                .put("exp_year", card.getExpYear())
                .put("fingerprint", card.getFingerprint())
                .put("funding", card.getFunding())
                .put("country", card.getCountry())
                .put("name", card.getName())
                .put("address_line1", card.getAddressLine1())
                .put("address_line2", card.getAddressLine2())
                .put("address_city", card.getAddressCity())
                .put("address_state", card.getAddressState())
                .put("address_zip", card.getAddressZip())
                .put("address_country", card.getAddressCountry())
                .put("cvc_check", card.getCvcCheck())
                .put("address_line1_check", card.getAddressLine1Check())
                .put("address_zip_check", card.getAddressZipCheck())
                .put("customer", card.getCustomer(), ownerCodec())
                .putMetadata(card.getMetadata())
                .build();
    }
}
