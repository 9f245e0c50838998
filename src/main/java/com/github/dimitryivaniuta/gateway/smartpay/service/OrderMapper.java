package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.github.dimitryivaniuta.gateway.smartpay.psp.model.Address;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.CountryCode;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.MerchantOrder;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.Money;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.OrderItem;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.PaymentBrand;
import com.github.dimitryivaniuta.gateway.smartpay.psp.model.PaymentBrandForce;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.DetailItem;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.ShoppingBasket;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Translates store baskets and customer details into a PSP {@link MerchantOrder}.
 */
@Component
public class OrderMapper {

    static final String SHIPPING_PREFIX = "shipping_";

    static final String FIRST_NAME = "firstname";
    static final String LAST_NAME = "lastname";
    static final String STREET = "street";
    static final String ZIP_CODE = "zipcode";
    static final String CITY = "city";
    static final String COUNTRY = "country";
    static final String HOUSE_NUMBER = "housenumber";
    static final String HOUSE_NUMBER_SUFFIX = "housenumber_suffix";

    static final String LINE_TITLE = "title";
    static final String LINE_DESCRIPTION = "description";
    static final String LINE_ITEM_ID = "connecteditemid";
    static final String LINE_QUANTITY = "quantity";
    static final String LINE_PRICE = "price";

    private final BasketPricingService pricingService;

    public OrderMapper(BasketPricingService pricingService) {
        this.pricingService = pricingService;
    }

    /**
     * Builds the order announced at checkout.
     *
     * @param baskets       baskets being paid
     * @param customer      customer details (billing and optional {@code shipping_} fields)
     * @param returnUrl     merchant return URL
     * @param invoiceNumber merchant order id
     * @param paymentMethod store payment method name
     * @return order with brand forcing {@link PaymentBrandForce#FORCE_ALWAYS}
     * @throws MappingException when the country or payment method is not supported, or a line quantity
     *                          or price is not a number
     */
    public MerchantOrder buildOrder(
            List<ShoppingBasket> baskets,
            DetailItem customer,
            String returnUrl,
            String invoiceNumber,
            String paymentMethod
    ) {
        BigDecimal total = BigDecimal.ZERO;
        List<OrderItem> items;
        try {
            for (ShoppingBasket basket : baskets) {
                total = total.add(pricingService.pspPriceInVat(basket));
            }
            items = orderItems(baskets);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new MappingException(MappingErrorKind.INVALID_LINE_VALUE,
                    "Basket line has an invalid quantity or price: " + e.getMessage());
        }

        Address billing = address(customer, "");
        Address shipping = address(customer, SHIPPING_PREFIX);
        PaymentBrand brand = brand(paymentMethod);

        return new MerchantOrder(
                invoiceNumber,
                Money.fromDecimal(total),
                returnUrl,
                billing,
                shipping != null ? shipping : billing,
                items,
                brand,
                PaymentBrandForce.FORCE_ALWAYS,
                OffsetDateTime.now()
        );
    }

    List<OrderItem> orderItems(List<ShoppingBasket> baskets) {
        List<OrderItem> items = new ArrayList<>();
        for (ShoppingBasket basket : baskets) {
            for (DetailItem line : basket.lines()) {
                // coupons carry no title
                String name = line.isBlank(LINE_TITLE) ? line.value(LINE_DESCRIPTION) : line.value(LINE_TITLE);
                items.add(new OrderItem(
                        line.value(LINE_ITEM_ID),
                        name,
                        name,
                        line.intValue(LINE_QUANTITY),
                        Money.fromDecimal(line.decimalValue(LINE_PRICE))
                ));
            }
        }
        return items;
    }

    /**
     * Builds an address from customer details.
     *
     * @param customer customer details
     * @param prefix   field prefix; with a prefix the address is optional
     * @return address, or {@code null} for a prefixed address missing street, zip code, city or country
     */
    Address address(DetailItem customer, String prefix) {
        if (!prefix.isEmpty()
                && (customer.isBlank(prefix + STREET)
                || customer.isBlank(prefix + ZIP_CODE)
                || customer.isBlank(prefix + CITY)
                || customer.isBlank(prefix + COUNTRY))) {
            return null;
        }

        String rawCountry = customer.value(prefix + COUNTRY);
        CountryCode country = CountryCode.parse(rawCountry)
                .orElseThrow(() -> new MappingException(MappingErrorKind.UNSUPPORTED_COUNTRY,
                        "Unknown or unsupported country '" + rawCountry + "'"));

        String houseNumber = null;
        String houseNumberAddition = null;
        if (!customer.isBlank(prefix + HOUSE_NUMBER)) {
            houseNumber = customer.value(prefix + HOUSE_NUMBER);
            if (!customer.isBlank(prefix + HOUSE_NUMBER_SUFFIX)) {
                houseNumberAddition = customer.value(prefix + HOUSE_NUMBER_SUFFIX);
            }
        }

        return new Address(
                customer.value(FIRST_NAME),
                customer.value(LAST_NAME),
                customer.value(prefix + STREET),
                customer.value(prefix + ZIP_CODE),
                customer.value(prefix + CITY),
                country,
                houseNumber,
                houseNumberAddition
        );
    }

    PaymentBrand brand(String paymentMethod) {
        return PaymentBrand.fromExternalName(paymentMethod)
                .orElseThrow(() -> new MappingException(MappingErrorKind.UNSUPPORTED_BRAND,
                        "Unknown or unsupported payment method '" + paymentMethod + "'"));
    }
}
