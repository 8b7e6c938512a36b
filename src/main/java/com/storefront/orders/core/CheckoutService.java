package com.storefront.orders.core;

import com.storefront.orders.config.ShippingProperties;
import com.storefront.orders.domain.AuthenticatedPrincipal;
import com.storefront.orders.domain.CartLine;
import com.storefront.orders.domain.Checkout;
import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.OrderItem;
import com.storefront.orders.domain.ProductSnapshot;
import com.storefront.orders.domain.ShippingMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Turns a checkout into a priced order draft. Names and unit prices are copied from the catalog
 * here and the totals are computed once; nothing downstream recomputes them.
 */
@Slf4j
@Service
public class CheckoutService {

    private static final int MONEY_SCALE = 2;

    private final ProductCatalog productCatalog;
    private final ShippingProperties shippingProperties;
    private final Clock clock;
    private final String currency;
    private final BigDecimal taxRate;
    private final int maxItemQuantity;

    public CheckoutService(
            ProductCatalog productCatalog,
            ShippingProperties shippingProperties,
            Clock clock,
            @Value("${orders.checkout.currency:GBP}") String currency,
            @Value("${orders.checkout.tax-rate:0}") BigDecimal taxRate,
            @Value("${orders.checkout.max-item-quantity:99}") int maxItemQuantity) {
        this.productCatalog = productCatalog;
        this.shippingProperties = shippingProperties;
        this.clock = clock;
        this.currency = currency;
        this.taxRate = taxRate;
        this.maxItemQuantity = maxItemQuantity;
    }

    public Order price(AuthenticatedPrincipal principal, Checkout checkout) {
        if (checkout.getLines().isEmpty()) {
            throw new IllegalArgumentException("Cart is empty");
        }
        if (checkout.getShippingAddress() == null) {
            throw new IllegalArgumentException("shippingAddress is required");
        }
        if (checkout.getPaymentMethod() == null) {
            throw new IllegalArgumentException("paymentMethod is required");
        }

        List<OrderItem> items = new ArrayList<>();
        BigDecimal subtotal = BigDecimal.ZERO;
        for (Map.Entry<String, Integer> line : mergeLines(checkout.getLines()).entrySet()) {
            ProductSnapshot product = productCatalog.findProduct(line.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown product " + line.getKey()));
            BigDecimal unitPrice = product.getPrice().setScale(MONEY_SCALE, RoundingMode.HALF_UP);
            BigDecimal lineTotal = unitPrice.multiply(BigDecimal.valueOf(line.getValue()));
            items.add(OrderItem.builder()
                    .productId(product.getProductId())
                    .productName(product.getName())
                    .unitPrice(unitPrice)
                    .quantity(line.getValue())
                    .lineTotal(lineTotal)
                    .build());
            subtotal = subtotal.add(lineTotal);
        }

        ShippingProperties.Method method = shippingProperties.findMethod(checkout.getShippingMethodId())
                .orElseThrow(() -> new IllegalArgumentException("Invalid shipping method " + checkout.getShippingMethodId()));
        if (!method.serves(checkout.getShippingAddress().getCountry())) {
            throw new IllegalArgumentException("Shipping method " + method.getId() + " does not deliver to "
                    + checkout.getShippingAddress().getCountry());
        }
        BigDecimal shippingCost = method.costFor(subtotal).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal tax = subtotal.multiply(taxRate).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal total = subtotal.add(shippingCost).add(tax).setScale(MONEY_SCALE, RoundingMode.HALF_UP);

        Order draft = Order.builder()
                .id(UUID.randomUUID().toString())
                .orderNumber(nextOrderNumber())
                .customerId(principal.getId())
                .customerEmail(checkout.getCustomerEmail())
                .items(items)
                .subtotal(subtotal.setScale(MONEY_SCALE, RoundingMode.HALF_UP))
                .shippingCost(shippingCost)
                .tax(tax)
                .totalAmount(total)
                .currency(currency)
                .shippingAddress(checkout.getShippingAddress())
                .billingAddress(checkout.getBillingAddress() != null ? checkout.getBillingAddress() : checkout.getShippingAddress())
                .shippingMethod(ShippingMethod.builder()
                        .id(method.getId())
                        .name(method.getName())
                        .cost(shippingCost)
                        .estimatedDelivery(method.getEstimatedDelivery())
                        .build())
                .paymentMethod(checkout.getPaymentMethod())
                .build();
        log.debug("Order priced: orderNumber={} subtotal={} shipping={} tax={} total={}",
                draft.getOrderNumber(), draft.getSubtotal(), shippingCost, tax, total);
        return draft;
    }

    /** ORD-&lt;last 8 digits of epoch millis&gt;-&lt;3 random digits&gt; */
    String nextOrderNumber() {
        String millis = String.valueOf(clock.millis());
        String tail = millis.length() > 8 ? millis.substring(millis.length() - 8) : millis;
        return "ORD-" + tail + "-" + String.format("%03d", ThreadLocalRandom.current().nextInt(1000));
    }

    private Map<String, Integer> mergeLines(List<CartLine> lines) {
        Map<String, Integer> merged = new LinkedHashMap<>();
        for (CartLine line : lines) {
            if (line.getProductId() == null || line.getProductId().isBlank()) {
                throw new IllegalArgumentException("Cart line without productId");
            }
            merged.merge(line.getProductId(), line.getQuantity(), Integer::sum);
        }
        for (Map.Entry<String, Integer> entry : merged.entrySet()) {
            if (entry.getValue() < 1 || entry.getValue() > maxItemQuantity) {
                throw new IllegalArgumentException("Quantity for product " + entry.getKey()
                        + " must be between 1 and " + maxItemQuantity);
            }
        }
        return merged;
    }
}
