package com.storefront.orders.messaging;

import com.storefront.orders.domain.Order;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes order lifecycle events to Kafka. A failed publish is logged and never fails the
 * order change that triggered it: the order row is the source of truth.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderEventProducer {

    private final KafkaTemplate<String, OrderEvent> kafkaTemplate;

    @Value("${orders.kafka.topic.order-events:order-events}")
    private String topic;

    public void publish(String eventType, Order order) {
        publish(eventType, order, null, null);
    }

    public void publish(String eventType, Order order, String reference, String note) {
        OrderEvent event = OrderEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .customerId(order.getCustomerId())
                .status(order.getStatus())
                .paymentStatus(order.getPaymentStatus())
                .paymentMethod(order.getPaymentMethod())
                .totalAmount(order.getTotalAmount())
                .currency(order.getCurrency())
                .reference(reference)
                .note(note)
                .version(order.getVersion())
                .timestamp(order.getUpdatedAt() != null ? order.getUpdatedAt() : Instant.now())
                .build();
        send(order.getId(), event);
    }

    private void send(String key, OrderEvent event) {
        log.info("Publishing order event: key={}, eventId={}, eventType={}, status={}, paymentStatus={}",
                key, event.getEventId(), event.getEventType(), event.getStatus(), event.getPaymentStatus());
        try {
            CompletableFuture<SendResult<String, OrderEvent>> future = kafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish order event key={} eventId={}", key, event.getEventId(), ex);
                } else {
                    log.debug("Published order event: key={}, eventId={}, partition={}, offset={}",
                            key, event.getEventId(),
                            result != null ? result.getRecordMetadata().partition() : null,
                            result != null ? result.getRecordMetadata().offset() : null);
                }
            });
        } catch (Exception e) {
            // send() itself throws when metadata cannot be fetched within max.block.ms
            log.error("Could not hand order event to Kafka key={} eventId={}", key, event.getEventId(), e);
        }
    }
}
