package com.chaski.deliveryservice.event;

import com.chaski.deliveryservice.config.RabbitMQConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Publishes events to the package exchange. Inside a transaction the send is
 * deferred until commit, so a rolled-back transition never produces an event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RabbitPackageEventPublisher implements PackageEventPublisher {

    private final RabbitTemplate rabbitTemplate;

    @Override
    public void publish(PackageEvent event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send(event);
                }
            });
        } else {
            send(event);
        }
    }

    private void send(PackageEvent event) {
        String routingKey = event.getType().getRoutingKey();
        try {
            rabbitTemplate.convertAndSend(RabbitMQConfig.EXCHANGE_NAME, routingKey, event);
            log.debug("Published {} for package {}", routingKey, event.getPackageId());
        } catch (AmqpException e) {
            // The state change is already committed; the dispatcher is best-effort
            log.error("Failed to publish {} for package {}: {}", routingKey, event.getPackageId(), e.getMessage(), e);
        }
    }
}
