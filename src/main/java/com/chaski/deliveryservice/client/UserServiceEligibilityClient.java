package com.chaski.deliveryservice.client;

import com.chaski.deliveryservice.config.BiddingProperties;
import com.chaski.deliveryservice.dto.CourierEligibilityDTO;
import com.chaski.deliveryservice.exception.ServiceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

@Slf4j
@Component
@RequiredArgsConstructor
public class UserServiceEligibilityClient implements CourierEligibilityClient {

    static final String SERVICE_NAME = "user-service";

    private final WebClient.Builder webClientBuilder;
    private final BiddingProperties properties;

    @Override
    public boolean isEligibleToBid(Long courierId) {
        CourierEligibilityDTO eligibility;
        try {
            eligibility = webClientBuilder.build()
                    .get()
                    .uri("http://user-service/api/v1/users/{id}/courier-eligibility", courierId)
                    .retrieve()
                    .bodyToMono(CourierEligibilityDTO.class)
                    .block(properties.getEligibilityTimeout());
        } catch (WebClientException | IllegalStateException e) {
            // IllegalStateException is what block() throws on timeout
            throw new ServiceUnavailableException(SERVICE_NAME,
                    "Could not verify courier eligibility for courier " + courierId, e);
        }

        if (eligibility == null) {
            log.warn("Empty eligibility response for courier {}", courierId);
            return false;
        }
        return eligibility.isEligibleToBid();
    }
}
