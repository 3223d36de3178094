package com.frenchtoast.alert.api;

import com.frenchtoast.alert.r2dbc.service.SubscriberRegistrationService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registration callback for the onboarding flow. The caller has already completed the
 * third-party authorization and hands over the resulting webhook url.
 */
@RestController
@RequestMapping(path = "/api/subscribers", produces = MediaType.APPLICATION_JSON_VALUE)
public class SubscriberController {

    private final SubscriberRegistrationService registrations;

    public SubscriberController(SubscriberRegistrationService registrations) {
        this.registrations = registrations;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> register(@Valid @RequestBody SubscriberRegistrationRequest req) {
        return registrations.register(req.teamId().trim(), req.channelId().trim(), req.deliveryUrl().trim())
                .map(r -> {
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("subscriberId", r.subscriber().id());
                    out.put("teamId", r.subscriber().teamId());
                    out.put("channelId", r.subscriber().channelId());
                    out.put("initialDelivery", r.initialDelivery().name());
                    return out;
                });
    }
}
