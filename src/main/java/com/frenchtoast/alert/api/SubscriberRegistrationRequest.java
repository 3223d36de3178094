package com.frenchtoast.alert.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SubscriberRegistrationRequest(
        @NotBlank @Size(max = 32) String teamId,
        @NotBlank @Size(max = 32) String channelId,
        @NotBlank String deliveryUrl
) {}
