package com.hostelbooking.inventory.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterFeedRequest(
        @NotBlank(message = "Room ID cannot be blank")
        String roomId,

        @NotBlank(message = "Feed URL cannot be blank")
        @Size(max = 2048)
        String url,

        @Size(max = 40)
        String platform
) {
}
