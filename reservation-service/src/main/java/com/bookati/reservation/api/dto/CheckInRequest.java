package com.bookati.reservation.api.dto;

import jakarta.validation.constraints.NotBlank;

public record CheckInRequest(
        @NotBlank(message = "Ticket token is required")
        String ticketToken
) {
}
