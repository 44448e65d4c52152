package com.storefront.scraper.dto;

import com.storefront.scraper.enums.JobPriority;
import jakarta.validation.constraints.NotNull;

public record PriorityUpdateRequest(@NotNull(message = "priority is required") JobPriority priority) {
}
