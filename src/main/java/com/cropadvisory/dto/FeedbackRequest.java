package com.cropadvisory.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class FeedbackRequest {

    String recommendationId;

    String farmerId;

    /** Optional; resolved from the referenced recommendation when absent. */
    String location;

    /** Optional; resolved from the referenced recommendation when absent. */
    String season;

    @NotBlank(message = "cropChosen is required")
    String cropChosen;

    @DecimalMin(value = "0.0", message = "yieldAchieved must be >= 0")
    double yieldAchieved;

    double profitRealized;

    @Min(value = 1, message = "satisfactionRating must be between 1 and 5")
    @Max(value = 5, message = "satisfactionRating must be between 1 and 5")
    Integer satisfactionRating;

    boolean success;

    @Size(max = 2000, message = "comments must be at most 2000 characters")
    String comments;
}
