package com.cropadvisory.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * A reported crop outcome. {@code recommendationId} is a weak reference: it is not
 * a foreign key and may point at a recommendation that was never tracked.
 */
@Entity
@Immutable
@Table(
    name = "feedback_records",
    indexes = {
        @Index(name = "idx_fb_recommendation", columnList = "recommendation_id"),
        @Index(name = "idx_fb_location_crop",  columnList = "location, crop_chosen"),
        @Index(name = "idx_fb_created",        columnList = "created_at"),
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class FeedbackRecord {

    @Id
    @Column(length = 64, updatable = false, nullable = false)
    private String id;

    @Column(name = "recommendation_id", length = 64)
    private String recommendationId;

    @Column(name = "farmer_id", length = 64)
    private String farmerId;

    @Column(nullable = false, length = 100)
    private String location;

    @Column(nullable = false, length = 20)
    private String season;

    @Column(name = "crop_chosen", nullable = false, length = 50)
    private String cropChosen;

    @Column(name = "yield_achieved")
    private double yieldAchieved;

    @Column(name = "profit_realized")
    private double profitRealized;

    @Column(name = "satisfaction_rating")
    private Integer satisfactionRating;

    private boolean success;

    @Column(length = 2000)
    private String comments;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
