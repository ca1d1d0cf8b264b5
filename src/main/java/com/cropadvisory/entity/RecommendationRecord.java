package com.cropadvisory.entity;

import com.cropadvisory.dto.WeatherSnapshot;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Immutable
@Table(
    name = "recommendation_records",
    indexes = {
        @Index(name = "idx_rec_location", columnList = "location"),
        @Index(name = "idx_rec_created",  columnList = "created_at"),
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RecommendationRecord {

    @Id
    @Column(length = 64, updatable = false, nullable = false)
    private String id;

    @Column(nullable = false, length = 100)
    private String location;

    private Double latitude;
    private Double longitude;

    @Column(length = 20)
    private String season;

    @Column(name = "soil_type", length = 30)
    private String soilType;

    @Convert(converter = WeatherSnapshotConverter.class)
    @Column(name = "weather_snapshot", length = 8000)
    private WeatherSnapshot weather;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "recommendation_crops", joinColumns = @JoinColumn(name = "recommendation_id"))
    @Column(name = "crop", length = 50)
    @Builder.Default
    private List<String> crops = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
