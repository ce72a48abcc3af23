package envsentinel.compute.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.BatchSize;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Una lectura multivariable: una fila en {@code readings} y un valor por código en
 * {@code reading_values}. Los códigos no reportados simplemente no tienen fila.
 */
@Entity
@Table(name = "readings", indexes = {
        @Index(name = "idx_readings_measured_at", columnList = "measured_at"),
        @Index(name = "idx_readings_sensor_time", columnList = "sensor_id, measured_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36)
    private String id;

    @Column(name = "sensor_id", nullable = false)
    private String sensorId;

    @Column(name = "sensor_type")
    private String sensorType; // "air" o "water"

    @Column(name = "measured_at", nullable = false)
    private Instant timestamp;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "reading_values", joinColumns = @JoinColumn(name = "reading_id"))
    @MapKeyColumn(name = "parameter_code")
    @Column(name = "reading_value")
    @BatchSize(size = 100)
    @Builder.Default
    private Map<String, Double> values = new HashMap<>();

    @PrePersist
    protected void onCreate() {
        if (this.timestamp == null) {
            this.timestamp = Instant.now();
        }
    }
}
