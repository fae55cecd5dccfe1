package sp.sistemaspalacios.api_checkpoint.entity.boundaries.generalConfiguration;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Parámetro de negocio ajustable en caliente. Si no hay fila para un tipo se usa el
 * valor de application.properties.
 */
@Entity
@Table(name = "general_configurations")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneralConfiguration {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, unique = true)
    private GeneralConfigurationType type;

    @Column(name = "config_value", nullable = false)
    private String value;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @PrePersist
    public void prePersist() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    public void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
