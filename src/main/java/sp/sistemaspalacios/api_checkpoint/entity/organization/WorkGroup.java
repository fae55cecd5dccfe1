package sp.sistemaspalacios.api_checkpoint.entity.organization;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalTime;

/**
 * Grupo dentro de un departamento. Cuando tiene ubicación propia su política
 * reemplaza por completo a la del departamento.
 */
@Entity
@Table(name = "work_groups")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String description;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "department_id")
    private Department department;

    // "longitud,latitud", ver StoredCoordinates
    private String location;

    @Column(name = "geofence_radius")
    private Integer geofenceRadius;

    @Column(name = "start_time")
    private LocalTime startTime;

    @Column(name = "end_time")
    private LocalTime endTime;
}
