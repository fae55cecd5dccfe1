package sp.sistemaspalacios.api_checkpoint.entity.attendance;

import jakarta.persistence.*;
import lombok.Data;
import sp.sistemaspalacios.api_checkpoint.entity.member.Member;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Fila viva del ledger: una por miembro y día calendario de la organización.
 * Las horas se guardan como hora de pared en la zona de la organización.
 */
@Entity
@Table(name = "attendance_records",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_attendance_member_day",
                columnNames = {"member_id", "attendance_date"}))
@Data
public class AttendanceRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "member_id", nullable = false)
    private Member member;

    @Column(name = "attendance_date", nullable = false, updatable = false)
    private LocalDate attendanceDate;

    @Column(name = "check_in_time")
    private LocalDateTime checkInTime;

    @Column(name = "check_out_time")
    private LocalDateTime checkOutTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AttendanceStatus status;

    // "longitud,latitud" de la última marcación de entrada
    private String location;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Las marcas de tiempo las fija quien crea la fila con el reloj de la organización;
     * aquí no se toma la hora del servidor.
     */
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            throw new IllegalStateException("createdAt es obligatorio al crear un registro de asistencia");
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public boolean hasCheckIn() {
        return checkInTime != null;
    }
}
