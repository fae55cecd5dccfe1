package sp.sistemaspalacios.api_checkpoint.entity.attendance;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Copia archivada de una fila del ledger. Solo se inserta, nunca se actualiza;
 * {@code attendanceId} es la llave de idempotencia del archivado.
 */
@Entity
@Table(name = "attendance_history",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_history_attendance_id",
                columnNames = "attendance_id"),
        indexes = @Index(name = "idx_history_member_date", columnList = "member_id, attendance_date"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "attendance_id", nullable = false, updatable = false)
    private Long attendanceId;

    @Column(name = "member_id", nullable = false, updatable = false)
    private Long memberId;

    @Column(name = "check_in_time", updatable = false)
    private LocalDateTime checkInTime;

    @Column(name = "check_out_time", updatable = false)
    private LocalDateTime checkOutTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private AttendanceStatus status;

    @Column(updatable = false)
    private String location;

    @Column(name = "attendance_date", nullable = false, updatable = false)
    private LocalDate attendanceDate;

    @Column(name = "archived_at", nullable = false, updatable = false)
    private LocalDateTime archivedAt;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", updatable = false)
    private LocalDateTime updatedAt;

    /**
     * Copia de una fila viva con el estado final con el que se archiva.
     */
    public static AttendanceHistory archiveOf(AttendanceRecord record, AttendanceStatus finalStatus, LocalDateTime archivedAt) {
        return AttendanceHistory.builder()
                .attendanceId(record.getId())
                .memberId(record.getMember().getId())
                .checkInTime(record.getCheckInTime())
                .checkOutTime(record.getCheckOutTime())
                .status(finalStatus)
                .location(record.getLocation())
                .attendanceDate(record.getAttendanceDate())
                .archivedAt(archivedAt)
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .build();
    }
}
