package sp.sistemaspalacios.api_checkpoint.repository.attendance;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AttendanceRecordRepository extends JpaRepository<AttendanceRecord, Long> {

    Optional<AttendanceRecord> findByMemberIdAndAttendanceDate(Long memberId, LocalDate attendanceDate);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM AttendanceRecord r " +
            "WHERE r.member.id = :memberId " +
            "AND r.attendanceDate = :date")
    Optional<AttendanceRecord> findForUpdate(
            @Param("memberId") Long memberId,
            @Param("date") LocalDate date
    );

    /** Lote de filas de días anteriores, en orden estable. */
    List<AttendanceRecord> findByAttendanceDateBeforeOrderByIdAsc(LocalDate date, Pageable pageable);

    /** Filas sin salida y aún no marcadas, tengan o no entrada. */
    @Query("SELECT r FROM AttendanceRecord r " +
            "WHERE r.checkOutTime IS NULL " +
            "AND r.status <> :excluded " +
            "ORDER BY r.id ASC")
    List<AttendanceRecord> findOpenSessions(@Param("excluded") AttendanceStatus excluded);

    /**
     * Marca como sin salida solo si la fila sigue abierta; una salida que llegue en
     * paralelo gana.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AttendanceRecord r " +
            "SET r.status = :status, r.updatedAt = :now " +
            "WHERE r.id = :id " +
            "AND r.checkOutTime IS NULL " +
            "AND r.status <> :status")
    int markIfStillOpen(
            @Param("id") Long id,
            @Param("status") AttendanceStatus status,
            @Param("now") LocalDateTime now
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM AttendanceRecord r WHERE r.id IN :ids")
    int deleteByIdIn(@Param("ids") Collection<Long> ids);
}
