package sp.sistemaspalacios.api_checkpoint.repository.attendance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceHistory;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Set;

@Repository
public interface AttendanceHistoryRepository extends JpaRepository<AttendanceHistory, Long> {

    @Query("SELECT h.attendanceId FROM AttendanceHistory h WHERE h.attendanceId IN :ids")
    Set<Long> findArchivedAttendanceIds(@Param("ids") Collection<Long> ids);

    List<AttendanceHistory> findByAttendanceDateOrderByIdAsc(LocalDate attendanceDate);
}
