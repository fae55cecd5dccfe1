package sp.sistemaspalacios.api_checkpoint.dto.attendance;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Data;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
public class AttendanceRecordDTO {
    private Long attendanceId;
    private Long memberId;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate attendanceDate;

    private LocalDateTime checkInTime;
    private LocalDateTime checkOutTime;
    private AttendanceStatus status;
    private String location;

    public static AttendanceRecordDTO from(AttendanceRecord record) {
        return AttendanceRecordDTO.builder()
                .attendanceId(record.getId())
                .memberId(record.getMember().getId())
                .attendanceDate(record.getAttendanceDate())
                .checkInTime(record.getCheckInTime())
                .checkOutTime(record.getCheckOutTime())
                .status(record.getStatus())
                .location(record.getLocation())
                .build();
    }
}
