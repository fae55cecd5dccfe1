package sp.sistemaspalacios.api_checkpoint.controller.attendance;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_checkpoint.dto.attendance.AttendanceRecordDTO;
import sp.sistemaspalacios.api_checkpoint.dto.attendance.FaceScanRequest;
import sp.sistemaspalacios.api_checkpoint.dto.attendance.ScanResponse;
import sp.sistemaspalacios.api_checkpoint.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_checkpoint.service.attendance.AttendanceLedgerService;
import sp.sistemaspalacios.api_checkpoint.service.attendance.AttendanceScanService;
import sp.sistemaspalacios.api_checkpoint.service.common.TimeService;

@RestController
@RequestMapping("/api/attendance")
@RequiredArgsConstructor
public class FaceScanController {

    private final AttendanceScanService scanService;
    private final AttendanceLedgerService ledgerService;
    private final TimeService timeService;

    /**
     * Marcación por escaneo facial con validación de ubicación
     * POST /api/attendance/scan
     * <p>
     * Sin coincidencia o fuera de la geocerca también responde 200, con el campo "error".
     */
    @PostMapping("/scan")
    public ResponseEntity<ScanResponse> scan(
            @Valid @RequestBody FaceScanRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(scanService.scan(request, clientAddress(httpRequest)));
    }

    /**
     * Registro del día de un miembro
     * GET /api/attendance/members/{memberId}/today
     */
    @GetMapping("/members/{memberId}/today")
    public ResponseEntity<AttendanceRecordDTO> getToday(@PathVariable Long memberId) {
        return ledgerService.findForDay(memberId, timeService.today())
                .map(AttendanceRecordDTO::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Sin registro de asistencia hoy para el miembro " + memberId));
    }

    private String clientAddress(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr() != null ? request.getRemoteAddr() : "unknown";
    }
}
