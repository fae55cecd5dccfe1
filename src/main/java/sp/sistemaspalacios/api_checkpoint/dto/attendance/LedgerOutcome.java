package sp.sistemaspalacios.api_checkpoint.dto.attendance;

import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceAction;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceStatus;

/**
 * Resultado de aplicar una marcación al ledger.
 *
 * @param repeatedCheckOut la salida reemplazó a una salida anterior del mismo día
 */
public record LedgerOutcome(
        AttendanceAction action,
        AttendanceStatus status,
        AttendanceRecord record,
        boolean repeatedCheckOut
) {
}
