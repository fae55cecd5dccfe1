package sp.sistemaspalacios.api_checkpoint.service.attendance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_checkpoint.dto.attendance.FaceScanRequest;
import sp.sistemaspalacios.api_checkpoint.dto.attendance.LedgerOutcome;
import sp.sistemaspalacios.api_checkpoint.dto.attendance.ScanResponse;
import sp.sistemaspalacios.api_checkpoint.dto.face.IdentityMatch;
import sp.sistemaspalacios.api_checkpoint.dto.geo.GeoPoint;
import sp.sistemaspalacios.api_checkpoint.dto.geo.GeofenceCheck;
import sp.sistemaspalacios.api_checkpoint.dto.policy.EffectivePolicy;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceAction;
import sp.sistemaspalacios.api_checkpoint.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.api_checkpoint.entity.member.Member;
import sp.sistemaspalacios.api_checkpoint.service.common.TimeService;
import sp.sistemaspalacios.api_checkpoint.service.face.IdentityMatcherService;
import sp.sistemaspalacios.api_checkpoint.service.geo.GeofenceService;
import sp.sistemaspalacios.api_checkpoint.service.geo.StoredCoordinates;
import sp.sistemaspalacios.api_checkpoint.service.policy.LocationPolicyResolver;
import sp.sistemaspalacios.api_checkpoint.validator.scan.ImageUrlValidator;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Motor de decisión de asistencia por escaneo facial:
 * coincidencia → geocerca → acción (entrada/salida) → estado → ledger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceScanService {

    private final IdentityMatcherService identityMatcher;
    private final LocationPolicyResolver policyResolver;
    private final GeofenceService geofenceService;
    private final AttendanceLedgerService ledger;
    private final AttendanceStatusClassifier statusClassifier;
    private final MemberDayLocks memberDayLocks;
    private final TimeService timeService;

    @Value("${attendance.image.allowed-hosts:i.ibb.co,ibb.co}")
    private List<String> allowedImageHosts;

    public ScanResponse scan(FaceScanRequest request, String clientAddress) {
        ImageUrlValidator.validateImageUrl(request.getCapturedImageUrl(), allowedImageHosts);
        GeoPoint position = request.getUserLocation().toGeoPoint();

        log.info("🔍 Escaneo facial desde {} - imagen: {}", clientAddress, request.getCapturedImageUrl());

        // 1. Coincidencia
        Optional<IdentityMatch> match = identityMatcher.match(
                request.getCapturedImageUrl(), identityMatcher.candidatePool());
        if (match.isEmpty()) {
            log.info("Sin coincidencia para el escaneo desde {}", clientAddress);
            return ScanResponse.userNotFound();
        }

        Member member = match.get().member();
        double confidence = match.get().confidence();
        EffectivePolicy policy = policyResolver.resolveEffectivePolicy(member);
        LocalDateTime now = timeService.now();

        // 2. Geocerca
        if (policy.hasGeofence()) {
            GeofenceCheck check = geofenceService.check(position, policy.center(), policy.radiusMeters());
            log.info("📍 Miembro {} - GPS lat={}, lon={} | centro {} {} lat={}, lon={} | distancia {} m, radio {} m",
                    member.getId(), position.latitude(), position.longitude(),
                    policy.source(), policy.sourceId(), policy.center().latitude(), policy.center().longitude(),
                    Math.round(check.getDistanceMeters()), check.getRadiusMeters());

            if (!check.isWithin()) {
                AttendanceAction attempted = ledger.nextAction(member.getId(), now.toLocalDate());
                log.warn("⚠️ Ubicación rechazada - Miembro: {}, intento de {}, {} m > {} m",
                        member.getId(), attempted.getValue(),
                        Math.round(check.getDistanceMeters()), check.getRadiusMeters());
                return ScanResponse.locationMismatch(member, confidence, attempted);
            }
        } else {
            log.warn("⚠️ Miembro {} sin ubicación configurada ({}), se omite la geocerca",
                    member.getId(), policy.source());
        }

        // 3-5. Acción, estado y escritura atómica
        LedgerOutcome outcome = recordScan(member, policy, now, StoredCoordinates.format(position));

        log.info("✅ Marcación completada - Miembro: {}, Acción: {}, Estado: {}, Similitud: {}",
                member.getId(), outcome.action().getValue(), outcome.status().getValue(), confidence);

        return ScanResponse.recorded(member, confidence, outcome.action(), outcome.status());
    }

    private LedgerOutcome recordScan(Member member, EffectivePolicy policy, LocalDateTime now, String location) {
        try {
            return memberDayLocks.withLock(member.getId(), now.toLocalDate(),
                    () -> ledger.applyScan(member, now, location, action -> classify(policy, now, action)));
        } catch (DataIntegrityViolationException e) {
            // Otro nodo creó la fila del día entre la lectura y la inserción
            log.warn("⚠️ Fila del día creada en paralelo para miembro {}, reintentando", member.getId());
            return memberDayLocks.withLock(member.getId(), now.toLocalDate(),
                    () -> ledger.applyScan(member, now, location, action -> classify(policy, now, action)));
        }
    }

    private AttendanceStatus classify(EffectivePolicy policy, LocalDateTime now, AttendanceAction action) {
        LocalTime boundary = action == AttendanceAction.CHECK_IN ? policy.startTime() : policy.endTime();
        AttendanceStatus status = statusClassifier.classify(now.toLocalTime(), boundary, action);
        log.debug("Clasificación {} a las {} contra límite {} -> {}",
                action.getValue(), timeService.format(now.toLocalTime()), timeService.format(boundary), status);
        return status;
    }
}
