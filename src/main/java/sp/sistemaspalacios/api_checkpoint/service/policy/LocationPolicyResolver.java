package sp.sistemaspalacios.api_checkpoint.service.policy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_checkpoint.dto.geo.GeoPoint;
import sp.sistemaspalacios.api_checkpoint.dto.policy.EffectivePolicy;
import sp.sistemaspalacios.api_checkpoint.dto.policy.PolicySource;
import sp.sistemaspalacios.api_checkpoint.entity.member.Member;
import sp.sistemaspalacios.api_checkpoint.entity.organization.Department;
import sp.sistemaspalacios.api_checkpoint.entity.organization.WorkGroup;
import sp.sistemaspalacios.api_checkpoint.exception.CorruptPolicyDataException;
import sp.sistemaspalacios.api_checkpoint.service.boundaries.generalConfiguration.GeneralConfigurationService;
import sp.sistemaspalacios.api_checkpoint.service.geo.StoredCoordinates;

import java.time.LocalTime;

/**
 * Precedencia de políticas: la política del grupo, si el grupo tiene ubicación,
 * reemplaza completa a la del departamento (sin mezclar campos). Si el grupo no tiene
 * ubicación se usa la del departamento completa.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocationPolicyResolver {

    private final GeneralConfigurationService configurationService;

    public EffectivePolicy resolveEffectivePolicy(Member member) {
        int defaultRadius = configurationService.getDefaultGeofenceRadius();
        WorkGroup group = member.getGroup();
        Department department = member.getDepartment();

        switch (sourceOf(member)) {
            case GROUP:
                return new EffectivePolicy(
                        PolicySource.GROUP,
                        group.getId(),
                        hasLocation(group.getLocation())
                                ? parseLocation(group.getLocation(), "grupo", group.getId())
                                : null,
                        radiusOrDefault(group.getGeofenceRadius(), defaultRadius),
                        group.getStartTime(),
                        group.getEndTime()
                );
            case DEPARTMENT:
                return new EffectivePolicy(
                        PolicySource.DEPARTMENT,
                        department.getId(),
                        hasLocation(department.getLocation())
                                ? parseLocation(department.getLocation(), "departamento", department.getId())
                                : null,
                        radiusOrDefault(department.getGeofenceRadius(), defaultRadius),
                        department.getStartTime(),
                        department.getEndTime()
                );
            default:
                log.debug("Miembro {} sin grupo ni departamento", member.getId());
                return EffectivePolicy.none(defaultRadius);
        }
    }

    /**
     * Hora de salida de la política vigente, con la misma precedencia pero sin
     * interpretar la ubicación guardada.
     */
    public LocalTime resolveEndTime(Member member) {
        switch (sourceOf(member)) {
            case GROUP:
                return member.getGroup().getEndTime();
            case DEPARTMENT:
                return member.getDepartment().getEndTime();
            default:
                return null;
        }
    }

    private static PolicySource sourceOf(Member member) {
        WorkGroup group = member.getGroup();
        if (group != null && hasLocation(group.getLocation())) {
            return PolicySource.GROUP;
        }
        if (member.getDepartment() != null) {
            return PolicySource.DEPARTMENT;
        }
        return group != null ? PolicySource.GROUP : PolicySource.NONE;
    }

    private static GeoPoint parseLocation(String stored, String owner, Long ownerId) {
        try {
            return StoredCoordinates.parse(stored);
        } catch (IllegalArgumentException e) {
            throw new CorruptPolicyDataException(
                    String.format("Ubicación inválida en %s %d: '%s'", owner, ownerId, stored), e);
        }
    }

    private static boolean hasLocation(String stored) {
        return stored != null && !stored.isBlank();
    }

    private static double radiusOrDefault(Integer radius, int defaultRadius) {
        return (radius != null && radius > 0) ? radius : defaultRadius;
    }
}
