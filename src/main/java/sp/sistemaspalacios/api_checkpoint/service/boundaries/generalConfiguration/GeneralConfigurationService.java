package sp.sistemaspalacios.api_checkpoint.service.boundaries.generalConfiguration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_checkpoint.dto.face.MatchThresholdPolicy;
import sp.sistemaspalacios.api_checkpoint.entity.boundaries.generalConfiguration.GeneralConfiguration;
import sp.sistemaspalacios.api_checkpoint.entity.boundaries.generalConfiguration.GeneralConfigurationType;
import sp.sistemaspalacios.api_checkpoint.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_checkpoint.repository.boundaries.generalConfiguration.GeneralConfigurationRepository;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class GeneralConfigurationService {

    private final GeneralConfigurationRepository repository;

    @Value("${attendance.match.threshold-policy:FIXED}")
    private String defaultThresholdPolicy;

    @Value("${attendance.match.fixed-threshold:70}")
    private double defaultFixedThreshold;

    @Value("${attendance.match.provider-fallback-threshold:62.327}")
    private double providerFallbackThreshold;

    @Value("${attendance.geofence.default-radius:500}")
    private int defaultGeofenceRadius;

    /**
     * 🔹 Obtener la configuración por tipo
     */
    @Transactional(readOnly = true)
    public GeneralConfiguration getByType(GeneralConfigurationType type) {
        return repository.findByType(type)
                .orElseThrow(() -> new ResourceNotFoundException("No hay configuración para: " + type));
    }

    /**
     * 🔹 Guardar o actualizar una configuración
     */
    @Transactional
    public GeneralConfiguration saveOrUpdate(GeneralConfigurationType type, String rawValue) {
        String value = validateConfiguration(type, rawValue);

        GeneralConfiguration existing = repository.findByType(type).orElse(null);

        if (existing == null) {
            existing = new GeneralConfiguration();
            existing.setType(type);
        }

        existing.setValue(value);
        log.info("⚙️ Configuración {} = {}", type, value);
        return repository.save(existing);
    }

    @Transactional(readOnly = true)
    public MatchThresholdPolicy getMatchThresholdPolicy() {
        return findValue(GeneralConfigurationType.MATCH_THRESHOLD_POLICY)
                .map(MatchThresholdPolicy::from)
                .orElseGet(() -> MatchThresholdPolicy.from(defaultThresholdPolicy));
    }

    @Transactional(readOnly = true)
    public double getFixedMatchThreshold() {
        return findValue(GeneralConfigurationType.MATCH_THRESHOLD)
                .map(Double::parseDouble)
                .orElse(defaultFixedThreshold);
    }

    /** Umbral a usar con PROVIDER cuando la respuesta no trae uno sugerido. */
    public double getProviderFallbackThreshold() {
        return providerFallbackThreshold;
    }

    @Transactional(readOnly = true)
    public int getDefaultGeofenceRadius() {
        return findValue(GeneralConfigurationType.DEFAULT_GEOFENCE_RADIUS)
                .map(Integer::parseInt)
                .orElse(defaultGeofenceRadius);
    }

    private Optional<String> findValue(GeneralConfigurationType type) {
        return repository.findByType(type).map(GeneralConfiguration::getValue);
    }

    private String validateConfiguration(GeneralConfigurationType type, String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new IllegalArgumentException("El valor de " + type + " es obligatorio.");
        }
        String value = rawValue.trim();

        try {
            switch (type) {
                case MATCH_THRESHOLD_POLICY:
                    return MatchThresholdPolicy.from(value).name();

                // MATCH_THRESHOLD: porcentaje de similitud entre 0 y 100
                case MATCH_THRESHOLD: {
                    double threshold = Double.parseDouble(value);
                    if (threshold < 0 || threshold > 100) {
                        throw new IllegalArgumentException("El umbral de coincidencia debe estar entre 0 y 100.");
                    }
                    return value;
                }

                // DEFAULT_GEOFENCE_RADIUS: metros, mínimo 1
                case DEFAULT_GEOFENCE_RADIUS: {
                    int radius = Integer.parseInt(value);
                    if (radius < 1) {
                        throw new IllegalArgumentException("El radio de la geocerca debe ser de al menos 1 metro.");
                    }
                    return value;
                }

                default:
                    throw new IllegalArgumentException("Tipo de configuración no soportado: " + type);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Formato numérico inválido para " + type + ": " + rawValue);
        }
    }
}
