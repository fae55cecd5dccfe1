package sp.sistemaspalacios.api_checkpoint.controller.boundaries.generalConfiguration;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_checkpoint.dto.configuration.GeneralConfigurationDTO;
import sp.sistemaspalacios.api_checkpoint.entity.boundaries.generalConfiguration.GeneralConfiguration;
import sp.sistemaspalacios.api_checkpoint.entity.boundaries.generalConfiguration.GeneralConfigurationType;
import sp.sistemaspalacios.api_checkpoint.service.boundaries.generalConfiguration.GeneralConfigurationService;

import java.util.Map;

@RestController
@RequestMapping("/api/config")
@RequiredArgsConstructor
public class GeneralConfigurationController {

    private final GeneralConfigurationService service;

    /**
     * 🔸 Guarda un parámetro del motor de asistencia
     * Ejemplos válidos: MATCH_THRESHOLD_POLICY=PROVIDER, MATCH_THRESHOLD=75, DEFAULT_GEOFENCE_RADIUS=300
     */
    @PostMapping("/{type}")
    public ResponseEntity<?> setConfig(@PathVariable String type, @Valid @RequestBody GeneralConfigurationDTO dto) {
        GeneralConfiguration config = service.saveOrUpdate(GeneralConfigurationType.from(type), dto.getValue());
        return ResponseEntity.ok(Map.of(
                "message", "Guardado exitosamente",
                "type", config.getType().name(),
                "value", config.getValue()
        ));
    }

    /**
     * 🔸 Consulta la configuración por tipo
     */
    @GetMapping("/{type}")
    public ResponseEntity<?> getConfig(@PathVariable String type) {
        GeneralConfiguration config = service.getByType(GeneralConfigurationType.from(type));
        return ResponseEntity.ok(Map.of(
                "type", config.getType().name(),
                "value", config.getValue()
        ));
    }
}
