package sp.sistemaspalacios.api_checkpoint.dto.policy;

public enum PolicySource {
    GROUP,
    DEPARTMENT,
    NONE // Sin grupo ni departamento: sin geocerca ni ventanas horarias
}
