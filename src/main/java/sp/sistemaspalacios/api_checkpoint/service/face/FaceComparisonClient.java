package sp.sistemaspalacios.api_checkpoint.service.face;

import sp.sistemaspalacios.api_checkpoint.dto.face.FaceComparison;
import sp.sistemaspalacios.api_checkpoint.exception.FaceComparisonException;

/**
 * Capacidad externa de comparación facial.
 */
public interface FaceComparisonClient {

    /**
     * Compara la imagen capturada con una foto de referencia.
     *
     * @throws FaceComparisonException si la llamada falla o el proveedor responde con error
     */
    FaceComparison compare(String capturedImageUrl, String referencePhotoUrl);
}
