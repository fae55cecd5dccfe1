package sp.sistemaspalacios.api_checkpoint.dto.face;

import sp.sistemaspalacios.api_checkpoint.entity.member.Member;

/**
 * Miembro aceptado por el matcher, con la similitud obtenida y el umbral aplicado.
 */
public record IdentityMatch(Member member, double confidence, double threshold) {
}
