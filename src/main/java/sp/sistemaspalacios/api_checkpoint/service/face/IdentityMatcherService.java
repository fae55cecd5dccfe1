package sp.sistemaspalacios.api_checkpoint.service.face;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_checkpoint.dto.face.FaceComparison;
import sp.sistemaspalacios.api_checkpoint.dto.face.FaceVerificationResponse;
import sp.sistemaspalacios.api_checkpoint.dto.face.IdentityMatch;
import sp.sistemaspalacios.api_checkpoint.dto.face.MatchThresholdPolicy;
import sp.sistemaspalacios.api_checkpoint.entity.member.Member;
import sp.sistemaspalacios.api_checkpoint.entity.member.MemberRole;
import sp.sistemaspalacios.api_checkpoint.exception.FaceComparisonException;
import sp.sistemaspalacios.api_checkpoint.exception.FaceServiceUnavailableException;
import sp.sistemaspalacios.api_checkpoint.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_checkpoint.repository.member.MemberRepository;
import sp.sistemaspalacios.api_checkpoint.service.boundaries.generalConfiguration.GeneralConfigurationService;

import java.util.List;
import java.util.Optional;

/**
 * Identifica al miembro de una foto capturada recorriendo el pool de candidatos en
 * orden. Gana el primero cuya similitud supera el umbral, no el de mayor puntaje, así
 * que el orden del pool es la prioridad.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityMatcherService {

    private final FaceComparisonClient faceComparisonClient;
    private final MemberRepository memberRepository;
    private final GeneralConfigurationService configurationService;

    /** Miembros (no administradores) con foto de referencia, ordenados por id. */
    public List<Member> candidatePool() {
        return memberRepository.findByRoleAndPhotoUrlIsNotNullOrderByIdAsc(MemberRole.MEMBER);
    }

    public Optional<IdentityMatch> match(String capturedImageUrl, List<Member> pool) {
        ThresholdRule rule = currentThresholdRule();
        log.info("🔍 Buscando coincidencia entre {} candidatos (política de umbral: {})", pool.size(), rule.policy());

        int attempted = 0;
        int failed = 0;
        FaceComparisonException lastFailure = null;

        for (Member candidate : pool) {
            if (candidate.getPhotoUrl() == null) {
                continue;
            }
            attempted++;

            FaceComparison comparison;
            try {
                comparison = faceComparisonClient.compare(capturedImageUrl, candidate.getPhotoUrl());
            } catch (FaceComparisonException e) {
                failed++;
                lastFailure = e;
                log.warn("⚠️ Comparación fallida con miembro {}: {}", candidate.getId(), e.getMessage());
                continue;
            }

            double threshold = rule.thresholdFor(comparison);
            boolean accepted = comparison.confidence() > threshold;
            log.info("   Miembro {}: similitud {} / umbral {} -> {}",
                    candidate.getId(), comparison.confidence(), threshold, accepted ? "COINCIDE" : "no coincide");

            if (accepted) {
                return Optional.of(new IdentityMatch(candidate, comparison.confidence(), threshold));
            }
        }

        if (attempted > 0 && failed == attempted) {
            throw new FaceServiceUnavailableException(
                    "El servicio de comparación facial falló para los " + attempted + " candidatos", lastFailure);
        }

        log.info("❌ Sin coincidencia tras evaluar {} candidatos", attempted);
        return Optional.empty();
    }

    /**
     * Verificación 1:1 contra un miembro conocido (escaneo desde la sesión del miembro).
     */
    public FaceVerificationResponse verify(Long memberId, String capturedImageUrl) {
        Member member = memberRepository.findById(memberId)
                .orElseThrow(() -> new ResourceNotFoundException("No se encontró el miembro " + memberId));

        if (member.getPhotoUrl() == null) {
            return FaceVerificationResponse.builder()
                    .matched(false)
                    .message("User does not have a registered photo. Please check with admin.")
                    .build();
        }

        FaceComparison comparison;
        try {
            comparison = faceComparisonClient.compare(capturedImageUrl, member.getPhotoUrl());
        } catch (FaceComparisonException e) {
            log.error("❌ Error verificando miembro {}: {}", memberId, e.getMessage(), e);
            return FaceVerificationResponse.builder()
                    .matched(false)
                    .message("Face recognition service error. Please try again.")
                    .build();
        }

        double threshold = currentThresholdRule().thresholdFor(comparison);
        if (comparison.confidence() > threshold) {
            return FaceVerificationResponse.builder()
                    .matched(true)
                    .user(new FaceVerificationResponse.VerifiedUser(member.getId(), member.getDisplayName()))
                    .confidence(comparison.confidence())
                    .build();
        }

        return FaceVerificationResponse.builder()
                .matched(false)
                .message("Face does not match. Please check with admin.")
                .build();
    }

    private ThresholdRule currentThresholdRule() {
        return new ThresholdRule(
                configurationService.getMatchThresholdPolicy(),
                configurationService.getFixedMatchThreshold(),
                configurationService.getProviderFallbackThreshold()
        );
    }

    /** Umbral vigente durante un escaneo; se lee una sola vez por solicitud. */
    record ThresholdRule(MatchThresholdPolicy policy, double fixedThreshold, double providerFallback) {

        double thresholdFor(FaceComparison comparison) {
            if (policy == MatchThresholdPolicy.PROVIDER) {
                return comparison.suggestedThreshold() != null
                        ? comparison.suggestedThreshold()
                        : providerFallback;
            }
            return fixedThreshold;
        }
    }
}
