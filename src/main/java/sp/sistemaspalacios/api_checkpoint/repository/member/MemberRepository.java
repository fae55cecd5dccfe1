package sp.sistemaspalacios.api_checkpoint.repository.member;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_checkpoint.entity.member.Member;
import sp.sistemaspalacios.api_checkpoint.entity.member.MemberRole;

import java.util.List;

@Repository
public interface MemberRepository extends JpaRepository<Member, Long> {

    /** Pool de candidatos del escaneo: orden estable por id. */
    List<Member> findByRoleAndPhotoUrlIsNotNullOrderByIdAsc(MemberRole role);
}
