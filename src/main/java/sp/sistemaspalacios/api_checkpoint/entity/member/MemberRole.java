package sp.sistemaspalacios.api_checkpoint.entity.member;

public enum MemberRole {
    MEMBER, // Marca asistencia
    ADMIN   // Excluido de la asistencia
}
