package sp.sistemaspalacios.api_checkpoint.entity.attendance;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttendanceRecordTest {

    @Test
    void persistingWithoutCreatedAtIsRejected() {
        AttendanceRecord record = new AttendanceRecord();

        assertThatThrownBy(record::onCreate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("createdAt");
        assertThat(record.getUpdatedAt()).isNull();
    }

    @Test
    void updatedAtDefaultsToTheCallerTimestamp() {
        LocalDateTime organizationTime = LocalDateTime.of(2025, 3, 10, 0, 5);
        AttendanceRecord record = new AttendanceRecord();
        record.setCreatedAt(organizationTime);

        record.onCreate();

        assertThat(record.getCreatedAt()).isEqualTo(organizationTime);
        assertThat(record.getUpdatedAt()).isEqualTo(organizationTime);
    }

    @Test
    void explicitUpdatedAtIsKept() {
        AttendanceRecord record = new AttendanceRecord();
        record.setCreatedAt(LocalDateTime.of(2025, 3, 10, 8, 55));
        record.setUpdatedAt(LocalDateTime.of(2025, 3, 10, 17, 30));

        record.onCreate();

        assertThat(record.getUpdatedAt()).isEqualTo(LocalDateTime.of(2025, 3, 10, 17, 30));
    }
}
