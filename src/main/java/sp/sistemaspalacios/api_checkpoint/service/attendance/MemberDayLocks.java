package sp.sistemaspalacios.api_checkpoint.service.attendance;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializa las mutaciones del ledger por (miembro, día) dentro de este proceso.
 * Las entradas se eliminan cuando nadie las usa. Entre nodos la garantía la da la
 * restricción única (member_id, attendance_date).
 */
@Component
public class MemberDayLocks {

    private final Map<Key, Holder> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Long memberId, LocalDate day, Supplier<T> action) {
        Key key = new Key(memberId, day);
        Holder holder = locks.compute(key, (k, existing) -> {
            Holder h = existing != null ? existing : new Holder();
            h.users++;
            return h;
        });

        holder.lock.lock();
        try {
            return action.get();
        } finally {
            holder.lock.unlock();
            locks.computeIfPresent(key, (k, h) -> --h.users == 0 ? null : h);
        }
    }

    int activeKeys() {
        return locks.size();
    }

    private record Key(Long memberId, LocalDate day) {
    }

    private static final class Holder {
        private final ReentrantLock lock = new ReentrantLock();
        // Solo se modifica dentro de compute/computeIfPresent
        private int users;
    }
}
