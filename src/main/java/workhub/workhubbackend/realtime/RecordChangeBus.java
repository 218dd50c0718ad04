package workhub.workhubbackend.realtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 레코드 변경 이벤트 버스. 구독자는 종류(EntityKind)와 변경 유형으로 필터링된다.
 */
@Slf4j
@Component
public class RecordChangeBus {

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    public Subscription subscribe(EntityKind entityKind, RecordChangeListener listener) {
        return subscribe(entityKind, ChangeKind.ANY, listener);
    }

    public Subscription subscribe(EntityKind entityKind, ChangeKind changeKind, RecordChangeListener listener) {
        Registration registration = new Registration(entityKind, changeKind, listener);
        registrations.add(registration);
        log.debug("변경 구독 등록: kind={}, change={}", entityKind, changeKind);
        return registration;
    }

    /**
     * 구독자에게 동기적으로 전달한다. 한 구독자의 예외가 다른 구독자 전달을 막지 않는다.
     */
    public void publish(RecordChangeEvent event) {
        for (Registration registration : registrations) {
            if (registration.matches(event)) {
                registration.deliver(event);
            }
        }
    }

    public int activeSubscriptionCount() {
        return registrations.size();
    }

    private final class Registration implements Subscription {
        private final EntityKind entityKind;
        private final ChangeKind changeKind;
        private final RecordChangeListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(EntityKind entityKind, ChangeKind changeKind, RecordChangeListener listener) {
            this.entityKind = entityKind;
            this.changeKind = changeKind;
            this.listener = listener;
        }

        private boolean matches(RecordChangeEvent event) {
            return entityKind == event.getEntityKind() && changeKind.matches(event.getChangeKind());
        }

        private void deliver(RecordChangeEvent event) {
            if (!active.get()) {
                return;
            }
            try {
                listener.onChange(event);
            } catch (RuntimeException e) {
                log.error("변경 이벤트 처리 중 오류: event={}", event, e);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                registrations.remove(this);
                log.debug("변경 구독 해제: kind={}, change={}", entityKind, changeKind);
            }
        }
    }
}
