package workhub.workhubbackend.realtime;

import jakarta.persistence.PostPersist;
import jakarta.persistence.PostRemove;
import jakarta.persistence.PostUpdate;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * JPA 엔티티 콜백을 변경 이벤트로 변환한다. 실제 버스 전달은 커밋 이후 {@link RecordChangeRelay}가 담당.
 */
@Component
@RequiredArgsConstructor
public class RecordChangeEntityListener {

    private final ApplicationEventPublisher eventPublisher;

    @PostPersist
    public void onInsert(Object entity) {
        publish(entity, ChangeKind.INSERT);
    }

    @PostUpdate
    public void onUpdate(Object entity) {
        publish(entity, ChangeKind.UPDATE);
    }

    @PostRemove
    public void onDelete(Object entity) {
        publish(entity, ChangeKind.DELETE);
    }

    private void publish(Object entity, ChangeKind changeKind) {
        if (!(entity instanceof TrackedRecord)) {
            return;
        }
        TrackedRecord record = (TrackedRecord) entity;
        eventPublisher.publishEvent(new RecordChangeEvent(record.trackedKind(), changeKind, record.trackedSubjectId()));
    }
}
