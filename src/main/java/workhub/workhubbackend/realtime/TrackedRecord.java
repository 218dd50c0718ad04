package workhub.workhubbackend.realtime;

/**
 * 변경 시 {@link RecordChangeEvent}를 발행하는 엔티티
 */
public interface TrackedRecord {

    EntityKind trackedKind();

    /**
     * 변경의 영향을 받는 대상 (사용자 ID 또는 요청 ID). 특정할 수 없으면 null.
     */
    String trackedSubjectId();
}
