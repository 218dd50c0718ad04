package workhub.workhubbackend.realtime;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Optional;

/**
 * 레코드 변경 신호. subjectId는 힌트일 뿐이며 없으면 해당 종류 전체가 영향을 받은 것으로 본다.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class RecordChangeEvent {
    private final EntityKind entityKind;
    private final ChangeKind changeKind;
    private final String subjectId;

    public static RecordChangeEvent of(EntityKind entityKind, ChangeKind changeKind) {
        return new RecordChangeEvent(entityKind, changeKind, null);
    }

    public Optional<String> subject() {
        return Optional.ofNullable(subjectId);
    }

    public boolean affects(String candidateId) {
        return subjectId == null || subjectId.equals(candidateId);
    }
}
