package workhub.workhubbackend.realtime;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@RequiredArgsConstructor
public class RecordChangeRelay {

    private final RecordChangeBus recordChangeBus;

    // 커밋된 변경만 전달 (트랜잭션 밖에서 발행된 이벤트는 즉시 전달)
    @TransactionalEventListener(fallbackExecution = true)
    public void relay(RecordChangeEvent event) {
        recordChangeBus.publish(event);
    }
}
