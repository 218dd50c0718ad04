package workhub.workhubbackend.realtime;

import java.util.List;

/**
 * 구독 해제 핸들. close()는 여러 번 호출해도 안전하며 호출 이후에는 콜백이 실행되지 않는다.
 */
public interface Subscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();

    static Subscription of(Subscription... subscriptions) {
        List<Subscription> parts = List.of(subscriptions);
        return new Subscription() {
            @Override
            public boolean isActive() {
                return parts.stream().anyMatch(Subscription::isActive);
            }

            @Override
            public void close() {
                parts.forEach(Subscription::close);
            }
        };
    }
}
