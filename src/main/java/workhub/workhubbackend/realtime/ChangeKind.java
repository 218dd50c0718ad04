package workhub.workhubbackend.realtime;

public enum ChangeKind {
    INSERT,
    UPDATE,
    DELETE,
    ANY; // 구독 필터 전용

    public boolean matches(ChangeKind actual) {
        return this == ANY || this == actual;
    }
}
