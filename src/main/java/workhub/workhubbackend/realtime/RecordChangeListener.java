package workhub.workhubbackend.realtime;

@FunctionalInterface
public interface RecordChangeListener {
    void onChange(RecordChangeEvent event);
}
