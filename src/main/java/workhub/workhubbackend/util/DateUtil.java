package workhub.workhubbackend.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 반개구간 [start, end) 날짜 계산
 */
public class DateUtil {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private DateUtil() {
    }

    /**
     * 두 구간이 하루라도 겹치는지 확인. start_a < end_b && start_b < end_a
     */
    public static boolean overlaps(LocalDate startA, LocalDate endA, LocalDate startB, LocalDate endB) {
        return startA.isBefore(endB) && startB.isBefore(endA);
    }

    public static boolean contains(LocalDate start, LocalDate end, LocalDate day) {
        return !day.isBefore(start) && day.isBefore(end);
    }

    public static List<LocalDate> daysOf(LocalDate start, LocalDate end) {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate day = start; day.isBefore(end); day = day.plusDays(1)) {
            days.add(day);
        }
        return days;
    }

    public static void requireValidRange(LocalDate start, LocalDate end) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("시작일은 종료일보다 앞서야 합니다: " + start + " ~ " + end);
        }
    }

    public static String format(LocalDate start, LocalDate end) {
        // 종료일은 미포함이므로 화면에는 전날까지 표시
        return start.format(FORMATTER) + " ~ " + end.minusDays(1).format(FORMATTER);
    }
}
