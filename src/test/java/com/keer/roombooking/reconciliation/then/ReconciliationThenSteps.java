package com.keer.roombooking.reconciliation.then;

import com.keer.roombooking.RecordingNotificationSender;
import com.keer.roombooking.ScenarioContext;
import com.keer.roombooking.booking.model.Booking;
import com.keer.roombooking.booking.repository.BookingRepository;
import com.keer.roombooking.member.repository.MemberRepository;
import com.keer.roombooking.reconciliation.SweepReport;
import io.cucumber.java.zh_tw.並且;
import io.cucumber.java.zh_tw.那麼;
import org.springframework.beans.factory.annotation.Autowired;

import static org.junit.jupiter.api.Assertions.*;

public class ReconciliationThenSteps {

    @Autowired
    private ScenarioContext scenarioContext;

    @Autowired
    private BookingRepository bookingRepository;

    @Autowired
    private MemberRepository memberRepository;

    @Autowired
    private RecordingNotificationSender notificationSender;

    @那麼("^會員「(.+)」應該收到 (\\d+) 封提醒通知$")
    public void 會員應該收到N封提醒通知(String memberName, int expectedCount) {
        String email = memberRepository.findById(scenarioContext.getId("member:" + memberName))
                .orElseThrow().getEmail();
        long count = notificationSender.getReminders().stream()
                .filter(reminder -> reminder.address() != null && reminder.address().equals(email))
                .count();
        assertEquals(expectedCount, count, "會員 " + memberName + " 應收到 " + expectedCount + " 封提醒");
    }

    @那麼("^不應該寄出任何提醒通知$")
    public void 不應該寄出任何提醒通知() {
        assertTrue(notificationSender.getReminders().isEmpty(), "不應有提醒通知");
    }

    @並且("^該預約(已|尚未)標記為已提醒$")
    public void 該預約標記為已提醒(String flag) {
        Booking booking = bookingRepository.findById(scenarioContext.getId("lastBookingId")).orElseThrow();
        assertEquals("已".equals(flag), booking.isReminderSent(), "提醒旗標應為" + flag + "設定");
    }

    @並且("^本次對帳完成了 (\\d+) 筆預約$")
    public void 本次對帳完成了N筆預約(int expectedCount) {
        SweepReport report = (SweepReport) scenarioContext.get("sweepReport");
        assertNotNull(report, "應該先執行排程對帳");
        assertEquals(expectedCount, report.completed(), "完成筆數應為 " + expectedCount);
    }
}
