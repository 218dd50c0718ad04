package workhub.workhubbackend.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 알림 발송 요청 본문 { user_id, title, message, type, related_id }
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRequest {
    @JsonProperty("user_id")
    private String userId;
    private String title;
    private String message;
    private String type;
    @JsonProperty("related_id")
    private Long relatedId;
}
