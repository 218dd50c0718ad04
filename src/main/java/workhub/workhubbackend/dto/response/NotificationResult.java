package workhub.workhubbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationResult {
    private boolean success;
    private String receiver;
    private String type;
    private Long relatedId;
    private String title;
    private String rawResponse;
    private String errorMessage;

    public static NotificationResult success(String receiver, String type, Long relatedId,
                                             String title, String rawResponse) {
        return NotificationResult.builder()
                .success(true)
                .receiver(receiver)
                .type(type)
                .relatedId(relatedId)
                .title(title)
                .rawResponse(rawResponse)
                .build();
    }

    public static NotificationResult fail(String receiver, String type, Long relatedId,
                                          String title, String errorMessage) {
        return NotificationResult.builder()
                .success(false)
                .receiver(receiver)
                .type(type)
                .relatedId(relatedId)
                .title(title)
                .errorMessage(errorMessage)
                .build();
    }
}
