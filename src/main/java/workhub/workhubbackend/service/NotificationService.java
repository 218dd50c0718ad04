package workhub.workhubbackend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import workhub.workhubbackend.config.NotificationProperties;
import workhub.workhubbackend.dto.request.NotificationRequest;
import workhub.workhubbackend.dto.response.NotificationResult;

/**
 * 알림 발송 서비스로 한 번 전달한다. 실패는 예외 대신 결과로 돌려준다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final RestTemplate restTemplate;
    private final NotificationProperties notificationProperties;

    public NotificationResult dispatch(NotificationRequest request) {
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            return fail(request, "수신자 정보가 비어있습니다.");
        }
        if (!notificationProperties.isEnabled()) {
            log.debug("알림 비활성화 상태, 발송 생략: userId={}, title={}", request.getUserId(), request.getTitle());
            return NotificationResult.success(request.getUserId(), request.getType(), request.getRelatedId(),
                    request.getTitle(), "disabled");
        }
        String dispatchUrl = notificationProperties.getDispatchUrl();
        if (dispatchUrl == null || dispatchUrl.isBlank()) {
            return fail(request, "알림 발송 URL이 설정되지 않았습니다.");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(dispatchUrl, new HttpEntity<>(request, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                return fail(request, "HTTP " + response.getStatusCode().value());
            }
            log.info("알림 발송 성공: userId={}, title={}", request.getUserId(), request.getTitle());
            return NotificationResult.success(request.getUserId(), request.getType(), request.getRelatedId(),
                    request.getTitle(), response.getBody());
        } catch (HttpStatusCodeException e) {
            return fail(request, "HTTP 오류: " + e.getStatusCode().value() + " " + e.getResponseBodyAsString());
        } catch (RestClientException e) {
            return fail(request, "발송 중 오류: " + e.getMessage());
        }
    }

    private NotificationResult fail(NotificationRequest request, String errorMessage) {
        log.warn("알림 발송 실패: userId={}, title={}, reason={}", request.getUserId(), request.getTitle(), errorMessage);
        return NotificationResult.fail(request.getUserId(), request.getType(), request.getRelatedId(),
                request.getTitle(), errorMessage);
    }
}
