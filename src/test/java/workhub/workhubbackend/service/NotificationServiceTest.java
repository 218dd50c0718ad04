package workhub.workhubbackend.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import workhub.workhubbackend.config.NotificationProperties;
import workhub.workhubbackend.dto.request.NotificationRequest;
import workhub.workhubbackend.dto.response.NotificationResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    private static final String URL = "http://notify.local/dispatch";

    @Mock
    private RestTemplate restTemplate;

    private NotificationProperties properties;
    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        properties = new NotificationProperties();
        properties.setDispatchUrl(URL);
        notificationService = new NotificationService(restTemplate, properties);
    }

    private static NotificationRequest request(String userId) {
        return NotificationRequest.builder()
                .userId(userId)
                .title("휴가 결재 요청")
                .message("1단계 결재를 기다리고 있습니다.")
                .type("vacation")
                .relatedId(7L)
                .build();
    }

    @Test
    @DisplayName("발송 성공 시 응답 본문을 결과에 담는다")
    void dispatchSuccess() {
        when(restTemplate.postForEntity(eq(URL), any(HttpEntity.class), eq(String.class)))
                .thenReturn(ResponseEntity.ok("{\"queued\":true}"));

        NotificationResult result = notificationService.dispatch(request("u1"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getReceiver()).isEqualTo("u1");
        assertThat(result.getRelatedId()).isEqualTo(7L);
        assertThat(result.getRawResponse()).contains("queued");
    }

    @Test
    @DisplayName("HTTP 오류는 예외 대신 실패 결과로 반환한다")
    void httpErrorBecomesFailure() {
        when(restTemplate.postForEntity(eq(URL), any(HttpEntity.class), eq(String.class)))
                .thenThrow(new HttpServerErrorException(HttpStatus.BAD_GATEWAY));

        NotificationResult result = notificationService.dispatch(request("u1"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("502");
    }

    @Test
    @DisplayName("연결 실패도 실패 결과로 반환한다")
    void connectionErrorBecomesFailure() {
        when(restTemplate.postForEntity(eq(URL), any(HttpEntity.class), eq(String.class)))
                .thenThrow(new ResourceAccessException("Connection refused"));

        NotificationResult result = notificationService.dispatch(request("u1"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("Connection refused");
    }

    @Test
    @DisplayName("수신자가 비어 있으면 호출하지 않는다")
    void blankReceiverIsNotSent() {
        NotificationResult result = notificationService.dispatch(request(" "));

        assertThat(result.isSuccess()).isFalse();
        verify(restTemplate, never()).postForEntity(anyString(), any(), eq(String.class));
    }

    @Test
    @DisplayName("비활성화 상태에서는 호출 없이 성공으로 처리한다")
    void disabledSkipsDispatch() {
        properties.setEnabled(false);

        NotificationResult result = notificationService.dispatch(request("u1"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRawResponse()).isEqualTo("disabled");
        verify(restTemplate, never()).postForEntity(anyString(), any(), eq(String.class));
    }
}
