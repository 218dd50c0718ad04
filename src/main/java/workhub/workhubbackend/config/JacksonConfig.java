package workhub.workhubbackend.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.hibernate6.Hibernate6Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer jacksonCustomizer() {
        Hibernate6Module hibernateModule = new Hibernate6Module();
        // 로딩되지 않은 연관 엔티티는 ID만 출력
        hibernateModule.enable(Hibernate6Module.Feature.SERIALIZE_IDENTIFIER_FOR_LAZY_NOT_LOADED_OBJECTS);

        return builder -> {
            builder.modulesToInstall(new JavaTimeModule(), hibernateModule);
            // 휴가 기간(LocalDate)과 결정 시각은 ISO-8601 문자열
            builder.featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            // 알림 발송 서비스 응답 등 외부 JSON의 추가 필드는 무시
            builder.featuresToDisable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            // 결재 조회 응답에서 비어 있는 선택 필드(decidedAt, conflictReason ...) 생략
            builder.serializationInclusion(JsonInclude.Include.NON_NULL);
        };
    }
}
