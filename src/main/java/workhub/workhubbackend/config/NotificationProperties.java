package workhub.workhubbackend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Setter
@Getter
@Configuration
@ConfigurationProperties(prefix = "workhub.notification")
public class NotificationProperties {
    private boolean enabled = true;
    private String dispatchUrl;
}
