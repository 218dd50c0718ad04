package workhub.workhubbackend.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String USER_ROLE_CACHE = "userRoleCache";
    public static final String APPROVAL_VIEW_CACHE = "approvalViewCache";
    public static final String ORG_UNIT_CACHE = "orgUnitCache";

    @Bean
    public CacheManager cacheManager() {
        // 무효화는 InvalidationBridge가 담당 (TTL 없음)
        return new ConcurrentMapCacheManager(USER_ROLE_CACHE, APPROVAL_VIEW_CACHE, ORG_UNIT_CACHE);
    }
}
