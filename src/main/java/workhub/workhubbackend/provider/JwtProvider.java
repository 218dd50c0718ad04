package workhub.workhubbackend.provider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;

/**
 * 인증 서버가 발급한 access token 검증. subject = 사용자 ID.
 * 발급(create)은 로컬 개발/테스트용이다.
 */
@Slf4j
@Service
public class JwtProvider {

    private static final String TOKEN_TYPE_CLAIM = "type";
    private static final String ACCESS_TOKEN_TYPE = "access";

    @Value("${secret-key}")
    private String secretKey;

    @Value("${jwt.issuer:workhub-auth}")
    private String issuer;

    @Value("${jwt.access-token.expiration:86400000}") // 24시간
    private Long accessTokenExpiration;

    private Key signingKey;

    @PostConstruct
    public void init() {
        this.signingKey = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
    }

    public String create(String userId) {
        Date now = new Date();
        Claims claims = Jwts.claims().setSubject(userId);
        claims.put(TOKEN_TYPE_CLAIM, ACCESS_TOKEN_TYPE);

        return Jwts.builder()
                .setClaims(claims)
                .setIssuer(issuer)
                .setIssuedAt(now)
                .setExpiration(new Date(now.getTime() + accessTokenExpiration))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * 서명, 만료, 발급자, 토큰 종류를 확인한다.
     * @return 유효한 access token 이면 사용자 ID, 아니면 null
     */
    public String validate(String token) {
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .requireIssuer(issuer)
                    .setAllowedClockSkewSeconds(30)
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            if (!ACCESS_TOKEN_TYPE.equals(claims.get(TOKEN_TYPE_CLAIM, String.class))) {
                log.warn("access token 이 아닙니다: subject={}", claims.getSubject());
                return null;
            }
            return claims.getSubject();
        } catch (ExpiredJwtException e) {
            log.warn("Access token expired: {}", e.getMessage());
            return null;
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid access token: {}", e.getMessage());
            return null;
        }
    }
}
