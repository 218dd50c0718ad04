package workhub.workhubbackend.service.access;

import workhub.workhubbackend.dto.response.UserModuleDto;

import java.util.List;

/**
 * get_user_modules 집계 조회. 사용자 한 명의 모듈 권한을 한 번에 돌려준다.
 */
public interface UserModuleGateway {

    List<UserModuleDto> fetchUserModules(String userId);
}
