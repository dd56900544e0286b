package se.bazaar_be.configuration;

import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;
import se.bazaar_be.dto.Actor;
import se.bazaar_be.exception.UnauthorizedException;
import se.bazaar_be.pojo.enums.Role;

/**
 * Reads the caller identity the API gateway forwards after authenticating the request.
 */
@Component
public class CurrentActorArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentActor.class)
                && Actor.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String userId = webRequest.getHeader(USER_ID_HEADER);
        String role = webRequest.getHeader(USER_ROLE_HEADER);
        if (userId == null || role == null) {
            throw new UnauthorizedException("Missing authenticated user headers");
        }
        try {
            Role parsedRole = Role.valueOf(role.trim().toUpperCase());
            if (parsedRole == Role.SYSTEM) {
                throw new UnauthorizedException("System role cannot be asserted by a request");
            }
            return Actor.of(Long.parseLong(userId.trim()), parsedRole);
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("Invalid authenticated user headers");
        }
    }
}
