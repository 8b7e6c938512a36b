package com.storefront.orders.api;

import com.storefront.orders.domain.AuthenticatedPrincipal;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.Locale;

/**
 * Builds the {@link AuthenticatedPrincipal} from the {@code X-User-Id} and {@code X-User-Role}
 * headers set by the gateway in front of this service. A missing user id is rejected with 401.
 */
public class PrincipalArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentPrincipal.class)
                && AuthenticatedPrincipal.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String userId = webRequest.getHeader(USER_ID_HEADER);
        if (userId == null || userId.isBlank()) {
            throw new MissingPrincipalException("Missing " + USER_ID_HEADER + " header");
        }
        String role = webRequest.getHeader(USER_ROLE_HEADER);
        if (role != null && "ADMIN".equals(role.trim().toUpperCase(Locale.ROOT))) {
            return AuthenticatedPrincipal.admin(userId.trim());
        }
        return AuthenticatedPrincipal.customer(userId.trim());
    }
}
